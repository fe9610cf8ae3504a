package com.largomodo.gangsheet.asset;

/**
 * An uploaded asset with the metadata needed for layout and rendering.
 * <p>
 * Intrinsic dimensions are in points for {@link AssetKind#VECTOR} assets and in
 * pixels for {@link AssetKind#RASTER} assets; {@link AssetDescriptorResolver}
 * converts both to points.
 *
 * @param name            unique name of the asset within a request
 * @param kind            vector or raster
 * @param intrinsicWidth  page width in points, or image width in pixels
 * @param intrinsicHeight page height in points, or image height in pixels
 * @param pageCount       number of pages (always 1 for raster images)
 * @param content         raw file bytes, embedded into each rendered sheet
 */
public record RawAsset(String name, AssetKind kind, double intrinsicWidth, double intrinsicHeight,
                       int pageCount, byte[] content) {

    public RawAsset {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Asset name must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Asset kind must not be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("Asset content must not be null");
        }
    }
}
