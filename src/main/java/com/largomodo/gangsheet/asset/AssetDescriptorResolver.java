package com.largomodo.gangsheet.asset;

import com.largomodo.gangsheet.core.DegenerateAssetException;
import com.largomodo.gangsheet.core.UnsupportedAssetKindException;
import com.largomodo.gangsheet.core.domain.AssetFootprint;
import com.largomodo.gangsheet.util.Units;

/**
 * Converts an asset's intrinsic size into a layout footprint in points.
 * <p>
 * Raster images carry no physical size, so pixels are interpreted at a fixed
 * print resolution: {@code points = pixels / dpi * 72}.
 */
public class AssetDescriptorResolver {

    public static final int DEFAULT_DPI = 300;

    private final int dpi;

    public AssetDescriptorResolver() {
        this(DEFAULT_DPI);
    }

    public AssetDescriptorResolver(int dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("Resolution must be positive, got: " + dpi);
        }
        this.dpi = dpi;
    }

    /**
     * @param asset  inspected asset
     * @param rotate whether copies are placed turned by 90°
     * @return footprint with un-rotated base dimensions in points
     * @throws UnsupportedAssetKindException if a vector asset has more or fewer than one page
     * @throws DegenerateAssetException      if either dimension is not positive
     */
    public AssetFootprint resolve(RawAsset asset, boolean rotate) {
        double width;
        double height;
        switch (asset.kind()) {
            case VECTOR -> {
                if (asset.pageCount() != 1) {
                    throw new UnsupportedAssetKindException("Vector asset " + asset.name()
                            + " must have exactly one page, found " + asset.pageCount());
                }
                width = asset.intrinsicWidth();
                height = asset.intrinsicHeight();
            }
            case RASTER -> {
                width = asset.intrinsicWidth() / dpi * Units.POINTS_PER_INCH;
                height = asset.intrinsicHeight() / dpi * Units.POINTS_PER_INCH;
            }
            default -> throw new UnsupportedAssetKindException("Unsupported asset kind: " + asset.kind());
        }

        if (!(width > 0) || !(height > 0)) {
            throw new DegenerateAssetException("Asset " + asset.name() + " has degenerate size "
                    + width + " x " + height + " pt");
        }
        return new AssetFootprint(width, height, rotate);
    }

    public int getDpi() {
        return dpi;
    }
}
