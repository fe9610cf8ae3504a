package com.largomodo.gangsheet.core.domain;

import com.largomodo.gangsheet.core.DegenerateAssetException;

/**
 * Immutable footprint of one asset copy, in points.
 * <p>
 * Base dimensions are the asset's intrinsic, un-rotated size. When {@code rotated}
 * is set, every copy is turned 90° and occupies a cell with width and height swapped.
 *
 * @param baseWidth  un-rotated width (> 0)
 * @param baseHeight un-rotated height (> 0)
 * @param rotated    whether copies are placed turned by 90°
 */
public record AssetFootprint(double baseWidth, double baseHeight, boolean rotated) {

    /**
     * @throws DegenerateAssetException if either base dimension is not positive
     */
    public AssetFootprint {
        if (!(baseWidth > 0) || !(baseHeight > 0)) {
            throw new DegenerateAssetException(
                    "Asset dimensions must be positive, got: " + baseWidth + " x " + baseHeight);
        }
    }

    public double orientedWidth() {
        return rotated ? baseHeight : baseWidth;
    }

    public double orientedHeight() {
        return rotated ? baseWidth : baseHeight;
    }

    public AssetFootprint withRotated(boolean rotate) {
        return rotate == rotated ? this : new AssetFootprint(baseWidth, baseHeight, rotate);
    }

    /**
     * Two footprints occupy identical cells when their oriented sizes match,
     * regardless of how they got there.
     */
    public boolean sameCellAs(AssetFootprint other) {
        return Double.compare(orientedWidth(), other.orientedWidth()) == 0
                && Double.compare(orientedHeight(), other.orientedHeight()) == 0;
    }
}
