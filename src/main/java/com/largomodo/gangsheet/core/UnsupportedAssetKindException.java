package com.largomodo.gangsheet.core;

/**
 * Thrown when an asset is neither a single-page vector document nor a decodable raster image.
 */
public class UnsupportedAssetKindException extends GangSheetException {

    public UnsupportedAssetKindException(String message) {
        super(Category.VALIDATION, message);
    }

    public UnsupportedAssetKindException(String message, Throwable cause) {
        super(Category.VALIDATION, message, cause);
    }
}
