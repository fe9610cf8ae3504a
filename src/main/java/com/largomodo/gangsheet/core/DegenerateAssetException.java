package com.largomodo.gangsheet.core;

/**
 * Thrown when an asset reports a zero or negative intrinsic width or height.
 */
public class DegenerateAssetException extends GangSheetException {

    public DegenerateAssetException(String message) {
        super(Category.VALIDATION, message);
    }
}
