package com.largomodo.gangsheet.core;

/**
 * Thrown when an asset's oriented height leaves no room for even one row within the maximum sheet length.
 */
public class AssetTooTallException extends GangSheetException {

    public AssetTooTallException(String message) {
        super(Category.VALIDATION, message);
    }
}
