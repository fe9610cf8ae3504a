package com.largomodo.gangsheet.core;

/**
 * Thrown when an asset's oriented width leaves no room for even one column on the sheet.
 */
public class AssetTooWideException extends GangSheetException {

    public AssetTooWideException(String message) {
        super(Category.VALIDATION, message);
    }
}
