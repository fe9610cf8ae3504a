package com.largomodo.gangsheet.core;

/**
 * Thrown when a copy count is outside the accepted range, or a request contains no designs.
 */
public class InvalidQuantityException extends GangSheetException {

    public InvalidQuantityException(String message) {
        super(Category.VALIDATION, message);
    }
}
