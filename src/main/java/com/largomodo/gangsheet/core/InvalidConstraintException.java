package com.largomodo.gangsheet.core;

/**
 * Thrown when sheet constraints are inconsistent or outside the accepted range.
 */
public class InvalidConstraintException extends GangSheetException {

    public InvalidConstraintException(String message) {
        super(Category.VALIDATION, message);
    }
}
