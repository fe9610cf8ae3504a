package com.largomodo.gangsheet.core;

import java.util.Set;

/**
 * Bounds a caller enforces on raw request values before building domain objects.
 * <p>
 * The layout engine itself accepts any consistent geometry; these limits reflect
 * what the print shop can actually produce.
 */
public class RequestLimits {

    public static final int MIN_QUANTITY = 1;
    public static final int MAX_QUANTITY = 10_000;
    public static final Set<Integer> SHEET_WIDTHS_INCHES = Set.of(22, 30);
    public static final int MIN_LENGTH_INCHES = 12;
    public static final int MAX_LENGTH_INCHES = 200;

    private RequestLimits() {
    }

    public static int requireQuantity(int quantity) {
        if (quantity < MIN_QUANTITY || quantity > MAX_QUANTITY) {
            throw new InvalidQuantityException(
                    "Quantity must be between " + MIN_QUANTITY + " and " + MAX_QUANTITY + ", got: " + quantity);
        }
        return quantity;
    }

    public static int requireSheetWidth(int widthInches) {
        if (!SHEET_WIDTHS_INCHES.contains(widthInches)) {
            throw new InvalidConstraintException(
                    "Sheet width must be 22 or 30 inches, got: " + widthInches);
        }
        return widthInches;
    }

    public static int requireMaxLength(int lengthInches) {
        if (lengthInches < MIN_LENGTH_INCHES || lengthInches > MAX_LENGTH_INCHES) {
            throw new InvalidConstraintException(
                    "Maximum sheet length must be between " + MIN_LENGTH_INCHES + " and "
                            + MAX_LENGTH_INCHES + " inches, got: " + lengthInches);
        }
        return lengthInches;
    }
}
