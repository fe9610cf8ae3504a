package com.largomodo.gangsheet.core.domain;

import com.largomodo.gangsheet.core.InvalidQuantityException;

/**
 * A named asset footprint together with how many copies of it were ordered.
 *
 * @param name            identifies the source asset (typically its file name), unique per request
 * @param footprint       size of one copy
 * @param requestedCopies number of copies to lay out (> 0)
 */
public record Design(String name, AssetFootprint footprint, int requestedCopies) {

    public Design {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Design name must not be null or blank");
        }
        if (footprint == null) {
            throw new IllegalArgumentException("Design footprint must not be null");
        }
        if (requestedCopies <= 0) {
            throw new InvalidQuantityException(
                    "Requested copies must be positive for " + name + ", got: " + requestedCopies);
        }
    }

    public Design withRotated(boolean rotate) {
        AssetFootprint oriented = footprint.withRotated(rotate);
        return oriented == footprint ? this : new Design(name, oriented, requestedCopies);
    }
}
