package com.largomodo.gangsheet.core.domain;

import com.largomodo.gangsheet.core.AssetTooTallException;
import com.largomodo.gangsheet.core.AssetTooWideException;
import com.largomodo.gangsheet.util.Units;

import java.util.List;

/**
 * Fail-fast checks shared by the packers.
 * <p>
 * Rejecting an unfittable copy up front is what guarantees every packer call
 * consumes at least one copy, so pagination always terminates.
 */
class FitCheck {

    private FitCheck() {
    }

    /**
     * Number of columns of the given cell width that fit side by side.
     * <p>
     * n cells need {@code n*w + (n-1)*s} of printable width, hence
     * {@code n = floor((printable + s) / (w + s))}.
     */
    static int columnsPerRow(AssetFootprint footprint, SheetConstraints constraints) {
        return Units.floorTolerant((constraints.printableWidth() + constraints.spacing())
                / (footprint.orientedWidth() + constraints.spacing()));
    }

    static int maxRowsPerSheet(AssetFootprint footprint, SheetConstraints constraints) {
        return Units.floorTolerant((constraints.printableHeight() + constraints.spacing())
                / (footprint.orientedHeight() + constraints.spacing()));
    }

    static void requireFits(Design design, SheetConstraints constraints) {
        AssetFootprint footprint = design.footprint();
        if (columnsPerRow(footprint, constraints) < 1) {
            throw new AssetTooWideException(
                    "Design " + design.name() + " is " + Units.formatInches(Units.toInches(footprint.orientedWidth()))
                            + "\" wide but only " + Units.formatInches(Units.toInches(constraints.printableWidth()))
                            + "\" of sheet width is printable");
        }
        if (maxRowsPerSheet(footprint, constraints) < 1) {
            throw new AssetTooTallException(
                    "Design " + design.name() + " is " + Units.formatInches(Units.toInches(footprint.orientedHeight()))
                            + "\" tall but only " + Units.formatInches(Units.toInches(constraints.printableHeight()))
                            + "\" of sheet length is printable");
        }
    }

    static void requireNonEmpty(List<Design> remaining) {
        if (remaining == null || remaining.isEmpty()) {
            throw new IllegalArgumentException("Cannot pack a sheet from an empty copy queue");
        }
    }
}
