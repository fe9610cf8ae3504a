package com.largomodo.gangsheet.core.domain;

import com.largomodo.gangsheet.util.Units;

import java.util.List;

/**
 * One produced gang sheet: its final size and the copies placed on it.
 *
 * @param widthPts   sheet width, equal to the constraint width
 * @param heightPts  sheet length after rounding up, never above the maximum length
 * @param placements placements in fill order (unmodifiable)
 */
public record Sheet(double widthPts, double heightPts, List<Placement> placements) {

    public Sheet {
        placements = List.copyOf(placements);
    }

    public double widthInches() {
        return Units.toInches(widthPts);
    }

    public double heightInches() {
        return Units.toInches(heightPts);
    }

    public int copyCount() {
        return placements.size();
    }

    /**
     * Conventional file name for a rendered sheet, e.g. {@code gangsheet_22x48.pdf}.
     *
     * @param extension file extension without the dot
     */
    public String fileName(String extension) {
        return "gangsheet_" + Units.formatInches(widthInches()) + "x"
                + Units.formatInches(heightInches()) + "." + extension;
    }
}
