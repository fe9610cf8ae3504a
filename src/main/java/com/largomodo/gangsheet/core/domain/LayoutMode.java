package com.largomodo.gangsheet.core.domain;

import java.util.List;

/**
 * Packing strategy chosen for a sheet.
 */
public enum LayoutMode {
    /** Every remaining copy has the same cell size: arithmetic grid. */
    UNIFORM,
    /** Mixed cell sizes: in-order shelf scan. */
    SHELF;

    /**
     * Picks the mode for the copies still queued.
     *
     * @param remaining non-empty remaining queue
     * @return UNIFORM when all copies share one oriented footprint, SHELF otherwise
     */
    public static LayoutMode select(List<Design> remaining) {
        AssetFootprint first = remaining.get(0).footprint();
        for (Design design : remaining) {
            if (!design.footprint().sameCellAs(first)) {
                return SHELF;
            }
        }
        return UNIFORM;
    }
}
