package com.largomodo.gangsheet.core.domain;

import java.util.List;

/**
 * Strategy interface for laying out one sheet from the front of a copy queue.
 * <p>
 * Implementations are pure: the same remaining queue and constraints always
 * produce the same placements.
 */
public interface SheetPacker {

    /**
     * Fills one sheet with as many copies from the front of the queue as fit.
     *
     * @param remaining   copies still to place, front first; must not be null or empty
     * @param constraints sheet geometry
     * @return the sheet and the number of copies it consumed (at least one)
     * @throws com.largomodo.gangsheet.core.AssetTooWideException if a copy cannot fit even one per row
     * @throws com.largomodo.gangsheet.core.AssetTooTallException if a copy cannot fit on an empty sheet
     * @throws IllegalArgumentException if remaining is null or empty
     */
    PackResult packOneSheet(List<Design> remaining, SheetConstraints constraints);
}
