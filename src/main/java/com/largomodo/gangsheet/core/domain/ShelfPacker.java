package com.largomodo.gangsheet.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Shelf packer for queues mixing different cell sizes.
 * <p>
 * Scans the queue in order with a cursor that starts at the top-left printable
 * corner. Copies are placed left to right; when the next copy would cross the
 * right margin the cursor wraps to a new shelf below the tallest copy of the
 * current one. The scan stops at the first copy that would cross the bottom
 * margin, leaving it at the front of the queue for the next sheet. Queue order
 * is never changed.
 * <p>
 * The scan runs against a full-length canvas; once the used length is known and
 * rounded up, every placement is shifted down so the content sits inside the
 * shorter sheet with its top shelf {@code margin} below the top edge.
 */
public class ShelfPacker implements SheetPacker {

    @Override
    public PackResult packOneSheet(List<Design> remaining, SheetConstraints constraints) {
        FitCheck.requireNonEmpty(remaining);
        // Every copy must fit an empty sheet, otherwise a later sheet could stall on it
        for (Design design : remaining) {
            FitCheck.requireFits(design, constraints);
        }

        double sheetWidth = constraints.width();
        double maxHeight = constraints.maxHeight();
        double margin = constraints.margin();
        double spacing = constraints.spacing();

        double x = margin;
        double y = maxHeight - margin;
        double rowHeight = 0;
        double lowestY = maxHeight;
        int row = 0;
        int col = 0;

        List<Placement> placements = new ArrayList<>();
        for (Design design : remaining) {
            double width = design.footprint().orientedWidth();
            double height = design.footprint().orientedHeight();

            if (col > 0 && x + width > sheetWidth - margin) {
                x = margin;
                y -= rowHeight + spacing;
                rowHeight = 0;
                row++;
                col = 0;
            }

            if (y - height < margin) {
                break;
            }

            double bottom = y - height;
            placements.add(new Placement(design, row, col, x, bottom, design.footprint().rotated()));
            x += width + spacing;
            rowHeight = Math.max(rowHeight, height);
            lowestY = Math.min(lowestY, bottom);
            col++;
        }

        double usedHeight = maxHeight - lowestY + margin;
        double height = constraints.roundUpLength(usedHeight);

        double shift = maxHeight - height;
        List<Placement> shifted = new ArrayList<>(placements.size());
        for (Placement placement : placements) {
            shifted.add(placement.shiftedDown(shift));
        }

        return new PackResult(new Sheet(sheetWidth, height, shifted), shifted.size());
    }
}
