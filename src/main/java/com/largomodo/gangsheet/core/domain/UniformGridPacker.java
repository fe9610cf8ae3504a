package com.largomodo.gangsheet.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Grid packer for queues where every copy occupies the same cell size.
 * <p>
 * Column and row counts follow directly from the cell size, so the sheet is
 * laid out arithmetically in one pass: rows are filled left to right, top row
 * first, and the bottom-most row sits exactly {@code margin} above the sheet's
 * bottom edge. The sheet length is the grid height plus margins, rounded up to
 * the next length step.
 */
public class UniformGridPacker implements SheetPacker {

    @Override
    public PackResult packOneSheet(List<Design> remaining, SheetConstraints constraints) {
        FitCheck.requireNonEmpty(remaining);

        AssetFootprint cell = remaining.get(0).footprint();
        for (Design design : remaining) {
            if (!design.footprint().sameCellAs(cell)) {
                throw new IllegalArgumentException(
                        "Uniform packing requires a single cell size, found " + design.name()
                                + " differing from " + remaining.get(0).name());
            }
        }
        FitCheck.requireFits(remaining.get(0), constraints);

        double cellWidth = cell.orientedWidth();
        double cellHeight = cell.orientedHeight();
        double margin = constraints.margin();
        double spacing = constraints.spacing();

        int colsPerRow = FitCheck.columnsPerRow(cell, constraints);
        int maxRows = FitCheck.maxRowsPerSheet(cell, constraints);

        int count = remaining.size();
        // Column and row counts saturate at Integer.MAX_VALUE for hairline cells
        long rowsNeeded = ((long) count + colsPerRow - 1) / colsPerRow;
        int rows = (int) Math.min(rowsNeeded, maxRows);
        int consumed = (int) Math.min(count, (long) rows * colsPerRow);

        double rawHeight = rows * cellHeight + (rows - 1) * spacing + 2 * margin;
        double height = constraints.roundUpLength(rawHeight);

        List<Placement> placements = new ArrayList<>(consumed);
        for (int i = 0; i < consumed; i++) {
            int row = i / colsPerRow;
            int col = i % colsPerRow;
            // Row 0 is the top row; row (rows - 1) rests on the bottom margin
            double x = margin + col * (cellWidth + spacing);
            double y = margin + (rows - 1 - row) * (cellHeight + spacing);
            Design design = remaining.get(i);
            placements.add(new Placement(design, row, col, x, y, design.footprint().rotated()));
        }

        return new PackResult(new Sheet(constraints.width(), height, placements), consumed);
    }
}
