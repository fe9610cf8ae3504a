package com.largomodo.gangsheet.core.domain;

/**
 * Position of one copy on a sheet, in points from the sheet's bottom-left corner.
 * <p>
 * {@code x}/{@code y} locate the bottom-left corner of the cell the oriented tile
 * occupies. The renderer draws the un-rotated asset from its own bottom-left
 * corner and turns rotated copies 90° counter-clockwise about that point, so a
 * rotated copy must be anchored at the cell's bottom-right corner:
 * {@code anchorX = x + orientedWidth}. Without that shift the rotated tile
 * would extend left of its cell.
 *
 * @param design  design this copy belongs to
 * @param row     zero-based row (shelf) index, top row first
 * @param col     zero-based position within the row, left to right
 * @param x       left edge of the cell
 * @param y       bottom edge of the cell
 * @param rotated whether the copy is turned 90°
 */
public record Placement(Design design, int row, int col, double x, double y, boolean rotated) {

    public double orientedWidth() {
        return rotated ? design.footprint().baseHeight() : design.footprint().baseWidth();
    }

    public double orientedHeight() {
        return rotated ? design.footprint().baseWidth() : design.footprint().baseHeight();
    }

    public double right() {
        return x + orientedWidth();
    }

    public double top() {
        return y + orientedHeight();
    }

    /**
     * @return x of the point the un-rotated asset's bottom-left corner is drawn at
     */
    public double anchorX() {
        return rotated ? x + orientedWidth() : x;
    }

    public double anchorY() {
        return y;
    }

    Placement shiftedDown(double delta) {
        return new Placement(design, row, col, x, y - delta, rotated);
    }
}
