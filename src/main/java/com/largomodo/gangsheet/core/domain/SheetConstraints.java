package com.largomodo.gangsheet.core.domain;

import com.largomodo.gangsheet.core.InvalidConstraintException;
import com.largomodo.gangsheet.util.Units;

/**
 * Immutable geometry of the output medium, in points.
 * <p>
 * The sheet width is fixed by the roll being printed on; the length is
 * variable up to {@code maxHeight} and is always rounded up to a multiple of
 * {@code lengthStep} so that billing and cutting happen on whole units.
 *
 * @param width      fixed sheet width (> 0)
 * @param maxHeight  longest sheet that may be produced (> 0)
 * @param margin     unprintable border kept clear on every edge (>= 0)
 * @param spacing    gap between neighbouring copies, horizontally and vertically (>= 0)
 * @param lengthStep increment the produced sheet length is rounded up to (> 0)
 */
public record SheetConstraints(double width, double maxHeight, double margin, double spacing, double lengthStep) {

    /**
     * Compact constructor validating the geometric invariants.
     *
     * @throws InvalidConstraintException if any dimension is out of range or margins swallow the sheet
     */
    public SheetConstraints {
        if (!(width > 0)) {
            throw new InvalidConstraintException("Sheet width must be positive, got: " + width);
        }
        if (!(maxHeight > 0)) {
            throw new InvalidConstraintException("Maximum sheet length must be positive, got: " + maxHeight);
        }
        if (!(margin >= 0)) {
            throw new InvalidConstraintException("Margin cannot be negative, got: " + margin);
        }
        if (!(spacing >= 0)) {
            throw new InvalidConstraintException("Spacing cannot be negative, got: " + spacing);
        }
        if (!(lengthStep > 0)) {
            throw new InvalidConstraintException("Length step must be positive, got: " + lengthStep);
        }
        if (width <= 2 * margin) {
            throw new InvalidConstraintException(
                    "Margins (" + margin + " pt each side) leave no printable width on a " + width + " pt sheet");
        }
        if (maxHeight <= 2 * margin) {
            throw new InvalidConstraintException(
                    "Margins (" + margin + " pt each side) leave no printable length on a " + maxHeight + " pt sheet");
        }
    }

    /**
     * Builds constraints from inch values, rounding sheet length to whole inches.
     */
    public static SheetConstraints ofInches(double widthInches, double maxHeightInches,
                                            double marginInches, double spacingInches) {
        return ofInches(widthInches, maxHeightInches, marginInches, spacingInches, 1.0);
    }

    public static SheetConstraints ofInches(double widthInches, double maxHeightInches,
                                            double marginInches, double spacingInches,
                                            double lengthStepInches) {
        return new SheetConstraints(
                Units.toPoints(widthInches),
                Units.toPoints(maxHeightInches),
                Units.toPoints(marginInches),
                Units.toPoints(spacingInches),
                Units.toPoints(lengthStepInches));
    }

    public double printableWidth() {
        return width - 2 * margin;
    }

    public double printableHeight() {
        return maxHeight - 2 * margin;
    }

    /**
     * Rounds a required sheet length up to the next length step, capped at {@code maxHeight}.
     * <p>
     * Never rounds down: a shorter sheet would clip the bottom row of tiles.
     *
     * @param rawHeight required length in points
     * @return produced sheet length in points, {@code rawHeight <= result <= maxHeight}
     */
    public double roundUpLength(double rawHeight) {
        double stepped = Units.ceilTolerant(rawHeight / lengthStep) * lengthStep;
        return Math.min(Math.max(stepped, rawHeight), maxHeight);
    }
}
