package com.largomodo.gangsheet.util;

import java.math.BigDecimal;

/**
 * Conversions between inches and PDF points (1/72 inch).
 * <p>
 * All layout geometry is computed in points. Inches only appear at the edges:
 * CLI arguments, tier lookups, and rendered file names.
 * <p>
 * The tolerant floor/ceil helpers absorb binary floating point noise so that
 * an exact fit such as {@code 1602.0 / 324.0} never lands one unit short.
 */
public class Units {

    public static final double POINTS_PER_INCH = 72.0;

    // Well below any meaningful geometric difference (1e-9 pt)
    private static final double EPSILON = 1e-9;

    private Units() {
    }

    public static double toPoints(double inches) {
        return inches * POINTS_PER_INCH;
    }

    public static double toInches(double points) {
        return points / POINTS_PER_INCH;
    }

    /**
     * Floors a quotient, treating values within epsilon below an integer as that integer.
     */
    public static int floorTolerant(double value) {
        return (int) Math.floor(value + EPSILON);
    }

    /**
     * Ceils a quotient, treating values within epsilon above an integer as that integer.
     */
    public static int ceilTolerant(double value) {
        return (int) Math.ceil(value - EPSILON);
    }

    /**
     * Formats an inch value for file names and reports: "22" for whole inches, "22.5" otherwise.
     *
     * @param inches length in inches
     * @return shortest plain decimal representation
     */
    public static String formatInches(double inches) {
        double rounded = Math.rint(inches);
        if (Math.abs(inches - rounded) < 1e-6) {
            return Long.toString((long) rounded);
        }
        return BigDecimal.valueOf(inches).stripTrailingZeros().toPlainString();
    }
}
