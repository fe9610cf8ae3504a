package com.largomodo.gangsheet.pricing;

import com.largomodo.gangsheet.util.Units;

/**
 * How a sheet length is matched to a price tier.
 * <p>
 * Both policies saturate at the largest tier: a sheet longer than every
 * threshold is billed at the maximum price rather than rejected.
 */
public enum TierPolicy {

    /**
     * First tier whose threshold is at least the sheet length.
     */
    FIRST_AT_LEAST {
        @Override
        CostTier select(TierTable table, double lengthInches) {
            return firstAtLeast(table, lengthInches);
        }
    },

    /**
     * Round the length up to the next multiple of 12 inches, then take the tier
     * with exactly that threshold, falling back to the first tier at least that long.
     * Bills e.g. a 79" sheet as 84", which lands in the 100" tier of the default table.
     */
    ROUND_UP_THEN_MATCH {
        @Override
        CostTier select(TierTable table, double lengthInches) {
            double rounded = Units.ceilTolerant(lengthInches / ROUNDING_INCHES) * ROUNDING_INCHES;
            for (CostTier tier : table.tiers()) {
                if (Double.compare(tier.thresholdInches(), rounded) == 0) {
                    return tier;
                }
            }
            return firstAtLeast(table, rounded);
        }
    };

    private static final double ROUNDING_INCHES = 12.0;

    abstract CostTier select(TierTable table, double lengthInches);

    private static CostTier firstAtLeast(TierTable table, double lengthInches) {
        for (CostTier tier : table.tiers()) {
            if (lengthInches <= tier.thresholdInches()) {
                return tier;
            }
        }
        return table.maxTier();
    }
}
