package com.largomodo.gangsheet.pricing;

import java.math.BigDecimal;

/**
 * Price bracket covering sheets up to {@code thresholdInches} long.
 *
 * @param thresholdInches longest sheet length billed at this price (> 0)
 * @param price           price of one sheet in this bracket (>= 0)
 */
public record CostTier(double thresholdInches, BigDecimal price) {

    public CostTier {
        if (!(thresholdInches > 0)) {
            throw new IllegalArgumentException("Tier threshold must be positive, got: " + thresholdInches);
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Tier price must be non-negative, got: " + price);
        }
    }
}
