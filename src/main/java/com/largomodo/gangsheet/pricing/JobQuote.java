package com.largomodo.gangsheet.pricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Prices of all sheets produced for one request.
 *
 * @param sheets per-sheet prices in production order (unmodifiable)
 * @param total  sum of all sheet prices
 */
public record JobQuote(List<SheetQuote> sheets, BigDecimal total) {

    public JobQuote {
        sheets = List.copyOf(sheets);
    }
}
