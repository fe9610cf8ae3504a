package com.largomodo.gangsheet.pricing;

import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.core.domain.SheetNaming;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps sheet lengths to prices using a tier table and a matching policy.
 */
public class TierCostResolver {

    private final TierTable table;
    private final TierPolicy policy;

    public TierCostResolver(TierTable table, TierPolicy policy) {
        if (table == null || policy == null) {
            throw new IllegalArgumentException("Tier table and policy must not be null");
        }
        this.table = table;
        this.policy = policy;
    }

    /**
     * @param lengthInches rounded sheet length in inches
     * @return price of the matching tier, or of the largest tier if the sheet exceeds them all
     * @throws IllegalArgumentException if lengthInches is not positive
     */
    public BigDecimal priceFor(double lengthInches) {
        if (!(lengthInches > 0)) {
            throw new IllegalArgumentException("Sheet length must be positive, got: " + lengthInches);
        }
        return policy.select(table, lengthInches).price();
    }

    public SheetQuote quote(Sheet sheet) {
        return new SheetQuote(sheet, sheet.fileName("pdf"), priceFor(sheet.heightInches()));
    }

    /**
     * Prices every sheet of a job, naming them as they are written to disk.
     */
    public JobQuote quote(List<Sheet> sheets) {
        List<String> names = SheetNaming.uniqueFileNames(sheets, "pdf");
        List<SheetQuote> quotes = new ArrayList<>(sheets.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < sheets.size(); i++) {
            Sheet sheet = sheets.get(i);
            SheetQuote quote = new SheetQuote(sheet, names.get(i), priceFor(sheet.heightInches()));
            quotes.add(quote);
            total = total.add(quote.price());
        }
        return new JobQuote(quotes, total);
    }

    public TierPolicy getPolicy() {
        return policy;
    }
}
