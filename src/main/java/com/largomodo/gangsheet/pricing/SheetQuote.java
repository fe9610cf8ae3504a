package com.largomodo.gangsheet.pricing;

import com.largomodo.gangsheet.core.domain.Sheet;

import java.math.BigDecimal;

/**
 * Price of a single produced sheet.
 *
 * @param sheet    the priced sheet
 * @param fileName conventional PDF file name of the sheet
 * @param price    tier price for the sheet's length
 */
public record SheetQuote(Sheet sheet, String fileName, BigDecimal price) {
}
