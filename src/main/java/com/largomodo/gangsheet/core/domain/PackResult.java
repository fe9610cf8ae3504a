package com.largomodo.gangsheet.core.domain;

/**
 * Output of packing a single sheet.
 *
 * @param sheet    the laid out sheet
 * @param consumed how many copies from the front of the queue the sheet holds
 */
public record PackResult(Sheet sheet, int consumed) {
}
