package com.largomodo.gangsheet.service;

/**
 * How rendered sheets are packaged on disk.
 */
public enum BundleMode {
    /** One PDF file per sheet, named {@code gangsheet_<W>x<H>.pdf}. */
    SEPARATE,
    /** A single {@code gangsheets.pdf} with one page per sheet. */
    MULTIPAGE,
    /** A single {@code gangsheets.zip} holding the per-sheet PDF files. */
    ZIP
}
