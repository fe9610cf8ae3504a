package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.pricing.JobQuote;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a job, returned to the caller instead of being kept in any shared store.
 *
 * @param sheets sheets in production order
 * @param quote  per-sheet and total prices
 * @param files  files written by the output assembler
 */
public record JobResult(List<Sheet> sheets, JobQuote quote, List<Path> files) {

    public JobResult {
        sheets = List.copyOf(sheets);
        files = List.copyOf(files);
    }
}
