package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.core.domain.SheetConstraints;

import java.nio.file.Path;
import java.util.List;

/**
 * Fully validated description of one gang sheet job.
 *
 * @param inputs      asset files with copy counts, in request order
 * @param constraints sheet geometry
 * @param rotate      whether to turn every copy 90°
 * @param outputDir   directory receiving the rendered files
 */
public record JobRequest(List<DesignInput> inputs, SheetConstraints constraints, boolean rotate, Path outputDir) {

    public JobRequest {
        inputs = List.copyOf(inputs);
    }
}
