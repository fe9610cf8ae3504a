package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.asset.RawAsset;
import com.largomodo.gangsheet.core.domain.Sheet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Turns laid out sheets into files.
 */
public interface OutputAssembler {

    /**
     * Renders and writes the sheets.
     *
     * @param sheets    sheets in production order
     * @param assets    source assets keyed by design name
     * @param outputDir existing directory to write into; existing files with the same names are replaced
     * @return written files
     * @throws IOException if rendering or writing fails
     */
    List<Path> assemble(List<Sheet> sheets, Map<String, RawAsset> assets, Path outputDir) throws IOException;
}
