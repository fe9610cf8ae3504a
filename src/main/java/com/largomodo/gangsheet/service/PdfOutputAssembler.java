package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.asset.RawAsset;
import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.core.domain.SheetNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes sheets as PDF files, bundled according to a {@link BundleMode}.
 */
public class PdfOutputAssembler implements OutputAssembler {

    static final String MULTIPAGE_FILE = "gangsheets.pdf";
    static final String ARCHIVE_FILE = "gangsheets.zip";

    private static final Logger log = LoggerFactory.getLogger(PdfOutputAssembler.class);

    private final SheetRenderer renderer;
    private final BundleMode mode;

    public PdfOutputAssembler(SheetRenderer renderer, BundleMode mode) {
        this.renderer = renderer;
        this.mode = mode;
    }

    @Override
    public List<Path> assemble(List<Sheet> sheets, Map<String, RawAsset> assets, Path outputDir) throws IOException {
        if (sheets.isEmpty()) {
            return List.of();
        }
        if (!Files.isDirectory(outputDir)) {
            throw new IOException("Output path is not a directory: " + outputDir);
        }

        List<Path> written = switch (mode) {
            case SEPARATE -> writeSeparate(sheets, assets, outputDir);
            case MULTIPAGE -> List.of(writeMultipage(sheets, assets, outputDir));
            case ZIP -> List.of(writeArchive(sheets, assets, outputDir));
        };
        for (Path file : written) {
            log.info("  Created: {}", file.getFileName());
        }
        return written;
    }

    private List<Path> writeSeparate(List<Sheet> sheets, Map<String, RawAsset> assets, Path outputDir)
            throws IOException {
        List<String> names = SheetNaming.uniqueFileNames(sheets, "pdf");
        List<Path> written = new ArrayList<>(sheets.size());
        for (int i = 0; i < sheets.size(); i++) {
            Path target = outputDir.resolve(names.get(i));
            Files.write(target, renderer.render(sheets.get(i), assets));
            written.add(target);
        }
        return written;
    }

    private Path writeMultipage(List<Sheet> sheets, Map<String, RawAsset> assets, Path outputDir)
            throws IOException {
        Path target = outputDir.resolve(MULTIPAGE_FILE);
        Files.write(target, renderer.render(sheets, assets));
        return target;
    }

    private Path writeArchive(List<Sheet> sheets, Map<String, RawAsset> assets, Path outputDir)
            throws IOException {
        Path target = outputDir.resolve(ARCHIVE_FILE);
        List<String> names = SheetNaming.uniqueFileNames(sheets, "pdf");
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (int i = 0; i < sheets.size(); i++) {
                zip.putNextEntry(new ZipEntry(names.get(i)));
                zip.write(renderer.render(sheets.get(i), assets));
                zip.closeEntry();
            }
        }
        return target;
    }

    public BundleMode getMode() {
        return mode;
    }
}
