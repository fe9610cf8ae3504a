package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.asset.AssetDescriptorResolver;
import com.largomodo.gangsheet.asset.AssetInspector;
import com.largomodo.gangsheet.asset.RawAsset;
import com.largomodo.gangsheet.core.domain.AssetFootprint;
import com.largomodo.gangsheet.core.domain.Design;
import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.pricing.JobQuote;
import com.largomodo.gangsheet.pricing.SheetQuote;
import com.largomodo.gangsheet.pricing.TierCostResolver;
import com.largomodo.gangsheet.service.OutputAssembler;
import com.largomodo.gangsheet.util.Units;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gang sheet job pipeline orchestrator.
 * <p>
 * Coordinates the workflow for one request:
 * 1. Inspect each asset file (kind, intrinsic size)
 * 2. Resolve footprints in points, once per distinct asset
 * 3. Lay out all copies across as many sheets as needed
 * 4. Price each sheet by its rounded length
 * 5. Render and write the sheets
 * <p>
 * Holds no per-request state; a single instance may serve concurrent jobs.
 */
public class GangSheetProcessor {

    private static final Logger log = LoggerFactory.getLogger(GangSheetProcessor.class);

    private final AssetInspector inspector;
    private final AssetDescriptorResolver resolver;
    private final GangSheetGenerator generator;
    private final TierCostResolver costResolver;
    private final OutputAssembler assembler;

    public GangSheetProcessor(AssetInspector inspector,
                              AssetDescriptorResolver resolver,
                              GangSheetGenerator generator,
                              TierCostResolver costResolver,
                              OutputAssembler assembler) {
        if (inspector == null || resolver == null || generator == null
                || costResolver == null || assembler == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.inspector = inspector;
        this.resolver = resolver;
        this.generator = generator;
        this.costResolver = costResolver;
        this.assembler = assembler;
    }

    /**
     * Runs a job end to end.
     *
     * @param request validated job description
     * @return sheets, prices and written files
     * @throws IOException         if an asset cannot be read or output cannot be written
     * @throws GangSheetException  if an asset or the geometry cannot be laid out
     */
    public JobResult process(JobRequest request) throws IOException {
        if (request.inputs().isEmpty()) {
            throw new InvalidQuantityException("At least one asset file is required");
        }

        Map<String, RawAsset> assets = new LinkedHashMap<>();
        List<Design> designs = new ArrayList<>();
        for (DesignInput input : request.inputs()) {
            RawAsset inspected = inspector.inspect(input.file());
            String name = uniqueName(inspected.name(), assets);
            RawAsset asset = new RawAsset(name, inspected.kind(), inspected.intrinsicWidth(),
                    inspected.intrinsicHeight(), inspected.pageCount(), inspected.content());

            AssetFootprint footprint = resolver.resolve(asset, request.rotate());
            log.info("Design {}: {}\" x {}\", {} copies", name,
                    Units.formatInches(round2(Units.toInches(footprint.baseWidth()))),
                    Units.formatInches(round2(Units.toInches(footprint.baseHeight()))),
                    input.copies());

            assets.put(name, asset);
            designs.add(new Design(name, footprint, input.copies()));
        }

        List<Sheet> sheets = generator.generateLayout(designs, request.constraints(), request.rotate());
        JobQuote quote = costResolver.quote(sheets);
        for (SheetQuote sheetQuote : quote.sheets()) {
            log.info("{}: {} copies, {}", sheetQuote.fileName(),
                    sheetQuote.sheet().copyCount(), sheetQuote.price().toPlainString());
        }

        List<Path> files = assembler.assemble(sheets, assets, request.outputDir());
        log.info("Success: {} sheet(s), total {}", sheets.size(), quote.total().toPlainString());
        return new JobResult(sheets, quote, files);
    }

    /**
     * Same file name from different directories must still map to distinct designs.
     */
    private static String uniqueName(String name, Map<String, RawAsset> taken) {
        if (!taken.containsKey(name)) {
            return name;
        }
        int suffix = 2;
        while (taken.containsKey(name + " (" + suffix + ")")) {
            suffix++;
        }
        return name + " (" + suffix + ")";
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
