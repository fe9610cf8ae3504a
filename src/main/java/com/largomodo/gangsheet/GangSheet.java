package com.largomodo.gangsheet;

import com.largomodo.gangsheet.asset.AssetDescriptorResolver;
import com.largomodo.gangsheet.asset.AssetInspector;
import com.largomodo.gangsheet.core.DesignInput;
import com.largomodo.gangsheet.core.GangSheetException;
import com.largomodo.gangsheet.core.GangSheetGenerator;
import com.largomodo.gangsheet.core.GangSheetProcessor;
import com.largomodo.gangsheet.core.JobRequest;
import com.largomodo.gangsheet.core.JobResult;
import com.largomodo.gangsheet.core.RequestLimits;
import com.largomodo.gangsheet.core.SheetPaginator;
import com.largomodo.gangsheet.core.domain.AdaptiveSheetPacker;
import com.largomodo.gangsheet.core.domain.SheetConstraints;
import com.largomodo.gangsheet.pricing.TierCostResolver;
import com.largomodo.gangsheet.pricing.TierPolicy;
import com.largomodo.gangsheet.pricing.TierTable;
import com.largomodo.gangsheet.service.BundleMode;
import com.largomodo.gangsheet.service.PdfOutputAssembler;
import com.largomodo.gangsheet.service.SheetRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for laying out repeated designs onto gang sheets.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Each positional argument is an asset file, optionally
 * suffixed with {@code =COUNT} to override the copy count for that file.
 * <p>
 * Request bounds (quantity, roll width, maximum length) are enforced here, before
 * any domain object is built; the layout engine itself accepts any consistent geometry.
 */
@Command(
        name = "gangsheet",
        mixinStandardHelpOptions = true,
        resourceBundle = "gangsheet.gangsheet",
        version = "${bundle:application.version}",
        header = "Lays out repeated designs onto print-ready gang sheets.",
        description = {
                "Places as many copies of each PDF or image design as fit on fixed-width sheets," +
                        " spilling onto further sheets until every copy is placed.",
                "",
                "Each sheet is cut to its used length, rounded up to whole inches, and priced" +
                        " against a tiered price list."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, internal layout failure)",
                "2:Invalid arguments or designs that cannot be laid out"
        }
)
public class GangSheet implements Callable<Integer> {

    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(GangSheet.class);

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "ASSET[=COUNT]",
            description = {
                    "Design files to lay out: single-page PDFs or PNG/JPEG/GIF/BMP images.",
                    "Append =COUNT to override --quantity for one file, e.g. logo.pdf=40."
            })
    List<String> assets;

    @Option(names = {"-q", "--quantity"}, required = true,
            description = "Copies of each design (1-10000).")
    int quantity;

    @Option(names = {"-w", "--width"}, defaultValue = "22",
            description = "Sheet width in inches: 22 or 30. Default: ${DEFAULT-VALUE}")
    int widthInches;

    @Option(names = {"-l", "--max-length"}, defaultValue = "200",
            description = "Longest sheet in inches (12-200). Default: ${DEFAULT-VALUE}")
    int maxLengthInches;

    @Option(names = "--margin", defaultValue = "0.125",
            description = "Clear border on every edge, in inches. Default: ${DEFAULT-VALUE}")
    double marginInches;

    @Option(names = "--spacing", defaultValue = "0.5",
            description = "Gap between copies, in inches. Default: ${DEFAULT-VALUE}")
    double spacingInches;

    @Option(names = "--length-step", defaultValue = "1",
            description = "Sheet lengths are rounded up to a multiple of this many inches. Default: ${DEFAULT-VALUE}")
    double lengthStepInches;

    @Option(names = "--rotate", description = "Turn every copy 90 degrees.")
    boolean rotate;

    @Option(names = "--dpi", defaultValue = "300",
            description = "Print resolution assumed for raster images. Default: ${DEFAULT-VALUE}")
    int dpi;

    @Option(names = "--tier-policy", defaultValue = "FIRST_AT_LEAST",
            description = {
                    "How sheet lengths map to price tiers.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    TierPolicy tierPolicy;

    @Option(names = "--tiers", paramLabel = "FILE",
            description = "Price list (properties: lengthInches=price). Default: bundled price list.")
    File tiersFile;

    @Option(names = "--bundle", defaultValue = "SEPARATE",
            description = {
                    "Output packaging.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    BundleMode bundle;

    @Option(names = {"-o", "--output-dir"}, defaultValue = ".",
            description = "Destination directory, created if missing. Default: current directory.")
    File outputDir;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    JobResult lastResult;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the configured command line: case-insensitive enums, and layout
     * failures reported as one-line errors with an exit code by category.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new GangSheet());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("ERROR: {}", ex.getMessage());
            log.debug("Failure details", ex);
            MDC.remove("job");
            return exitCodeFor(ex);
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof GangSheetException && ((GangSheetException) ex).isValidationFailure()) {
            return EXIT_USAGE;
        }
        return EXIT_ERROR;
    }

    /**
     * Splits {@code path=COUNT} arguments. A trailing {@code =digits} is a count
     * unless the whole argument names an existing file.
     */
    static DesignInput parseAsset(String argument, int defaultCopies) {
        int separator = argument.lastIndexOf('=');
        if (separator > 0 && separator < argument.length() - 1 && !Files.exists(Path.of(argument))) {
            String count = argument.substring(separator + 1);
            if (count.chars().allMatch(Character::isDigit)) {
                int copies;
                try {
                    copies = Integer.parseInt(count);
                } catch (NumberFormatException e) {
                    copies = Integer.MAX_VALUE;
                }
                return new DesignInput(Path.of(argument.substring(0, separator)), copies);
            }
        }
        return new DesignInput(Path.of(argument), defaultCopies);
    }

    private static GangSheetProcessor createProcessor(int dpi, TierCostResolver costResolver, BundleMode bundle) {
        // Dependency injection: instantiate service implementations
        GangSheetGenerator generator = new GangSheetGenerator(new SheetPaginator(new AdaptiveSheetPacker()));
        return new GangSheetProcessor(
                new AssetInspector(),
                new AssetDescriptorResolver(dpi),
                generator,
                costResolver,
                new PdfOutputAssembler(new SheetRenderer(), bundle));
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        RequestLimits.requireQuantity(quantity);
        RequestLimits.requireSheetWidth(widthInches);
        RequestLimits.requireMaxLength(maxLengthInches);

        if (dpi <= 0) {
            throw new ParameterException(spec.commandLine(), "Resolution must be positive, got: " + dpi);
        }

        List<DesignInput> inputs = new ArrayList<>(assets.size());
        for (String argument : assets) {
            DesignInput input = parseAsset(argument, quantity);
            RequestLimits.requireQuantity(input.copies());
            if (!Files.isRegularFile(input.file())) {
                throw new ParameterException(spec.commandLine(),
                        "Asset file does not exist: " + input.file().toAbsolutePath());
            }
            inputs.add(input);
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        Files.createDirectories(outputDir.toPath());
        if (!outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }

        TierTable table = tiersFile == null ? TierTable.defaults() : TierTable.load(tiersFile.toPath());

        SheetConstraints constraints = SheetConstraints.ofInches(
                widthInches, maxLengthInches, marginInches, spacingInches, lengthStepInches);
        GangSheetProcessor processor = createProcessor(dpi, new TierCostResolver(table, tierPolicy), bundle);

        // On failure the execution exception handler logs the error under this job, then removes it
        MDC.put("job", inputs.get(0).file().getFileName().toString());
        lastResult = processor.process(new JobRequest(inputs, constraints, rotate, outputDir.toPath()));
        MDC.remove("job");

        log.info("Conversion complete: {} sheet(s) in {}", lastResult.sheets().size(), outputDir.getAbsolutePath());
        return 0;
    }
}
