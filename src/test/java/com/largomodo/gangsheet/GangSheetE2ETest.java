package com.largomodo.gangsheet;

import com.largomodo.gangsheet.asset.generators.SyntheticAssetFactory;
import com.largomodo.gangsheet.core.JobResult;
import com.largomodo.gangsheet.core.domain.Placement;
import com.largomodo.gangsheet.core.domain.Sheet;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests running the full CLI pipeline on synthetic designs.
 * <p>
 * Each test writes real PDF or PNG files, executes the command line and checks
 * the rendered sheets on disk together with the returned layout and prices.
 */
class GangSheetE2ETest {

    @TempDir
    Path tempDir;

    private static final class Run {
        final int exitCode;
        final JobResult result;

        Run(int exitCode, JobResult result) {
            this.exitCode = exitCode;
            this.result = result;
        }
    }

    private static Run execute(String... args) {
        CommandLine cmd = GangSheet.createCommandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));
        int exitCode = cmd.execute(args);
        GangSheet gangSheet = cmd.getCommand();
        return new Run(exitCode, gangSheet.lastResult);
    }

    @Test
    void testFiftyCopiesOnOneSheet() throws Exception {
        Path logo = SyntheticAssetFactory.writePdf(tempDir, "logo.pdf", 288, 144);
        Path out = tempDir.resolve("out");

        Run run = execute("-q", "50", logo.toString(), "-o", out.toString());

        assertEquals(0, run.exitCode);
        assertEquals(1, run.result.sheets().size());
        assertEquals(new BigDecimal("15.84"), run.result.quote().total());

        Path sheet = out.resolve("gangsheet_22x33.pdf");
        assertTrue(Files.exists(sheet), "Sheet file should be created in a new output directory");
        try (PDDocument document = PDDocument.load(sheet.toFile())) {
            assertEquals(1, document.getNumberOfPages());
            assertEquals(22 * 72f, document.getPage(0).getMediaBox().getWidth(), 1e-3);
            assertEquals(33 * 72f, document.getPage(0).getMediaBox().getHeight(), 1e-3);
        }
    }

    @Test
    void testLargeOrderSplitsAcrossSheets() throws Exception {
        Path logo = SyntheticAssetFactory.writePdf(tempDir, "logo.pdf", 288, 144);

        Run run = execute("-q", "5000", logo.toString(), "-o", tempDir.toString());

        assertEquals(0, run.exitCode);
        assertEquals(16, run.result.sheets().size());
        assertEquals(16, run.result.files().size());
        assertTrue(Files.exists(tempDir.resolve("gangsheet_22x200.pdf")));
        assertTrue(Files.exists(tempDir.resolve("gangsheet_22x200_15.pdf")));
        assertTrue(Files.exists(tempDir.resolve("gangsheet_22x125.pdf")));
        // 15 x 75.68 + 56.32
        assertEquals(new BigDecimal("1191.52"), run.result.quote().total());
    }

    @Test
    void testRotatedCopies() throws Exception {
        Path logo = SyntheticAssetFactory.writePdf(tempDir, "logo.pdf", 288, 144);

        Run run = execute("-q", "50", "--rotate", logo.toString(), "-o", tempDir.toString());

        assertEquals(0, run.exitCode);
        assertTrue(Files.exists(tempDir.resolve("gangsheet_22x32.pdf")));
        Placement first = run.result.sheets().get(0).placements().get(0);
        assertTrue(first.rotated());
        assertEquals(153.0, first.anchorX(), 1e-9);
    }

    @Test
    void testRasterAndVectorMixedWithPerAssetCounts() throws Exception {
        Path logo = SyntheticAssetFactory.writePdf(tempDir, "logo.pdf", 288, 144);
        // 600 x 600 px at 300 dpi = 2" square
        Path photo = SyntheticAssetFactory.writePng(tempDir, "photo.png", 600, 600);

        Run run = execute("-q", "5", logo + "=3", photo.toString(), "-o", tempDir.toString());

        assertEquals(0, run.exitCode);
        assertEquals(8, run.result.sheets().stream().mapToInt(Sheet::copyCount).sum());
        assertEquals(3, run.result.sheets().get(0).placements().stream()
                .filter(p -> p.design().name().equals("logo.pdf")).count());
    }

    @Test
    void testMultipageBundleAndCustomTiers() throws Exception {
        Path logo = SyntheticAssetFactory.writePdf(tempDir, "logo.pdf", 288, 144);
        Path tiers = Files.writeString(tempDir.resolve("tiers.properties"), "12=1.00\n200=9.00\n");
        Path out = tempDir.resolve("bundle");

        Run run = execute("-q", "40", "-l", "12", "--bundle", "multipage", "--tiers", tiers.toString(),
                logo.toString(), "-o", out.toString());

        assertEquals(0, run.exitCode);
        assertEquals(3, run.result.sheets().size());
        assertEquals(new BigDecimal("3.00"), run.result.quote().total());
        try (PDDocument document = PDDocument.load(out.resolve("gangsheets.pdf").toFile())) {
            assertEquals(3, document.getNumberOfPages());
        }
    }

    @Test
    void testRoundUpTierPolicySelectable() throws Exception {
        // 20" x 2" strip: one copy per row, 31 rows -> 31*2 + 30*0.5 + 0.25 = 77.25" -> 78"
        Path strip = SyntheticAssetFactory.writePdf(tempDir, "strip.pdf", 20 * 72, 144);

        Run first = execute("-q", "31", strip.toString(), "-o", tempDir.resolve("a").toString());
        Run rounded = execute("-q", "31", "--tier-policy", "ROUND_UP_THEN_MATCH",
                strip.toString(), "-o", tempDir.resolve("b").toString());

        assertEquals(0, first.exitCode);
        assertEquals(78.0, first.result.sheets().get(0).heightInches(), 1e-9);
        assertEquals(new BigDecimal("35.20"), first.result.quote().total());
        // 78" bills as 84"; there is no 84" tier, so the 100" tier applies
        assertEquals(0, rounded.exitCode);
        assertEquals(new BigDecimal("44.00"), rounded.result.quote().total());
    }

    @Test
    void testTooWideDesignFailsWithUsageCode() throws IOException {
        Path poster = SyntheticAssetFactory.writePdf(tempDir, "poster.pdf", 23 * 72, 144);
        Path out = tempDir.resolve("out");

        Run run = execute("-q", "1", poster.toString(), "-o", out.toString());

        assertEquals(GangSheet.EXIT_USAGE, run.exitCode);
        assertNull(run.result);
        try (Stream<Path> listing = Files.list(out)) {
            assertEquals(0, listing.count(), "No files written for a failed job");
        }
    }

    @Test
    void testMultiPagePdfRejected() throws IOException {
        Path brochure = Files.write(tempDir.resolve("brochure.pdf"), SyntheticAssetFactory.pdf(288, 144, 2));

        Run run = execute("-q", "1", brochure.toString(), "-o", tempDir.toString());

        assertEquals(GangSheet.EXIT_USAGE, run.exitCode);
    }

    @Test
    void testCorruptPdfIsGeneralError() throws IOException {
        Path corrupt = Files.writeString(tempDir.resolve("corrupt.pdf"), "%PDF-1.4\nnot really a pdf");

        Run run = execute("-q", "1", corrupt.toString(), "-o", tempDir.toString());

        assertEquals(GangSheet.EXIT_ERROR, run.exitCode);
    }
}
