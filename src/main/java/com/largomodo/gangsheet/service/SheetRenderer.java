package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.asset.RawAsset;
import com.largomodo.gangsheet.core.domain.Placement;
import com.largomodo.gangsheet.core.domain.Sheet;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Renders laid out sheets as PDF pages sized exactly to each sheet.
 */
public class SheetRenderer {

    private static final Logger log = LoggerFactory.getLogger(SheetRenderer.class);

    /**
     * Renders sheets into one PDF, one page per sheet.
     *
     * @param sheets sheets in page order
     * @param assets source assets keyed by design name
     * @return saved PDF bytes
     * @throws IOException if an asset cannot be embedded or the document cannot be written
     */
    public byte[] render(List<Sheet> sheets, Map<String, RawAsset> assets) throws IOException {
        try (PDDocument document = new PDDocument();
             AssetEmbedder embedder = new AssetEmbedder(document)) {
            for (Sheet sheet : sheets) {
                addPage(document, embedder, sheet, assets);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    public byte[] render(Sheet sheet, Map<String, RawAsset> assets) throws IOException {
        return render(List.of(sheet), assets);
    }

    private void addPage(PDDocument document, AssetEmbedder embedder, Sheet sheet,
                         Map<String, RawAsset> assets) throws IOException {
        PDPage page = new PDPage(new PDRectangle((float) sheet.widthPts(), (float) sheet.heightPts()));
        document.addPage(page);

        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            for (Placement placement : sheet.placements()) {
                RawAsset asset = assets.get(placement.design().name());
                if (asset == null) {
                    throw new IllegalArgumentException("No asset supplied for design " + placement.design().name());
                }
                embedder.drawerFor(asset).draw(content, placement);
            }
        }
        log.debug("Rendered page {} x {} pt with {} copies",
                sheet.widthPts(), sheet.heightPts(), sheet.copyCount());
    }
}
