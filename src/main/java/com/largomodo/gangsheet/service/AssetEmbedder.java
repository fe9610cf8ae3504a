package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.asset.RawAsset;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.geom.AffineTransform;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds assets into one target document, at most once per asset.
 * <p>
 * The drawing strategy is chosen from the asset kind when the asset is first
 * embedded, never per placement. Imported source PDFs must stay open until the
 * target document is saved, so the embedder owns them and closes them in
 * {@link #close()}; close it only after saving.
 */
public class AssetEmbedder implements Closeable {

    private final PDDocument target;
    private final LayerUtility layerUtility;
    private final Map<String, AssetDrawer> drawers = new HashMap<>();
    private final List<PDDocument> sources = new ArrayList<>();

    public AssetEmbedder(PDDocument target) {
        this.target = target;
        this.layerUtility = new LayerUtility(target);
    }

    /**
     * @return drawer for the asset, embedding it into the target document on first use
     * @throws IOException if the asset content cannot be parsed
     */
    public AssetDrawer drawerFor(RawAsset asset) throws IOException {
        AssetDrawer drawer = drawers.get(asset.name());
        if (drawer == null) {
            drawer = embed(asset);
            drawers.put(asset.name(), drawer);
        }
        return drawer;
    }

    private AssetDrawer embed(RawAsset asset) throws IOException {
        return switch (asset.kind()) {
            case VECTOR -> {
                PDDocument source = PDDocument.load(asset.content());
                sources.add(source);
                PDPage page = source.getPage(0);
                PDFormXObject form = layerUtility.importPageAsForm(source, page);
                // The imported matrix offsets a crop box that is not flush with the media box
                // twice, so the crop box is moved to the form origin here instead.
                // Page /Rotate is not applied: the page is placed as measured.
                PDRectangle cropBox = page.getCropBox();
                form.setMatrix(AffineTransform.getTranslateInstance(-cropBox.getLowerLeftX(), -cropBox.getLowerLeftY()));
                form.setBBox(new PDRectangle(cropBox.getLowerLeftX(), cropBox.getLowerLeftY(),
                        cropBox.getWidth(), cropBox.getHeight()));
                yield new PdfPageDrawer(form);
            }
            case RASTER -> new RasterImageDrawer(
                    PDImageXObject.createFromByteArray(target, asset.content(), asset.name()));
        };
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (PDDocument source : sources) {
            try {
                source.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        sources.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
