package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.core.domain.Placement;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;

import java.io.IOException;

/**
 * Draws a raster asset embedded once as an image XObject, scaled to the footprint size.
 */
class RasterImageDrawer implements AssetDrawer {

    private final PDImageXObject image;

    RasterImageDrawer(PDImageXObject image) {
        this.image = image;
    }

    @Override
    public void draw(PDPageContentStream content, Placement placement) throws IOException {
        float width = (float) placement.design().footprint().baseWidth();
        float height = (float) placement.design().footprint().baseHeight();
        content.saveGraphicsState();
        content.transform(Matrix.getTranslateInstance((float) placement.anchorX(), (float) placement.anchorY()));
        if (placement.rotated()) {
            content.transform(Matrix.getRotateInstance(Math.PI / 2, 0, 0));
        }
        content.drawImage(image, 0, 0, width, height);
        content.restoreGraphicsState();
    }
}
