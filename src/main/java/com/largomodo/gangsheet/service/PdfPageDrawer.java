package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.core.domain.Placement;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;

import java.io.IOException;

/**
 * Draws a vector asset imported as a form XObject.
 * <p>
 * The form is written to the document once and referenced by every placement,
 * so a sheet with hundreds of copies stays small and keeps the artwork vector.
 * The form matrix set on import already moves the crop box to the origin.
 */
class PdfPageDrawer implements AssetDrawer {

    private final PDFormXObject form;

    PdfPageDrawer(PDFormXObject form) {
        this.form = form;
    }

    @Override
    public void draw(PDPageContentStream content, Placement placement) throws IOException {
        content.saveGraphicsState();
        content.transform(Matrix.getTranslateInstance((float) placement.anchorX(), (float) placement.anchorY()));
        if (placement.rotated()) {
            content.transform(Matrix.getRotateInstance(Math.PI / 2, 0, 0));
        }
        content.drawForm(form);
        content.restoreGraphicsState();
    }
}
