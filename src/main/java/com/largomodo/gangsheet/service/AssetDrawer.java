package com.largomodo.gangsheet.service;

import com.largomodo.gangsheet.core.domain.Placement;
import org.apache.pdfbox.pdmodel.PDPageContentStream;

import java.io.IOException;

/**
 * Draws one embedded asset at a placement.
 * <p>
 * Implementations hold a handle valid only for the document the asset was
 * embedded into; obtain them from {@link AssetEmbedder}.
 */
public interface AssetDrawer {

    /**
     * Draws the un-rotated asset with its bottom-left corner at the placement's
     * anchor, turned 90° counter-clockwise about the anchor when the placement is rotated.
     *
     * @param content   content stream of the sheet page
     * @param placement where to draw
     * @throws IOException if writing to the content stream fails
     */
    void draw(PDPageContentStream content, Placement placement) throws IOException;
}
