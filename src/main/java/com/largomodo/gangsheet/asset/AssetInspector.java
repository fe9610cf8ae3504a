package com.largomodo.gangsheet.asset;

import com.largomodo.gangsheet.core.UnsupportedAssetKindException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Loads asset files and reads their intrinsic dimensions.
 * <p>
 * PDFs are parsed with PDFBox and measured by the first page's CropBox. Images
 * are measured through an ImageIO reader's header without decoding pixel data,
 * so large print-resolution artwork stays cheap to inspect.
 */
public class AssetInspector {

    private static final Logger log = LoggerFactory.getLogger(AssetInspector.class);

    /**
     * Reads an asset from disk, naming it after its file name.
     *
     * @throws IOException                   if the file cannot be read or a PDF cannot be parsed
     * @throws UnsupportedAssetKindException if the content is neither PDF nor a supported image
     */
    public RawAsset inspect(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Asset file does not exist or is not a file: " + file);
        }
        return inspect(file.getFileName().toString(), Files.readAllBytes(file));
    }

    public RawAsset inspect(String name, byte[] content) throws IOException {
        AssetKind kind = AssetKind.detect(content, name);
        RawAsset asset = switch (kind) {
            case VECTOR -> inspectPdf(name, content);
            case RASTER -> inspectImage(name, content);
        };
        log.debug("Inspected {}: {} {} x {} ({} page(s))", name, kind,
                asset.intrinsicWidth(), asset.intrinsicHeight(), asset.pageCount());
        return asset;
    }

    private RawAsset inspectPdf(String name, byte[] content) throws IOException {
        try (PDDocument document = PDDocument.load(content)) {
            int pages = document.getNumberOfPages();
            if (pages == 0) {
                return new RawAsset(name, AssetKind.VECTOR, 0, 0, 0, content);
            }
            PDRectangle box = document.getPage(0).getCropBox();
            return new RawAsset(name, AssetKind.VECTOR, box.getWidth(), box.getHeight(), pages, content);
        }
    }

    private RawAsset inspectImage(String name, byte[] content) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new UnsupportedAssetKindException("No image decoder available for " + name);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new RawAsset(name, AssetKind.RASTER, reader.getWidth(0), reader.getHeight(0), 1, content);
            } catch (IOException e) {
                throw new UnsupportedAssetKindException("Image " + name + " could not be decoded", e);
            } finally {
                reader.dispose();
            }
        }
    }
}
