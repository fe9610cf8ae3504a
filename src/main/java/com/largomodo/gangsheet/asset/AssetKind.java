package com.largomodo.gangsheet.asset;

import com.largomodo.gangsheet.core.UnsupportedAssetKindException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Closed set of asset kinds the layout engine can place.
 * <p>
 * Detection looks at the leading magic bytes only; file extensions and MIME
 * types supplied by users are not trusted.
 */
public enum AssetKind {
    /** Single-page PDF, placed at its page box size. */
    VECTOR,
    /** PNG, JPEG, GIF or BMP image, placed at its pixel size over a fixed resolution. */
    RASTER;

    private static final byte[] PDF = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] GIF = "GIF8".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] BMP = "BM".getBytes(StandardCharsets.US_ASCII);

    /**
     * Determines the kind of an asset from its content.
     *
     * @param content raw file bytes
     * @param name    asset name, used in the error message
     * @return detected kind
     * @throws UnsupportedAssetKindException if the content matches no supported signature
     */
    public static AssetKind detect(byte[] content, String name) {
        if (content != null) {
            if (startsWith(content, PDF)) {
                return VECTOR;
            }
            if (startsWith(content, PNG) || startsWith(content, JPEG)
                    || startsWith(content, GIF) || startsWith(content, BMP)) {
                return RASTER;
            }
        }
        throw new UnsupportedAssetKindException(
                "Unsupported asset " + name + ": expected a PDF or a PNG/JPEG/GIF/BMP image");
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        return content.length >= prefix.length
                && Arrays.equals(content, 0, prefix.length, prefix, 0, prefix.length);
    }
}
