package com.largomodo.gangsheet.core;

/**
 * Thrown when the packer makes no progress on a non-empty copy queue.
 * <p>
 * The packer fails fast on unfittable assets, so a stalled sheet means the
 * packer and the paginator disagree about the queue. Treated as a bug: never retried.
 */
public class PackingStalledException extends GangSheetException {

    public PackingStalledException(String message) {
        super(Category.INTERNAL, message);
    }
}
