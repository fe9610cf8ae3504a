package com.largomodo.gangsheet.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered work list of individual copies awaiting placement.
 * <p>
 * Each design is repeated {@code requestedCopies} times, grouped per design in
 * request order. Pagination consumes the queue from the front; the remaining
 * items are exposed as a read-only view so packers never copy the whole queue.
 * <p>
 * Not thread-safe: a queue belongs to a single request.
 */
public final class CopyQueue {

    private final List<Design> items;
    private int cursor;

    private CopyQueue(List<Design> items) {
        this.items = items;
    }

    /**
     * Expands designs into one entry per copy.
     *
     * @param designs designs in request order, must not be null
     * @return queue of length {@code sum(requestedCopies)}
     */
    public static CopyQueue of(List<Design> designs) {
        if (designs == null) {
            throw new IllegalArgumentException("Designs list cannot be null");
        }
        int total = designs.stream().mapToInt(Design::requestedCopies).sum();
        List<Design> items = new ArrayList<>(total);
        for (Design design : designs) {
            for (int i = 0; i < design.requestedCopies(); i++) {
                items.add(design);
            }
        }
        return new CopyQueue(items);
    }

    public int initialSize() {
        return items.size();
    }

    public int remainingCount() {
        return items.size() - cursor;
    }

    public boolean isEmpty() {
        return cursor >= items.size();
    }

    /**
     * @return unmodifiable view of the copies not yet placed, front first
     */
    public List<Design> remaining() {
        return Collections.unmodifiableList(items.subList(cursor, items.size()));
    }

    /**
     * Drops {@code consumed} copies from the front of the queue.
     *
     * @throws IllegalArgumentException if consumed is negative or exceeds the remaining count
     */
    public void advance(int consumed) {
        if (consumed < 0 || consumed > remainingCount()) {
            throw new IllegalArgumentException(
                    "Cannot advance by " + consumed + " with " + remainingCount() + " copies remaining");
        }
        cursor += consumed;
    }
}
