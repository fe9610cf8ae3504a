package com.largomodo.gangsheet.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CopyQueueTest {

    private final Design logo = new Design("logo.pdf", new AssetFootprint(288, 144, false), 3);
    private final Design badge = new Design("badge.png", new AssetFootprint(144, 144, false), 2);

    @Test
    void testCopiesGroupedPerDesignInOrder() {
        CopyQueue queue = CopyQueue.of(List.of(logo, badge));

        assertEquals(5, queue.initialSize());
        assertEquals(List.of(logo, logo, logo, badge, badge), queue.remaining());
    }

    @Test
    void testAdvanceConsumesFromFront() {
        CopyQueue queue = CopyQueue.of(List.of(logo, badge));

        queue.advance(4);

        assertEquals(1, queue.remainingCount());
        assertEquals(List.of(badge), queue.remaining());
        assertFalse(queue.isEmpty());

        queue.advance(1);
        assertTrue(queue.isEmpty());
        assertEquals(5, queue.initialSize(), "Initial size is unaffected by consumption");
    }

    @Test
    void testAdvanceBeyondRemainingRejected() {
        CopyQueue queue = CopyQueue.of(List.of(badge));

        assertThrows(IllegalArgumentException.class, () -> queue.advance(3));
        assertThrows(IllegalArgumentException.class, () -> queue.advance(-1));
    }

    @Test
    void testRemainingIsReadOnly() {
        CopyQueue queue = CopyQueue.of(List.of(logo));

        assertThrows(UnsupportedOperationException.class, () -> queue.remaining().add(badge));
    }

    @Test
    void testEmptyDesignListGivesEmptyQueue() {
        CopyQueue queue = CopyQueue.of(List.of());

        assertTrue(queue.isEmpty());
        assertEquals(0, queue.initialSize());
    }
}
