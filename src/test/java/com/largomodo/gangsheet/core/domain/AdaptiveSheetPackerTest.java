package com.largomodo.gangsheet.core.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for layout mode selection and delegation.
 */
class AdaptiveSheetPackerTest {

    private static final SheetConstraints ROLL = SheetConstraints.ofInches(22, 200, 0.125, 0.5);
    private static final AssetFootprint SMALL = new AssetFootprint(288, 144, false);
    private static final AssetFootprint LARGE = new AssetFootprint(432, 216, false);

    private SheetPacker mockUniform;
    private SheetPacker mockShelf;
    private AdaptiveSheetPacker packer;

    @BeforeEach
    void setUp() {
        mockUniform = mock(SheetPacker.class);
        mockShelf = mock(SheetPacker.class);
        packer = new AdaptiveSheetPacker(mockUniform, mockShelf);
    }

    @Test
    void testSingleSizeQueueUsesUniformGrid() {
        List<Design> queue = CopyQueue.of(List.of(
                new Design("a.pdf", SMALL, 2),
                new Design("b.pdf", SMALL, 3))).remaining();

        assertEquals(LayoutMode.UNIFORM, LayoutMode.select(queue));
        packer.packOneSheet(queue, ROLL);

        verify(mockUniform).packOneSheet(queue, ROLL);
        verifyNoInteractions(mockShelf);
    }

    @Test
    void testMixedQueueUsesShelves() {
        List<Design> queue = CopyQueue.of(List.of(
                new Design("a.pdf", SMALL, 2),
                new Design("b.pdf", LARGE, 1))).remaining();

        assertEquals(LayoutMode.SHELF, LayoutMode.select(queue));
        packer.packOneSheet(queue, ROLL);

        verify(mockShelf).packOneSheet(queue, ROLL);
        verifyNoInteractions(mockUniform);
    }

    @Test
    void testRotatedAndUprightCopiesOfSwappedSizesShareCell() {
        AssetFootprint tall = new AssetFootprint(144, 288, false);
        List<Design> queue = CopyQueue.of(List.of(
                new Design("wide.pdf", SMALL.withRotated(true), 1),
                new Design("tall.pdf", tall, 1))).remaining();

        assertEquals(LayoutMode.UNIFORM, LayoutMode.select(queue));
    }

    @Test
    void testEmptyQueueRejectedBeforeDelegation() {
        assertThrows(IllegalArgumentException.class, () -> packer.packOneSheet(List.of(), ROLL));
        verify(mockUniform, never()).packOneSheet(any(), any());
        verify(mockShelf, never()).packOneSheet(any(), any());
    }

    @Test
    void testDefaultPackerSwitchesToGridOnceMixedDesignsAreUsedUp() {
        // 12" sheet: the shelf sheet takes 2 banners and 2 strips, leaving 1 strip for a grid sheet
        SheetConstraints shortRoll = SheetConstraints.ofInches(22, 12, 0.125, 0.5);
        CopyQueue queue = CopyQueue.of(List.of(
                new Design("banner.pdf", new AssetFootprint(720, 360, false), 2),
                new Design("strip.pdf", new AssetFootprint(720, 288, false), 3)));
        AdaptiveSheetPacker real = new AdaptiveSheetPacker();

        PackResult first = real.packOneSheet(queue.remaining(), shortRoll);
        queue.advance(first.consumed());
        assertEquals(4, first.consumed());
        assertEquals(LayoutMode.UNIFORM, LayoutMode.select(queue.remaining()));

        PackResult second = real.packOneSheet(queue.remaining(), shortRoll);
        assertEquals(1, second.consumed());
        // 4" strip + margins = 4.25" -> 5"
        assertEquals(5.0, second.sheet().heightInches(), 1e-9);
        assertEquals(9.0, second.sheet().placements().get(0).y(), 1e-9);
    }
}
