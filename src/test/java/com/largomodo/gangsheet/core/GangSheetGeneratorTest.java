package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.core.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GangSheetGeneratorTest {

    private static final SheetConstraints ROLL = SheetConstraints.ofInches(22, 200, 0.125, 0.5);

    private GangSheetGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new GangSheetGenerator(new SheetPaginator(new AdaptiveSheetPacker()));
    }

    @Test
    void testFiftyCopiesOnOneSheet() {
        List<Sheet> sheets = generator.generateLayout(
                List.of(new Design("logo.pdf", new AssetFootprint(288, 144, false), 50)), ROLL, false);

        assertEquals(1, sheets.size());
        assertEquals(50, sheets.get(0).copyCount());
        assertEquals(33.0, sheets.get(0).heightInches(), 1e-9);
        assertEquals("gangsheet_22x33.pdf", sheets.get(0).fileName("pdf"));
    }

    @Test
    void testRotateTurnsEveryCopy() {
        List<Sheet> sheets = generator.generateLayout(
                List.of(new Design("logo.pdf", new AssetFootprint(288, 144, false), 50)), ROLL, true);

        assertEquals(1, sheets.size());
        assertEquals(32.0, sheets.get(0).heightInches(), 1e-9);
        assertTrue(sheets.get(0).placements().stream().allMatch(Placement::rotated));
        Placement second = sheets.get(0).placements().get(1);
        assertEquals(189.0, second.x(), 1e-9);
        assertEquals(333.0, second.anchorX(), 1e-9);
    }

    @Test
    void testEmptyDesignListRejected() {
        assertThrows(InvalidQuantityException.class, () -> generator.generateLayout(List.of(), ROLL, false));
        assertThrows(InvalidQuantityException.class, () -> generator.generateLayout(null, ROLL, false));
    }

    @Test
    void testTooWideDesignFailsWithValidationCategory() {
        List<Design> designs = List.of(new Design("poster.pdf", new AssetFootprint(23 * 72, 144, false), 1));

        AssetTooWideException ex = assertThrows(AssetTooWideException.class,
                () -> generator.generateLayout(designs, ROLL, false));
        assertTrue(ex.isValidationFailure());
    }

    @Test
    void testTooTallDesignRejected() {
        List<Design> designs = List.of(new Design("scroll.pdf", new AssetFootprint(144, 201 * 72, false), 1));

        assertThrows(AssetTooTallException.class, () -> generator.generateLayout(designs, ROLL, false));
    }

    @Test
    void testMultipleDesignsKeepRequestOrder() {
        List<Design> designs = List.of(
                new Design("first.pdf", new AssetFootprint(288, 144, false), 2),
                new Design("second.png", new AssetFootprint(144, 144, false), 2));

        List<Sheet> sheets = generator.generateLayout(designs, ROLL, false);

        List<Placement> placements = sheets.get(0).placements();
        assertEquals(List.of("first.pdf", "first.pdf", "second.png", "second.png"),
                placements.stream().map(p -> p.design().name()).toList());
    }
}
