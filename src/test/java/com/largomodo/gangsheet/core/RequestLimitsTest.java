package com.largomodo.gangsheet.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RequestLimitsTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 50, 10_000})
    void testQuantityWithinBoundsAccepted(int quantity) {
        assertEquals(quantity, RequestLimits.requireQuantity(quantity));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 10_001})
    void testQuantityOutOfBoundsRejected(int quantity) {
        InvalidQuantityException ex = assertThrows(InvalidQuantityException.class,
                () -> RequestLimits.requireQuantity(quantity));
        assertTrue(ex.isValidationFailure());
    }

    @Test
    void testOnlyStockRollWidthsAccepted() {
        assertEquals(22, RequestLimits.requireSheetWidth(22));
        assertEquals(30, RequestLimits.requireSheetWidth(30));
        assertThrows(InvalidConstraintException.class, () -> RequestLimits.requireSheetWidth(24));
    }

    @ParameterizedTest
    @ValueSource(ints = {11, 201, 0})
    void testMaxLengthOutOfBoundsRejected(int length) {
        assertThrows(InvalidConstraintException.class, () -> RequestLimits.requireMaxLength(length));
    }

    @Test
    void testMaxLengthBoundsInclusive() {
        assertEquals(12, RequestLimits.requireMaxLength(12));
        assertEquals(200, RequestLimits.requireMaxLength(200));
    }
}
