package com.kotsin.estimator.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MathUtils")
class MathUtilsTest {

    // ========== LOG-SUM-EXP ==========

    @Test
    @DisplayName("logSumExp matches the direct formula for small values")
    void testLogSumExp() {
        double expected = Math.log(Math.exp(1.0) + Math.exp(2.0) + Math.exp(3.0));

        assertEquals(expected, MathUtils.logSumExp(new double[] {1.0, 2.0, 3.0}), 1e-12);
    }

    @Test
    @DisplayName("logSumExp does not overflow or underflow")
    void testLogSumExp_ExtremeValues() {
        assertEquals(1000.0 + Math.log(2.0), MathUtils.logSumExp(new double[] {1000.0, 1000.0}), 1e-9);
        assertEquals(-1000.0 + Math.log(2.0), MathUtils.logSumExp(new double[] {-1000.0, -1000.0}), 1e-9);
    }

    @Test
    @DisplayName("logSumExp of nothing is negative infinity")
    void testLogSumExp_Empty() {
        assertEquals(Double.NEGATIVE_INFINITY, MathUtils.logSumExp(new double[0]));
        assertEquals(Double.NEGATIVE_INFINITY,
                MathUtils.logSumExp(new double[] {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY}));
    }

    // ========== SOFTMAX ==========

    @Test
    @DisplayName("normalizeLogWeights is invariant to a common shift")
    void testNormalizeLogWeights_ShiftInvariant() {
        double[] base = MathUtils.normalizeLogWeights(new double[] {0.0, Math.log(3.0)});
        double[] shifted = MathUtils.normalizeLogWeights(new double[] {-5000.0, -5000.0 + Math.log(3.0)});

        assertArrayEquals(new double[] {0.25, 0.75}, base, 1e-12);
        assertArrayEquals(base, shifted, 1e-12);
    }

    @Test
    @DisplayName("normalizeLogWeights falls back to uniform weights")
    void testNormalizeLogWeights_NoFiniteTerm() {
        double[] weights = MathUtils.normalizeLogWeights(
                new double[] {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY});

        assertArrayEquals(new double[] {0.5, 0.5}, weights, 1e-12);
    }

    @Test
    @DisplayName("normalize scales weights to sum to one")
    void testNormalize() {
        assertArrayEquals(new double[] {0.2, 0.8}, MathUtils.normalize(new double[] {1.0, 4.0}), 1e-12);
        assertArrayEquals(new double[] {0.5, 0.5}, MathUtils.normalize(new double[] {0.0, 0.0}), 1e-12);
    }

    // ========== VALIDATION ==========

    @Test
    @DisplayName("isValidNumber rejects NaN and infinities")
    void testIsValidNumber() {
        assertTrue(MathUtils.isValidNumber(1.5));
        assertFalse(MathUtils.isValidNumber(Double.NaN));
        assertFalse(MathUtils.isValidNumber(Double.POSITIVE_INFINITY));
    }
}
