package com.kotsin.estimator.util;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.linalg.LinalgUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Per-step checks must raise ShapeMismatchException, configuration checks
 * EstimatorConfigurationException; the runtime routes the two differently.
 */
@DisplayName("ValidationUtils - Shape and configuration checks")
class ValidationUtilsTest {

    // ========== PER-STEP SHAPES ==========

    @Test
    @DisplayName("requireSize accepts the expected size")
    void testRequireSize_Valid() {
        assertDoesNotThrow(() -> ValidationUtils.requireSize(LinalgUtils.zeros(3), 3, "measurement"));
    }

    @Test
    @DisplayName("requireSize names the offending input")
    void testRequireSize_Mismatch() {
        ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
                () -> ValidationUtils.requireSize(LinalgUtils.zeros(2), 3, "measurement"));

        assertTrue(e.getMessage().contains("measurement"));
    }

    @Test
    @DisplayName("requireSize and requireShape reject missing values")
    void testRequire_Missing() {
        assertThrows(ShapeMismatchException.class, () -> ValidationUtils.requireSize(null, 1, "features"));
        assertThrows(ShapeMismatchException.class, () -> ValidationUtils.requireShape(null, 1, 1, "processModel"));
    }

    @Test
    @DisplayName("requireSquare rejects a rectangular matrix")
    void testRequireSquare() {
        assertThrows(ShapeMismatchException.class,
                () -> ValidationUtils.requireSquare(LinalgUtils.zeros(2, 3), "processNoise"));
    }

    @Test
    @DisplayName("requireRectangular rejects jagged and empty arrays")
    void testRequireRectangular() {
        assertThrows(ShapeMismatchException.class,
                () -> ValidationUtils.requireRectangular(new double[][] {{1, 2}, {3}}, "measurementModel"));
        assertThrows(ShapeMismatchException.class,
                () -> ValidationUtils.requireRectangular(new double[0][], "measurementModel"));
        assertThrows(ShapeMismatchException.class,
                () -> ValidationUtils.requireRectangular(new double[][] {{}}, "measurementModel"));
    }

    // ========== CONFIGURATION ==========

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("checkPositive rejects non-positive sizes")
    void testCheckPositive(int value) {
        assertThrows(EstimatorConfigurationException.class, () -> ValidationUtils.checkPositive(value, "stateSize"));
    }

    @Test
    @DisplayName("checkShape raises a configuration error")
    void testCheckShape() {
        assertThrows(EstimatorConfigurationException.class,
                () -> ValidationUtils.checkShape(LinalgUtils.identity(2), 3, 3, "initialCovariance"));
        assertThrows(EstimatorConfigurationException.class,
                () -> ValidationUtils.checkShape(null, 3, 3, "initialCovariance"));
    }

    @Test
    @DisplayName("getOrDefault returns the default only for null")
    void testGetOrDefault() {
        assertEquals(3, ValidationUtils.getOrDefault(3, 5));
        assertEquals(5, ValidationUtils.getOrDefault(null, 5));
    }
}
