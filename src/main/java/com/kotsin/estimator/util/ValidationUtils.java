package com.kotsin.estimator.util;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/**
 * Utility class for shape and parameter checks.
 *
 * Two flavours: {@code require*} methods throw {@link ShapeMismatchException} and are used on
 * per-step inputs; {@code check*} methods throw {@link EstimatorConfigurationException} and are
 * used while building estimators.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ========== PER-STEP SHAPES ==========

    public static RealVector requireSize(RealVector vector, int size, String name) {
        if (vector == null) {
            throw new ShapeMismatchException(name + " is missing");
        }
        if (vector.getDimension() != size) {
            throw new ShapeMismatchException(String.format(
                    "%s must have size %d, got %d", name, size, vector.getDimension()));
        }
        return vector;
    }

    public static RealMatrix requireShape(RealMatrix matrix, int rows, int cols, String name) {
        if (matrix == null) {
            throw new ShapeMismatchException(name + " is missing");
        }
        if (matrix.getRowDimension() != rows || matrix.getColumnDimension() != cols) {
            throw new ShapeMismatchException(String.format(
                    "%s must be %dx%d, got %dx%d", name, rows, cols,
                    matrix.getRowDimension(), matrix.getColumnDimension()));
        }
        return matrix;
    }

    public static RealMatrix requireSquare(RealMatrix matrix, String name) {
        if (!matrix.isSquare()) {
            throw new ShapeMismatchException(String.format(
                    "%s must be square, got %dx%d", name,
                    matrix.getRowDimension(), matrix.getColumnDimension()));
        }
        return matrix;
    }

    /**
     * Rejects jagged arrays before they reach Commons Math.
     */
    public static double[][] requireRectangular(double[][] values, String name) {
        if (values == null || values.length == 0) {
            throw new ShapeMismatchException(name + " must have at least one row");
        }
        int cols = values[0] == null ? -1 : values[0].length;
        for (double[] row : values) {
            if (row == null || row.length != cols || cols == 0) {
                throw new ShapeMismatchException(name + " must be a non-empty rectangular matrix");
            }
        }
        return values;
    }

    // ========== CONFIGURATION ==========

    public static void checkPositive(int value, String name) {
        if (value <= 0) {
            throw new EstimatorConfigurationException(name + " must be positive, got " + value);
        }
    }

    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new EstimatorConfigurationException(message);
        }
    }

    public static <T> T checkNotNull(T value, String name) {
        if (Objects.isNull(value)) {
            throw new EstimatorConfigurationException(name + " is not configured");
        }
        return value;
    }

    /**
     * Configuration-time variant of {@link #requireShape} for default matrices.
     */
    public static RealMatrix checkShape(RealMatrix matrix, int rows, int cols, String name) {
        checkNotNull(matrix, name);
        if (matrix.getRowDimension() != rows || matrix.getColumnDimension() != cols) {
            throw new EstimatorConfigurationException(String.format(
                    "%s must be %dx%d, got %dx%d", name, rows, cols,
                    matrix.getRowDimension(), matrix.getColumnDimension()));
        }
        return matrix;
    }

    public static RealVector checkSize(RealVector vector, int size, String name) {
        checkNotNull(vector, name);
        if (vector.getDimension() != size) {
            throw new EstimatorConfigurationException(String.format(
                    "%s must have size %d, got %d", name, size, vector.getDimension()));
        }
        return vector;
    }

    /**
     * Safe get with default value
     */
    public static <T> T getOrDefault(T value, T defaultValue) {
        return Objects.nonNull(value) ? value : defaultValue;
    }
}
