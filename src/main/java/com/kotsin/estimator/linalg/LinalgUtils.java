package com.kotsin.estimator.linalg;

import com.kotsin.estimator.exception.InvalidCovarianceException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * LinalgUtils - thin adapter between the JSON-friendly array representation used by the
 * state stores and Commons Math vectors/matrices.
 *
 * All factorizations go through {@link #cholesky(RealMatrix)} so that a non positive definite
 * covariance always surfaces as {@link InvalidCovarianceException}.
 */
public final class LinalgUtils {

    private LinalgUtils() {} // Prevent instantiation

    /** Relative asymmetry tolerated by the Cholesky factorization; inputs are symmetrized first. */
    private static final double SYMMETRY_THRESHOLD = 1e-8;

    private static final double POSITIVITY_THRESHOLD = CholeskyDecomposition.DEFAULT_ABSOLUTE_POSITIVITY_THRESHOLD;

    // ======================== CONVERSION ========================

    public static RealVector toVector(double[] values) {
        return new ArrayRealVector(values, true);
    }

    public static RealMatrix toMatrix(double[][] values) {
        return MatrixUtils.createRealMatrix(values);
    }

    /**
     * Build a matrix from row-major values, the layout used by configuration properties.
     */
    public static RealMatrix fromRowMajor(double[] values, int rows, int cols) {
        if (values == null || values.length != rows * cols) {
            throw new ShapeMismatchException(String.format(
                    "Expected %d values for a %dx%d matrix, got %s",
                    rows * cols, rows, cols, values == null ? "none" : String.valueOf(values.length)));
        }
        RealMatrix m = new Array2DRowRealMatrix(rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                m.setEntry(i, j, values[i * cols + j]);
            }
        }
        return m;
    }

    public static double[] toArray(RealVector vector) {
        return vector == null ? null : vector.toArray();
    }

    public static double[][] toArray(RealMatrix matrix) {
        return matrix == null ? null : matrix.getData();
    }

    // ======================== FACTORIES ========================

    public static RealMatrix identity(int size) {
        return MatrixUtils.createRealIdentityMatrix(size);
    }

    public static RealMatrix zeros(int rows, int cols) {
        return new Array2DRowRealMatrix(rows, cols);
    }

    public static RealVector zeros(int size) {
        return new ArrayRealVector(size);
    }

    /**
     * Rectangular matrix with ones on the main diagonal; maps the leading state entries to
     * the measurement.
     */
    public static RealMatrix eye(int rows, int cols) {
        RealMatrix m = zeros(rows, cols);
        for (int i = 0; i < Math.min(rows, cols); i++) {
            m.setEntry(i, i, 1.0);
        }
        return m;
    }

    public static RealMatrix diagonal(int size, double value) {
        return identity(size).scalarMultiply(value);
    }

    // ======================== PRIMITIVES ========================

    public static RealMatrix symmetrize(RealMatrix m) {
        return m.add(m.transpose()).scalarMultiply(0.5);
    }

    public static RealMatrix outer(RealVector u, RealVector v) {
        return u.outerProduct(v);
    }

    /**
     * Cholesky factorization of a (numerically) symmetric positive definite matrix.
     */
    public static CholeskyDecomposition cholesky(RealMatrix m) {
        if (!m.isSquare()) {
            throw new ShapeMismatchException(String.format(
                    "Covariance must be square, got %dx%d", m.getRowDimension(), m.getColumnDimension()));
        }
        try {
            return new CholeskyDecomposition(symmetrize(m), SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD);
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new InvalidCovarianceException("Covariance is not symmetric positive definite: " + e.getMessage(), e);
        }
    }

    /**
     * Solves {@code A·X = B} for symmetric positive definite {@code A} without forming the inverse.
     */
    public static RealMatrix solveSymmetric(RealMatrix a, RealMatrix b) {
        return cholesky(a).getSolver().solve(b);
    }

    public static RealVector solveSymmetric(RealMatrix a, RealVector b) {
        return cholesky(a).getSolver().solve(b);
    }

    /**
     * Sum of the logs of the Cholesky factor's diagonal, i.e. half the log-determinant.
     */
    public static double choleskyLogDiagonalSum(RealMatrix cov) {
        RealMatrix root = cholesky(cov).getL();
        double sum = 0.0;
        for (int i = 0; i < root.getRowDimension(); i++) {
            sum += Math.log(root.getEntry(i, i));
        }
        return sum;
    }

    public static double squaredMahalanobis(RealVector point, RealVector mean, RealMatrix cov) {
        if (point.getDimension() != mean.getDimension() || cov.getRowDimension() != mean.getDimension()) {
            throw new ShapeMismatchException(String.format(
                    "Mahalanobis distance needs matching sizes, got point=%d mean=%d cov=%dx%d",
                    point.getDimension(), mean.getDimension(), cov.getRowDimension(), cov.getColumnDimension()));
        }
        RealVector diff = point.subtract(mean);
        return diff.dotProduct(solveSymmetric(cov, diff));
    }

    public static double mahalanobis(RealVector point, RealVector mean, RealMatrix cov) {
        return Math.sqrt(squaredMahalanobis(point, mean, cov));
    }
}
