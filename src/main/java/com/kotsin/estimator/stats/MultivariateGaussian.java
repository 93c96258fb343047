package com.kotsin.estimator.stats;

import com.kotsin.estimator.linalg.LinalgUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Multivariate gaussian log-density helpers.
 *
 * The normalization constant is taken from the Cholesky factor of the covariance instead of
 * an explicit determinant, which stays accurate for near-singular covariances.
 */
public final class MultivariateGaussian {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private MultivariateGaussian() {}

    public static double unnormalizedLogpdf(RealVector point, RealVector mean, RealMatrix cov) {
        return -LinalgUtils.squaredMahalanobis(point, mean, cov) / 2.0;
    }

    /**
     * {@code n/2·log(2π) + Σ log diag(chol(cov))}
     */
    public static double normConst(int size, RealMatrix cov) {
        return size / 2.0 * LOG_2PI + LinalgUtils.choleskyLogDiagonalSum(cov);
    }

    public static double logpdf(RealVector point, RealVector mean, RealMatrix cov) {
        return unnormalizedLogpdf(point, mean, cov) - normConst(mean.getDimension(), cov);
    }

    /**
     * Log-density of a residual under a zero-mean gaussian with the residual covariance.
     */
    public static double residualLogpdf(RealVector residual, RealMatrix residualCovariance) {
        return logpdf(residual, LinalgUtils.zeros(residual.getDimension()), residualCovariance);
    }
}
