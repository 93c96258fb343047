package com.kotsin.estimator.stats;

import com.kotsin.estimator.linalg.LinalgUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.List;

/**
 * Multivariate gaussian distribution.
 *
 * @param mean mean vector
 * @param covariance covariance matrix, row-major
 */
public record MultivariateGaussianDistribution(double[] mean, double[][] covariance)
        implements Distribution<double[], MultivariateGaussianDistribution> {

    public static MultivariateGaussianDistribution of(RealVector mean, RealMatrix covariance) {
        return new MultivariateGaussianDistribution(LinalgUtils.toArray(mean), LinalgUtils.toArray(covariance));
    }

    @Override
    public DistributionFamily family() {
        return DistributionFamily.GAUSSIAN;
    }

    public RealVector meanVector() {
        return LinalgUtils.toVector(mean);
    }

    public RealMatrix covarianceMatrix() {
        return LinalgUtils.toMatrix(covariance);
    }

    @Override
    public double loglikelihood(double[] sample) {
        return MultivariateGaussian.logpdf(LinalgUtils.toVector(sample), meanVector(), covarianceMatrix());
    }

    /**
     * Batch variant that factorizes the covariance once.
     */
    @Override
    public double[] loglikelihoods(List<double[]> samples) {
        RealVector mu = meanVector();
        RealMatrix cov = covarianceMatrix();
        double normConst = MultivariateGaussian.normConst(mean.length, cov);
        double[] out = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            out[i] = MultivariateGaussian.unnormalizedLogpdf(LinalgUtils.toVector(samples.get(i)), mu, cov) - normConst;
        }
        return out;
    }

    @Override
    public MultivariateGaussianDistribution scale(double weight) {
        return of(meanVector().mapMultiply(weight), covarianceMatrix().scalarMultiply(weight));
    }

    @Override
    public MultivariateGaussianDistribution combine(double weight, MultivariateGaussianDistribution other) {
        return of(
                meanVector().add(other.meanVector().mapMultiply(weight)),
                covarianceMatrix().add(other.covarianceMatrix().scalarMultiply(weight)));
    }

    /**
     * Weighted mean and weighted outer products of the deviations from this distribution's mean.
     */
    @Override
    public MultivariateGaussianDistribution summarize(double[] weights, List<double[]> samples) {
        int n = samples.size();
        RealVector mu = meanVector();
        RealVector meanSummary = LinalgUtils.zeros(mean.length);
        RealMatrix covSummary = LinalgUtils.zeros(mean.length, mean.length);
        for (int i = 0; i < n; i++) {
            double w = weights[i] / n;
            RealVector v = LinalgUtils.toVector(samples.get(i));
            meanSummary = meanSummary.add(v.mapMultiply(w));
            RealVector residual = v.subtract(mu);
            covSummary = covSummary.add(LinalgUtils.outer(residual, residual).scalarMultiply(w));
        }
        return of(meanSummary, covSummary);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MultivariateGaussianDistribution other)) return false;
        return Arrays.equals(mean, other.mean) && Arrays.deepEquals(covariance, other.covariance);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(mean) + Arrays.deepHashCode(covariance);
    }

    @Override
    public String toString() {
        return "MultivariateGaussianDistribution[mean=" + Arrays.toString(mean)
                + ", covariance=" + Arrays.deepToString(covariance) + "]";
    }
}
