package com.kotsin.estimator.stats;

import org.apache.commons.math3.special.Gamma;

import java.util.List;

/**
 * Poisson distribution over non-negative counts.
 *
 * @param rate expected count
 */
public record PoissonDistribution(double rate) implements Distribution<Long, PoissonDistribution> {

    @Override
    public DistributionFamily family() {
        return DistributionFamily.POISSON;
    }

    @Override
    public double loglikelihood(Long sample) {
        long k = sample;
        if (k < 0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (k == 0) {
            return -rate;
        }
        return k * Math.log(rate) - rate - Gamma.logGamma(k + 1.0);
    }

    @Override
    public PoissonDistribution scale(double weight) {
        return new PoissonDistribution(rate * weight);
    }

    @Override
    public PoissonDistribution combine(double weight, PoissonDistribution other) {
        return new PoissonDistribution(rate + weight * other.rate);
    }

    @Override
    public PoissonDistribution summarize(double[] weights, List<Long> samples) {
        double summary = 0.0;
        int n = samples.size();
        for (int i = 0; i < n; i++) {
            summary += weights[i] * samples.get(i) / n;
        }
        return new PoissonDistribution(summary);
    }
}
