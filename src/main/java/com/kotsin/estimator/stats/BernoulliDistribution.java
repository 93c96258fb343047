package com.kotsin.estimator.stats;

import java.util.List;

/**
 * Bernoulli distribution over boolean samples.
 *
 * @param probability success probability
 */
public record BernoulliDistribution(double probability) implements Distribution<Boolean, BernoulliDistribution> {

    @Override
    public DistributionFamily family() {
        return DistributionFamily.BERNOULLI;
    }

    @Override
    public double loglikelihood(Boolean sample) {
        return Boolean.TRUE.equals(sample) ? Math.log(probability) : Math.log(1.0 - probability);
    }

    @Override
    public BernoulliDistribution scale(double weight) {
        return new BernoulliDistribution(probability * weight);
    }

    @Override
    public BernoulliDistribution combine(double weight, BernoulliDistribution other) {
        return new BernoulliDistribution(probability + weight * other.probability);
    }

    @Override
    public BernoulliDistribution summarize(double[] weights, List<Boolean> samples) {
        double summary = 0.0;
        int n = samples.size();
        for (int i = 0; i < n; i++) {
            if (Boolean.TRUE.equals(samples.get(i))) {
                summary += weights[i] / n;
            }
        }
        return new BernoulliDistribution(summary);
    }
}
