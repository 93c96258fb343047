package com.kotsin.estimator.stats;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.util.MathUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finite mixture: ordered (weight, distribution) pairs of one family.
 *
 * <p>Used both as the model estimate, where weights are normalized, and as the running
 * sufficient-statistic summary of online EM, where weights and parameters are unnormalized
 * averages.</p>
 */
public record MixtureModel<S, D extends Distribution<S, D>>(double[] weights, List<D> distributions) {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public MixtureModel {
        if (weights == null || distributions == null || weights.length != distributions.size()) {
            throw new ShapeMismatchException("Mixture weights and distributions must have the same length");
        }
        weights = weights.clone();
        distributions = List.copyOf(distributions);
    }

    /**
     * Validated constructor for configured models: non-empty, non-negative weights summing to one.
     */
    public static <S, D extends Distribution<S, D>> MixtureModel<S, D> of(double[] weights, List<D> distributions) {
        if (weights == null || weights.length == 0) {
            throw new EstimatorConfigurationException("Mixture must have at least one component");
        }
        if (distributions == null || weights.length != distributions.size()) {
            throw new EstimatorConfigurationException(String.format(
                    "Mixture has %d weights but %s distributions",
                    weights.length, distributions == null ? "no" : String.valueOf(distributions.size())));
        }
        for (double w : weights) {
            if (!(w >= 0.0) || !MathUtils.isValidNumber(w)) {
                throw new EstimatorConfigurationException("Mixture weights must be non-negative, got " + Arrays.toString(weights));
            }
        }
        if (Math.abs(MathUtils.sum(weights) - 1.0) > WEIGHT_TOLERANCE) {
            throw new EstimatorConfigurationException("Mixture weights must sum to 1, got " + Arrays.toString(weights));
        }
        return new MixtureModel<>(weights, distributions);
    }

    public static <S, D extends Distribution<S, D>> MixtureModel<S, D> uniform(List<D> distributions) {
        double[] weights = new double[distributions.size()];
        Arrays.fill(weights, 1.0 / distributions.size());
        return of(weights, distributions);
    }

    public int size() {
        return weights.length;
    }

    public MixtureModel<S, D> scale(double weight) {
        double[] w = new double[weights.length];
        List<D> dists = new ArrayList<>(weights.length);
        for (int k = 0; k < weights.length; k++) {
            w[k] = weights[k] * weight;
            dists.add(distributions.get(k).scale(weight));
        }
        return new MixtureModel<>(w, dists);
    }

    public MixtureModel<S, D> combine(double weight, MixtureModel<S, D> other) {
        if (other.size() != size()) {
            throw new ShapeMismatchException(String.format(
                    "Cannot combine mixtures of %d and %d components", size(), other.size()));
        }
        double[] w = new double[weights.length];
        List<D> dists = new ArrayList<>(weights.length);
        for (int k = 0; k < weights.length; k++) {
            w[k] = weights[k] + weight * other.weights[k];
            dists.add(distributions.get(k).combine(weight, other.distributions.get(k)));
        }
        return new MixtureModel<>(w, dists);
    }

    /**
     * Weighted per-component log-likelihoods {@code log w_k + log f_k(sample)}.
     */
    public double[] weightedLoglikelihoods(S sample) {
        double[] out = new double[weights.length];
        for (int k = 0; k < weights.length; k++) {
            out[k] = Math.log(weights[k]) + distributions.get(k).loglikelihood(sample);
        }
        return out;
    }

    public double loglikelihood(S sample) {
        return MathUtils.logSumExp(weightedLoglikelihoods(sample));
    }

    /**
     * Posterior component membership of {@code sample}; sums to one.
     */
    public double[] responsibilities(S sample) {
        return MathUtils.normalizeLogWeights(weightedLoglikelihoods(sample));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MixtureModel<?, ?> other)) return false;
        return Arrays.equals(weights, other.weights) && distributions.equals(other.distributions);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(weights) + distributions.hashCode();
    }

    @Override
    public String toString() {
        return "MixtureModel[weights=" + Arrays.toString(weights) + ", distributions=" + distributions + "]";
    }
}
