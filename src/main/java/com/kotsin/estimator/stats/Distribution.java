package com.kotsin.estimator.stats;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Parametric distribution with the algebra online EM and likelihood scoring are built on.
 *
 * <p>Implementations are immutable values; every operation returns a new instance.
 * {@link #scale} and {@link #combine} act on the raw parameter vector/matrix, so
 * {@code a.scale(1 - g).combine(g, b)} is the linear interpolation of the parameters.</p>
 *
 * @param <S> sample type
 * @param <D> concrete distribution type
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "family")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BernoulliDistribution.class, name = "bernoulli"),
        @JsonSubTypes.Type(value = PoissonDistribution.class, name = "poisson"),
        @JsonSubTypes.Type(value = MultivariateGaussianDistribution.class, name = "gaussian")
})
public interface Distribution<S, D extends Distribution<S, D>> {

    DistributionFamily family();

    /**
     * Log density (or log mass) of a single sample.
     */
    double loglikelihood(S sample);

    /**
     * Multiplies every parameter by {@code weight}.
     */
    D scale(double weight);

    /**
     * Returns {@code this + weight * other}, parameter by parameter.
     */
    D combine(double weight, D other);

    /**
     * Weighted sufficient-statistic estimate of {@code samples}; each sample contributes
     * {@code weights[i] / samples.size()}.
     */
    D summarize(double[] weights, List<S> samples);

    default double[] loglikelihoods(List<S> samples) {
        double[] out = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            out[i] = loglikelihood(samples.get(i));
        }
        return out;
    }
}
