package com.kotsin.estimator.stats;

import com.kotsin.estimator.exception.EstimatorConfigurationException;

import java.util.Arrays;

/**
 * The closed set of component families supported by the mixture estimator.
 * The label doubles as the JSON type tag of {@link Distribution}.
 */
public enum DistributionFamily {

    BERNOULLI("bernoulli", Boolean.class, BernoulliDistribution.class),
    POISSON("poisson", Long.class, PoissonDistribution.class),
    GAUSSIAN("gaussian", double[].class, MultivariateGaussianDistribution.class);

    private final String label;
    private final Class<?> sampleType;
    private final Class<?> distributionType;

    DistributionFamily(String label, Class<?> sampleType, Class<?> distributionType) {
        this.label = label;
        this.sampleType = sampleType;
        this.distributionType = distributionType;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Java type of a single sample of this family, used to build input serdes.
     */
    public Class<?> getSampleType() {
        return sampleType;
    }

    public Class<?> getDistributionType() {
        return distributionType;
    }

    public static DistributionFamily fromLabel(String label) {
        return Arrays.stream(values())
                .filter(f -> f.label.equalsIgnoreCase(label) || f.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new EstimatorConfigurationException("Unknown distribution family: " + label));
    }
}
