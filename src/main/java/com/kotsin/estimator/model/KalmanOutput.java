package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

/**
 * Posterior of one Kalman step plus the diagnostics enabled in configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class KalmanOutput {

    private String stateKey;

    private String modelGroup;

    private long stateIndex;

    private double[] state;

    private double[][] stateCovariance;

    private double[] residual;

    private double[][] residualCovariance;

    private Double mahalanobis;

    private Double loglikelihood;

    /**
     * Sum of the log-likelihoods in the sliding window.
     */
    private Double slidingLoglikelihood;

    /**
     * {@code exp(slidingLoglikelihood)}, an unnormalized model weight. Underflows to zero for
     * long windows; aggregation uses {@link #slidingLoglikelihood}.
     */
    private Double slidingLikelihood;

    private Long eventTime;

    private double[][] processModel;

    private double[][] processNoise;

    private double[][] measurementModel;

    public static JsonSerde<KalmanOutput> serde() {
        return new JsonSerde<>(KalmanOutput.class);
    }
}
