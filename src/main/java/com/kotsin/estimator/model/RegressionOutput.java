package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegressionOutput {

    private String stateKey;

    private long stateIndex;

    private double[] state;

    /**
     * RLS only: the inverse-covariance-like matrix P.
     */
    private double[][] covariance;

    /**
     * Error {@code label − featuresᵗ·state} of the updated coefficients; absent when the input had no label.
     */
    private Double residual;

    private Long eventTime;

    public static JsonSerde<RegressionOutput> serde() {
        return new JsonSerde<>(RegressionOutput.class);
    }
}
