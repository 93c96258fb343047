package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

/**
 * One observation {@code label ≈ featuresᵗ·state} for the RLS and LMS estimators.
 * A null {@code label} advances the key without changing its estimate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegressionInput implements KeyedInput {

    private String stateKey;

    private Double label;

    private double[] features;

    /**
     * Initial coefficients for a key without state.
     */
    private double[] initialState;

    private Long eventTime;

    @Override
    public boolean hasObservation() {
        return label != null;
    }

    public static JsonSerde<RegressionInput> serde() {
        return new JsonSerde<>(RegressionInput.class);
    }
}
