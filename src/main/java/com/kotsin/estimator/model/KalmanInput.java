package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

/**
 * One measurement step for a Kalman filter key.
 *
 * Every matrix is optional and overrides the configured default for this step only.
 * A null {@code measurement} makes the step predict-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KalmanInput implements KeyedInput {

    private String stateKey;

    /**
     * Logical entity shared by competing filter instances, used for multi-model aggregation.
     */
    private String modelGroup;

    private double[] measurement;

    private double[][] measurementModel;

    private double[][] measurementNoise;

    private double[][] processModel;

    private double[][] processNoise;

    private double[] control;

    private double[][] controlFunction;

    /**
     * Initial state for a key without state; ignored once the key has been initialized.
     */
    private double[] initialState;

    private double[][] initialCovariance;

    private Long eventTime;

    @Override
    public boolean hasObservation() {
        return measurement != null;
    }

    public static JsonSerde<KalmanInput> serde() {
        return new JsonSerde<>(KalmanInput.class);
    }
}
