package com.kotsin.estimator.model;

import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.Arrays;

/**
 * Recursive least squares coefficients with their inverse-covariance-like matrix.
 */
public record RlsState(long stateIndex, double[] state, double[][] covariance) implements IndexedState {

    public static JsonSerde<RlsState> serde() {
        return new JsonSerde<>(RlsState.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RlsState other)) return false;
        return stateIndex == other.stateIndex
                && Arrays.equals(state, other.state)
                && Arrays.deepEquals(covariance, other.covariance);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(stateIndex) + Arrays.hashCode(state)) + Arrays.deepHashCode(covariance);
    }

    @Override
    public String toString() {
        return "RlsState[stateIndex=" + stateIndex + ", state=" + Arrays.toString(state) + "]";
    }
}
