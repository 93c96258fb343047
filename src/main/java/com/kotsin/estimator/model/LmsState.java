package com.kotsin.estimator.model;

import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.Arrays;

public record LmsState(long stateIndex, double[] state) implements IndexedState {

    public static JsonSerde<LmsState> serde() {
        return new JsonSerde<>(LmsState.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LmsState other)) return false;
        return stateIndex == other.stateIndex && Arrays.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(stateIndex) + Arrays.hashCode(state);
    }

    @Override
    public String toString() {
        return "LmsState[stateIndex=" + stateIndex + ", state=" + Arrays.toString(state) + "]";
    }
}
