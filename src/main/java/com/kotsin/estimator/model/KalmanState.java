package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.Arrays;
import java.util.List;

/**
 * Kalman belief for one key. Replaced wholesale on every step.
 *
 * @param stateIndex number of processed inputs
 * @param state posterior mean
 * @param stateCovariance posterior covariance
 * @param residual last measurement residual, absent after a predict-only step
 * @param residualCovariance covariance of {@code residual}
 * @param slidingLoglikelihood most recent log-likelihoods, oldest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KalmanState(
        long stateIndex,
        double[] state,
        double[][] stateCovariance,
        double[] residual,
        double[][] residualCovariance,
        List<Double> slidingLoglikelihood) implements IndexedState {

    public KalmanState {
        slidingLoglikelihood = slidingLoglikelihood == null ? List.of() : List.copyOf(slidingLoglikelihood);
    }

    public static JsonSerde<KalmanState> serde() {
        return new JsonSerde<>(KalmanState.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KalmanState other)) return false;
        return stateIndex == other.stateIndex
                && Arrays.equals(state, other.state)
                && Arrays.deepEquals(stateCovariance, other.stateCovariance)
                && Arrays.equals(residual, other.residual)
                && Arrays.deepEquals(residualCovariance, other.residualCovariance)
                && slidingLoglikelihood.equals(other.slidingLoglikelihood);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(stateIndex);
        result = 31 * result + Arrays.hashCode(state);
        result = 31 * result + Arrays.deepHashCode(stateCovariance);
        result = 31 * result + slidingLoglikelihood.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "KalmanState[stateIndex=" + stateIndex + ", state=" + Arrays.toString(state)
                + ", stateCovariance=" + Arrays.deepToString(stateCovariance)
                + ", residual=" + Arrays.toString(residual)
                + ", slidingLoglikelihood=" + slidingLoglikelihood + "]";
    }
}
