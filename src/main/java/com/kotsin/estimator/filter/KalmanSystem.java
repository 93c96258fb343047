package com.kotsin.estimator.filter;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * System matrices in effect for one Kalman step, after per-input overrides were applied.
 *
 * {@code control} and {@code controlFunction} are null unless both were supplied.
 */
public record KalmanSystem(
        RealMatrix processModel,
        RealMatrix processNoise,
        RealMatrix measurementModel,
        RealMatrix measurementNoise,
        RealVector control,
        RealMatrix controlFunction) {

    public boolean hasControl() {
        return control != null && controlFunction != null;
    }
}
