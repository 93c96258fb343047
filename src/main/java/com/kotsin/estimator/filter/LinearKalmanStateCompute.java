package com.kotsin.estimator.filter;

import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.util.ValidationUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Linear Kalman filter.
 *
 * <pre>
 * x' = F·x + B·u
 * P' = λ·F·P·Fᵗ + Q
 * </pre>
 *
 * The fading factor {@code λ >= 1} inflates the predicted covariance so that recent
 * measurements weigh more; {@code λ = 1} is the standard filter. It is the inverse convention
 * of the RLS forgetting factor, which is {@code <= 1} and divides.
 */
public class LinearKalmanStateCompute implements KalmanStateCompute {

    private final double fadingFactor;

    public LinearKalmanStateCompute(double fadingFactor) {
        this.fadingFactor = KalmanEquations.checkFadingFactor(fadingFactor);
    }

    public LinearKalmanStateCompute() {
        this(1.0);
    }

    public double getFadingFactor() {
        return fadingFactor;
    }

    @Override
    public KalmanDefaults validate(KalmanDefaults defaults) {
        return defaults.validateLinear();
    }

    @Override
    public KalmanState predict(KalmanState state, KalmanSystem system) {
        int n = state.state().length;
        RealMatrix f = ValidationUtils.requireShape(system.processModel(), n, n, "processModel");
        RealMatrix q = ValidationUtils.requireShape(system.processNoise(), n, n, "processNoise");
        RealVector mean = KalmanEquations.controlled(f.operate(LinalgUtils.toVector(state.state())), system);
        RealMatrix covariance = KalmanEquations.propagateCovariance(
                f, LinalgUtils.toMatrix(state.stateCovariance()), q, fadingFactor);
        return KalmanEquations.predicted(state, mean, covariance);
    }

    @Override
    public KalmanState estimate(KalmanState predicted, RealVector measurement, KalmanSystem system,
                                boolean storeResidual, int likelihoodWindow) {
        RealMatrix h = system.measurementModel();
        RealVector residual = measurement.subtract(
                ValidationUtils.requireShape(h, measurement.getDimension(), predicted.state().length, "measurementModel")
                        .operate(LinalgUtils.toVector(predicted.state())));
        return KalmanEquations.update(predicted, residual, h, system.measurementNoise(), storeResidual, likelihoodWindow);
    }
}
