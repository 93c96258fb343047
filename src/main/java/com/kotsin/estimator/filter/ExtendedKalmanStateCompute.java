package com.kotsin.estimator.filter;

import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.util.ValidationUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Extended Kalman filter: the process and measurement functions of an {@link ExtendedKalmanModel}
 * drive the means, their Jacobians replace {@code F} and {@code H} in the covariance equations.
 */
public class ExtendedKalmanStateCompute implements KalmanStateCompute {

    private final double fadingFactor;
    private final ExtendedKalmanModel model;

    public ExtendedKalmanStateCompute(double fadingFactor, ExtendedKalmanModel model) {
        this.fadingFactor = KalmanEquations.checkFadingFactor(fadingFactor);
        this.model = ValidationUtils.checkNotNull(model, "model");
    }

    public ExtendedKalmanStateCompute(ExtendedKalmanModel model) {
        this(1.0, model);
    }

    public ExtendedKalmanModel getModel() {
        return model;
    }

    @Override
    public KalmanState predict(KalmanState state, KalmanSystem system) {
        int n = state.state().length;
        RealVector x = LinalgUtils.toVector(state.state());
        RealMatrix f = system.processModel();

        RealVector mean = KalmanEquations.controlled(
                ValidationUtils.requireSize(model.processFunction(x, f), n, "process function"), system);
        RealMatrix jacobian = ValidationUtils.requireShape(model.processStateJacobian(x, f), n, n, "process Jacobian");
        RealMatrix noise = ValidationUtils.requireShape(
                KalmanEquations.effectiveNoise(model.processNoiseJacobian(x, f), system.processNoise()),
                n, n, "process noise");

        RealMatrix covariance = KalmanEquations.propagateCovariance(
                jacobian, LinalgUtils.toMatrix(state.stateCovariance()), noise, fadingFactor);
        return KalmanEquations.predicted(state, mean, covariance);
    }

    @Override
    public KalmanState estimate(KalmanState predicted, RealVector measurement, KalmanSystem system,
                                boolean storeResidual, int likelihoodWindow) {
        RealVector x = LinalgUtils.toVector(predicted.state());
        RealMatrix h = system.measurementModel();
        int m = measurement.getDimension();

        RealVector expected = ValidationUtils.requireSize(model.measurementFunction(x, h), m, "measurement function");
        RealMatrix jacobian = model.measurementStateJacobian(x, h);
        RealMatrix noise = KalmanEquations.effectiveNoise(model.measurementNoiseJacobian(x, h), system.measurementNoise());
        return KalmanEquations.update(predicted, measurement.subtract(expected), jacobian, noise,
                storeResidual, likelihoodWindow);
    }
}
