package com.kotsin.estimator.filter;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Possibly nonlinear process and measurement functions of an extended Kalman filter.
 *
 * Each method receives the current estimate and the step's configured model matrix, which the
 * implementation may use as a parameter or ignore. Every default reproduces the linear filter.
 * Jacobians are evaluated at the most recent estimate; there is no re-linearization in a step.
 */
public interface ExtendedKalmanModel {

    ExtendedKalmanModel LINEAR = new ExtendedKalmanModel() {};

    default RealVector processFunction(RealVector state, RealMatrix processModel) {
        return processModel.operate(state);
    }

    default RealMatrix processStateJacobian(RealVector state, RealMatrix processModel) {
        return processModel;
    }

    /**
     * Jacobian {@code G} of the process function with respect to the noise, giving
     * {@code G·Q·Gᵗ}. Null means additive noise.
     */
    default RealMatrix processNoiseJacobian(RealVector state, RealMatrix processModel) {
        return null;
    }

    default RealVector measurementFunction(RealVector state, RealMatrix measurementModel) {
        return measurementModel.operate(state);
    }

    default RealMatrix measurementStateJacobian(RealVector state, RealMatrix measurementModel) {
        return measurementModel;
    }

    /**
     * Jacobian {@code V} of the measurement function with respect to the noise, giving
     * {@code V·R·Vᵗ}. Null means additive noise.
     */
    default RealMatrix measurementNoiseJacobian(RealVector state, RealMatrix measurementModel) {
        return null;
    }
}
