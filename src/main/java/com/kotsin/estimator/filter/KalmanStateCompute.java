package com.kotsin.estimator.filter;

import com.kotsin.estimator.model.KalmanState;
import org.apache.commons.math3.linear.RealVector;

/**
 * The two phases of a Kalman step. Both return a new state and leave their argument untouched.
 */
public interface KalmanStateCompute {

    /**
     * Configuration-time check of the defaults this computation will run with.
     */
    default KalmanDefaults validate(KalmanDefaults defaults) {
        return defaults.validate();
    }

    /**
     * Time update. Increments {@code stateIndex} and clears the residual fields.
     */
    KalmanState predict(KalmanState state, KalmanSystem system);

    /**
     * Measurement update of a predicted state. When {@code likelihoodWindow} is positive the
     * residual log-likelihood is pushed onto the state's sliding window.
     */
    KalmanState estimate(KalmanState predicted, RealVector measurement, KalmanSystem system,
                         boolean storeResidual, int likelihoodWindow);

    default KalmanState predictAndEstimate(KalmanState state, RealVector measurement, KalmanSystem system,
                                           boolean storeResidual, int likelihoodWindow) {
        return estimate(predict(state, system), measurement, system, storeResidual, likelihoodWindow);
    }
}
