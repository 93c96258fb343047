package com.kotsin.estimator.exception;

/**
 * Invalid estimator setup: missing default matrix, dimension mismatch between configured sizes
 * and supplied matrices, or an out-of-range parameter. Raised before any input is processed.
 */
public class EstimatorConfigurationException extends EstimationException {

    public EstimatorConfigurationException(String message) {
        super(message);
    }
}
