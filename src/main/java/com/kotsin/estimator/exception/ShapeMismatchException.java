package com.kotsin.estimator.exception;

/**
 * An input vector or matrix does not match the estimator's declared state/measurement size.
 */
public class ShapeMismatchException extends EstimationException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
