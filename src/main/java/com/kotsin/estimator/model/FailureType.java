package com.kotsin.estimator.model;

import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.exception.InvalidCovarianceException;
import com.kotsin.estimator.exception.ShapeMismatchException;

public enum FailureType {
    INVALID_COVARIANCE,
    SHAPE_MISMATCH,
    NUMERICAL;

    public static FailureType of(EstimationException e) {
        if (e instanceof InvalidCovarianceException) {
            return INVALID_COVARIANCE;
        }
        if (e instanceof ShapeMismatchException) {
            return SHAPE_MISMATCH;
        }
        return NUMERICAL;
    }
}
