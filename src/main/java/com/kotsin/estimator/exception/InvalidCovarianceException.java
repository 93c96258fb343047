package com.kotsin.estimator.exception;

/**
 * A covariance or noise matrix could not be Cholesky-factorized (not symmetric positive definite).
 */
public class InvalidCovarianceException extends EstimationException {

    public InvalidCovarianceException(String message) {
        super(message);
    }

    public InvalidCovarianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
