package com.kotsin.estimator.exception;

/**
 * Base class for every failure raised by the estimation core.
 *
 * Per-step subclasses are caught by the stream runtime and turned into failure records;
 * the key's state is left untouched when one of them escapes an update.
 */
public class EstimationException extends RuntimeException {

    public EstimationException(String message) {
        super(message);
    }

    public EstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
