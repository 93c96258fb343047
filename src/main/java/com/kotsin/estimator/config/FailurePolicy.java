package com.kotsin.estimator.config;

/**
 * What the runtime does with a step that throws an estimation error.
 */
public enum FailurePolicy {
    /**
     * Keep the key's prior state, publish an {@code EstimationFailure} and continue.
     */
    SKIP,
    /**
     * Rethrow and let the stream thread fail.
     */
    FAIL
}
