package com.kotsin.estimator.model;

/**
 * Per-key estimator state; {@code stateIndex} counts processed inputs.
 */
public interface IndexedState {

    long stateIndex();
}
