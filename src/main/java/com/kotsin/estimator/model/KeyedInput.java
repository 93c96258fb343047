package com.kotsin.estimator.model;

/**
 * An input routed to one key's estimator state.
 */
public interface KeyedInput {

    /**
     * Fallback state key used when the Kafka record carries no key.
     */
    String getStateKey();

    /**
     * Event time in epoch millis, or null to use the record timestamp.
     */
    Long getEventTime();

    /**
     * False when the step only advances the state (no measurement, label or samples).
     */
    boolean hasObservation();
}
