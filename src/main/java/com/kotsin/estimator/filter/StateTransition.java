package com.kotsin.estimator.filter;

/**
 * Per-key transition of an online estimator.
 *
 * Implementations are pure functions of {@code (priorState, input)}: they keep no mutable
 * context, never modify the prior, and either return a complete posterior or throw.
 *
 * @param <I> input record
 * @param <S> immutable per-key state
 * @param <O> output record
 */
public interface StateTransition<I, S, O> {

    /**
     * @param key state key, for diagnostics only
     * @param input next input for the key, in delivery order
     * @param priorState state after the previous input, or null for a new key
     * @return posterior state with {@code stateIndex} one above the prior (or 1 for a new key)
     * @throws com.kotsin.estimator.exception.EstimationException if the step is rejected
     */
    S update(String key, I input, S priorState);

    /**
     * Render the output row of a posterior returned by {@link #update}.
     */
    O output(String key, I input, S state);
}
