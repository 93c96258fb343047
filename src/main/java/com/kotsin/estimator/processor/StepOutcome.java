package com.kotsin.estimator.processor;

import com.kotsin.estimator.model.EstimationFailure;

/**
 * Result of one transition: either an output or a failure, never both.
 */
public record StepOutcome<O>(O output, EstimationFailure failure) {

    public static <O> StepOutcome<O> success(O output) {
        return new StepOutcome<>(output, null);
    }

    public static <O> StepOutcome<O> failed(EstimationFailure failure) {
        return new StepOutcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
