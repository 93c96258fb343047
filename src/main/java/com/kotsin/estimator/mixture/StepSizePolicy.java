package com.kotsin.estimator.mixture;

import com.kotsin.estimator.util.ValidationUtils;

/**
 * Step size {@code γ_t} of the online EM stochastic approximation.
 *
 * Either constant, or decaying as {@code γ_t = (t + 2)^−α} where {@code t} is the prior state
 * index. The decaying form satisfies the Robbins-Monro conditions for {@code 0.5 < α <= 1}.
 */
public final class StepSizePolicy {

    private final double stepSize;
    private final Double decayRate;

    private StepSizePolicy(double stepSize, Double decayRate) {
        this.stepSize = stepSize;
        this.decayRate = decayRate;
    }

    public static StepSizePolicy constant(double stepSize) {
        checkStepSize(stepSize);
        return new StepSizePolicy(stepSize, null);
    }

    public static StepSizePolicy decaying(double decayRate) {
        ValidationUtils.checkArgument(decayRate > 0.0 && decayRate <= 1.0,
                "decayRate must be in (0, 1], got " + decayRate);
        return new StepSizePolicy(Double.NaN, decayRate);
    }

    public static void checkStepSize(double stepSize) {
        ValidationUtils.checkArgument(stepSize > 0.0 && stepSize <= 1.0,
                "stepSize must be in (0, 1], got " + stepSize);
    }

    public boolean isDecaying() {
        return decayRate != null;
    }

    /**
     * @param stateIndex index of the state the step starts from
     */
    public double stepSize(long stateIndex) {
        if (decayRate == null) {
            return stepSize;
        }
        return Math.pow(stateIndex + 2.0, -decayRate);
    }

    @Override
    public String toString() {
        return isDecaying() ? "StepSizePolicy[decayRate=" + decayRate + "]" : "StepSizePolicy[stepSize=" + stepSize + "]";
    }
}
