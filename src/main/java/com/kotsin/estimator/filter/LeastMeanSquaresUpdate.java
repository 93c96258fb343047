package com.kotsin.estimator.filter;

import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.LmsState;
import com.kotsin.estimator.model.RegressionInput;
import com.kotsin.estimator.model.RegressionOutput;
import com.kotsin.estimator.util.ValidationUtils;
import org.apache.commons.math3.linear.RealVector;

/**
 * Normalized least mean squares: {@code state += μ·(y − xᵗ·state)·x / (ε + xᵗ·x)}.
 *
 * Cheaper than {@link RecursiveLeastSquaresUpdate} (no covariance is kept) at the cost of slower
 * convergence on correlated features. Stable for {@code 0 < μ < 2}.
 */
public class LeastMeanSquaresUpdate implements StateTransition<RegressionInput, LmsState, RegressionOutput> {

    private final int stateSize;
    private final double learningRate;
    private final double regularization;
    private final RealVector initialState;

    public LeastMeanSquaresUpdate(int stateSize, double learningRate, double regularization, RealVector initialState) {
        ValidationUtils.checkPositive(stateSize, "stateSize");
        ValidationUtils.checkArgument(learningRate > 0.0 && learningRate < 2.0,
                "learningRate must be in (0, 2), got " + learningRate);
        ValidationUtils.checkArgument(regularization > 0.0 && Double.isFinite(regularization),
                "regularization must be a finite positive number, got " + regularization);
        this.stateSize = stateSize;
        this.learningRate = learningRate;
        this.regularization = regularization;
        this.initialState = ValidationUtils.checkSize(initialState, stateSize, "initialState");
    }

    public LeastMeanSquaresUpdate(int stateSize) {
        this(stateSize, 1.0, 1.0, LinalgUtils.zeros(stateSize));
    }

    @Override
    public LmsState update(String key, RegressionInput input, LmsState priorState) {
        LmsState current = priorState;
        if (current == null) {
            RealVector mean = input.getInitialState() == null
                    ? initialState
                    : ValidationUtils.requireSize(LinalgUtils.toVector(input.getInitialState()), stateSize, "initialState");
            current = new LmsState(0L, mean.toArray());
        }
        if (input.getLabel() == null) {
            return new LmsState(current.stateIndex() + 1, current.state());
        }

        RealVector x = ValidationUtils.requireSize(RecursiveLeastSquaresUpdate.features(input), stateSize, "features");
        RealVector state = LinalgUtils.toVector(current.state());
        double residual = input.getLabel() - x.dotProduct(state);
        double step = learningRate * residual / (regularization + x.dotProduct(x));
        return new LmsState(current.stateIndex() + 1, state.add(x.mapMultiply(step)).toArray());
    }

    @Override
    public RegressionOutput output(String key, RegressionInput input, LmsState state) {
        RegressionOutput.RegressionOutputBuilder builder = RegressionOutput.builder()
                .stateKey(key)
                .stateIndex(state.stateIndex())
                .state(state.state())
                .eventTime(input.getEventTime());
        if (input.getLabel() != null) {
            builder.residual(input.getLabel()
                    - RecursiveLeastSquaresUpdate.features(input).dotProduct(LinalgUtils.toVector(state.state())));
        }
        return builder.build();
    }
}
