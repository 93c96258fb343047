package com.kotsin.estimator.filter;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.RegressionInput;
import com.kotsin.estimator.model.RegressionOutput;
import com.kotsin.estimator.model.RlsState;
import com.kotsin.estimator.util.ValidationUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Recursive least squares for {@code label ≈ featuresᵗ·state}.
 *
 * <pre>
 * g     = P·x / (φ + xᵗ·P·x)
 * state = state + (y − xᵗ·state)·g
 * P     = (P − g·xᵗ·P) / φ
 * </pre>
 *
 * No matrix is inverted. The forgetting factor {@code 0 < φ <= 1} down-weights older data by
 * dividing {@code P}; {@code φ = 1} weighs the whole history equally. This is the inverse
 * convention of the Kalman fading factor, which is {@code >= 1} and multiplies.
 */
public class RecursiveLeastSquaresUpdate implements StateTransition<RegressionInput, RlsState, RegressionOutput> {

    public static final double DEFAULT_INVERSE_COVARIANCE_DIAG = 10E5;

    private final int stateSize;
    private final double forgettingFactor;
    private final RealVector initialState;
    private final RealMatrix initialCovariance;

    public RecursiveLeastSquaresUpdate(int stateSize, double forgettingFactor,
                                       RealVector initialState, RealMatrix initialCovariance) {
        ValidationUtils.checkPositive(stateSize, "stateSize");
        if (!(forgettingFactor > 0.0 && forgettingFactor <= 1.0)) {
            throw new EstimatorConfigurationException("Forgetting factor must be in (0, 1], got " + forgettingFactor);
        }
        this.stateSize = stateSize;
        this.forgettingFactor = forgettingFactor;
        this.initialState = ValidationUtils.checkSize(initialState, stateSize, "initialState");
        this.initialCovariance = ValidationUtils.checkShape(initialCovariance, stateSize, stateSize, "inverseCovariance");
    }

    public RecursiveLeastSquaresUpdate(int stateSize, double forgettingFactor) {
        this(stateSize, forgettingFactor, LinalgUtils.zeros(stateSize),
                LinalgUtils.diagonal(stateSize, DEFAULT_INVERSE_COVARIANCE_DIAG));
    }

    public double getForgettingFactor() {
        return forgettingFactor;
    }

    @Override
    public RlsState update(String key, RegressionInput input, RlsState priorState) {
        RlsState current = priorState == null ? initialState(input) : priorState;
        if (input.getLabel() == null) {
            return new RlsState(current.stateIndex() + 1, current.state(), current.covariance());
        }

        RealVector x = ValidationUtils.requireSize(features(input), stateSize, "features");
        RealVector state = LinalgUtils.toVector(current.state());
        RealMatrix p = LinalgUtils.toMatrix(current.covariance());

        RealVector model = p.preMultiply(x);
        RealVector gain = p.operate(x).mapDivide(forgettingFactor + model.dotProduct(x));
        double residual = input.getLabel() - x.dotProduct(state);

        RealVector mean = state.add(gain.mapMultiply(residual));
        RealMatrix covariance = p.subtract(gain.outerProduct(model)).scalarMultiply(1.0 / forgettingFactor);
        return new RlsState(current.stateIndex() + 1, mean.toArray(), covariance.getData());
    }

    @Override
    public RegressionOutput output(String key, RegressionInput input, RlsState state) {
        RegressionOutput.RegressionOutputBuilder builder = RegressionOutput.builder()
                .stateKey(key)
                .stateIndex(state.stateIndex())
                .state(state.state())
                .covariance(state.covariance())
                .eventTime(input.getEventTime());
        if (input.getLabel() != null) {
            builder.residual(input.getLabel() - features(input).dotProduct(LinalgUtils.toVector(state.state())));
        }
        return builder.build();
    }

    private RlsState initialState(RegressionInput input) {
        RealVector mean = input.getInitialState() == null
                ? initialState
                : ValidationUtils.requireSize(LinalgUtils.toVector(input.getInitialState()), stateSize, "initialState");
        return new RlsState(0L, mean.toArray(), initialCovariance.getData());
    }

    static RealVector features(RegressionInput input) {
        if (input.getFeatures() == null) {
            throw new ShapeMismatchException("features are missing for a labelled input");
        }
        return LinalgUtils.toVector(input.getFeatures());
    }
}
