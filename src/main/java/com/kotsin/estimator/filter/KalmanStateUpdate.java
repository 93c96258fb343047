package com.kotsin.estimator.filter;

import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanInput;
import com.kotsin.estimator.model.KalmanOutput;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.stats.MultivariateGaussian;
import com.kotsin.estimator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Kalman estimator for one key: resolves the step's system against the configured defaults and
 * runs predict, or predict and estimate when the input carries a measurement.
 */
@Slf4j
public class KalmanStateUpdate implements StateTransition<KalmanInput, KalmanState, KalmanOutput> {

    private final KalmanDefaults defaults;
    private final KalmanStateCompute compute;
    private final KalmanOutputOptions options;

    public KalmanStateUpdate(KalmanDefaults defaults, KalmanStateCompute compute, KalmanOutputOptions options) {
        this.compute = ValidationUtils.checkNotNull(compute, "compute");
        this.defaults = compute.validate(ValidationUtils.checkNotNull(defaults, "defaults"));
        this.options = ValidationUtils.checkNotNull(options, "options");
        ValidationUtils.checkArgument(options.slidingLikelihoodWindow() >= 0,
                "slidingLikelihoodWindow must not be negative, got " + options.slidingLikelihoodWindow());
    }

    public KalmanDefaults getDefaults() {
        return defaults;
    }

    public KalmanOutputOptions getOptions() {
        return options;
    }

    @Override
    public KalmanState update(String key, KalmanInput input, KalmanState priorState) {
        KalmanState current = priorState;
        if (current == null) {
            current = initialState(input);
            log.debug("Initialized Kalman state for key {}", key);
        }
        KalmanSystem system = resolveSystem(input);

        if (input.getMeasurement() == null) {
            return compute.predict(current, system);
        }
        RealVector measurement = ValidationUtils.requireSize(
                LinalgUtils.toVector(input.getMeasurement()), defaults.getMeasurementSize(), "measurement");
        return compute.predictAndEstimate(current, measurement, system,
                options.storeResidual(), options.slidingLikelihoodWindow());
    }

    @Override
    public KalmanOutput output(String key, KalmanInput input, KalmanState state) {
        KalmanOutput.KalmanOutputBuilder builder = KalmanOutput.builder()
                .stateKey(key)
                .modelGroup(input.getModelGroup())
                .stateIndex(state.stateIndex())
                .state(state.state())
                .stateCovariance(state.stateCovariance())
                .eventTime(input.getEventTime());

        if (state.residual() != null) {
            RealVector residual = LinalgUtils.toVector(state.residual());
            RealMatrix residualCovariance = LinalgUtils.toMatrix(state.residualCovariance());
            if (options.outputResiduals()) {
                builder.residual(state.residual()).residualCovariance(state.residualCovariance());
            }
            if (options.calculateMahalanobis()) {
                builder.mahalanobis(LinalgUtils.mahalanobis(
                        residual, LinalgUtils.zeros(residual.getDimension()), residualCovariance));
            }
            if (options.calculateLoglikelihood()) {
                builder.loglikelihood(MultivariateGaussian.residualLogpdf(residual, residualCovariance));
            }
        }

        List<Double> window = state.slidingLoglikelihood();
        if (options.slidingLikelihoodWindow() > 0 && !window.isEmpty()) {
            double sum = SlidingLikelihood.sum(window);
            builder.slidingLoglikelihood(sum).slidingLikelihood(Math.exp(sum));
        }

        if (options.outputSystemMatrices()) {
            KalmanSystem system = resolveSystem(input);
            builder.processModel(LinalgUtils.toArray(system.processModel()))
                    .processNoise(LinalgUtils.toArray(system.processNoise()))
                    .measurementModel(LinalgUtils.toArray(system.measurementModel()));
        }
        return builder.build();
    }

    KalmanState initialState(KalmanInput input) {
        int n = defaults.getStateSize();
        RealVector mean = input.getInitialState() == null
                ? defaults.getInitialState()
                : ValidationUtils.requireSize(LinalgUtils.toVector(input.getInitialState()), n, "initialState");
        RealMatrix covariance = input.getInitialCovariance() == null
                ? defaults.getInitialCovariance()
                : ValidationUtils.requireShape(matrix(input.getInitialCovariance(), "initialCovariance"),
                        n, n, "initialCovariance");
        return new KalmanState(0L, mean.toArray(), covariance.getData(), null, null, List.of());
    }

    KalmanSystem resolveSystem(KalmanInput input) {
        RealMatrix processNoise = orDefault(input.getProcessNoise(), defaults.getProcessNoise(), "processNoise");
        RealMatrix measurementNoise = orDefault(
                input.getMeasurementNoise(), defaults.getMeasurementNoise(), "measurementNoise");
        ValidationUtils.requireSquare(processNoise, "processNoise");
        ValidationUtils.requireSquare(measurementNoise, "measurementNoise");

        RealVector control = input.getControl() == null ? null : LinalgUtils.toVector(input.getControl());
        RealMatrix controlFunction = orDefault(
                input.getControlFunction(), defaults.getControlFunction(), "controlFunction");
        boolean controlled = control != null && controlFunction != null;

        return new KalmanSystem(
                orDefault(input.getProcessModel(), defaults.getProcessModel(), "processModel"),
                processNoise,
                orDefault(input.getMeasurementModel(), defaults.getMeasurementModel(), "measurementModel"),
                measurementNoise,
                controlled ? control : null,
                controlled ? controlFunction : null);
    }

    private static RealMatrix orDefault(double[][] override, RealMatrix defaultValue, String name) {
        return override == null ? defaultValue : matrix(override, name);
    }

    private static RealMatrix matrix(double[][] values, String name) {
        return LinalgUtils.toMatrix(ValidationUtils.requireRectangular(values, name));
    }
}
