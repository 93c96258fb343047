package com.kotsin.estimator.service;

import com.kotsin.estimator.config.EstimatorConfig.KalmanConfig;
import com.kotsin.estimator.config.EstimatorConfig.LmsConfig;
import com.kotsin.estimator.config.EstimatorConfig.MixtureConfig;
import com.kotsin.estimator.config.EstimatorConfig.RlsConfig;
import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.InvalidCovarianceException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.filter.ExtendedKalmanModel;
import com.kotsin.estimator.filter.ExtendedKalmanStateCompute;
import com.kotsin.estimator.filter.KalmanDefaults;
import com.kotsin.estimator.filter.KalmanOutputOptions;
import com.kotsin.estimator.filter.KalmanStateUpdate;
import com.kotsin.estimator.filter.LeastMeanSquaresUpdate;
import com.kotsin.estimator.filter.LinearKalmanStateCompute;
import com.kotsin.estimator.filter.RecursiveLeastSquaresUpdate;
import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.mixture.OnlineMixtureUpdate;
import com.kotsin.estimator.mixture.StepSizePolicy;
import com.kotsin.estimator.stats.BernoulliDistribution;
import com.kotsin.estimator.stats.Distribution;
import com.kotsin.estimator.stats.DistributionFamily;
import com.kotsin.estimator.stats.MixtureModel;
import com.kotsin.estimator.stats.MultivariateGaussianDistribution;
import com.kotsin.estimator.stats.PoissonDistribution;
import com.kotsin.estimator.util.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds estimators from their configuration sections.
 *
 * Every method either returns a ready estimator or throws {@link EstimatorConfigurationException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EstimatorFactory {

    /**
     * Application-supplied nonlinear model; the extended filter falls back to the linear model.
     */
    private final ObjectProvider<ExtendedKalmanModel> extendedKalmanModel;

    public KalmanStateUpdate linearKalman(KalmanConfig config) {
        return new KalmanStateUpdate(kalmanDefaults(config),
                new LinearKalmanStateCompute(config.getFadingFactor()), outputOptions(config));
    }

    public KalmanStateUpdate extendedKalman(KalmanConfig config) {
        ExtendedKalmanModel model = extendedKalmanModel.getIfAvailable(() -> {
            log.warn("No ExtendedKalmanModel bean defined, extended filter runs the linear model");
            return ExtendedKalmanModel.LINEAR;
        });
        return new KalmanStateUpdate(kalmanDefaults(config),
                new ExtendedKalmanStateCompute(config.getFadingFactor(), model), outputOptions(config));
    }

    public RecursiveLeastSquaresUpdate recursiveLeastSquares(RlsConfig config) {
        int n = config.getStateSize();
        ValidationUtils.checkPositive(n, "rls.stateSize");
        RealVector initialState = config.getInitialState() == null
                ? LinalgUtils.zeros(n) : vector(config.getInitialState(), n, "rls.initialState");
        RealMatrix inverseCovariance = config.getInverseCovariance() == null
                ? LinalgUtils.diagonal(n, config.getInverseCovarianceDiag())
                : matrix(config.getInverseCovariance(), n, n, "rls.inverseCovariance");
        return new RecursiveLeastSquaresUpdate(n, config.getForgettingFactor(), initialState, inverseCovariance);
    }

    public LeastMeanSquaresUpdate leastMeanSquares(LmsConfig config) {
        int n = config.getStateSize();
        ValidationUtils.checkPositive(n, "lms.stateSize");
        RealVector initialState = config.getInitialState() == null
                ? LinalgUtils.zeros(n) : vector(config.getInitialState(), n, "lms.initialState");
        return new LeastMeanSquaresUpdate(n, config.getLearningRate(), config.getRegularization(), initialState);
    }

    public OnlineMixtureUpdate<?, ?> onlineMixture(MixtureConfig config) {
        DistributionFamily family = DistributionFamily.fromLabel(config.getFamily());
        int k = config.getMixtureCount();
        ValidationUtils.checkPositive(k, "mixture.mixtureCount");

        double[] weights = config.getInitialWeights();
        if (weights == null) {
            weights = new double[k];
            Arrays.fill(weights, 1.0 / k);
        }
        StepSizePolicy policy = config.getDecayRate() == null
                ? StepSizePolicy.constant(config.getStepSize())
                : StepSizePolicy.decaying(config.getDecayRate());

        return switch (family) {
            case BERNOULLI -> mixture(config, weights, bernoulliComponents(config), policy);
            case POISSON -> mixture(config, weights, poissonComponents(config), policy);
            case GAUSSIAN -> mixture(config, weights, gaussianComponents(config), policy);
        };
    }

    KalmanDefaults kalmanDefaults(KalmanConfig config) {
        int n = config.getStateSize();
        int m = config.getMeasurementSize();
        int q = ValidationUtils.getOrDefault(config.getProcessNoiseSize(), n);
        int r = ValidationUtils.getOrDefault(config.getMeasurementNoiseSize(), m);
        ValidationUtils.checkPositive(q, "processNoiseSize");
        ValidationUtils.checkPositive(r, "measurementNoiseSize");

        KalmanDefaults.KalmanDefaultsBuilder builder = KalmanDefaults.standard(n, m).toBuilder()
                .processNoise(LinalgUtils.identity(q))
                .measurementNoise(LinalgUtils.identity(r));
        if (config.getInitialState() != null) {
            builder.initialState(vector(config.getInitialState(), n, "initialState"));
        }
        if (config.getInitialCovariance() != null) {
            builder.initialCovariance(matrix(config.getInitialCovariance(), n, n, "initialCovariance"));
        }
        if (config.getProcessModel() != null) {
            builder.processModel(matrix(config.getProcessModel(), n, n, "processModel"));
        }
        if (config.getProcessNoise() != null) {
            builder.processNoise(matrix(config.getProcessNoise(), q, q, "processNoise"));
        }
        if (config.getMeasurementModel() != null) {
            builder.measurementModel(matrix(config.getMeasurementModel(), m, n, "measurementModel"));
        }
        if (config.getMeasurementNoise() != null) {
            builder.measurementNoise(matrix(config.getMeasurementNoise(), r, r, "measurementNoise"));
        }
        if (config.getControlFunction() != null) {
            ValidationUtils.checkPositive(config.getControlSize(), "controlSize");
            builder.controlFunction(matrix(config.getControlFunction(), n, config.getControlSize(), "controlFunction"));
        }
        return builder.build();
    }

    KalmanOutputOptions outputOptions(KalmanConfig config) {
        if (config.getMultipleModel().isEnabled()) {
            ValidationUtils.checkArgument(config.getSlidingLikelihoodWindow() > 0,
                    "multiple model aggregation needs slidingLikelihoodWindow > 0");
        }
        return new KalmanOutputOptions(
                config.isCalculateMahalanobis(),
                config.isCalculateLoglikelihood(),
                config.getSlidingLikelihoodWindow(),
                config.isOutputResiduals(),
                config.isOutputSystemMatrices());
    }

    private static <S, D extends Distribution<S, D>> OnlineMixtureUpdate<S, D> mixture(
            MixtureConfig config, double[] weights, List<D> components, StepSizePolicy policy) {
        return new OnlineMixtureUpdate<>(MixtureModel.of(weights, components), policy,
                config.getBatchTrainMaxIter(), config.getBatchTrainTol());
    }

    private static List<BernoulliDistribution> bernoulliComponents(MixtureConfig config) {
        double[] probabilities = sized(config.getInitialProbabilities(), config.getMixtureCount(), "initialProbabilities");
        List<BernoulliDistribution> components = new ArrayList<>();
        for (double p : probabilities) {
            ValidationUtils.checkArgument(p > 0.0 && p < 1.0, "Bernoulli probabilities must be in (0, 1), got " + p);
            components.add(new BernoulliDistribution(p));
        }
        return components;
    }

    private static List<PoissonDistribution> poissonComponents(MixtureConfig config) {
        double[] rates = sized(config.getInitialRates(), config.getMixtureCount(), "initialRates");
        List<PoissonDistribution> components = new ArrayList<>();
        for (double rate : rates) {
            ValidationUtils.checkArgument(rate > 0.0, "Poisson rates must be positive, got " + rate);
            components.add(new PoissonDistribution(rate));
        }
        return components;
    }

    private static List<MultivariateGaussianDistribution> gaussianComponents(MixtureConfig config) {
        int k = config.getMixtureCount();
        int d = config.getSampleSize();
        ValidationUtils.checkPositive(d, "mixture.sampleSize");
        RealMatrix means = matrix(ValidationUtils.checkNotNull(config.getInitialMeans(), "initialMeans"), k, d, "initialMeans");
        RealMatrix covariances = config.getInitialCovariances() == null
                ? null : matrix(config.getInitialCovariances(), k * d, d, "initialCovariances");

        List<MultivariateGaussianDistribution> components = new ArrayList<>();
        for (int i = 0; i < k; i++) {
            RealMatrix covariance = covariances == null
                    ? LinalgUtils.identity(d)
                    : covariances.getSubMatrix(i * d, (i + 1) * d - 1, 0, d - 1);
            try {
                LinalgUtils.cholesky(covariance);
            } catch (InvalidCovarianceException e) {
                throw new EstimatorConfigurationException("Covariance of component " + i + " is invalid: " + e.getMessage());
            }
            components.add(MultivariateGaussianDistribution.of(means.getRowVector(i), covariance));
        }
        return components;
    }

    private static double[] sized(double[] values, int size, String name) {
        ValidationUtils.checkNotNull(values, name);
        ValidationUtils.checkArgument(values.length == size,
                String.format("%s must have %d entries, got %d", name, size, values.length));
        return values;
    }

    private static RealVector vector(double[] values, int size, String name) {
        return ValidationUtils.checkSize(LinalgUtils.toVector(values), size, name);
    }

    private static RealMatrix matrix(double[] values, int rows, int cols, String name) {
        try {
            return LinalgUtils.fromRowMajor(values, rows, cols);
        } catch (ShapeMismatchException e) {
            throw new EstimatorConfigurationException(name + ": " + e.getMessage());
        }
    }
}
