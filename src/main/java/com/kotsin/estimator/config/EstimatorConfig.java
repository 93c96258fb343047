package com.kotsin.estimator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Estimator configuration, bound from the {@code estimator} prefix.
 *
 * Matrices are given row-major as flat lists, e.g. a 2x2 identity is {@code [1, 0, 0, 1]}.
 * A matrix left unset takes the estimator's default.
 *
 * <pre>
 * estimator:
 *   failure-policy: skip
 *   state-timeout: 1h
 *   kalman:
 *     enabled: true
 *     state-size: 2
 *     measurement-size: 1
 *     process-model: [1, 1, 0, 1]
 * </pre>
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "estimator")
public class EstimatorConfig {

    /**
     * Prefix of the Kafka Streams application id, one application per enabled estimator.
     */
    private String applicationIdPrefix = "streaming-estimator";

    private FailurePolicy failurePolicy = FailurePolicy.SKIP;

    private String failureTopic = KafkaTopics.ESTIMATION_FAILURES;

    /**
     * Keys without input for this long in stream time lose their state; unset keeps state forever.
     */
    private Duration stateTimeout;

    private Duration evictionInterval = ProcessingConstants.DEFAULT_EVICTION_INTERVAL;

    /**
     * Log every step through the pipeline trace logger.
     */
    private boolean traceSteps = false;

    private KalmanConfig kalman = new KalmanConfig(KafkaTopics.KALMAN_INPUT, KafkaTopics.KALMAN_OUTPUT);

    private KalmanConfig extendedKalman = new KalmanConfig(
            KafkaTopics.EXTENDED_KALMAN_INPUT, KafkaTopics.EXTENDED_KALMAN_OUTPUT);

    private RlsConfig rls = new RlsConfig();

    private LmsConfig lms = new LmsConfig();

    private MixtureConfig mixture = new MixtureConfig();

    @Data
    public static class KalmanConfig {
        private boolean enabled = false;
        private String inputTopic;
        private String outputTopic;

        private int stateSize = 1;
        private int measurementSize = 1;

        private double[] initialState;
        private double[] initialCovariance;
        private double[] processModel;
        private double[] processNoise;
        private double[] measurementModel;
        private double[] measurementNoise;

        /**
         * Row-major {@code stateSize x controlSize} matrix B.
         */
        private double[] controlFunction;
        private int controlSize = 0;

        /**
         * Process noise size when a noise Jacobian maps it into the state space; defaults to stateSize.
         */
        private Integer processNoiseSize;

        /**
         * Measurement noise size when a noise Jacobian maps it; defaults to measurementSize.
         */
        private Integer measurementNoiseSize;

        /**
         * {@code >= 1}; multiplies the predicted covariance.
         */
        private double fadingFactor = ProcessingConstants.DEFAULT_FADING_FACTOR;

        private boolean calculateMahalanobis = false;
        private boolean calculateLoglikelihood = false;
        private boolean outputResiduals = true;
        private boolean outputSystemMatrices = false;

        /**
         * Capacity of the sliding log-likelihood window, 0 disables it.
         */
        private int slidingLikelihoodWindow = 0;

        private MultipleModelConfig multipleModel = new MultipleModelConfig();

        public KalmanConfig() {
        }

        public KalmanConfig(String inputTopic, String outputTopic) {
            this.inputTopic = inputTopic;
            this.outputTopic = outputTopic;
        }
    }

    @Data
    public static class MultipleModelConfig {
        private boolean enabled = false;
        private String outputTopic = KafkaTopics.KALMAN_MULTIPLE_MODEL;

        /**
         * Also group filter outputs by event-time window of this size.
         */
        private Duration windowDuration;
    }

    @Data
    public static class RlsConfig {
        private boolean enabled = false;
        private String inputTopic = KafkaTopics.RLS_INPUT;
        private String outputTopic = KafkaTopics.RLS_OUTPUT;
        private int stateSize = 1;

        /**
         * {@code 0 < φ <= 1}; divides the inverse covariance.
         */
        private double forgettingFactor = ProcessingConstants.DEFAULT_FORGETTING_FACTOR;
        private double[] initialState;
        private double[] inverseCovariance;
        private double inverseCovarianceDiag = 10E5;
    }

    @Data
    public static class LmsConfig {
        private boolean enabled = false;
        private String inputTopic = KafkaTopics.LMS_INPUT;
        private String outputTopic = KafkaTopics.LMS_OUTPUT;
        private int stateSize = 1;
        private double learningRate = ProcessingConstants.DEFAULT_LMS_LEARNING_RATE;
        private double regularization = ProcessingConstants.DEFAULT_LMS_REGULARIZATION;
        private double[] initialState;
    }

    @Data
    public static class MixtureConfig {
        private boolean enabled = false;
        private String inputTopic = KafkaTopics.MIXTURE_INPUT;
        private String outputTopic = KafkaTopics.MIXTURE_OUTPUT;

        /**
         * bernoulli, poisson or gaussian.
         */
        private String family = "gaussian";
        private int mixtureCount = 2;

        /**
         * Initial component weights; uniform when unset.
         */
        private double[] initialWeights;

        /**
         * Bernoulli: one success probability per component.
         */
        private double[] initialProbabilities;

        /**
         * Poisson: one rate per component.
         */
        private double[] initialRates;

        /**
         * Gaussian: sample dimension, component means (mixtureCount x sampleSize, row-major) and
         * component covariances (mixtureCount blocks of sampleSize x sampleSize). Covariances
         * default to identity.
         */
        private int sampleSize = 1;
        private double[] initialMeans;
        private double[] initialCovariances;

        private double stepSize = ProcessingConstants.DEFAULT_MIXTURE_STEP_SIZE;

        /**
         * When set, the step size decays as (t + 2)^-decayRate instead of staying constant.
         */
        private Double decayRate;

        private int batchTrainMaxIter = 1;
        private double batchTrainTol = 0.0;
    }
}
