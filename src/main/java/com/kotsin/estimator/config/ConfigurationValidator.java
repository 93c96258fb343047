package com.kotsin.estimator.config;

import com.kotsin.estimator.config.EstimatorConfig.KalmanConfig;
import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.service.EstimatorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Fails fast on invalid configuration: every enabled estimator is built once and every problem
 * is reported before any stream starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigurationValidator {

    private final EstimatorConfig config;
    private final EstimatorFactory factory;
    private final KafkaConfig kafkaConfig;

    public void validateConfiguration() {
        log.info("🔍 Validating estimator configuration...");

        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            log.error("❌ Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("✅ Configuration validation passed");
        logConfigurationSummary();
    }

    public List<String> collectErrors() {
        List<String> errors = new ArrayList<>();

        if (isNullOrEmpty(kafkaConfig.getBootstrapServers())) {
            errors.add("spring.kafka.bootstrap-servers is not configured");
        }
        if (isNullOrEmpty(config.getApplicationIdPrefix())) {
            errors.add("estimator.application-id-prefix is not configured");
        }
        if (isNullOrEmpty(config.getFailureTopic())) {
            errors.add("estimator.failure-topic is not configured");
        }
        if (config.getFailurePolicy() == null) {
            errors.add("estimator.failure-policy is not configured");
        }
        if (config.getStateTimeout() != null && !isPositive(config.getStateTimeout())) {
            errors.add("estimator.state-timeout must be positive");
        }
        if (config.getEvictionInterval() == null || !isPositive(config.getEvictionInterval())) {
            errors.add("estimator.eviction-interval must be positive");
        }

        Set<String> outputTopics = new HashSet<>();
        KalmanConfig kalman = config.getKalman();
        if (kalman.isEnabled()) {
            checkTopics("kalman", kalman.getInputTopic(), kalman.getOutputTopic(), outputTopics, errors);
            checkMultipleModel("kalman", kalman, outputTopics, errors);
            checkEstimator("kalman", () -> factory.linearKalman(kalman), errors);
        }
        KalmanConfig extended = config.getExtendedKalman();
        if (extended.isEnabled()) {
            checkTopics("extended-kalman", extended.getInputTopic(), extended.getOutputTopic(), outputTopics, errors);
            checkMultipleModel("extended-kalman", extended, outputTopics, errors);
            checkEstimator("extended-kalman", () -> factory.extendedKalman(extended), errors);
        }
        if (config.getRls().isEnabled()) {
            checkTopics("rls", config.getRls().getInputTopic(), config.getRls().getOutputTopic(), outputTopics, errors);
            checkEstimator("rls", () -> factory.recursiveLeastSquares(config.getRls()), errors);
        }
        if (config.getLms().isEnabled()) {
            checkTopics("lms", config.getLms().getInputTopic(), config.getLms().getOutputTopic(), outputTopics, errors);
            checkEstimator("lms", () -> factory.leastMeanSquares(config.getLms()), errors);
        }
        if (config.getMixture().isEnabled()) {
            checkTopics("mixture", config.getMixture().getInputTopic(), config.getMixture().getOutputTopic(),
                    outputTopics, errors);
            checkEstimator("mixture", () -> factory.onlineMixture(config.getMixture()), errors);
        }
        if (outputTopics.isEmpty()) {
            log.warn("⚠️ No estimator is enabled - nothing will be processed");
        }
        return errors;
    }

    private void checkEstimator(String name, Supplier<?> builder, List<String> errors) {
        try {
            builder.get();
        } catch (EstimationException e) {
            errors.add("estimator." + name + ": " + e.getMessage());
        }
    }

    private void checkTopics(String name, String inputTopic, String outputTopic, Set<String> outputTopics,
                             List<String> errors) {
        if (isNullOrEmpty(inputTopic)) {
            errors.add("estimator." + name + ".input-topic is not configured");
        }
        if (isNullOrEmpty(outputTopic)) {
            errors.add("estimator." + name + ".output-topic is not configured");
        } else if (!outputTopics.add(outputTopic) || outputTopic.equals(config.getFailureTopic())) {
            errors.add("estimator." + name + ".output-topic " + outputTopic + " is already used");
        }
    }

    private void checkMultipleModel(String name, KalmanConfig kalman, Set<String> outputTopics, List<String> errors) {
        EstimatorConfig.MultipleModelConfig multipleModel = kalman.getMultipleModel();
        if (!multipleModel.isEnabled()) {
            return;
        }
        if (isNullOrEmpty(multipleModel.getOutputTopic()) || !outputTopics.add(multipleModel.getOutputTopic())) {
            errors.add("estimator." + name + ".multiple-model.output-topic must be set and unique");
        }
        if (multipleModel.getWindowDuration() != null && !isPositive(multipleModel.getWindowDuration())) {
            errors.add("estimator." + name + ".multiple-model.window-duration must be positive");
        }
    }

    private void logConfigurationSummary() {
        log.info("📋 Configuration Summary:");
        log.info("  Kafka Bootstrap Servers: {}", kafkaConfig.getBootstrapServers());
        log.info("  Application ID prefix: {}", config.getApplicationIdPrefix());
        log.info("  Failure policy: {} → {}", config.getFailurePolicy(), config.getFailureTopic());
        log.info("  State timeout: {}", config.getStateTimeout() == null ? "none" : config.getStateTimeout());
        log.info("  Enabled: kalman={} extended-kalman={} rls={} lms={} mixture={}",
                config.getKalman().isEnabled(), config.getExtendedKalman().isEnabled(),
                config.getRls().isEnabled(), config.getLms().isEnabled(), config.getMixture().isEnabled());
    }

    private boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }
}
