package com.kotsin.estimator.config;

import com.kotsin.estimator.filter.ExtendedKalmanModel;
import com.kotsin.estimator.service.EstimatorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@DisplayName("ConfigurationValidator - Fail fast on bad configuration")
class ConfigurationValidatorTest {

    @Mock
    private KafkaConfig kafkaConfig;

    @Mock
    private ObjectProvider<ExtendedKalmanModel> modelProvider;

    private EstimatorConfig config;
    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(kafkaConfig.getBootstrapServers()).thenReturn("localhost:9092");
        when(modelProvider.getIfAvailable(any())).thenAnswer(inv -> ((Supplier<?>) inv.getArgument(0)).get());
        config = new EstimatorConfig();
        config.getKalman().setEnabled(true);
        validator = new ConfigurationValidator(config, new EstimatorFactory(modelProvider), kafkaConfig);
    }

    @Test
    @DisplayName("Default configuration with one estimator passes")
    void testValidConfiguration() {
        assertTrue(validator.collectErrors().isEmpty());
        assertDoesNotThrow(() -> validator.validateConfiguration());
    }

    @Test
    @DisplayName("Missing bootstrap servers is reported")
    void testMissingBootstrapServers() {
        when(kafkaConfig.getBootstrapServers()).thenReturn(" ");

        List<String> errors = validator.collectErrors();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("bootstrap-servers"));
        assertThrows(IllegalStateException.class, () -> validator.validateConfiguration());
    }

    @Test
    @DisplayName("Estimator construction errors are collected with their section")
    void testEstimatorErrors() {
        config.getKalman().setProcessModel(new double[] {1, 2});
        config.getRls().setEnabled(true);
        config.getRls().setForgettingFactor(0.0);

        List<String> errors = validator.collectErrors();

        assertEquals(2, errors.size());
        assertTrue(errors.get(0).startsWith("estimator.kalman:"));
        assertTrue(errors.get(1).startsWith("estimator.rls:"));
    }

    @Test
    @DisplayName("Output topics must be distinct from each other and from the failure topic")
    void testDuplicateTopics() {
        config.getLms().setEnabled(true);
        config.getLms().setOutputTopic(config.getKalman().getOutputTopic());
        config.getRls().setEnabled(true);
        config.getRls().setOutputTopic(config.getFailureTopic());

        List<String> errors = validator.collectErrors();

        assertTrue(errors.stream().anyMatch(e -> e.startsWith("estimator.lms.output-topic")));
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("estimator.rls.output-topic")));
    }

    @Test
    @DisplayName("Durations must be positive")
    void testDurations() {
        config.setStateTimeout(Duration.ZERO);
        config.setEvictionInterval(Duration.ofSeconds(-1));
        config.getKalman().setSlidingLikelihoodWindow(4);
        config.getKalman().getMultipleModel().setEnabled(true);
        config.getKalman().getMultipleModel().setWindowDuration(Duration.ZERO);

        List<String> errors = validator.collectErrors();

        assertEquals(3, errors.size());
    }

    @Test
    @DisplayName("Disabled estimators are not validated")
    void testDisabledEstimatorIgnored() {
        config.getMixture().setFamily("poisson");

        assertTrue(validator.collectErrors().isEmpty());
    }
}
