package com.kotsin.estimator.processor;

import com.kotsin.estimator.config.ConfigurationValidator;
import com.kotsin.estimator.config.EstimatorConfig;
import com.kotsin.estimator.config.FailurePolicy;
import com.kotsin.estimator.config.KafkaConfig;
import com.kotsin.estimator.config.ProcessingConstants;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.errors.StreamsUncaughtExceptionHandler.StreamThreadExceptionResponse;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Stream lifecycle: validates the configuration, then runs one Kafka Streams application per
 * enabled estimator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EstimationOrchestrator {

    private final EstimatorConfig config;
    private final KafkaConfig kafkaConfig;
    private final ConfigurationValidator validator;
    private final EstimationTopology topology;
    private final Map<String, KafkaStreams> streamsInstances = new ConcurrentHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void startAllStreams() {
        validator.validateConfiguration();
        log.info("🚀 Starting estimator streams");

        if (config.getKalman().isEnabled()) {
            startStream(ProcessingConstants.LINEAR_KALMAN, topology::createLinearKalmanTopology);
        }
        if (config.getExtendedKalman().isEnabled()) {
            startStream(ProcessingConstants.EXTENDED_KALMAN, topology::createExtendedKalmanTopology);
        }
        if (config.getRls().isEnabled()) {
            startStream(ProcessingConstants.RECURSIVE_LEAST_SQUARES, topology::createRecursiveLeastSquaresTopology);
        }
        if (config.getLms().isEnabled()) {
            startStream(ProcessingConstants.LEAST_MEAN_SQUARES, topology::createLeastMeanSquaresTopology);
        }
        if (config.getMixture().isEnabled()) {
            startStream(ProcessingConstants.ONLINE_MIXTURE, topology::createOnlineMixtureTopology);
        }
        log.info("✅ {} estimator streams started", streamsInstances.size());
    }

    void startStream(String estimator, Supplier<StreamsBuilder> topologySupplier) {
        if (streamsInstances.containsKey(estimator)) {
            log.warn("⚠️ {} stream already running. Skipping duplicate start.", estimator);
            return;
        }

        String appId = config.getApplicationIdPrefix() + "-" + estimator;
        KafkaStreams streams = new KafkaStreams(topologySupplier.get().build(), kafkaConfig.getStreamProperties(appId));
        streamsInstances.put(estimator, streams);

        streams.setStateListener((newState, oldState) -> {
            log.info("{} streams state transition: {} -> {}", estimator, oldState, newState);
            if (newState == KafkaStreams.State.ERROR) {
                log.error("❌ {} stream entered ERROR state!", estimator);
            }
        });

        streams.setUncaughtExceptionHandler((Throwable exception) -> {
            log.error("❌ Uncaught exception in {} stream: ", estimator, exception);
            return config.getFailurePolicy() == FailurePolicy.FAIL
                    ? StreamThreadExceptionResponse.SHUTDOWN_CLIENT
                    : StreamThreadExceptionResponse.REPLACE_THREAD;
        });

        try {
            streams.start();
            log.info("✅ Started {} stream ({})", estimator, appId);
        } catch (Exception e) {
            log.error("❌ Failed to start {} stream", estimator, e);
            streamsInstances.remove(estimator);
            throw new IllegalStateException("Failed to start " + estimator + " stream", e);
        }
    }

    @PreDestroy
    public void stopAllStreams() {
        log.info("🛑 Stopping all estimator streams");

        streamsInstances.forEach((key, streams) -> {
            try {
                streams.close(ProcessingConstants.SHUTDOWN_TIMEOUT);
                log.info("✅ Stopped stream: {}", key);
            } catch (Exception e) {
                log.error("❌ Error stopping stream: {}", key, e);
            }
        });

        streamsInstances.clear();
    }

    public Map<String, String> getStreamStatus() {
        Map<String, String> status = new ConcurrentHashMap<>();
        streamsInstances.forEach((key, streams) -> status.put(key, streams.state().toString()));
        return status;
    }
}
