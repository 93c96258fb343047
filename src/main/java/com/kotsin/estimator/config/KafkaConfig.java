package com.kotsin.estimator.config;

import com.kotsin.estimator.processor.EventTimeExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.streams.StreamsConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.Properties;

/**
 * Kafka Streams client settings shared by every estimator application.
 */
@Component
@Slf4j
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.streams.state-dir:/tmp/kafka-streams/streaming-estimator}")
    private String baseStateDir;

    @Value("${spring.kafka.streams.properties.commit.interval.ms:1000}")
    private int commitIntervalMs;

    @Value("${spring.kafka.streams.properties.statestore.cache.max.bytes:10485760}")
    private long statestoreCacheMaxBytes;

    @Value("${spring.kafka.streams.properties.num.stream.threads:1}")
    private int numStreamThreads;

    /**
     * exactly_once_v2 makes the state store write and the output record atomic per step.
     */
    @Value("${spring.kafka.streams.properties.processing.guarantee:at_least_once}")
    private String processingGuarantee;

    @Value("${spring.kafka.streams.properties.auto.offset.reset:earliest}")
    private String autoOffsetReset;

    @Value("${spring.kafka.streams.properties.default.deserialization.exception.handler:org.apache.kafka.streams.errors.LogAndContinueExceptionHandler}")
    private String deserializationExceptionHandler;

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    /**
     * Properties of one Kafka Streams application.
     *
     * @param appId application id; also names the state directory
     */
    public Properties getStreamProperties(String appId) {
        Properties props = new Properties();

        props.put(StreamsConfig.APPLICATION_ID_CONFIG, appId);
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG, Serdes.String().getClass().getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG, Serdes.String().getClass().getName());
        props.put(StreamsConfig.DEFAULT_TIMESTAMP_EXTRACTOR_CLASS_CONFIG, EventTimeExtractor.class.getName());
        props.put(StreamsConfig.STATE_DIR_CONFIG, stateDir(appId));

        props.put(StreamsConfig.COMMIT_INTERVAL_MS_CONFIG, commitIntervalMs);
        props.put(StreamsConfig.STATESTORE_CACHE_MAX_BYTES_CONFIG, statestoreCacheMaxBytes);
        props.put(StreamsConfig.NUM_STREAM_THREADS_CONFIG, numStreamThreads);
        props.put(StreamsConfig.PROCESSING_GUARANTEE_CONFIG, processingGuarantee);
        props.put(StreamsConfig.DEFAULT_DESERIALIZATION_EXCEPTION_HANDLER_CLASS_CONFIG,
                deserializationExceptionHandler);
        props.put(StreamsConfig.CONSUMER_PREFIX + "auto.offset.reset", autoOffsetReset);

        return props;
    }

    private String stateDir(String appId) {
        File baseDir = new File(baseStateDir);
        if (!baseDir.exists() && !baseDir.mkdirs()) {
            String fallbackPath = System.getProperty("java.io.tmpdir") + "/kafka-streams/" + appId;
            log.warn("Could not create state directory {}, falling back to {}", baseStateDir, fallbackPath);
            return fallbackPath;
        }
        return baseStateDir + "/" + appId;
    }
}
