package com.kotsin.estimator.logging;

import com.kotsin.estimator.config.EstimatorConfig;
import com.kotsin.estimator.model.EstimationFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * PipelineTraceLogger - per-step tracing of the estimation flow
 *
 * INPUT → STEP → OUTPUT, or INPUT → FAILURE
 *
 * Format: [STAGE] estimator | time | key | details
 */
@Slf4j
@Component
public class PipelineTraceLogger {

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS")
            .withZone(ZoneId.systemDefault());

    private final boolean traceEnabled;

    public PipelineTraceLogger(EstimatorConfig config) {
        this.traceEnabled = config.isTraceSteps();
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public void logInputReceived(String estimator, String stateKey, long timestamp, Long priorIndex,
                                 boolean hasObservation) {
        if (!traceEnabled) return;
        log.info("┌─[INPUT-{}] {} | {} | prior={} | {}",
                estimator, formatTime(timestamp), stateKey,
                priorIndex == null ? "new" : priorIndex,
                hasObservation ? "observed" : "predict-only");
    }

    public void logStepCompleted(String estimator, String stateKey, long timestamp, long stateIndex) {
        if (!traceEnabled) return;
        log.info("└─[STEP-{}] {} | {} | stateIndex={}", estimator, formatTime(timestamp), stateKey, stateIndex);
    }

    /**
     * Failures are always logged, tracing or not.
     */
    public void logStepFailed(EstimationFailure failure) {
        log.warn("└─[FAILURE-{}] {} | {} | {} | kept stateIndex={} | {}",
                failure.getEstimator(), formatTime(failure.getRecordTimestamp()), failure.getStateKey(),
                failure.getFailureType(), failure.getStateIndex() == null ? "none" : failure.getStateIndex(),
                failure.getMessage());
    }

    public void logStatesEvicted(String estimator, long streamTime, int count) {
        if (count == 0) return;
        log.info("── [EVICT-{}] {} | {} idle states removed", estimator, formatTime(streamTime), count);
    }

    public void logMultipleModelEstimate(String modelGroup, long stateIndex, int modelCount, String weights) {
        if (!traceEnabled) return;
        log.info("├─[MMAE] {} | stateIndex={} | models={} | weights={}", modelGroup, stateIndex, modelCount, weights);
    }

    private String formatTime(long timestamp) {
        return TIME_FMT.format(Instant.ofEpochMilli(timestamp));
    }
}
