package com.kotsin.estimator.metrics;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-estimator step counters.
 */
@Component
public class StreamMetrics {
    private final Map<String, AtomicLong> stepsByEstimator = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> predictOnlyByEstimator = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failuresByEstimator = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> droppedByEstimator = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> evictionsByEstimator = new ConcurrentHashMap<>();
    private final AtomicLong multipleModelEmits = new AtomicLong(0);

    public void incStep(String estimator) { counter(stepsByEstimator, estimator).incrementAndGet(); }
    public void incPredictOnly(String estimator) { counter(predictOnlyByEstimator, estimator).incrementAndGet(); }
    public void incFailure(String estimator) { counter(failuresByEstimator, estimator).incrementAndGet(); }
    // records without a usable state key
    public void incDropped(String estimator) { counter(droppedByEstimator, estimator).incrementAndGet(); }
    public void addEvictions(String estimator, long count) { counter(evictionsByEstimator, estimator).addAndGet(count); }
    public void incMultipleModelEmit() { multipleModelEmits.incrementAndGet(); }

    public Map<String, Long> getStepsByEstimator() { return toLongMap(stepsByEstimator); }
    public Map<String, Long> getPredictOnlyByEstimator() { return toLongMap(predictOnlyByEstimator); }
    public Map<String, Long> getFailuresByEstimator() { return toLongMap(failuresByEstimator); }
    public Map<String, Long> getDroppedByEstimator() { return toLongMap(droppedByEstimator); }
    public Map<String, Long> getEvictionsByEstimator() { return toLongMap(evictionsByEstimator); }
    public long getMultipleModelEmits() { return multipleModelEmits.get(); }

    public long getSteps(String estimator) { return valueOf(stepsByEstimator, estimator); }
    public long getFailures(String estimator) { return valueOf(failuresByEstimator, estimator); }

    private AtomicLong counter(Map<String, AtomicLong> counters, String estimator) {
        return counters.computeIfAbsent(estimator, k -> new AtomicLong());
    }

    private long valueOf(Map<String, AtomicLong> counters, String estimator) {
        AtomicLong counter = counters.get(estimator);
        return counter == null ? 0L : counter.get();
    }

    private Map<String, Long> toLongMap(Map<String, AtomicLong> src) {
        Map<String, Long> out = new ConcurrentHashMap<>();
        src.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }
}
