package com.kotsin.estimator.processor;

import com.kotsin.estimator.config.FailurePolicy;
import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.filter.StateTransition;
import com.kotsin.estimator.logging.PipelineTraceLogger;
import com.kotsin.estimator.metrics.StreamMetrics;
import com.kotsin.estimator.model.EstimationFailure;
import com.kotsin.estimator.model.FailureType;
import com.kotsin.estimator.model.IndexedState;
import com.kotsin.estimator.model.KeyedInput;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.kstream.Transformer;
import org.apache.kafka.streams.processor.ProcessorContext;
import org.apache.kafka.streams.processor.PunctuationType;
import org.apache.kafka.streams.state.KeyValueIterator;
import org.apache.kafka.streams.state.TimestampedKeyValueStore;
import org.apache.kafka.streams.state.ValueAndTimestamp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a {@link StateTransition} against a keyed state store.
 *
 * The Kafka record key selects the state, falling back to the input's {@code stateKey}. The
 * posterior is written only after both the update and the output succeeded, so a failed step
 * leaves the stored state exactly as it was. Each entry is stamped with the stream time of its
 * last update; when a timeout is configured a stream-time punctuator evicts idle keys.
 */
@Slf4j
public class StateTransitionTransformer<I extends KeyedInput, S extends IndexedState, O>
        implements Transformer<String, I, KeyValue<String, StepOutcome<O>>> {

    private final String estimator;
    private final String storeName;
    private final StateTransition<I, S, O> transition;
    private final FailurePolicy failurePolicy;
    private final Duration stateTimeout;
    private final Duration evictionInterval;
    private final StreamMetrics metrics;
    private final PipelineTraceLogger traceLogger;

    private ProcessorContext context;
    private TimestampedKeyValueStore<String, S> store;

    public StateTransitionTransformer(String estimator, String storeName, StateTransition<I, S, O> transition,
                                      FailurePolicy failurePolicy, Duration stateTimeout, Duration evictionInterval,
                                      StreamMetrics metrics, PipelineTraceLogger traceLogger) {
        this.estimator = estimator;
        this.storeName = storeName;
        this.transition = transition;
        this.failurePolicy = failurePolicy;
        this.stateTimeout = stateTimeout;
        this.evictionInterval = evictionInterval;
        this.metrics = metrics;
        this.traceLogger = traceLogger;
    }

    @Override @SuppressWarnings("unchecked")
    public void init(ProcessorContext context) {
        this.context = context;
        this.store = (TimestampedKeyValueStore<String, S>) context.getStateStore(storeName);
        if (stateTimeout != null) {
            context.schedule(evictionInterval, PunctuationType.STREAM_TIME, this::evictIdleStates);
        }
    }

    @Override
    public KeyValue<String, StepOutcome<O>> transform(String key, I input) {
        if (input == null) return null;

        String stateKey = (key != null && !key.isEmpty()) ? key : input.getStateKey();
        if (stateKey == null || stateKey.isEmpty()) {
            log.warn("[{}] Dropping input without a state key at offset {}", estimator, context.offset());
            metrics.incDropped(estimator);
            return null;
        }

        long timestamp = context.timestamp();
        S prior = ValueAndTimestamp.getValueOrNull(store.get(stateKey));
        traceLogger.logInputReceived(estimator, stateKey, timestamp,
                prior == null ? null : prior.stateIndex(), input.hasObservation());

        S posterior;
        O output;
        try {
            posterior = transition.update(stateKey, input, prior);
            output = transition.output(stateKey, input, posterior);
        } catch (EstimationException e) {
            metrics.incFailure(estimator);
            if (failurePolicy == FailurePolicy.FAIL) {
                log.error("[{}] Step failed for key {}, failure policy is FAIL", estimator, stateKey, e);
                throw e;
            }
            EstimationFailure failure = EstimationFailure.builder()
                    .estimator(estimator)
                    .stateKey(stateKey)
                    .stateIndex(prior == null ? null : prior.stateIndex())
                    .failureType(FailureType.of(e))
                    .message(e.getMessage())
                    .recordTimestamp(timestamp)
                    .build();
            traceLogger.logStepFailed(failure);
            return KeyValue.pair(stateKey, StepOutcome.failed(failure));
        }

        store.put(stateKey, ValueAndTimestamp.make(posterior, timestamp));
        metrics.incStep(estimator);
        if (!input.hasObservation()) {
            metrics.incPredictOnly(estimator);
        }
        traceLogger.logStepCompleted(estimator, stateKey, timestamp, posterior.stateIndex());
        return KeyValue.pair(stateKey, StepOutcome.success(output));
    }

    void evictIdleStates(long streamTime) {
        long cutoff = streamTime - stateTimeout.toMillis();
        List<String> expired = new ArrayList<>();
        try (KeyValueIterator<String, ValueAndTimestamp<S>> it = store.all()) {
            while (it.hasNext()) {
                KeyValue<String, ValueAndTimestamp<S>> entry = it.next();
                if (entry.value != null && entry.value.timestamp() < cutoff) {
                    expired.add(entry.key);
                }
            }
        }
        expired.forEach(store::delete);
        metrics.addEvictions(estimator, expired.size());
        traceLogger.logStatesEvicted(estimator, streamTime, expired.size());
    }

    @Override public void close() {}
}
