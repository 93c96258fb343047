package com.kotsin.estimator.processor;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.estimator.config.EstimatorConfig;
import com.kotsin.estimator.config.EstimatorConfig.KalmanConfig;
import com.kotsin.estimator.config.EstimatorConfig.MultipleModelConfig;
import com.kotsin.estimator.config.KafkaTopics;
import com.kotsin.estimator.config.ProcessingConstants;
import com.kotsin.estimator.filter.MultipleModelAggregator;
import com.kotsin.estimator.filter.StateTransition;
import com.kotsin.estimator.logging.PipelineTraceLogger;
import com.kotsin.estimator.metrics.StreamMetrics;
import com.kotsin.estimator.mixture.OnlineMixtureUpdate;
import com.kotsin.estimator.model.EstimationFailure;
import com.kotsin.estimator.model.IndexedState;
import com.kotsin.estimator.model.KalmanInput;
import com.kotsin.estimator.model.KalmanOutput;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.model.KeyedInput;
import com.kotsin.estimator.model.LmsState;
import com.kotsin.estimator.model.MixtureInput;
import com.kotsin.estimator.model.MixtureOutput;
import com.kotsin.estimator.model.MixtureState;
import com.kotsin.estimator.model.MultipleModelAccumulator;
import com.kotsin.estimator.model.MultipleModelEstimate;
import com.kotsin.estimator.model.RegressionInput;
import com.kotsin.estimator.model.RegressionOutput;
import com.kotsin.estimator.model.RlsState;
import com.kotsin.estimator.service.EstimatorFactory;
import com.kotsin.estimator.stats.Distribution;
import com.kotsin.estimator.stats.DistributionFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.utils.Bytes;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.kstream.Consumed;
import org.apache.kafka.streams.kstream.Grouped;
import org.apache.kafka.streams.kstream.KGroupedStream;
import org.apache.kafka.streams.kstream.KStream;
import org.apache.kafka.streams.kstream.Materialized;
import org.apache.kafka.streams.kstream.Produced;
import org.apache.kafka.streams.kstream.TimeWindows;
import org.apache.kafka.streams.state.KeyValueStore;
import org.apache.kafka.streams.state.Stores;
import org.apache.kafka.streams.state.WindowStore;
import org.springframework.kafka.support.JacksonUtils;
import org.springframework.kafka.support.serializer.JsonSerde;
import org.springframework.stereotype.Component;

/**
 * One topology per estimator:
 *
 * input topic → {@link StateTransitionTransformer} (keyed state store) → output topic
 *                                                                      → failure topic
 *
 * Kalman outputs with a model group additionally feed the multiple model aggregation:
 * grouped by model group (and event-time window when configured), combined per step.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EstimationTopology {

    private final EstimatorConfig config;
    private final EstimatorFactory factory;
    private final StreamMetrics metrics;
    private final PipelineTraceLogger traceLogger;
    private final ObjectMapper objectMapper = JacksonUtils.enhancedObjectMapper();

    public StreamsBuilder createLinearKalmanTopology() {
        KalmanConfig kalman = config.getKalman();
        return kalmanTopology(ProcessingConstants.LINEAR_KALMAN, kalman, factory.linearKalman(kalman));
    }

    public StreamsBuilder createExtendedKalmanTopology() {
        KalmanConfig kalman = config.getExtendedKalman();
        return kalmanTopology(ProcessingConstants.EXTENDED_KALMAN, kalman, factory.extendedKalman(kalman));
    }

    public StreamsBuilder createRecursiveLeastSquaresTopology() {
        StreamsBuilder builder = new StreamsBuilder();
        addEstimator(builder, ProcessingConstants.RECURSIVE_LEAST_SQUARES,
                config.getRls().getInputTopic(), config.getRls().getOutputTopic(),
                RegressionInput.serde(), RlsState.serde(), RegressionOutput.serde(),
                factory.recursiveLeastSquares(config.getRls()));
        return builder;
    }

    public StreamsBuilder createLeastMeanSquaresTopology() {
        StreamsBuilder builder = new StreamsBuilder();
        addEstimator(builder, ProcessingConstants.LEAST_MEAN_SQUARES,
                config.getLms().getInputTopic(), config.getLms().getOutputTopic(),
                RegressionInput.serde(), LmsState.serde(), RegressionOutput.serde(),
                factory.leastMeanSquares(config.getLms()));
        return builder;
    }

    public StreamsBuilder createOnlineMixtureTopology() {
        DistributionFamily family = DistributionFamily.fromLabel(config.getMixture().getFamily());
        StreamsBuilder builder = new StreamsBuilder();
        addMixtureEstimator(builder, family, factory.onlineMixture(config.getMixture()));
        return builder;
    }

    private StreamsBuilder kalmanTopology(String estimator, KalmanConfig kalman,
                                          StateTransition<KalmanInput, KalmanState, KalmanOutput> transition) {
        log.info("Building {} topology {} → {}", estimator, kalman.getInputTopic(), kalman.getOutputTopic());
        StreamsBuilder builder = new StreamsBuilder();
        KStream<String, KalmanOutput> outputs = addEstimator(builder, estimator,
                kalman.getInputTopic(), kalman.getOutputTopic(),
                KalmanInput.serde(), KalmanState.serde(), KalmanOutput.serde(), transition);
        if (kalman.getMultipleModel().isEnabled()) {
            addMultipleModelAggregation(outputs, estimator, kalman.getMultipleModel());
        }
        return builder;
    }

    /**
     * Wires one estimator into {@code builder} and returns its stream of successful outputs.
     */
    <I extends KeyedInput, S extends IndexedState, O> KStream<String, O> addEstimator(
            StreamsBuilder builder, String estimator, String inputTopic, String outputTopic,
            Serde<I> inputSerde, Serde<S> stateSerde, Serde<O> outputSerde, StateTransition<I, S, O> transition) {

        String storeName = KafkaTopics.stateStore(estimator);
        builder.addStateStore(
            Stores.timestampedKeyValueStoreBuilder(
                Stores.persistentTimestampedKeyValueStore(storeName),
                Serdes.String(),
                stateSerde
            )
        );

        KStream<String, StepOutcome<O>> outcomes = builder
            .stream(inputTopic, Consumed.with(Serdes.String(), inputSerde)
                .withTimestampExtractor(new EventTimeExtractor()))
            .transform(
                () -> new StateTransitionTransformer<>(estimator, storeName, transition,
                        config.getFailurePolicy(), config.getStateTimeout(), config.getEvictionInterval(),
                        metrics, traceLogger),
                storeName
            );

        outcomes
            .filter((key, outcome) -> !outcome.isSuccess())
            .mapValues(StepOutcome::failure)
            .to(config.getFailureTopic(), Produced.with(Serdes.String(), EstimationFailure.serde()));

        KStream<String, O> outputs = outcomes
            .filter((key, outcome) -> outcome.isSuccess())
            .mapValues(StepOutcome::output);
        outputs.to(outputTopic, Produced.with(Serdes.String(), outputSerde));
        return outputs;
    }

    private <S, D extends Distribution<S, D>> void addMixtureEstimator(
            StreamsBuilder builder, DistributionFamily family, OnlineMixtureUpdate<S, D> transition) {
        JavaType inputType = objectMapper.getTypeFactory()
                .constructParametricType(MixtureInput.class, family.getSampleType());
        JavaType stateType = objectMapper.getTypeFactory()
                .constructParametricType(MixtureState.class, family.getSampleType(), family.getDistributionType());
        Serde<MixtureInput<S>> inputSerde = new JsonSerde<MixtureInput<S>>(inputType, objectMapper).ignoreTypeHeaders();
        Serde<MixtureState<S, D>> stateSerde = new JsonSerde<MixtureState<S, D>>(stateType, objectMapper).ignoreTypeHeaders();

        log.info("Building {} topology for {} mixtures", ProcessingConstants.ONLINE_MIXTURE, family.getLabel());
        addEstimator(builder, ProcessingConstants.ONLINE_MIXTURE,
                config.getMixture().getInputTopic(), config.getMixture().getOutputTopic(),
                inputSerde, stateSerde, new JsonSerde<>(MixtureOutput.class, objectMapper), transition);
    }

    private void addMultipleModelAggregation(KStream<String, KalmanOutput> outputs, String estimator,
                                             MultipleModelConfig multipleModel) {
        log.info("  [{}] multiple model aggregation → {} (window={})",
                estimator, multipleModel.getOutputTopic(), multipleModel.getWindowDuration());

        KGroupedStream<String, KalmanOutput> byGroup = outputs
            .filter((key, output) -> output.getModelGroup() != null && output.getSlidingLoglikelihood() != null)
            .selectKey((key, output) -> output.getModelGroup())
            .groupByKey(Grouped.with(Serdes.String(), KalmanOutput.serde()));

        KStream<String, MultipleModelEstimate> estimates;
        if (multipleModel.getWindowDuration() == null) {
            estimates = byGroup
                .aggregate(
                    MultipleModelAccumulator::new,
                    (group, output, acc) -> acc.add(output, ProcessingConstants.MULTIPLE_MODEL_RETAINED_STEPS),
                    Materialized.<String, MultipleModelAccumulator, KeyValueStore<Bytes, byte[]>>as(
                            KafkaTopics.STORE_MULTIPLE_MODEL + "-" + estimator)
                        .withKeySerde(Serdes.String())
                        .withValueSerde(MultipleModelAccumulator.serde()))
                .toStream()
                .filter((group, acc) -> acc != null && !acc.lastStepMembers().isEmpty())
                .mapValues(this::combine);
        } else {
            TimeWindows windows = TimeWindows.ofSizeAndGrace(
                multipleModel.getWindowDuration(), ProcessingConstants.MULTIPLE_MODEL_GRACE_PERIOD);
            estimates = byGroup
                .windowedBy(windows)
                .aggregate(
                    MultipleModelAccumulator::new,
                    (group, output, acc) -> acc.add(output, ProcessingConstants.MULTIPLE_MODEL_RETAINED_STEPS),
                    Materialized.<String, MultipleModelAccumulator, WindowStore<Bytes, byte[]>>as(
                            KafkaTopics.STORE_MULTIPLE_MODEL + "-" + estimator)
                        .withKeySerde(Serdes.String())
                        .withValueSerde(MultipleModelAccumulator.serde()))
                .toStream()
                .filter((windowed, acc) -> acc != null && !acc.lastStepMembers().isEmpty())
                .map((windowed, acc) -> {
                    MultipleModelEstimate estimate = combine(acc);
                    estimate.setWindowStart(windowed.window().start());
                    estimate.setWindowEnd(windowed.window().end());
                    return KeyValue.pair(windowed.key(), estimate);
                });
        }
        estimates.to(multipleModel.getOutputTopic(), Produced.with(Serdes.String(), MultipleModelEstimate.serde()));
    }

    private MultipleModelEstimate combine(MultipleModelAccumulator acc) {
        MultipleModelEstimate estimate = MultipleModelAggregator.aggregate(
                acc.getModelGroup(), acc.getLastStateIndex(), acc.lastStepMembers());
        metrics.incMultipleModelEmit();
        traceLogger.logMultipleModelEstimate(estimate.getModelGroup(), estimate.getStateIndex(),
                estimate.getModelCount(), String.valueOf(estimate.getModelWeights()));
        return estimate;
    }
}
