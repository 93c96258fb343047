package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregation buffer of one model group: the latest output of every filter, per step.
 *
 * Only the most recent {@code retainedSteps} steps are kept, so filters running a few steps
 * apart still meet at the same step while the buffer stays bounded.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MultipleModelAccumulator {

    private String modelGroup;

    private long lastStateIndex;

    private Map<Long, Map<String, KalmanOutput>> steps = new TreeMap<>();

    public MultipleModelAccumulator add(KalmanOutput output, int retainedSteps) {
        this.modelGroup = output.getModelGroup();
        this.lastStateIndex = output.getStateIndex();
        steps.computeIfAbsent(output.getStateIndex(), k -> new TreeMap<>()).put(output.getStateKey(), output);

        TreeMap<Long, Map<String, KalmanOutput>> ordered = new TreeMap<>(steps);
        while (ordered.size() > retainedSteps) {
            ordered.pollFirstEntry();
        }
        this.steps = ordered;
        return this;
    }

    /**
     * Outputs of the step touched by the last {@link #add}.
     */
    public Map<String, KalmanOutput> lastStepMembers() {
        return steps.getOrDefault(lastStateIndex, Map.of());
    }

    public static JsonSerde<MultipleModelAccumulator> serde() {
        return new JsonSerde<>(MultipleModelAccumulator.class);
    }
}
