package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

import java.util.Map;

/**
 * Likelihood-weighted combination of the filters sharing a model group at one step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MultipleModelEstimate {

    private String modelGroup;

    private long stateIndex;

    private Long windowStart;

    private Long windowEnd;

    private double[] state;

    private double[][] stateCovariance;

    /**
     * Normalized weight per contributing state key.
     */
    private Map<String, Double> modelWeights;

    private int modelCount;

    public static JsonSerde<MultipleModelEstimate> serde() {
        return new JsonSerde<>(MultipleModelEstimate.class);
    }
}
