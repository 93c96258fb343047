package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.kafka.support.serializer.JsonSerde;

/**
 * A step that was rejected. The key's state is left exactly as it was before the step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EstimationFailure {

    private String estimator;

    private String stateKey;

    /**
     * Index of the retained state, null when the key had no state yet.
     */
    private Long stateIndex;

    private FailureType failureType;

    private String message;

    private long recordTimestamp;

    public static JsonSerde<EstimationFailure> serde() {
        return new JsonSerde<>(EstimationFailure.class);
    }
}
