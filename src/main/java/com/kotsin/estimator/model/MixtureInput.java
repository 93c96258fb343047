package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A mini-batch of samples for the online mixture estimator. The whole batch is one EM step.
 *
 * @param <S> sample type of the configured distribution family
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MixtureInput<S> implements KeyedInput {

    private String stateKey;

    private List<S> samples;

    /**
     * Overrides the configured step size policy for this step when present.
     */
    private Double stepSize;

    private Long eventTime;

    @Override
    public boolean hasObservation() {
        return samples != null && !samples.isEmpty();
    }
}
