package com.kotsin.estimator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kotsin.estimator.stats.MixtureModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MixtureOutput {

    private String stateKey;

    private long stateIndex;

    private MixtureModel<?, ?> mixtureModel;

    /**
     * Mean log-likelihood of the input's samples under the updated model.
     */
    private Double loglikelihood;

    private Long eventTime;
}
