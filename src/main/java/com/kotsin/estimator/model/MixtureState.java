package com.kotsin.estimator.model;

import com.kotsin.estimator.stats.Distribution;
import com.kotsin.estimator.stats.MixtureModel;

/**
 * Online EM state: the running sufficient-statistic summary and the model derived from it.
 *
 * @param summaryModel unnormalized mixture accumulating decayed sufficient statistics
 * @param mixtureModel normalized model read off the summary by the M-step
 */
public record MixtureState<S, D extends Distribution<S, D>>(
        long stateIndex,
        MixtureModel<S, D> summaryModel,
        MixtureModel<S, D> mixtureModel) implements IndexedState {
}
