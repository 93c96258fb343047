package com.kotsin.estimator.filter;

/**
 * Optional diagnostics rendered into {@link com.kotsin.estimator.model.KalmanOutput}.
 *
 * @param slidingLikelihoodWindow capacity of the per-key log-likelihood window, 0 disables it
 */
public record KalmanOutputOptions(
        boolean calculateMahalanobis,
        boolean calculateLoglikelihood,
        int slidingLikelihoodWindow,
        boolean outputResiduals,
        boolean outputSystemMatrices) {

    public static KalmanOutputOptions defaults() {
        return new KalmanOutputOptions(false, false, 0, true, false);
    }

    public KalmanOutputOptions withSlidingLikelihoodWindow(int window) {
        return new KalmanOutputOptions(calculateMahalanobis, calculateLoglikelihood, window,
                outputResiduals, outputSystemMatrices);
    }

    /**
     * The residual is kept in state only when some output is derived from it.
     */
    public boolean storeResidual() {
        return calculateMahalanobis || calculateLoglikelihood || outputResiduals;
    }
}
