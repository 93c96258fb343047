package com.kotsin.estimator.filter;

import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanOutput;
import com.kotsin.estimator.model.MultipleModelEstimate;
import com.kotsin.estimator.util.MathUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multiple model adaptive estimation: filters that track the same entity with different
 * parameters are weighted by their sliding likelihood and their posteriors averaged.
 *
 * Weights are {@code exp(ℓᵢ − max ℓ)} normalized, so windows whose likelihoods underflow
 * {@code exp} still produce usable weights.
 */
public final class MultipleModelAggregator {

    private MultipleModelAggregator() {}

    public static double[] modelWeights(double[] slidingLoglikelihoods) {
        return MathUtils.normalizeLogWeights(slidingLoglikelihoods);
    }

    /**
     * Combine the outputs of one model group at one step.
     *
     * @param outputs output per state key; each needs a sliding log-likelihood
     */
    public static MultipleModelEstimate aggregate(String modelGroup, long stateIndex, Map<String, KalmanOutput> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            throw new EstimationException("No filter outputs to aggregate for model group " + modelGroup);
        }
        List<String> keys = new ArrayList<>(outputs.keySet());
        double[] loglikelihoods = new double[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            Double value = outputs.get(keys.get(i)).getSlidingLoglikelihood();
            if (value == null) {
                throw new EstimationException("Output of " + keys.get(i) + " has no sliding log-likelihood");
            }
            loglikelihoods[i] = value;
        }
        double[] weights = modelWeights(loglikelihoods);

        int n = outputs.get(keys.get(0)).getState().length;
        RealVector mean = LinalgUtils.zeros(n);
        RealMatrix covariance = LinalgUtils.zeros(n, n);
        Map<String, Double> modelWeights = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            KalmanOutput output = outputs.get(keys.get(i));
            if (output.getState().length != n) {
                throw new ShapeMismatchException(String.format(
                        "Model %s has state size %d, expected %d", keys.get(i), output.getState().length, n));
            }
            mean = mean.add(LinalgUtils.toVector(output.getState()).mapMultiply(weights[i]));
            covariance = covariance.add(LinalgUtils.toMatrix(output.getStateCovariance()).scalarMultiply(weights[i]));
            modelWeights.put(keys.get(i), weights[i]);
        }

        return MultipleModelEstimate.builder()
                .modelGroup(modelGroup)
                .stateIndex(stateIndex)
                .state(mean.toArray())
                .stateCovariance(covariance.getData())
                .modelWeights(modelWeights)
                .modelCount(keys.size())
                .build();
    }
}
