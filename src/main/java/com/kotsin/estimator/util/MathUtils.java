package com.kotsin.estimator.util;

import java.util.Arrays;

/**
 * MathUtils - numerically safe scalar helpers shared by the estimators.
 *
 * USAGE:
 * Instead of: Math.log(Math.exp(a) + Math.exp(b))
 * Use: MathUtils.logSumExp(new double[] {a, b})
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // ======================== NUMBER VALIDATION ========================

    /**
     * Check if a number is valid (not NaN, not Infinite)
     */
    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== LOG-SPACE ARITHMETIC ========================

    /**
     * log(Σ exp(x_i)) shifted by the maximum so large magnitudes neither overflow nor underflow.
     * Returns -Infinity for an empty input or when every term is -Infinity.
     */
    public static double logSumExp(double[] logValues) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : logValues) {
            max = Math.max(max, v);
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0.0;
        for (double v : logValues) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Softmax: exp(x_i) / Σ exp(x_j), invariant to adding a constant to every x_i.
     * Falls back to uniform weights when no term is finite.
     */
    public static double[] normalizeLogWeights(double[] logWeights) {
        double[] out = new double[logWeights.length];
        double norm = logSumExp(logWeights);
        if (!isValidNumber(norm)) {
            Arrays.fill(out, 1.0 / logWeights.length);
            return out;
        }
        for (int i = 0; i < logWeights.length; i++) {
            out[i] = Math.exp(logWeights[i] - norm);
        }
        return out;
    }

    /**
     * Scale non-negative weights so they sum to one.
     */
    public static double[] normalize(double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        double[] out = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            out[i] = sum > 0 ? weights[i] / sum : 1.0 / weights.length;
        }
        return out;
    }

    public static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
