package com.kotsin.estimator.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded FIFO of recent log-likelihoods, oldest first. Every push returns a new list.
 */
public final class SlidingLikelihood {

    private SlidingLikelihood() {}

    public static List<Double> push(List<Double> window, double loglikelihood, int capacity) {
        if (capacity <= 0) {
            return List.of();
        }
        List<Double> next = new ArrayList<>(capacity);
        if (window != null) {
            int skip = Math.max(0, window.size() + 1 - capacity);
            next.addAll(window.subList(skip, window.size()));
        }
        next.add(loglikelihood);
        return Collections.unmodifiableList(next);
    }

    public static double sum(List<Double> window) {
        double total = 0.0;
        for (double value : window) {
            total += value;
        }
        return total;
    }
}
