package com.kotsin.estimator.config;

import java.time.Duration;

/**
 * Central constants for estimation processing
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== ESTIMATOR NAMES ==========

    public static final String LINEAR_KALMAN = "linear-kalman";
    public static final String EXTENDED_KALMAN = "extended-kalman";
    public static final String RECURSIVE_LEAST_SQUARES = "recursive-least-squares";
    public static final String LEAST_MEAN_SQUARES = "least-mean-squares";
    public static final String ONLINE_MIXTURE = "online-mixture";

    // ========== STATE LIFECYCLE ==========

    public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofMinutes(1);

    // ========== MULTIPLE MODEL ==========

    public static final Duration MULTIPLE_MODEL_GRACE_PERIOD = Duration.ofSeconds(10);
    public static final int MULTIPLE_MODEL_RETAINED_STEPS = 16;

    // ========== NUMERICS ==========

    public static final double DEFAULT_FADING_FACTOR = 1.0;
    public static final double DEFAULT_FORGETTING_FACTOR = 1.0;
    public static final double DEFAULT_LMS_LEARNING_RATE = 1.0;
    public static final double DEFAULT_LMS_REGULARIZATION = 1.0;
    public static final double DEFAULT_MIXTURE_STEP_SIZE = 0.1;

    // ========== SHUTDOWN ==========

    public static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
}
