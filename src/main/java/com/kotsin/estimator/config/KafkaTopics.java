package com.kotsin.estimator.config;

/**
 * KafkaTopics - default topic and state store names.
 */
public final class KafkaTopics {

    private KafkaTopics() {} // Prevent instantiation

    // ========== Kalman ==========
    public static final String KALMAN_INPUT = "kalman-input";
    public static final String KALMAN_OUTPUT = "kalman-output";
    public static final String EXTENDED_KALMAN_INPUT = "extended-kalman-input";
    public static final String EXTENDED_KALMAN_OUTPUT = "extended-kalman-output";
    public static final String KALMAN_MULTIPLE_MODEL = "kalman-multiple-model";

    // ========== Regression ==========
    public static final String RLS_INPUT = "rls-input";
    public static final String RLS_OUTPUT = "rls-output";
    public static final String LMS_INPUT = "lms-input";
    public static final String LMS_OUTPUT = "lms-output";

    // ========== Mixture ==========
    public static final String MIXTURE_INPUT = "mixture-input";
    public static final String MIXTURE_OUTPUT = "mixture-output";

    // ========== Failures ==========
    public static final String ESTIMATION_FAILURES = "estimation-failures";

    // ========== State Stores ==========
    public static final String STORE_SUFFIX = "-state-store";
    public static final String STORE_MULTIPLE_MODEL = "kalman-multiple-model-store";

    public static String stateStore(String estimatorName) {
        return estimatorName + STORE_SUFFIX;
    }
}
