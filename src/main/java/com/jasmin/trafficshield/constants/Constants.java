package com.jasmin.trafficshield.constants;

public class Constants {
    public static final String ENTROPY_DETECTOR = "entropy";
    public static final String BURST_DETECTOR = "burst";
    public static final String OUTLIER_DETECTOR = "outlier";

    public static final String REASON_ANOMALY_SCORE = "Anomaly score: %.2f";
    public static final String REASON_LOW_TRUST_SUFFIX = " (low-trust)";

    public static final String STRATEGY_BRUTE_FORCE = "brute-force";
    public static final String STRATEGY_SLIDING_WINDOW = "sliding-window";

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";

    private Constants() {
    }
}
