package com.jasmin.trafficshield.detectors;

import com.jasmin.trafficshield.models.WindowMetrics;

/**
 * One weighted signal of the anomaly score. Implementations return a sub-score in [0,1].
 */
public interface Detector {

    String name();

    double weight();

    double score(WindowMetrics metrics);

    /** Drops any rolling state. */
    default void reset() {
    }

    /** Clamps {@code v} into [0,1]; NaN maps to 0. */
    static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
