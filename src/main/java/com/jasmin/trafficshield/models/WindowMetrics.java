package com.jasmin.trafficshield.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the profiler window. Immutable once emitted.
 */
@Value
@Builder
public class WindowMetrics {
    Instant timestamp;
    double requestsPerSecond;
    int uniqueSources;
    double entropy;
    double burstScore;
    int totalRequests;

    /** Zero-valued snapshot returned before the first emission. */
    public static WindowMetrics empty(Instant at) {
        return WindowMetrics.builder()
                .timestamp(at)
                .requestsPerSecond(0.0)
                .uniqueSources(0)
                .entropy(0.0)
                .burstScore(0.0)
                .totalRequests(0)
                .build();
    }

    /** Feature vector consumed by the outlier model: rps, unique sources, entropy, burst. */
    public double[] features() {
        return new double[]{requestsPerSecond, uniqueSources, entropy, burstScore};
    }
}
