package com.jasmin.trafficshield.profiler;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "profiler")
public class TrafficProfilerProperties {

    /** Length of the live window in seconds; older events are evicted. */
    @Min(1) private int windowSizeSeconds = 60;

    /** Snapshots kept in memory (oldest dropped first). */
    @Min(1) private int historyCapacity = 1000;

    /** Previous snapshots used for the burst coefficient of variation. */
    @Min(2) private int burstSamples = 10;

    /** Minimum event-time gap between two snapshots, in milliseconds. */
    @Min(1) private long snapshotIntervalMillis = 1000;

    /** Every n-th snapshot is written to the metrics store. */
    @Min(1) private int persistEvery = 5;
}
