package com.jasmin.trafficshield.detectors.burstdetector;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.burst")
public class BurstProperties {

    /** Share of the combined anomaly score. */
    @DecimalMin("0.0") private double weight = 0.3;

    /** Coefficient of variation above which the rate is considered bursty. */
    private double threshold = 3.0;

    /** Coefficient of variation at which the sub-score saturates. */
    private double maxBurst = 10.0;
}
