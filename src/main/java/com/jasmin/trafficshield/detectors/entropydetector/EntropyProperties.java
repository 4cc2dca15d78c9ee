package com.jasmin.trafficshield.detectors.entropydetector;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.entropy")
public class EntropyProperties {

    /** Share of the combined anomaly score. */
    @DecimalMin("0.0") private double weight = 0.4;

    /** Below this (nats) traffic is considered concentrated on too few sources. */
    private double lowThreshold = 0.5;

    /** Above this (nats) traffic is considered spread over suspiciously many sources. */
    private double highThreshold = 3.0;

    /** Entropy at which the high-side sub-score saturates. */
    private double maxEntropy = 4.0;
}
