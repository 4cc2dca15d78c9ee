package com.jasmin.trafficshield.engine;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.anomaly")
public class AnomalyDetectorProperties {

    /** Anomaly records kept in memory. */
    @Min(1) private int historyCapacity = 1000;

    /** Records scoring at least this are written to the metrics store. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double persistMinScore = 0.3;
}
