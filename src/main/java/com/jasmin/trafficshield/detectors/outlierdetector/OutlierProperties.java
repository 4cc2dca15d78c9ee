package com.jasmin.trafficshield.detectors.outlierdetector;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.outlier")
public class OutlierProperties {

    /** Share of the combined anomaly score. */
    @DecimalMin("0.0") private double weight = 0.3;

    /** Rolling buffer of feature vectors the model is trained on. */
    @Min(2) private int bufferSize = 100;

    /** Samples required before the first fit; below this the sub-score is 0. */
    @Min(2) private int minSamples = 50;

    /** New samples between two refits. */
    @Min(1) private int refitEvery = 50;

    @Min(1) private int trees = 100;

    /** Upper bound on the per-tree sub-sample. */
    @Min(2) private int sampleSize = 256;

    /** Fixed so that fits are reproducible. */
    private long seed = 42L;
}
