package com.jasmin.trafficshield.store;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "store")
public class StoreProperties {

    /** Backing store: "memory" or "redis". */
    @NotBlank private String type = "memory";

    /** Namespace for every Redis key written by the service. */
    @NotBlank private String keyPrefix = "ts";

    /** Failed writes kept for retry; the oldest is dropped beyond this. */
    @Min(0) private int retryCapacity = 1000;

    /** Approximate cap on each Redis metrics stream. */
    @Min(1) private long metricsStreamMaxLen = 10_000;

    /** Entries kept by the in-memory metrics store per kind. */
    @Min(1) private int memoryCapacity = 1000;
}
