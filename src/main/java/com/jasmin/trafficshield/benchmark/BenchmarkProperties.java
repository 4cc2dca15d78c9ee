package com.jasmin.trafficshield.benchmark;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkProperties {

    /** Wall-clock budget per strategy; slower strategies are reported as skipped. */
    private Duration timeout = Duration.ofSeconds(10);
}
