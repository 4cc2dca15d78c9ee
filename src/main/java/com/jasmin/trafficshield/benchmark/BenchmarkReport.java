package com.jasmin.trafficshield.benchmark;

import lombok.Value;

import java.util.List;

@Value
public class BenchmarkReport {
    int events;
    int windowSeconds;
    int threshold;
    List<StrategyResult> results;
}
