package com.jasmin.trafficshield.benchmark;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StrategyResult {

    public enum Status { COMPLETED, SKIPPED, FAILED }

    String strategy;
    Status status;
    long elapsedMillis;
    List<String> detected;

    // null without labelled attackers
    Double precision;
    Double recall;
    Double f1;

    String error;
}
