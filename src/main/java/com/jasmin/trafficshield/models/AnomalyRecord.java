package com.jasmin.trafficshield.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AnomalyRecord {
    Instant timestamp;
    double anomalyScore;
    double entropyScore;
    double burstScore;
    double outlierScore;

    // observation the score was computed for
    double entropy;
    double burst;
    int uniqueSources;
    int totalRequests;
}
