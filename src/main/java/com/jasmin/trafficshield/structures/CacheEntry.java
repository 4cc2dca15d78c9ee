package com.jasmin.trafficshield.structures;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CacheEntry {
    String sourceId;
    double lastScore;
    Instant lastSeen;
    double requestRate;
    long totalRequests;
}
