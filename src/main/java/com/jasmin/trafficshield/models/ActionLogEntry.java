package com.jasmin.trafficshield.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ActionLogEntry {
    Instant timestamp;
    String sourceId;
    MitigationAction action;
    double score;
    double threatLevel;
}
