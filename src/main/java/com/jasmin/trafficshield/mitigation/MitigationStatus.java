package com.jasmin.trafficshield.mitigation;

import com.jasmin.trafficshield.models.ActionLogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Diagnostic view of the mitigation state. */
@Value
@Builder
public class MitigationStatus {
    long activeMitigations;
    int trackedSources;
    int rateLimitedSources;
    int challengedSources;
    int blockedSources;
    List<ActionLogEntry> recentActions;

    int cacheSize;
    int cacheCapacity;
    double cacheUtilization;
    long cacheEvictions;

    int graphNodes;
    double averageConnections;
    List<NodeSummary> topWeightedNodes;

    int queueSize;
    List<ThreatSummary> topThreats;

    long globalRequests;
    int sourceWindowRequests;
    boolean generationSessionActive;

    @Value
    public static class NodeSummary {
        String sourceId;
        double weight;
        double threatScore;
        int connections;
    }

    @Value
    public static class ThreatSummary {
        String sourceId;
        double threatScore;
        Instant timestamp;
    }
}
