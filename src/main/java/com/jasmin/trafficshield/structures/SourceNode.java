package com.jasmin.trafficshield.structures;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Vertex of the {@link RelationshipGraph}. Mutated only under its own monitor.
 */
public class SourceNode {

    private final String id;
    private final Set<String> connections = new LinkedHashSet<>();
    private double weight;
    private double threatScore;
    private Instant lastSeen;

    SourceNode(String id, Instant firstSeen) {
        this.id = id;
        this.lastSeen = firstSeen;
    }

    synchronized void observe(double score, Instant at, double weightRetention, double threatRetention) {
        weight = weight * weightRetention + score * (1.0 - weightRetention);
        threatScore = threatScore * threatRetention + score * (1.0 - threatRetention);
        if (lastSeen == null || at.isAfter(lastSeen)) {
            lastSeen = at;
        }
    }

    synchronized boolean connect(String other, int maxConnections) {
        if (connections.contains(other)) {
            return false;
        }
        if (connections.size() >= maxConnections) {
            return false;
        }
        return connections.add(other);
    }

    synchronized void disconnect(String other) {
        connections.remove(other);
    }

    public String getId() {
        return id;
    }

    public synchronized double getWeight() {
        return weight;
    }

    public synchronized double getThreatScore() {
        return threatScore;
    }

    public synchronized Instant getLastSeen() {
        return lastSeen;
    }

    public synchronized int getConnectionCount() {
        return connections.size();
    }

    public synchronized Set<String> getConnections() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(connections));
    }
}
