package com.jasmin.trafficshield.structures;

import lombok.Value;

import java.time.Instant;

/**
 * Heap element keyed on the negated threat score, so the natural order yields the highest
 * threat first.
 */
@Value
public class ThreatQueueEntry implements Comparable<ThreatQueueEntry> {
    double negThreatScore;
    Instant timestamp;
    String sourceId;

    public static ThreatQueueEntry of(String sourceId, double threatScore, Instant timestamp) {
        return new ThreatQueueEntry(-threatScore, timestamp, sourceId);
    }

    public double threatScore() {
        return -negThreatScore;
    }

    @Override
    public int compareTo(ThreatQueueEntry o) {
        int c = Double.compare(negThreatScore, o.negThreatScore);
        if (c != 0) {
            return c;
        }
        // newer first among equal scores
        return o.timestamp.compareTo(timestamp);
    }
}
