package com.jasmin.trafficshield.structures;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Exact per-key event counter over a fixed horizon.
 * <p>
 * Occurrences are kept in arrival order; each read or write first drops occurrences older than
 * {@code newest - horizon}, and keys whose count reaches zero are removed, so the sum of the
 * per-key counts always equals the number of retained occurrences.
 */
public class KeyedSlidingWindowCounter {

    private final long horizonMillis;
    private final Deque<Occurrence> occurrences = new ArrayDeque<>();
    private final Map<String, Integer> counts = new HashMap<>();
    private long newestMillis = Long.MIN_VALUE;

    public KeyedSlidingWindowCounter(Duration horizon) {
        if (horizon.isZero() || horizon.isNegative()) {
            throw new IllegalArgumentException("Horizon must be positive: " + horizon);
        }
        this.horizonMillis = horizon.toMillis();
    }

    /**
     * Records one occurrence of {@code key}.
     *
     * @return false when the occurrence is already older than the horizon of the newest one seen
     */
    public synchronized boolean increment(String key, Instant ts) {
        long at = ts.toEpochMilli();
        if (newestMillis != Long.MIN_VALUE && at < newestMillis - horizonMillis) {
            return false;
        }
        newestMillis = Math.max(newestMillis, at);
        occurrences.addLast(new Occurrence(key, at));
        counts.merge(key, 1, Integer::sum);
        evict(newestMillis);
        return true;
    }

    public synchronized int count(String key, Instant now) {
        evict(now.toEpochMilli());
        return counts.getOrDefault(key, 0);
    }

    /** Occurrences of {@code key} per second averaged over the full horizon. */
    public double rate(String key, Instant now) {
        return count(key, now) / (horizonMillis / 1000.0);
    }

    /** Number of keys with at least one occurrence inside the horizon. */
    public synchronized int activeKeys(Instant now) {
        evict(now.toEpochMilli());
        return counts.size();
    }

    public synchronized int total(Instant now) {
        evict(now.toEpochMilli());
        return occurrences.size();
    }

    /** Copy of the per-key counts as of the last eviction. */
    public synchronized Map<String, Integer> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(counts));
    }

    public synchronized int size() {
        return occurrences.size();
    }

    public synchronized void clear() {
        occurrences.clear();
        counts.clear();
        newestMillis = Long.MIN_VALUE;
    }

    private void evict(long nowMillis) {
        long cutoff = nowMillis - horizonMillis;
        while (!occurrences.isEmpty() && occurrences.peekFirst().at < cutoff) {
            Occurrence old = occurrences.pollFirst();
            Integer left = counts.computeIfPresent(old.key, (k, c) -> c - 1);
            if (left != null && left <= 0) {
                counts.remove(old.key);
            }
        }
    }

    private static final class Occurrence {
        private final String key;
        private final long at;

        private Occurrence(String key, long at) {
            this.key = key;
            this.at = at;
        }
    }
}
