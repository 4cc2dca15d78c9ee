package com.jasmin.trafficshield.profiler;

import com.jasmin.trafficshield.models.WindowMetrics;
import com.jasmin.trafficshield.services.StoreWriter;
import com.jasmin.trafficshield.structures.KeyedSlidingWindowCounter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Keeps a live window of request events and turns it into {@link WindowMetrics} snapshots.
 * <p>
 * Time is driven by event timestamps: the first event arms the snapshot timer and a snapshot is
 * emitted by the first event that arrives at least {@code snapshotIntervalMillis} after the
 * previous snapshot. Events older than {@code newest - windowSize} are ignored.
 */
@Slf4j
@Service
public class TrafficProfiler {

    private final TrafficProfilerProperties props;
    private final StoreWriter storeWriter;
    private final Clock clock;

    private final KeyedSlidingWindowCounter window;
    private final Deque<WindowMetrics> history = new ArrayDeque<>();
    private long lastSnapshotMillis = Long.MIN_VALUE;
    private long snapshotsEmitted;

    public TrafficProfiler(TrafficProfilerProperties props, StoreWriter storeWriter, Clock clock) {
        this.props = props;
        this.storeWriter = storeWriter;
        this.clock = clock;
        this.window = new KeyedSlidingWindowCounter(Duration.ofSeconds(props.getWindowSizeSeconds()));
    }

    /**
     * Adds one event to the window.
     *
     * @return the snapshot taken because of this event, if one was due
     */
    public synchronized Optional<WindowMetrics> processEvent(String sourceId, String path, String method, Instant timestamp) {
        if (!window.increment(sourceId, timestamp)) {
            log.debug("Dropped stale event from {} at {}", sourceId, timestamp);
            return Optional.empty();
        }

        long at = timestamp.toEpochMilli();
        if (lastSnapshotMillis == Long.MIN_VALUE) {
            lastSnapshotMillis = at;
            return Optional.empty();
        }
        if (at - lastSnapshotMillis < props.getSnapshotIntervalMillis()) {
            return Optional.empty();
        }
        lastSnapshotMillis = at;

        WindowMetrics metrics = snapshot(timestamp);
        history.addLast(metrics);
        while (history.size() > props.getHistoryCapacity()) {
            history.pollFirst();
        }
        snapshotsEmitted++;
        if (snapshotsEmitted % props.getPersistEvery() == 0) {
            storeWriter.appendMetrics(metrics);
        }
        log.debug("Snapshot at {}: rps={} sources={} entropy={} burst={}", metrics.getTimestamp(),
                metrics.getRequestsPerSecond(), metrics.getUniqueSources(), metrics.getEntropy(), metrics.getBurstScore());
        return Optional.of(metrics);
    }

    public synchronized WindowMetrics getCurrentMetrics() {
        WindowMetrics last = history.peekLast();
        return last != null ? last : WindowMetrics.empty(clock.instant());
    }

    /**
     * Snapshots newer than {@code now - duration}. Each call to {@code iterator()} walks a fresh
     * copy of the history taken at that moment.
     */
    public Iterable<WindowMetrics> getHistory(Duration duration) {
        Instant cutoff = clock.instant().minus(duration);
        return () -> {
            List<WindowMetrics> copy;
            synchronized (this) {
                copy = new ArrayList<>(history);
            }
            Iterator<WindowMetrics> it = copy.iterator();
            return new Iterator<>() {
                private WindowMetrics next = advance();

                private WindowMetrics advance() {
                    while (it.hasNext()) {
                        WindowMetrics m = it.next();
                        if (m.getTimestamp().isAfter(cutoff)) {
                            return m;
                        }
                    }
                    return null;
                }

                @Override
                public boolean hasNext() {
                    return next != null;
                }

                @Override
                public WindowMetrics next() {
                    if (next == null) {
                        throw new NoSuchElementException();
                    }
                    WindowMetrics out = next;
                    next = advance();
                    return out;
                }
            };
        };
    }

    /** Events currently inside the window. */
    public synchronized int windowLength() {
        return window.size();
    }

    public synchronized Map<String, Integer> sourceCounts() {
        return window.snapshot();
    }

    public synchronized void reset() {
        window.clear();
        history.clear();
        lastSnapshotMillis = Long.MIN_VALUE;
        snapshotsEmitted = 0;
        log.info("Traffic profiler reset");
    }

    private WindowMetrics snapshot(Instant at) {
        Map<String, Integer> counts = window.snapshot();
        int total = window.size();
        return WindowMetrics.builder()
                .timestamp(at)
                .requestsPerSecond((double) total / props.getWindowSizeSeconds())
                .uniqueSources(counts.size())
                .entropy(entropy(counts, total))
                .burstScore(burst())
                .totalRequests(total)
                .build();
    }

    /** Shannon entropy in nats of the per-source shares. */
    static double entropy(Map<String, Integer> counts, int total) {
        if (total <= 0 || counts.size() <= 1) {
            return 0.0;
        }
        double h = 0.0;
        for (int c : counts.values()) {
            if (c > 0) {
                double p = (double) c / total;
                h -= p * Math.log(p);
            }
        }
        return h;
    }

    // coefficient of variation of rps over the previous snapshots
    private double burst() {
        int n = 0;
        double sum = 0.0;
        double sumSq = 0.0;
        Iterator<WindowMetrics> it = history.descendingIterator();
        while (it.hasNext() && n < props.getBurstSamples()) {
            double rps = it.next().getRequestsPerSecond();
            sum += rps;
            sumSq += rps * rps;
            n++;
        }
        if (n < 2) {
            return 0.0;
        }
        double mean = sum / n;
        if (mean <= 0.0) {
            return 0.0;
        }
        double variance = Math.max(0.0, sumSq / n - mean * mean);
        return Math.sqrt(variance) / mean;
    }
}
