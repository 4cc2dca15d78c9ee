package com.jasmin.trafficshield.structures;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Max-priority queue of threat observations.
 * <p>
 * Several entries for the same source may coexist; readers treat the queue as advisory. Stale
 * entries are dropped by a rebuild that runs on a sampled fraction of pushes, or when the queue
 * grows past {@code maxSize}. A rebuild that still leaves the queue oversized keeps only the
 * {@code maxSize / 2} highest entries.
 */
public class ThreatQueue {

    private final PriorityQueue<ThreatQueueEntry> heap = new PriorityQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Random random;
    private final double pruneProbability;
    private final int maxSize;
    private final Duration maxAge;

    public ThreatQueue(double pruneProbability, int maxSize, Duration maxAge, Random random) {
        this.pruneProbability = pruneProbability;
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.random = random;
    }

    public void push(String sourceId, double threatScore, Instant at) {
        lock.lock();
        try {
            heap.add(ThreatQueueEntry.of(sourceId, threatScore, at));
            if (heap.size() > maxSize || random.nextDouble() < pruneProbability) {
                pruneLocked(at);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<ThreatQueueEntry> peek() {
        lock.lock();
        try {
            return Optional.ofNullable(heap.peek());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Highest-threat entries, at most one per source, without removing anything.
     */
    public List<ThreatQueueEntry> top(int k) {
        lock.lock();
        try {
            PriorityQueue<ThreatQueueEntry> copy = new PriorityQueue<>(heap);
            Set<String> seen = new LinkedHashSet<>();
            List<ThreatQueueEntry> out = new ArrayList<>();
            while (!copy.isEmpty() && out.size() < k) {
                ThreatQueueEntry e = copy.poll();
                if (seen.add(e.getSourceId())) {
                    out.add(e);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuilds the heap keeping only entries younger than the configured age.
     *
     * @return number of entries dropped
     */
    public int prune(Instant now) {
        lock.lock();
        try {
            return pruneLocked(now);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            heap.clear();
        } finally {
            lock.unlock();
        }
    }

    private int pruneLocked(Instant now) {
        Instant cutoff = now.minus(maxAge);
        int before = heap.size();
        heap.removeIf(e -> e.getTimestamp().isBefore(cutoff));
        if (heap.size() > maxSize) {
            int keep = Math.max(1, maxSize / 2);
            List<ThreatQueueEntry> highest = new ArrayList<>(keep);
            while (highest.size() < keep) {
                highest.add(heap.poll());
            }
            heap.clear();
            heap.addAll(highest);
        }
        return before - heap.size();
    }
}
