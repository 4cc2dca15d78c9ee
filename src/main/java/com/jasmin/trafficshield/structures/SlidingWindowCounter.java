package com.jasmin.trafficshield.structures;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Fixed-horizon event counter built from one-second buckets arranged in a ring.
 * <p>
 * Memory is bounded by the horizon, not by the event rate: a bucket is reused once its
 * second falls out of the horizon. Counts are therefore exact to one-second resolution.
 */
public class SlidingWindowCounter {

    private final int horizonSeconds;
    private final long[] bucketSecond;
    private final long[] bucketCount;
    private long totalIncrements;

    public SlidingWindowCounter(Duration horizon) {
        long seconds = horizon.getSeconds();
        if (seconds < 1) {
            throw new IllegalArgumentException("Horizon must be at least one second: " + horizon);
        }
        this.horizonSeconds = (int) seconds;
        this.bucketSecond = new long[horizonSeconds];
        this.bucketCount = new long[horizonSeconds];
        Arrays.fill(bucketSecond, Long.MIN_VALUE);
    }

    public synchronized void increment(Instant ts) {
        long second = ts.getEpochSecond();
        int idx = index(second);
        if (bucketSecond[idx] > second) {
            // a newer second already owns this slot, so the event is past the horizon
            return;
        }
        if (bucketSecond[idx] != second) {
            bucketSecond[idx] = second;
            bucketCount[idx] = 0;
        }
        bucketCount[idx]++;
        totalIncrements++;
    }

    /** Events counted in the horizon ending at {@code now} (inclusive of the current second). */
    public synchronized long count(Instant now) {
        long nowSecond = now.getEpochSecond();
        long oldest = nowSecond - horizonSeconds;
        long sum = 0L;
        for (int i = 0; i < horizonSeconds; i++) {
            long s = bucketSecond[i];
            if (s > oldest && s <= nowSecond) {
                sum += bucketCount[i];
            }
        }
        return sum;
    }

    /** Events per second averaged over the full horizon. */
    public double rate(Instant now) {
        return (double) count(now) / horizonSeconds;
    }

    public synchronized long getTotalIncrements() {
        return totalIncrements;
    }

    public synchronized void clear() {
        Arrays.fill(bucketSecond, Long.MIN_VALUE);
        Arrays.fill(bucketCount, 0L);
        totalIncrements = 0L;
    }

    private int index(long second) {
        return (int) Math.floorMod(second, (long) horizonSeconds);
    }
}
