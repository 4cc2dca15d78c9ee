package com.jasmin.trafficshield.benchmark;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.models.RequestEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Compares every event with every other event: quadratic, but exact.
 */
@Component
public class BruteForceStrategy implements DetectionStrategy {

    @Override
    public String name() {
        return Constants.STRATEGY_BRUTE_FORCE;
    }

    @Override
    public Set<String> detect(List<RequestEvent> events, Duration window, int threshold) {
        long t = window.toMillis();
        Map<String, Integer> peak = new HashMap<>();
        for (RequestEvent a : events) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("brute-force detection interrupted");
            }
            long start = a.getTimestamp().toEpochMilli();
            int count = 0;
            for (RequestEvent b : events) {
                long d = b.getTimestamp().toEpochMilli() - start;
                if (a.getSourceId().equals(b.getSourceId()) && d >= 0 && d <= t) {
                    count++;
                }
            }
            peak.merge(a.getSourceId(), count, Math::max);
        }
        return peak.entrySet().stream()
                .filter(e -> e.getValue() > threshold)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }
}
