package com.jasmin.trafficshield.benchmark;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.models.RequestEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single pass over the time-ordered events with a deque holding the current window.
 * A source is flagged when its count inside the window exceeds the threshold, or when more
 * than half the threshold of its requests arrived less than a tenth of the window apart.
 */
@Component
public class SlidingWindowStrategy implements DetectionStrategy {

    @Override
    public String name() {
        return Constants.STRATEGY_SLIDING_WINDOW;
    }

    @Override
    public Set<String> detect(List<RequestEvent> events, Duration window, int threshold) {
        List<RequestEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(RequestEvent::getTimestamp));

        long t = window.toMillis();
        long burstGap = t / 10;
        Deque<RequestEvent> live = new ArrayDeque<>();
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Integer> bursts = new HashMap<>();
        Map<String, Long> lastSeen = new HashMap<>();
        Set<String> flagged = new HashSet<>();

        for (RequestEvent e : ordered) {
            long now = e.getTimestamp().toEpochMilli();
            while (!live.isEmpty() && now - live.peekFirst().getTimestamp().toEpochMilli() > t) {
                counts.merge(live.pollFirst().getSourceId(), -1, Integer::sum);
            }
            live.addLast(e);
            String src = e.getSourceId();
            int count = counts.merge(src, 1, Integer::sum);

            Long previous = lastSeen.put(src, now);
            int burst = bursts.getOrDefault(src, 0);
            if (previous != null && now - previous < burstGap) {
                burst = bursts.merge(src, 1, Integer::sum);
            }

            if (count > threshold || burst > threshold / 2.0) {
                flagged.add(src);
            }
        }
        return flagged;
    }
}
