package com.jasmin.trafficshield.benchmark;

import com.jasmin.trafficshield.models.RequestEvent;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/** Offline detector of flooding sources over a recorded batch of events. */
public interface DetectionStrategy {

    String name();

    /**
     * @return sources sending more than {@code threshold} requests within {@code window}
     */
    Set<String> detect(List<RequestEvent> events, Duration window, int threshold);
}
