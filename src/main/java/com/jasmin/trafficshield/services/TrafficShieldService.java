package com.jasmin.trafficshield.services;

import com.jasmin.trafficshield.engine.AnomalyDetector;
import com.jasmin.trafficshield.mitigation.MitigationEngine;
import com.jasmin.trafficshield.models.MitigationAction;
import com.jasmin.trafficshield.models.MitigationVerdict;
import com.jasmin.trafficshield.models.RequestEvent;
import com.jasmin.trafficshield.profiler.TrafficProfiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrafficShieldService {

    private final TrafficProfiler trafficProfiler;
    private final AnomalyDetector anomalyDetector;
    private final MitigationEngine mitigationEngine;
    private final Clock clock;

    /**
     * Runs one event through profiling, detection (when a new snapshot is due) and mitigation.
     * Events without a timestamp are stamped with the service clock. Events whose source id the
     * mitigation engine rejects get {@link MitigationAction#NONE} and leave every stage untouched.
     */
    public MitigationVerdict handle(RequestEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        if (!mitigationEngine.isValidSourceId(event.getSourceId())) {
            log.warn("Ignoring event from invalid source id '{}'", event.getSourceId());
            return new MitigationVerdict(event.getSourceId(), MitigationAction.NONE,
                    anomalyDetector.getLatestScore(), false);
        }
        Instant ts = event.getTimestamp() != null ? event.getTimestamp() : clock.instant();

        trafficProfiler.processEvent(event.getSourceId(), event.getPath(), event.getMethod(), ts)
                .ifPresent(anomalyDetector::detect);
        double score = anomalyDetector.getLatestScore();

        MitigationAction action = mitigationEngine.mitigate(event.getSourceId(), score, ts);
        return new MitigationVerdict(event.getSourceId(), action, score, action == MitigationAction.BLOCK);
    }

    /** Clears profiler, detector and mitigation state together. */
    public void reset() {
        trafficProfiler.reset();
        anomalyDetector.reset();
        mitigationEngine.reset();
    }
}
