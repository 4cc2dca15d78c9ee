package com.jasmin.trafficshield.services;

import com.jasmin.trafficshield.engine.AnomalyDetector;
import com.jasmin.trafficshield.mitigation.MitigationEngine;
import com.jasmin.trafficshield.mitigation.MitigationProperties;
import com.jasmin.trafficshield.models.MitigationAction;
import com.jasmin.trafficshield.models.MitigationVerdict;
import com.jasmin.trafficshield.models.RequestEvent;
import com.jasmin.trafficshield.profiler.TrafficProfiler;
import com.jasmin.trafficshield.support.MutableClock;
import com.jasmin.trafficshield.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jasmin.trafficshield.support.TestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TrafficShieldService")
class TrafficShieldServiceTest {

    private MutableClock clock;
    private TrafficProfiler profiler;
    private AnomalyDetector anomalyDetector;
    private MitigationEngine mitigationEngine;
    private TrafficShieldService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        StoreWriter writer = TestFixtures.storeWriter();
        profiler = TestFixtures.profiler(writer, clock);
        anomalyDetector = TestFixtures.anomalyDetector(writer, clock);
        mitigationEngine = TestFixtures.mitigationEngine(new MitigationProperties(), writer, clock);
        service = new TrafficShieldService(profiler, anomalyDetector, mitigationEngine, clock);
    }

    private MitigationVerdict send(String sourceId, long offsetMillis) {
        return service.handle(RequestEvent.builder()
                .sourceId(sourceId)
                .path("/api/items")
                .method("GET")
                .timestamp(T0.plusMillis(offsetMillis))
                .build());
    }

    @Test
    @DisplayName("Should leave evenly spread traffic from twenty sources alone")
    void shouldIgnoreNormalTraffic() {
        double highest = 0.0;
        for (int second = 0; second < 60; second++) {
            for (int i = 0; i < 20; i++) {
                MitigationVerdict verdict = send("10.0.0." + (i + 1), second * 1000L + i * 50L);
                assertThat(verdict.getAction()).isEqualTo(MitigationAction.NONE);
                assertThat(verdict.isBlocked()).isFalse();
                highest = Math.max(highest, verdict.getAnomalyScore());
            }
        }

        assertThat(highest).isLessThanOrEqualTo(0.2);
        assertThat(mitigationEngine.getBlocked()).isEmpty();
        assertThat(profiler.getCurrentMetrics().getUniqueSources()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should escalate a single flooding source once the first snapshot is scored")
    void shouldEscalateFlood() {
        List<MitigationVerdict> verdicts = new ArrayList<>();
        for (int i = 0; i <= 220; i++) {
            verdicts.add(send("203.0.113.9", i * 5L));
        }

        assertThat(verdicts.subList(0, 200))
                .extracting(MitigationVerdict::getAction)
                .containsOnly(MitigationAction.NONE);

        assertThat(verdicts.get(200).getAnomalyScore()).isCloseTo(0.4, within(1e-9));
        assertThat(verdicts.subList(200, 205))
                .extracting(MitigationVerdict::getAction)
                .containsOnly(MitigationAction.RATE_LIMIT);
        assertThat(verdicts.subList(205, verdicts.size()))
                .extracting(MitigationVerdict::getAction)
                .containsOnly(MitigationAction.CHALLENGE);
        assertThat(mitigationEngine.getStatus().getChallengedSources()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stamp events without a timestamp with the service clock")
    void shouldStampMissingTimestamp() {
        MitigationVerdict verdict = service.handle(RequestEvent.builder().sourceId("10.0.0.1").build());

        assertThat(verdict.getAction()).isEqualTo(MitigationAction.NONE);
        assertThat(profiler.windowLength()).isEqualTo(1);
        assertThat(mitigationEngine.getStatus().getTrackedSources()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep events from rejected source ids out of the window")
    void shouldNotProfileInvalidSources() {
        for (int i = 0; i < 3; i++) {
            MitigationVerdict verdict = send("ab" + i, i * 10L);
            assertThat(verdict.getAction()).isEqualTo(MitigationAction.NONE);
            assertThat(verdict.isBlocked()).isFalse();
        }
        send("", 40L);

        assertThat(profiler.windowLength()).isZero();
        assertThat(profiler.sourceCounts()).isEmpty();
        assertThat(mitigationEngine.getStatus().getTrackedSources()).isZero();
    }

    @Test
    @DisplayName("Should reject a missing event")
    void shouldRejectNullEvent() {
        assertThatThrownBy(() -> service.handle(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should clear every stage on reset")
    void shouldResetAllStages() {
        for (int i = 0; i <= 210; i++) {
            send("203.0.113.9", i * 5L);
        }

        service.reset();

        assertThat(profiler.windowLength()).isZero();
        assertThat(anomalyDetector.getLatestScore()).isZero();
        assertThat(mitigationEngine.getStatus().getTrackedSources()).isZero();
    }
}
