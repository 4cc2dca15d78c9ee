package com.jasmin.trafficshield.mitigation;

import com.jasmin.trafficshield.exceptions.SourceValidationException;
import com.jasmin.trafficshield.models.ActionLogEntry;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.MitigationAction;
import com.jasmin.trafficshield.models.Severity;
import com.jasmin.trafficshield.store.InMemoryBlockStore;
import com.jasmin.trafficshield.store.InMemoryMetricsStore;
import com.jasmin.trafficshield.store.StoreProperties;
import com.jasmin.trafficshield.support.MutableClock;
import com.jasmin.trafficshield.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.jasmin.trafficshield.support.TestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MitigationEngine")
class MitigationEngineTest {

    private static final String SOURCE = "192.168.1.10";

    private MitigationProperties props;
    private MutableClock clock;
    private InMemoryBlockStore blockStore;
    private MitigationEngine engine;

    @BeforeEach
    void setUp() {
        props = new MitigationProperties();
        clock = new MutableClock(T0);
        rebuild();
    }

    private void rebuild() {
        blockStore = new InMemoryBlockStore();
        engine = TestFixtures.mitigationEngine(props,
                TestFixtures.storeWriter(blockStore, new InMemoryMetricsStore(new StoreProperties())), clock);
    }

    @Nested
    @DisplayName("Source validation")
    class Validation {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "abc", "1.2.3"})
        @DisplayName("Should ignore invalid identifiers without tracking them")
        void shouldIgnoreInvalidIds(String sourceId) {
            assertThat(engine.mitigate(sourceId, 1.0, T0)).isEqualTo(MitigationAction.NONE);

            MitigationStatus status = engine.getStatus();
            assertThat(status.getTrackedSources()).isZero();
            assertThat(status.getGlobalRequests()).isZero();
            assertThat(status.getGraphNodes()).isZero();
        }

        @Test
        @DisplayName("Should report which identifiers are accepted")
        void shouldReportValidIds() {
            assertThat(engine.isValidSourceId(SOURCE)).isTrue();
            assertThat(engine.isValidSourceId("ab1")).isFalse();
            assertThat(engine.isValidSourceId("  ")).isFalse();
            assertThat(engine.isValidSourceId(null)).isFalse();
        }

        @Test
        @DisplayName("Should reject manual blocks of invalid identifiers")
        void shouldRejectManualBlock() {
            assertThatThrownBy(() -> engine.block("abc", Severity.LIGHT))
                    .isInstanceOf(SourceValidationException.class);
            assertThat(engine.getBlocked()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Should take no action on a clean source")
        void shouldLeaveCleanSourceAlone() {
            assertThat(engine.mitigate(SOURCE, 0.0, T0)).isEqualTo(MitigationAction.NONE);
            assertThat(engine.getStatus().getActiveMitigations()).isZero();
            assertThat(engine.getStatus().getTrackedSources()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should block a flooding source at severe for 24 hours")
        void shouldBlockSevere() {
            assertThat(engine.mitigate(SOURCE, 1.0, T0)).isEqualTo(MitigationAction.BLOCK);

            assertThat(engine.isBlocked(SOURCE)).isTrue();
            BlockRecord block = engine.getBlocked().get(0);
            assertThat(block.getSeverity()).isEqualTo(Severity.SEVERE);
            assertThat(block.getBlockedAt()).isEqualTo(T0);
            assertThat(block.getExpiresAt()).isEqualTo(T0.plus(Duration.ofHours(24)));
            assertThat(block.getReason()).startsWith("Anomaly score: ");
            assertThat(blockStore.get(SOURCE)).isPresent();
        }

        @Test
        @DisplayName("Should rate limit a light offender and escalate to challenge")
        void shouldEscalateRateLimits() {
            List<MitigationAction> actions = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                actions.add(engine.mitigate(SOURCE, 0.4, T0.plusMillis(i * 100L)));
            }

            assertThat(actions).containsExactly(
                    MitigationAction.RATE_LIMIT, MitigationAction.RATE_LIMIT, MitigationAction.RATE_LIMIT,
                    MitigationAction.RATE_LIMIT, MitigationAction.RATE_LIMIT,
                    MitigationAction.CHALLENGE, MitigationAction.CHALLENGE);
            assertThat(engine.getStatus().getChallengedSources()).isEqualTo(1);
            assertThat(engine.isBlocked(SOURCE)).isFalse();
        }

        @Test
        @DisplayName("Should challenge a medium threat without a high score history")
        void shouldChallengeMediumThreat() {
            assertThat(engine.mitigate(SOURCE, 0.7, T0)).isEqualTo(MitigationAction.CHALLENGE);
            assertThat(engine.getStatus().getChallengedSources()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should block a medium threat with a high decayed score for one hour")
        void shouldBlockMediumThreat() {
            assertThat(engine.mitigate(SOURCE, 0.75, T0)).isEqualTo(MitigationAction.BLOCK);

            BlockRecord block = engine.getBlocked().get(0);
            assertThat(block.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(block.getExpiresAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("Should keep answering block while a block is active")
        void shouldShortCircuitBlockedSource() {
            engine.mitigate(SOURCE, 1.0, T0);

            assertThat(engine.mitigate(SOURCE, 0.0, T0.plusSeconds(5))).isEqualTo(MitigationAction.BLOCK);
            assertThat(engine.getStatus().getActiveMitigations()).isEqualTo(2);
            assertThat(engine.getStatus().getRecentActions())
                    .extracting(ActionLogEntry::getAction)
                    .containsOnly(MitigationAction.BLOCK);
        }

        @Test
        @DisplayName("Should drop an expired block and decide afresh")
        void shouldExpireBlock() {
            engine.mitigate(SOURCE, 1.0, T0);
            Instant later = T0.plus(Duration.ofHours(25));
            clock.set(later);

            assertThat(engine.mitigate(SOURCE, 0.0, later)).isEqualTo(MitigationAction.NONE);
            assertThat(engine.isBlocked(SOURCE)).isFalse();
            assertThat(engine.getBlocked()).isEmpty();
            assertThat(blockStore.get(SOURCE)).isEmpty();
        }

        @Test
        @DisplayName("Should link suspicious sources active within the co-activity window")
        void shouldLinkCoActiveSuspects() {
            engine.mitigate("10.0.0.101", 0.8, T0);
            engine.mitigate("10.0.0.102", 0.8, T0.plusSeconds(1));
            engine.mitigate("10.0.0.103", 0.8, T0.plusSeconds(10));

            MitigationStatus status = engine.getStatus();
            assertThat(status.getGraphNodes()).isEqualTo(3);
            assertThat(status.getTopWeightedNodes())
                    .filteredOn(n -> n.getSourceId().equals("10.0.0.103"))
                    .extracting(MitigationStatus.NodeSummary::getConnections)
                    .containsExactly(0);
            assertThat(status.getTopWeightedNodes())
                    .filteredOn(n -> n.getSourceId().equals("10.0.0.101"))
                    .extracting(MitigationStatus.NodeSummary::getConnections)
                    .containsExactly(1);
        }
    }

    @Nested
    @DisplayName("Blocks")
    class Blocks {

        @Test
        @DisplayName("Should never shorten or downgrade an active block")
        void shouldOnlyExtendBlocks() {
            engine.block(SOURCE, Severity.SEVERE);
            clock.advance(Duration.ofHours(1));

            BlockRecord refreshed = engine.block(SOURCE, Severity.MEDIUM);

            assertThat(refreshed.getSeverity()).isEqualTo(Severity.SEVERE);
            assertThat(refreshed.getBlockedAt()).isEqualTo(T0);
            assertThat(refreshed.getExpiresAt()).isEqualTo(T0.plus(Duration.ofHours(24)));
        }

        @Test
        @DisplayName("Should extend a shorter block")
        void shouldExtendShorterBlock() {
            engine.block(SOURCE, Severity.LIGHT);
            clock.advance(Duration.ofMinutes(5));

            BlockRecord refreshed = engine.block(SOURCE, Severity.MEDIUM);

            assertThat(refreshed.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(refreshed.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(65)));
        }

        @Test
        @DisplayName("Should keep permanent severe blocks permanent")
        void shouldKeepPermanentBlocks() {
            props.setPermanentSevere(true);
            rebuild();

            engine.mitigate(SOURCE, 1.0, T0);
            BlockRecord refreshed = engine.block(SOURCE, Severity.LIGHT);

            assertThat(refreshed.getExpiresAt()).isNull();
            clock.advance(Duration.ofDays(1000));
            assertThat(engine.isBlocked(SOURCE)).isTrue();
        }

        @Test
        @DisplayName("Should leave the block store unchanged on a second cleanup")
        void shouldCleanupIdempotently() {
            engine.mitigate(SOURCE, 1.0, T0);
            engine.block("10.0.0.250", Severity.LIGHT);
            clock.set(T0.plus(Duration.ofHours(1)));

            assertThat(engine.cleanup().getExpiredBlocks()).isEqualTo(1);
            List<BlockRecord> afterFirst = blockStore.listActive(clock.instant());
            CleanupReport second = engine.cleanup();

            assertThat(second.total()).isZero();
            assertThat(blockStore.size()).isEqualTo(1);
            assertThat(blockStore.listActive(clock.instant())).containsExactlyInAnyOrderElementsOf(afterFirst);
        }

        @Test
        @DisplayName("Should list blocks oldest first")
        void shouldListOldestFirst() {
            engine.block("10.0.0.200", Severity.MEDIUM);
            clock.advance(Duration.ofSeconds(1));
            engine.block("10.0.0.100", Severity.MEDIUM);

            assertThat(engine.getBlocked())
                    .extracting(BlockRecord::getSourceId)
                    .containsExactly("10.0.0.200", "10.0.0.100");
        }
    }

    @Nested
    @DisplayName("Low-trust sources")
    class LowTrust {

        private static final String GENERATOR = "10.99.1.5";

        @BeforeEach
        void configure() {
            props.getLowTrust().setCidrs(List.of("10.99.0.0/16"));
            rebuild();
        }

        @Test
        @DisplayName("Should apply lowered thresholds and mark the reason")
        void shouldLowerThresholds() {
            assertThat(engine.mitigate(SOURCE, 0.9, T0)).isEqualTo(MitigationAction.BLOCK);
            assertThat(engine.mitigate(GENERATOR, 0.9, T0)).isEqualTo(MitigationAction.BLOCK);

            List<BlockRecord> blocked = engine.getBlocked();
            assertThat(blocked).filteredOn(b -> b.getSourceId().equals(SOURCE))
                    .extracting(BlockRecord::getSeverity).containsExactly(Severity.MEDIUM);

            BlockRecord generator = blocked.stream()
                    .filter(b -> b.getSourceId().equals(GENERATOR)).findFirst().orElseThrow();
            assertThat(generator.getSeverity()).isEqualTo(Severity.SEVERE);
            assertThat(generator.isLowTrust()).isTrue();
            assertThat(generator.getReason()).endsWith("(low-trust)");
        }

        @Test
        @DisplayName("Should keep low-trust state while a generation session runs")
        void shouldPurgeOnlyOutsideSessions() {
            engine.mitigate(GENERATOR, 1.0, T0);
            engine.mitigate(SOURCE, 1.0, T0);
            engine.block("10.0.0.250", Severity.MEDIUM);
            clock.set(T0.plus(Duration.ofHours(2)));

            engine.setGenerationSessionActive(true);
            CleanupReport during = engine.cleanup();
            assertThat(during.getExpiredBlocks()).isEqualTo(1);
            assertThat(during.getLowTrustBlocks()).isZero();
            assertThat(during.getLowTrustStates()).isZero();
            assertThat(engine.isBlocked(GENERATOR)).isTrue();

            engine.setGenerationSessionActive(false);
            CleanupReport after = engine.cleanup();
            assertThat(after.getExpiredBlocks()).isZero();
            assertThat(after.getLowTrustBlocks()).isEqualTo(1);
            assertThat(after.getLowTrustStates()).isEqualTo(1);
            assertThat(engine.isBlocked(GENERATOR)).isFalse();
            assertThat(engine.isBlocked(SOURCE)).isTrue();
            assertThat(engine.getStatus().getTrackedSources()).isEqualTo(1);

            assertThat(engine.cleanup().total()).isZero();
        }
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("Should report an empty state for a fresh engine")
        void shouldReportEmptyState() {
            MitigationStatus status = engine.getStatus();

            assertThat(status.getActiveMitigations()).isZero();
            assertThat(status.getTrackedSources()).isZero();
            assertThat(status.getBlockedSources()).isZero();
            assertThat(status.getRecentActions()).isEmpty();
            assertThat(status.getTopWeightedNodes()).isEmpty();
            assertThat(status.getTopThreats()).isEmpty();
            assertThat(status.getCacheSize()).isZero();
            assertThat(status.getCacheCapacity()).isEqualTo(1000);
            assertThat(status.getAverageConnections()).isZero();
            assertThat(status.isGenerationSessionActive()).isFalse();
        }

        @Test
        @DisplayName("Should bound the action log")
        void shouldBoundActionLog() {
            props.setActionLogCapacity(3);
            rebuild();

            for (int i = 0; i < 10; i++) {
                engine.mitigate("10.0.1." + (100 + i), 1.0, T0.plusSeconds(i));
            }

            MitigationStatus status = engine.getStatus();
            assertThat(status.getActiveMitigations()).isEqualTo(10);
            assertThat(status.getRecentActions())
                    .extracting(ActionLogEntry::getSourceId)
                    .containsExactly("10.0.1.107", "10.0.1.108", "10.0.1.109");
        }

        @Test
        @DisplayName("Should drop graph nodes with cache evictions only when configured")
        void shouldEvictGraphNodesWithCache() {
            props.setCacheCapacity(2);
            rebuild();
            feedThreeSources();
            assertThat(engine.getStatus().getCacheEvictions()).isEqualTo(1);
            assertThat(engine.getStatus().getGraphNodes()).isEqualTo(3);

            props.getGraph().setEvictWithCache(true);
            rebuild();
            feedThreeSources();
            assertThat(engine.getStatus().getCacheSize()).isEqualTo(2);
            assertThat(engine.getStatus().getGraphNodes()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should clear everything on reset")
        void shouldReset() {
            engine.mitigate(SOURCE, 1.0, T0);

            engine.reset();

            assertThat(engine.isBlocked(SOURCE)).isFalse();
            MitigationStatus status = engine.getStatus();
            assertThat(status.getTrackedSources()).isZero();
            assertThat(status.getQueueSize()).isZero();
            assertThat(status.getGraphNodes()).isZero();
        }

        private void feedThreeSources() {
            engine.mitigate("10.0.2.101", 0.1, T0);
            engine.mitigate("10.0.2.102", 0.1, T0);
            engine.mitigate("10.0.2.103", 0.1, T0);
        }
    }

    @Test
    @DisplayName("Should tolerate cleanup running alongside mitigation")
    void shouldRunCleanupConcurrently() throws Exception {
        props.getLowTrust().setCidrs(List.of("10.99.0.0/16"));
        rebuild();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String id = "10.99." + worker + "." + (i % 50);
                        engine.mitigate(id, (i % 10) / 10.0, T0.plusMillis(i));
                    }
                }));
            }
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    engine.cleanup();
                }
            }));
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        engine.cleanup();
        assertThat(engine.getBlocked()).isEmpty();
        assertThat(engine.getStatus().getTrackedSources()).isZero();
    }
}
