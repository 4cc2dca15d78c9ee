package com.jasmin.trafficshield.mitigation;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.exceptions.SourceValidationException;
import com.jasmin.trafficshield.models.ActionLogEntry;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.MitigationAction;
import com.jasmin.trafficshield.models.Severity;
import com.jasmin.trafficshield.services.StoreWriter;
import com.jasmin.trafficshield.structures.CacheEntry;
import com.jasmin.trafficshield.structures.KeyedSlidingWindowCounter;
import com.jasmin.trafficshield.structures.RecencyCache;
import com.jasmin.trafficshield.structures.RelationshipGraph;
import com.jasmin.trafficshield.structures.SourceNode;
import com.jasmin.trafficshield.structures.SlidingWindowCounter;
import com.jasmin.trafficshield.structures.ThreatQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Turns anomaly scores into graduated per-source actions.
 * <p>
 * Each call blends the anomaly score with the source's request rate relative to its fair share,
 * its position in the relationship graph and its decayed score history into a threat level.
 * The threat level selects light, medium or severe handling, and repeat offenders escalate
 * from rate limiting to challenges to blocks.
 * <p>
 * Updates for one source are serialized on that source's {@link RateState}; the shared
 * structures lock themselves. Block records live in memory and are mirrored to the block store
 * without waiting for it.
 */
@Slf4j
@Service
public class MitigationEngine {

    private final MitigationProperties props;
    private final LowTrustPolicy lowTrustPolicy;
    private final StoreWriter storeWriter;
    private final Clock clock;

    private final ConcurrentMap<String, RateState> rateStates = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BlockRecord> blocks = new ConcurrentHashMap<>();
    private final SlidingWindowCounter globalCounter;
    private final KeyedSlidingWindowCounter sourceCounter;
    private final RecencyCache<String, CacheEntry> cache;
    private final RelationshipGraph graph;
    private final ThreatQueue queue;
    private final Deque<ActionLogEntry> actionLog = new ArrayDeque<>();
    private final AtomicLong activeMitigations = new AtomicLong();
    private volatile boolean generationSessionActive;

    public MitigationEngine(MitigationProperties props,
                            LowTrustPolicy lowTrustPolicy,
                            StoreWriter storeWriter,
                            Clock clock) {
        this.props = props;
        this.lowTrustPolicy = lowTrustPolicy;
        this.storeWriter = storeWriter;
        this.clock = clock;

        this.globalCounter = new SlidingWindowCounter(props.getGlobalWindow());
        this.sourceCounter = new KeyedSlidingWindowCounter(props.getSourceWindow());
        this.cache = new RecencyCache<>(props.getCacheCapacity());

        MitigationProperties.Graph g = props.getGraph();
        this.graph = new RelationshipGraph(g.getWeightRetention(), g.getThreatRetention(), g.getLinkMinScore(),
                g.getCoActivityWindow(), g.getRecentSuspects(), g.getMaxLinksPerUpdate(), g.getMaxConnections());

        MitigationProperties.Queue q = props.getQueue();
        this.queue = new ThreatQueue(q.getPruneProbability(), q.getMaxSize(), q.getMaxAge(), new Random());
    }

    public MitigationAction mitigate(String sourceId, double anomalyScore) {
        return mitigate(sourceId, anomalyScore, clock.instant());
    }

    /**
     * Decides the action for one observation of {@code sourceId}. Invalid identifiers yield
     * {@link MitigationAction#NONE} without touching any state.
     */
    public MitigationAction mitigate(String sourceId, double anomalyScore, Instant timestamp) {
        try {
            validate(sourceId);
        } catch (SourceValidationException e) {
            log.warn("Ignoring source: {}", e.getMessage());
            return MitigationAction.NONE;
        }

        double score = clamp01(anomalyScore);
        globalCounter.increment(timestamp);
        sourceCounter.increment(sourceId, timestamp);

        RateState state = rateStates.computeIfAbsent(sourceId, id -> new RateState(lowTrustPolicy.isLowTrust(id)));
        MitigationAction action;
        double threat;
        synchronized (state) {
            state.totalRequests++;
            state.lastSeen = timestamp;
            state.decayedScore = Math.max(score, state.decayedScore * props.getDecayFactor());

            SourceNode node = graph.observe(sourceId, score, timestamp);
            double sourceRate = sourceCounter.rate(sourceId, timestamp);
            cache.put(sourceId, CacheEntry.builder()
                    .sourceId(sourceId)
                    .lastScore(score)
                    .lastSeen(timestamp)
                    .requestRate(sourceRate)
                    .totalRequests(state.totalRequests)
                    .build()
            ).ifPresent(this::onCacheEviction);
            queue.push(sourceId, node.getThreatScore(), timestamp);

            threat = threatLevel(score, sourceRate, node, state, timestamp);

            BlockRecord existing = blocks.get(sourceId);
            if (existing != null && existing.isActive(timestamp)) {
                state.state = SourceState.BLOCKED;
                action = MitigationAction.BLOCK;
            } else {
                if (existing != null) {
                    expire(sourceId, existing, state);
                }
                action = decide(sourceId, state, threat, timestamp);
            }
        }

        if (action != MitigationAction.NONE) {
            record(timestamp, sourceId, action, score, threat);
        }
        return action;
    }

    /** Blocks {@code sourceId} at {@code severity} from now on. */
    public BlockRecord block(String sourceId, Severity severity) {
        validate(sourceId);
        return block(sourceId, severity, "Manual block", lowTrustPolicy.isLowTrust(sourceId), clock.instant());
    }

    public boolean isBlocked(String sourceId) {
        BlockRecord b = sourceId == null ? null : blocks.get(sourceId);
        return b != null && b.isActive(clock.instant());
    }

    /** Unexpired blocks, oldest first. */
    public List<BlockRecord> getBlocked() {
        Instant now = clock.instant();
        return blocks.values().stream()
                .filter(b -> b.isActive(now))
                .sorted(Comparator.comparing(BlockRecord::getBlockedAt))
                .map(b -> b.toBuilder().build())
                .collect(Collectors.toList());
    }

    public MitigationStatus getStatus() {
        Instant now = clock.instant();
        int rateLimited = 0;
        int challenged = 0;
        for (RateState s : rateStates.values()) {
            synchronized (s) {
                if (s.state == SourceState.RATE_LIMITED) {
                    rateLimited++;
                } else if (s.state == SourceState.CHALLENGED) {
                    challenged++;
                }
            }
        }
        int n = props.getStatusListSize();
        List<ActionLogEntry> recent;
        synchronized (actionLog) {
            recent = new ArrayList<>(actionLog);
        }
        if (recent.size() > n) {
            recent = new ArrayList<>(recent.subList(recent.size() - n, recent.size()));
        }

        return MitigationStatus.builder()
                .activeMitigations(activeMitigations.get())
                .trackedSources(rateStates.size())
                .rateLimitedSources(rateLimited)
                .challengedSources(challenged)
                .blockedSources((int) blocks.values().stream().filter(b -> b.isActive(now)).count())
                .recentActions(recent)
                .cacheSize(cache.size())
                .cacheCapacity(cache.getCapacity())
                .cacheUtilization(cache.utilization())
                .cacheEvictions(cache.getEvictions())
                .graphNodes(graph.size())
                .averageConnections(graph.averageConnections())
                .topWeightedNodes(graph.topByWeight(n).stream()
                        .map(node -> new MitigationStatus.NodeSummary(node.getId(), node.getWeight(),
                                node.getThreatScore(), node.getConnectionCount()))
                        .collect(Collectors.toList()))
                .queueSize(queue.size())
                .topThreats(queue.top(n).stream()
                        .map(e -> new MitigationStatus.ThreatSummary(e.getSourceId(), e.threatScore(), e.getTimestamp()))
                        .collect(Collectors.toList()))
                .globalRequests(globalCounter.count(now))
                .sourceWindowRequests(sourceCounter.total(now))
                .generationSessionActive(generationSessionActive)
                .build();
    }

    /**
     * Drops expired blocks. Unless a traffic generation session is active, also drops blocks and
     * escalation state of low-trust sources. Running it twice in a row changes nothing the
     * second time.
     */
    public CleanupReport cleanup() {
        Instant now = clock.instant();
        boolean purgeLowTrust = !generationSessionActive;
        int expired = 0;
        int lowTrustBlocks = 0;
        int lowTrustStates = 0;

        for (Map.Entry<String, BlockRecord> e : blocks.entrySet()) {
            BlockRecord b = e.getValue();
            boolean isExpired = !b.isActive(now);
            if (!isExpired && !(purgeLowTrust && b.isLowTrust())) {
                continue;
            }
            if (blocks.remove(e.getKey(), b)) {
                storeWriter.deleteBlock(e.getKey());
                RateState s = rateStates.get(e.getKey());
                if (s != null) {
                    synchronized (s) {
                        s.state = SourceState.NONE;
                        s.rateLimitCount = 0;
                    }
                }
                if (isExpired) {
                    expired++;
                } else {
                    lowTrustBlocks++;
                }
            }
        }

        if (purgeLowTrust) {
            for (Map.Entry<String, RateState> e : rateStates.entrySet()) {
                if (e.getValue().lowTrust && rateStates.remove(e.getKey(), e.getValue())) {
                    cache.remove(e.getKey());
                    lowTrustStates++;
                }
            }
        }

        CleanupReport report = new CleanupReport(expired, lowTrustBlocks, lowTrustStates);
        if (report.total() > 0) {
            log.info("Cleanup removed {} expired blocks, {} low-trust blocks, {} low-trust sources",
                    expired, lowTrustBlocks, lowTrustStates);
        }
        return report;
    }

    /** Set by an external traffic generator while it runs; suspends low-trust purging. */
    public void setGenerationSessionActive(boolean active) {
        this.generationSessionActive = active;
        log.info("Traffic generation session {}", active ? "started" : "ended");
    }

    public boolean isGenerationSessionActive() {
        return generationSessionActive;
    }

    /** Clears every counter, structure, block and log entry. */
    public void reset() {
        rateStates.clear();
        blocks.clear();
        globalCounter.clear();
        sourceCounter.clear();
        cache.clear();
        graph.clear();
        queue.clear();
        synchronized (actionLog) {
            actionLog.clear();
        }
        activeMitigations.set(0);
        log.info("Mitigation state reset");
    }

    /** Whether {@code sourceId} would be accepted by {@link #mitigate} and {@link #block}. */
    public boolean isValidSourceId(String sourceId) {
        try {
            validate(sourceId);
            return true;
        } catch (SourceValidationException e) {
            return false;
        }
    }

    private void validate(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new SourceValidationException("empty source id");
        }
        if (sourceId.length() < props.getMinSourceIdLength()) {
            throw new SourceValidationException("source id too short: " + sourceId);
        }
    }

    private double threatLevel(double score, double sourceRate, SourceNode node, RateState state, Instant now) {
        double globalRate = globalCounter.rate(now);
        int activeSources = sourceCounter.activeKeys(now);
        double rateFactor = 0.0;
        if (activeSources > 0 && globalRate > 0.0) {
            double fairShare = props.getFairShareMultiple() * globalRate / activeSources;
            rateFactor = fairShare > 0.0 ? clamp01(sourceRate / fairShare) : 1.0;
        }
        double graphFactor = clamp01(
                ((double) node.getConnectionCount() / props.getGraph().getConnectionScale() + node.getWeight()) / 2.0);
        double historyFactor = clamp01(state.decayedScore);

        return clamp01(0.5 * score + 0.2 * rateFactor + 0.2 * graphFactor + 0.1 * historyFactor);
    }

    private MitigationAction decide(String sourceId, RateState state, double threat, Instant now) {
        double m = state.lowTrust ? lowTrustPolicy.getThresholdMultiplier() : 1.0;

        if (threat >= props.getSevereThreshold() * m) {
            block(sourceId, Severity.SEVERE, reason(threat, state), state.lowTrust, now);
            state.state = SourceState.BLOCKED;
            return MitigationAction.BLOCK;
        }
        if (threat >= props.getMediumThreshold() * m) {
            if (state.decayedScore > props.getChallengeBlockScore()
                    || state.rateLimitCount > props.getChallengeBlockRateLimits()) {
                block(sourceId, Severity.MEDIUM, reason(threat, state), state.lowTrust, now);
                state.state = SourceState.BLOCKED;
                return MitigationAction.BLOCK;
            }
            state.state = SourceState.CHALLENGED;
            return MitigationAction.CHALLENGE;
        }
        if (threat >= props.getLightThreshold() * m) {
            state.rateLimitCount++;
            if (state.rateLimitCount > props.getRateLimitEscalation()) {
                state.state = SourceState.CHALLENGED;
                return MitigationAction.CHALLENGE;
            }
            state.state = SourceState.RATE_LIMITED;
            return MitigationAction.RATE_LIMIT;
        }
        return MitigationAction.NONE;
    }

    private BlockRecord block(String sourceId, Severity severity, String reason, boolean lowTrust, Instant now) {
        Instant expiresAt = severity == Severity.SEVERE && props.isPermanentSevere()
                ? null
                : now.plus(duration(severity));
        BlockRecord candidate = BlockRecord.builder()
                .sourceId(sourceId)
                .severity(severity)
                .blockedAt(now)
                .expiresAt(expiresAt)
                .reason(reason)
                .lowTrust(lowTrust)
                .build();
        BlockRecord stored = blocks.merge(sourceId, candidate, (old, fresh) -> refresh(old, fresh, now));
        storeWriter.upsertBlock(stored);
        log.info("Blocked {} ({}) until {}: {}", sourceId, stored.getSeverity().code(),
                stored.getExpiresAt() == null ? "further notice" : stored.getExpiresAt(), stored.getReason());
        return stored;
    }

    // an unexpired block is only ever extended
    private static BlockRecord refresh(BlockRecord old, BlockRecord fresh, Instant now) {
        if (!old.isActive(now)) {
            return fresh;
        }
        Instant expiresAt;
        if (old.getExpiresAt() == null || fresh.getExpiresAt() == null) {
            expiresAt = null;
        } else {
            expiresAt = fresh.getExpiresAt().isAfter(old.getExpiresAt()) ? fresh.getExpiresAt() : old.getExpiresAt();
        }
        Severity severity = fresh.getSeverity().compareTo(old.getSeverity()) >= 0 ? fresh.getSeverity() : old.getSeverity();
        return fresh.toBuilder()
                .blockedAt(old.getBlockedAt())
                .severity(severity)
                .expiresAt(expiresAt)
                .build();
    }

    private void expire(String sourceId, BlockRecord expired, RateState state) {
        if (blocks.remove(sourceId, expired)) {
            storeWriter.deleteBlock(sourceId);
            log.info("Block on {} expired", sourceId);
        }
        state.state = SourceState.NONE;
        state.rateLimitCount = 0;
    }

    private Duration duration(Severity severity) {
        MitigationProperties.BlockDurations d = props.getBlockDurations();
        switch (severity) {
            case LIGHT:
                return d.getLight();
            case MEDIUM:
                return d.getMedium();
            default:
                return d.getSevere();
        }
    }

    private static String reason(double threat, RateState state) {
        String reason = String.format(Locale.ROOT, Constants.REASON_ANOMALY_SCORE, threat);
        return state.lowTrust ? reason + Constants.REASON_LOW_TRUST_SUFFIX : reason;
    }

    private void onCacheEviction(String evicted) {
        if (props.getGraph().isEvictWithCache()) {
            graph.remove(evicted);
        }
    }

    private void record(Instant at, String sourceId, MitigationAction action, double score, double threat) {
        ActionLogEntry entry = ActionLogEntry.builder()
                .timestamp(at)
                .sourceId(sourceId)
                .action(action)
                .score(score)
                .threatLevel(threat)
                .build();
        synchronized (actionLog) {
            actionLog.addLast(entry);
            while (actionLog.size() > props.getActionLogCapacity()) {
                actionLog.pollFirst();
            }
        }
        activeMitigations.incrementAndGet();
        log.debug("{} -> {} (score={}, threat={})", sourceId, action.code(), score, threat);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
