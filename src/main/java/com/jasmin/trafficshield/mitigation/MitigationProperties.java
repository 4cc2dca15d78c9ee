package com.jasmin.trafficshield.mitigation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "mitigation")
public class MitigationProperties {

    /** Threat level from which a source is rate limited. */
    private double lightThreshold = 0.4;

    /** Threat level from which a source is challenged. */
    private double mediumThreshold = 0.6;

    /** Threat level from which a source is blocked outright. */
    private double severeThreshold = 0.8;

    /** Retention of the per-source decayed score between updates. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double decayFactor = 0.85;

    /** Rate limits after which a light offender is challenged instead. */
    @Min(0) private int rateLimitEscalation = 5;

    /** Decayed score above which a challenged source is blocked. */
    private double challengeBlockScore = 0.7;

    /** Rate limits above which a challenged source is blocked. */
    @Min(0) private int challengeBlockRateLimits = 10;

    /** Shorter source identifiers are rejected. */
    @Min(1) private int minSourceIdLength = 7;

    /** Horizon of the global request counter. */
    private Duration globalWindow = Duration.ofSeconds(300);

    /** Horizon of the per-source request counter. */
    private Duration sourceWindow = Duration.ofSeconds(60);

    /** A source is at full rate factor once it sends this many times its fair share. */
    @DecimalMin("0.0") private double fairShareMultiple = 3.0;

    /** Sources tracked by the recency cache. */
    @Min(1) private int cacheCapacity = 1000;

    @Min(1) private int actionLogCapacity = 1000;

    /** Actions and nodes listed by the status report. */
    @Min(1) private int statusListSize = 10;

    /** When true, severe blocks never expire. */
    private boolean permanentSevere = false;

    private Duration cleanupInterval = Duration.ofSeconds(30);

    @Valid private BlockDurations blockDurations = new BlockDurations();

    @Valid private Graph graph = new Graph();

    @Valid private Queue queue = new Queue();

    @Valid private LowTrust lowTrust = new LowTrust();

    @Data
    public static class BlockDurations {
        private Duration light = Duration.ofMinutes(10);
        private Duration medium = Duration.ofHours(1);
        private Duration severe = Duration.ofHours(24);
    }

    @Data
    public static class Graph {

        /** Smoothing retention of the node weight. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double weightRetention = 0.95;

        /** Smoothing retention of the node threat score. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double threatRetention = 0.7;

        /** Only sources scoring at least this are linked to each other. */
        private double linkMinScore = 0.5;

        /** Two suspicious sightings closer than this are considered co-active. */
        private Duration coActivityWindow = Duration.ofSeconds(2);

        /** Recent suspicious sightings considered for linking. */
        @Min(1) private int recentSuspects = 16;

        @Min(0) private int maxLinksPerUpdate = 5;

        @Min(0) private int maxConnections = 50;

        /** Connection count at which the connection part of the graph factor saturates. */
        @Min(1) private int connectionScale = 10;

        /** Drop a source's node when the recency cache evicts it. */
        private boolean evictWithCache = false;
    }

    @Data
    public static class Queue {

        /** Chance that a push triggers a rebuild without stale entries. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double pruneProbability = 0.05;

        /** Every push rebuilds once the queue is larger than this. */
        @Min(1) private int maxSize = 10_000;

        /** Entries older than this are dropped by a rebuild. */
        private Duration maxAge = Duration.ofHours(1);
    }

    @Data
    public static class LowTrust {

        /** Address ranges in CIDR notation, e.g. 10.99.0.0/16. */
        private List<String> cidrs = new ArrayList<>();

        /** Exact source identifiers. */
        private List<String> sourceIds = new ArrayList<>();

        /** Applied to the decision thresholds of low-trust sources. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double thresholdMultiplier = 0.85;
    }
}
