package com.jasmin.trafficshield.mitigation;

import java.time.Instant;

/**
 * Escalation counters of one source. Read and written only while holding the instance monitor.
 */
class RateState {

    final boolean lowTrust;
    int rateLimitCount;
    double decayedScore;
    long totalRequests;
    SourceState state = SourceState.NONE;
    Instant lastSeen;

    RateState(boolean lowTrust) {
        this.lowTrust = lowTrust;
    }
}
