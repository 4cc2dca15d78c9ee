package com.jasmin.trafficshield.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class BlockRecord {
    private String sourceId;
    private Severity severity;
    private Instant blockedAt;

    // null means permanent
    private Instant expiresAt;
    private String reason;

    // set for sources matched by the low-trust policy, purged by cleanup when no generator runs
    private boolean lowTrust;

    public boolean isActive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
