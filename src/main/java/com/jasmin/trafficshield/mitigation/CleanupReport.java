package com.jasmin.trafficshield.mitigation;

import lombok.Value;

@Value
public class CleanupReport {
    int expiredBlocks;
    int lowTrustBlocks;
    int lowTrustStates;

    public int total() {
        return expiredBlocks + lowTrustBlocks + lowTrustStates;
    }
}
