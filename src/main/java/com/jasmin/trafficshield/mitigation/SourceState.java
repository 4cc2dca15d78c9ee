package com.jasmin.trafficshield.mitigation;

public enum SourceState {
    NONE,
    RATE_LIMITED,
    CHALLENGED,
    BLOCKED
}
