package com.jasmin.trafficshield.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Graduated response issued per source, in increasing order of strength.
 */
public enum MitigationAction {
    NONE("none"),
    RATE_LIMIT("rate_limit"),
    CHALLENGE("challenge"),
    BLOCK("block");

    private final String code;

    MitigationAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
