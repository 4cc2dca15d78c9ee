package com.jasmin.trafficshield.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LIGHT,
    MEDIUM,
    SEVERE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
