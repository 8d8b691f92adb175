package com.feeledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Bracket convention for tier matching. {@code CLOSED_CLOSED} matches
 * {@code min <= v <= max}; {@code CLOSED_OPEN} matches {@code min <= v < max}.
 */
public enum TierBoundary {
    CLOSED_CLOSED("closed_closed"),
    CLOSED_OPEN("closed_open");

    private final String value;

    TierBoundary(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TierBoundary fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown tier boundary: " + raw));
    }
}
