package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Ledger entry lifecycle. {@code REVERSED} is reserved for a full-reversal
 * event type; nothing sets it yet.
 */
public enum EntryStatus {
    ACTIVE("active"),
    ADJUSTED("adjusted"),
    REVERSED("reversed");

    private final String value;

    EntryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntryStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown entry status: " + raw));
    }
}
