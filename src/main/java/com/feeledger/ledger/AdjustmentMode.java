package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** {@code AUTO} derives the refund from the original breakdown; {@code MANUAL} debits a caller-given fee amount. */
public enum AdjustmentMode {
    AUTO("auto"),
    MANUAL("manual");

    private final String value;

    AdjustmentMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AdjustmentMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown adjustment mode: " + raw));
    }
}
