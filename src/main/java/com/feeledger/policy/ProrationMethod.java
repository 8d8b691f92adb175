package com.feeledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** How a component amount is split across the lines it applies to. */
public enum ProrationMethod {
    BY_NET("by_net"),
    BY_GROSS("by_gross"),
    BY_QUANTITY("by_quantity"),
    EQUAL("equal");

    private final String value;

    ProrationMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProrationMethod fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown proration method: " + raw));
    }
}
