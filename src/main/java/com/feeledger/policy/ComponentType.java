package com.feeledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ComponentType {
    RATE("rate"),
    RATE_PP("rate_pp"),
    FIXED_UNIT("fixed_unit"),
    FIXED_ORDER("fixed_order"),
    TIER("tier"),
    CAP("cap"),
    OVERRIDE("override");

    private final String value;

    ComponentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComponentType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown component type: " + raw));
    }
}
