package com.feeledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Value used to pick a tier bracket. {@code UNIT_PRICE} is the base divided by the quantity. */
public enum TierBy {
    BASE("base"),
    UNIT_PRICE("unit_price"),
    QUANTITY("quantity");

    private final String value;

    TierBy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TierBy fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown tier_by: " + raw));
    }
}
