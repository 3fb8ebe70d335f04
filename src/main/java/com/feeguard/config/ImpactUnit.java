package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Unit of the price metric supplied by the host.
 *
 * TICK deltas are used as-is. PRICE deltas are divided by the configured
 * price-impact divisor and capped at 10 so they land on the same scale.
 */
public enum ImpactUnit {
    TICK("tick"),
    PRICE("price");

    private final String value;

    ImpactUnit(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ImpactUnit fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown impact unit: " + raw));
    }
}
