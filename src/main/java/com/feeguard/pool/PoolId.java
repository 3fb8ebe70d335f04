package com.feeguard.pool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque key identifying one trading pool. The engine attaches no meaning to its content.
 */
public record PoolId(@JsonValue String value) implements Comparable<PoolId> {

    public PoolId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("pool id must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PoolId of(String value) {
        return new PoolId(value);
    }

    @Override
    public int compareTo(PoolId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
