package com.feeguard.fee;

/**
 * Bounds of the discrete model's risk score. Scores saturate at the bounds, never wrap.
 */
public final class RiskScore {

    public static final int MIN = 0;
    public static final int MAX = 255;

    private RiskScore() {
    }

    public static int clamp(long raw) {
        if (raw < MIN) {
            return MIN;
        }
        return raw > MAX ? MAX : (int) raw;
    }
}
