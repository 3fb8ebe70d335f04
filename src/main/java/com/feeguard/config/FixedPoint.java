package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Non-negative decimal with one fractional digit, stored as an integer scaled by {@link #SCALE}.
 *
 * 0.5 is held as 5 and 0.2 as 2. Products are computed exactly and then divided by
 * the scale with floor rounding, so every caller truncates the same way.
 */
public record FixedPoint(long scaled) {

    public static final int SCALE = 10;

    private static final BigInteger SCALE_BIG = BigInteger.valueOf(SCALE);

    public static FixedPoint ofScaled(long scaled) {
        return new FixedPoint(scaled);
    }

    /**
     * Parses a decimal such as {@code 0.5}. More than one fractional digit is rejected
     * rather than rounded.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FixedPoint of(BigDecimal value) {
        if (value == null) {
            return null;
        }
        try {
            return new FixedPoint(value.movePointRight(1).longValueExact());
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException(
                "fixed-point value must have at most one fractional digit: " + value.toPlainString(), ex);
        }
    }

    public static FixedPoint of(String value) {
        return of(new BigDecimal(value));
    }

    @JsonValue
    public BigDecimal decimalValue() {
        return BigDecimal.valueOf(scaled, 1);
    }

    public boolean isNegative() {
        return scaled < 0;
    }

    /** {@code floor(this * x)} for non-negative {@code x}. */
    public BigInteger multiplyFloor(BigInteger x) {
        return BigInteger.valueOf(scaled).multiply(x).divide(SCALE_BIG);
    }

    @Override
    public String toString() {
        return decimalValue().toPlainString();
    }
}
