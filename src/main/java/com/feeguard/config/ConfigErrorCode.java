package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a pool configuration was rejected.
 *
 * The first three codes are the range and ordering errors a pool operator can hit with
 * well-formed input. {@link #INVALID_PARAMETER} extends that set for values the three
 * cannot describe: missing fields and negative weights or coefficients.
 */
public enum ConfigErrorCode {
    /** Fees are not strictly increasing ({@code feeLow < feeMed < feeHigh}, {@code baseFee < maxFee}). */
    INVALID_FEE_RANGE("INVALID_FEE_RANGE"),
    /** {@code thresholdLow >= thresholdHigh}, or a threshold is not an 8-bit score value. */
    INVALID_THRESHOLD_ORDER("INVALID_THRESHOLD_ORDER"),
    /** A fee lies outside {@code (0, 10000]} bps. */
    FEE_OUT_OF_BOUNDS("FEE_OUT_OF_BOUNDS"),
    /** A weight or coefficient is negative, or a required parameter is missing. */
    INVALID_PARAMETER("INVALID_PARAMETER");

    private final String value;

    ConfigErrorCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
