package com.feeguard.pool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeguard.metric.MetricCalculator;

import java.math.BigInteger;

/**
 * A settled trade as reported by the host.
 *
 * @param size order size; the magnitude is used, {@code null} counts as zero
 * @param resultingMetric price or tick after execution, {@code null} if unavailable
 */
public record Trade(
    @JsonProperty("size") BigInteger size,
    @JsonProperty("resulting_metric") Long resultingMetric
) {

    public Trade {
        size = MetricCalculator.magnitude(size);
    }

    /** A trade that carries no information about the pool and must not update its history. */
    @JsonIgnore
    public boolean isDegenerate() {
        return size.signum() == 0 || resultingMetric == null;
    }
}
