package com.feeguard.metric;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk inputs derived for one incoming trade from the pool's pre-trade history.
 *
 * @param relativeSize trade size over the average trade size, in [0, 10]; 1 on cold start
 * @param impact absolute metric move since the last recorded trade; 0 when no prior metric exists
 * @param spikeCount consecutive spike counter, capped at 10
 */
public record TradeMetrics(
    @JsonProperty("relative_size") int relativeSize,
    @JsonProperty("impact") long impact,
    @JsonProperty("spike_count") int spikeCount
) {}
