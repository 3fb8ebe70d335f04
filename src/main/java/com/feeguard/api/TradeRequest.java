package com.feeguard.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of quote and trade requests.
 *
 * @param currentMetric price or tick; before execution for quotes, after execution for trades
 * @param tradeSize absolute order size
 */
public record TradeRequest(
    @JsonProperty("current_metric") Long currentMetric,
    @JsonProperty("trade_size") BigInteger tradeSize
) {}
