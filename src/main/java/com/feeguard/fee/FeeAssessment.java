package com.feeguard.fee;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeguard.config.FeeModel;
import com.feeguard.metric.TradeMetrics;

/**
 * Outcome of pricing one trade: the fee plus the inputs that produced it.
 *
 * @param riskScore score in [0, 255] for the discrete model, {@code null} for the quadratic model
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeeAssessment(
    @JsonProperty("fee_bps") int feeBps,
    @JsonProperty("risk_score") Integer riskScore,
    @JsonProperty("metrics") TradeMetrics metrics,
    @JsonProperty("model") FeeModel model,
    @JsonProperty("strategy_id") String strategyId,
    @JsonProperty("strategy_version") String strategyVersion
) {}
