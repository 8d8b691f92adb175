package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.policy.ProrationMethod;

import java.math.BigDecimal;

/**
 * @param prorationWeight  the line's share of the component's weight total, in {@code [0, 1]}
 */
public record LineContribution(
    @JsonProperty("component_id") String componentId,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("proration_method") ProrationMethod prorationMethod,
    @JsonProperty("proration_weight") BigDecimal prorationWeight
) {
}
