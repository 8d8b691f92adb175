package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.policy.ComponentType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Display row for one applied component of a settlement. */
public record FeeSummaryItem(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("type") ComponentType type,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("applied_to") List<String> appliedTo,
    @JsonProperty("details") Map<String, Object> details
) {
}
