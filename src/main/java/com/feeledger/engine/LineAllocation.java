package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record LineAllocation(
    @JsonProperty("line_id") String lineId,
    @JsonProperty("fee_amount") BigDecimal feeAmount,
    @JsonProperty("components") List<LineContribution> components
) {

    public LineAllocation {
        components = components != null ? List.copyOf(components) : List.of();
    }
}
