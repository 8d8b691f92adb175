package com.feeledger.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RunningTotals(
    @JsonProperty("total_fees") BigDecimal totalFees,
    @JsonProperty("total_adjustments") BigDecimal totalAdjustments,
    @JsonProperty("net_fees") BigDecimal netFees,
    @JsonProperty("entry_count") long entryCount
) {
}
