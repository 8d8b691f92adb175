package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Adjustment-specific fields of an adjustment entry.
 *
 * @param refundBase  order amount refunded; null for manual adjustments
 */
public record AdjustmentDetails(
    @JsonProperty("mode") AdjustmentMode mode,
    @JsonProperty("refund_base") BigDecimal refundBase,
    @JsonProperty("reason") String reason,
    @JsonProperty("line_refunds") Map<String, BigDecimal> lineRefunds,
    @JsonProperty("coverage") Coverage coverage,
    @JsonProperty("fallback") boolean fallback
) {

    public AdjustmentDetails {
        lineRefunds = lineRefunds != null ? Map.copyOf(lineRefunds) : Map.of();
        coverage = coverage != null ? coverage : Coverage.NONE;
    }
}
