package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Successful calculation. {@code totalFee} equals the sum of breakdown amounts
 * and the sum of allocation fee amounts.
 *
 * @param orderTotals  normalized order totals the calculation used
 */
public record FeeCalculation(
    @JsonProperty("currency") String currency,
    @JsonProperty("total_fee") BigDecimal totalFee,
    @JsonProperty("breakdown") List<BreakdownEntry> breakdown,
    @JsonProperty("allocation") List<LineAllocation> allocation,
    @JsonProperty("warnings") List<CalculationWarning> warnings,
    @JsonProperty("meta") CalculationMeta meta,
    @JsonProperty("explain_plan") ExplainPlan explainPlan,
    @JsonProperty("order_totals") OrderTotals orderTotals
) {

    public FeeCalculation {
        breakdown = List.copyOf(breakdown);
        allocation = List.copyOf(allocation);
        warnings = List.copyOf(warnings);
    }

    public String signature() {
        return meta.signature();
    }

    public int precision() {
        return meta.precision();
    }
}
