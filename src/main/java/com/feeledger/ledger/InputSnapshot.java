package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.engine.OrderTotals;

import java.util.List;

/**
 * Transaction amounts at settlement time. Refund ratios are computed against
 * {@code orderTotals.net}.
 */
public record InputSnapshot(
    @JsonProperty("lines_count") int linesCount,
    @JsonProperty("order_totals") OrderTotals orderTotals,
    @JsonProperty("line_ids") List<String> lineIds
) {

    public InputSnapshot {
        lineIds = lineIds != null ? List.copyOf(lineIds) : List.of();
    }
}
