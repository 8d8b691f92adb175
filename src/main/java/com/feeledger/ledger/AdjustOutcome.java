package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record AdjustOutcome(
    @JsonProperty("entry") LedgerEntry entry,
    @JsonProperty("fee_adjustment") BigDecimal feeAdjustment,
    @JsonProperty("running_total") BigDecimal runningTotal,
    @JsonProperty("replayed") boolean replayed
) {
}
