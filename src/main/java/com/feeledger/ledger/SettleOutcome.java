package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.engine.CalculationWarning;

import java.util.List;

/**
 * @param replayed  true when an entry with the same idempotency key and signature already existed
 */
public record SettleOutcome(
    @JsonProperty("entry") LedgerEntry entry,
    @JsonProperty("fees") List<FeeSummaryItem> fees,
    @JsonProperty("warnings") List<CalculationWarning> warnings,
    @JsonProperty("replayed") boolean replayed
) {
}
