package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * Running fee position of one transaction.
 *
 * {@code totalFees} sums SETTLE entries, {@code totalAdjustments} sums every
 * other entry (negative for refunds), {@code netFees} is their sum.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionFees(
    @JsonProperty("transaction_id") String transactionId,
    @JsonProperty("currency") String currency,
    @JsonProperty("total_fees") BigDecimal totalFees,
    @JsonProperty("total_adjustments") BigDecimal totalAdjustments,
    @JsonProperty("net_fees") BigDecimal netFees,
    @JsonProperty("entry_count") int entryCount
) {
}
