package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.engine.BreakdownEntry;
import com.feeledger.engine.CalculationWarning;
import com.feeledger.engine.FeeCalculation;
import com.feeledger.engine.LineAllocation;
import com.feeledger.policy.FeePolicy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of a settlement or an adjustment.
 *
 * Invariants:
 * - a SETTLE entry's {@code totalFee} equals the sum of its breakdown amounts
 * - an adjustment's {@code totalFee} is the negated refunded amount
 * - the sum of {@code totalFee} over all entries of a transaction is its running net fee
 *
 * Only the status of a settled entry ever changes after persistence.
 *
 * @param entryId        storage-assigned; null until saved
 * @param parentEntryId  the adjusted settlement, for adjustments only
 * @param adjustment     null for settlements
 */
public record LedgerEntry(
    @JsonProperty("entry_id") Long entryId,
    @JsonProperty("transaction_id") String transactionId,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("status") EntryStatus status,
    @JsonProperty("currency") String currency,
    @JsonProperty("total_fee") BigDecimal totalFee,
    @JsonProperty("breakdown") List<BreakdownEntry> breakdown,
    @JsonProperty("allocation") List<LineAllocation> allocation,
    @JsonProperty("warnings") List<CalculationWarning> warnings,
    @JsonProperty("policy_snapshot") PolicySnapshot policySnapshot,
    @JsonProperty("input_snapshot") InputSnapshot inputSnapshot,
    @JsonProperty("signature") String signature,
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("parent_entry_id") Long parentEntryId,
    @JsonProperty("source") FeeSource source,
    @JsonProperty("refund_plan") List<RefundPlanItem> refundPlan,
    @JsonProperty("adjustment") AdjustmentDetails adjustment,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("meta") Map<String, String> meta
) {

    public LedgerEntry {
        breakdown = breakdown != null ? List.copyOf(breakdown) : List.of();
        allocation = allocation != null ? List.copyOf(allocation) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        refundPlan = refundPlan != null ? List.copyOf(refundPlan) : List.of();
        meta = meta != null ? Map.copyOf(meta) : Map.of();
    }

    /** Builds an unsaved SETTLE entry from a successful calculation. */
    public static LedgerEntry settlement(FeeCalculation calculation, FeePolicy policy, String transactionId,
                                         FeeSource source, String idempotencyKey, Instant createdAt,
                                         Map<String, String> meta) {
        PolicySnapshot policySnapshot = new PolicySnapshot(
            policy.policyKey(),
            policy.version(),
            policy.components().size(),
            calculation.meta().policyHash(),
            calculation.precision(),
            policy.channelKey()
        );
        InputSnapshot inputSnapshot = new InputSnapshot(
            calculation.allocation().size(),
            calculation.orderTotals(),
            calculation.allocation().stream().map(LineAllocation::lineId).toList()
        );
        return new LedgerEntry(
            null,
            transactionId,
            EventType.SETTLE,
            EntryStatus.ACTIVE,
            calculation.currency(),
            calculation.totalFee(),
            calculation.breakdown(),
            calculation.allocation(),
            calculation.warnings(),
            policySnapshot,
            inputSnapshot,
            calculation.signature(),
            idempotencyKey,
            null,
            source,
            List.of(),
            null,
            createdAt,
            meta
        );
    }

    public boolean isSettlement() {
        return eventType == EventType.SETTLE;
    }

    public int precision() {
        return policySnapshot != null ? policySnapshot.precision() : 2;
    }

    public LedgerEntry withEntryId(long id) {
        return new LedgerEntry(id, transactionId, eventType, status, currency, totalFee, breakdown, allocation,
            warnings, policySnapshot, inputSnapshot, signature, idempotencyKey, parentEntryId, source, refundPlan,
            adjustment, createdAt, meta);
    }

    public LedgerEntry withStatus(EntryStatus newStatus) {
        return new LedgerEntry(entryId, transactionId, eventType, newStatus, currency, totalFee, breakdown, allocation,
            warnings, policySnapshot, inputSnapshot, signature, idempotencyKey, parentEntryId, source, refundPlan,
            adjustment, createdAt, meta);
    }
}
