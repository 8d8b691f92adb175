package com.feeledger.ledger;

import com.feeledger.engine.BreakdownEntry;
import com.feeledger.engine.CalculationOptions;
import com.feeledger.engine.FeeCalculation;
import com.feeledger.engine.FeeCalculationEngine;
import com.feeledger.engine.FeeTransaction;
import com.feeledger.engine.LineAllocation;
import com.feeledger.engine.TransactionLine;
import com.feeledger.error.ErrorCode;
import com.feeledger.error.Result;
import com.feeledger.math.DecimalMath;
import com.feeledger.policy.FeePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger lifecycle: settle, simulate, adjust and running totals.
 *
 * The ledger holds no state and no locks. Policies come from the caller's
 * {@link com.feeledger.policy.PolicyLoader}, entries go through the caller's
 * {@link EntryStore}, and every write sequence runs inside the store's
 * transaction boundary so a failure leaves no partial rows.
 * Errors are returned as {@link Result} values.
 */
public class FeeLedger {

    private static final Logger log = LoggerFactory.getLogger(FeeLedger.class);

    private final FeeCalculationEngine engine;
    private final Clock clock;

    public FeeLedger(FeeCalculationEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Resolves the channel's policy, calculates and persists a SETTLE entry.
     * A repeated idempotency key with the same signature returns the stored
     * entry without writing.
     */
    public Result<SettleOutcome> settle(FeeTransaction input, LedgerCallbacks callbacks, LedgerOptions options) {
        LedgerOptions opts = options != null ? options : LedgerOptions.DEFAULTS;
        if (callbacks == null || callbacks.policyLoader() == null || callbacks.entryStore() == null) {
            return Result.err(ErrorCode.MISSING_CALLBACK, "settle needs a policy loader and an entry store");
        }
        if (input == null || input.channelKey() == null || input.channelKey().isBlank()) {
            return Result.err(ErrorCode.MISSING_CHANNEL, "channel_key is required");
        }

        LocalDate asOf = input.asOf() != null ? input.asOf() : LocalDate.now(clock);
        String scopeId = opts.source() != null ? opts.source().scopeId() : null;
        Optional<FeePolicy> policy = callbacks.policyLoader().load(input.channelKey(), asOf, scopeId);
        if (policy.isEmpty()) {
            log.warn("No fee policy for channel={} as_of={}", input.channelKey(), asOf);
            return Result.err(ErrorCode.NO_POLICY,
                "no policy for channel " + input.channelKey() + " on " + asOf);
        }

        Result<FeeCalculation> calculated = engine.calculate(input, policy.get(), calculationOptions(opts));
        if (!(calculated instanceof Result.Ok<FeeCalculation> ok)) {
            return calculated.asError();
        }
        FeeCalculation calculation = ok.value();
        EntryStore store = callbacks.entryStore();

        try {
            return store.inTransaction(() -> {
                if (input.idempotencyKey() != null) {
                    Optional<LedgerEntry> existing = store.findByIdempotencyKey(input.idempotencyKey());
                    if (existing.isPresent()) {
                        return replay(existing.get(), calculation);
                    }
                }
                String transactionId = input.transactionId() != null
                    ? input.transactionId() : UUID.randomUUID().toString();
                LedgerEntry entry = LedgerEntry.settlement(calculation, policy.get(), transactionId, opts.source(),
                    input.idempotencyKey(), Instant.now(clock), opts.meta());
                long entryId = store.saveEntry(entry);
                LedgerEntry saved = entry.withEntryId(entryId);
                log.info("Settled entry={} transaction={} policy={} v{} total_fee={}",
                    entryId, transactionId, policy.get().policyKey(), policy.get().version(),
                    saved.totalFee().toPlainString());
                return Result.ok(new SettleOutcome(saved, summarize(saved.breakdown()), calculation.warnings(), false));
            });
        } catch (RuntimeException ex) {
            log.warn("Settlement rolled back for channel={}: {}", input.channelKey(), ex.getMessage());
            return Result.err(ErrorCode.PERSISTENCE_FAILED, "settlement could not be persisted: " + ex.getMessage());
        }
    }

    /** Same calculation as {@link #settle}, against a given policy, without persisting. */
    public Result<FeeCalculation> simulate(FeeTransaction input, FeePolicy policy, LedgerOptions options) {
        LedgerOptions opts = options != null ? options : LedgerOptions.DEFAULTS;
        return engine.calculate(input, policy, calculationOptions(opts));
    }

    /** Treats a single item as a one-line transaction and returns that line's allocation. */
    public Result<LineAllocation> calculateForItem(TransactionLine item, FeePolicy policy, LedgerOptions options) {
        if (policy == null) {
            return Result.err(ErrorCode.NO_POLICY, "policy is required");
        }
        FeeTransaction single = FeeTransaction.builder()
            .channelKey(policy.channelKey())
            .line(item)
            .build();
        return simulate(single, policy, options).map(calculation -> calculation.allocation().get(0));
    }

    /**
     * Writes an adjustment entry against a settled entry and flips the
     * original's status to {@code adjusted}. The original is loaded with a row
     * lock so concurrent adjustments of the same entry are serialized.
     */
    public Result<AdjustOutcome> adjust(long originalEntryId, Adjustment adjustment, LedgerCallbacks callbacks,
                                        LedgerOptions options) {
        LedgerOptions opts = options != null ? options : LedgerOptions.DEFAULTS;
        if (callbacks == null || callbacks.entryStore() == null) {
            return Result.err(ErrorCode.MISSING_CALLBACK, "adjust needs an entry store");
        }
        if (adjustment == null) {
            return Result.err(ErrorCode.INVALID_ADJUSTMENT, "adjustment is required");
        }
        EntryStore store = callbacks.entryStore();
        try {
            return store.inTransaction(() -> adjustLocked(originalEntryId, adjustment, store, opts));
        } catch (RuntimeException ex) {
            log.warn("Adjustment of entry={} rolled back: {}", originalEntryId, ex.getMessage());
            return Result.err(ErrorCode.PERSISTENCE_FAILED, "adjustment could not be persisted: " + ex.getMessage());
        }
    }

    public Result<TransactionFees> getTransactionFees(String transactionId, LedgerCallbacks callbacks) {
        if (callbacks == null || callbacks.entryStore() == null) {
            return Result.err(ErrorCode.MISSING_CALLBACK, "getTransactionFees needs an entry store");
        }
        return Result.ok(totals(transactionId, callbacks.entryStore().loadByTransaction(transactionId)));
    }

    private Result<AdjustOutcome> adjustLocked(long originalEntryId, Adjustment adjustment, EntryStore store,
                                               LedgerOptions opts) {
        Optional<LedgerEntry> loaded = store.loadEntryForUpdate(originalEntryId);
        if (loaded.isEmpty()) {
            return Result.err(ErrorCode.ERR_LEDGER_ENTRY_NOT_FOUND, "ledger entry " + originalEntryId + " not found");
        }
        LedgerEntry original = loaded.get();
        if (!original.isSettlement()) {
            return Result.err(ErrorCode.INVALID_ADJUSTMENT, "only SETTLE entries can be adjusted");
        }

        if (adjustment.idempotencyKey() != null) {
            Optional<LedgerEntry> existing = store.findByIdempotencyKey(adjustment.idempotencyKey());
            if (existing.isPresent()) {
                if (!Objects.equals(existing.get().parentEntryId(), original.entryId())) {
                    return Result.err(ErrorCode.IDEMPOTENCY_CONFLICT,
                        "idempotency_key " + adjustment.idempotencyKey() + " belongs to another entry");
                }
                log.info("Adjustment replayed for idempotency_key={}", adjustment.idempotencyKey());
                return Result.ok(new AdjustOutcome(existing.get(), existing.get().totalFee(),
                    runningTotal(store, original.transactionId(), original.precision()), true));
            }
        }

        boolean strict = Boolean.TRUE.equals(opts.strict());
        int scale = original.precision();
        if (strict && adjustment.currency() != null && !adjustment.currency().equals(original.currency())) {
            return Result.err(ErrorCode.ERR_CURRENCY_MISMATCH,
                "adjustment currency " + adjustment.currency() + " does not match " + original.currency());
        }

        List<String> lineIds = original.allocation().stream().map(LineAllocation::lineId).toList();
        for (String lineId : adjustment.lineRefunds().keySet()) {
            if (!lineIds.contains(lineId)) {
                return Result.err(ErrorCode.ERR_LINE_NOT_FOUND, "line " + lineId + " is not part of entry " + originalEntryId);
            }
        }
        Coverage coverage = coverage(lineIds, adjustment.lineRefunds());

        BigDecimal originalBase = original.inputSnapshot() != null && original.inputSnapshot().orderTotals() != null
            ? DecimalMath.orZero(original.inputSnapshot().orderTotals().net())
            : BigDecimal.ZERO;
        RefundAllocator.RefundPlan plan;
        BigDecimal refundBase = null;
        boolean fallback = false;

        if (adjustment.mode() == AdjustmentMode.MANUAL) {
            if (adjustment.feeAmount() == null) {
                return Result.err(ErrorCode.INVALID_ADJUSTMENT, "manual adjustment needs fee_amount");
            }
            plan = new RefundAllocator.RefundPlan(null, DecimalMath.round(adjustment.feeAmount().abs(), scale), List.of());
        } else {
            if (adjustment.refundAmount() == null && adjustment.lineRefunds().isEmpty()) {
                return Result.err(ErrorCode.INVALID_ADJUSTMENT, "refund_amount or line_refunds is required");
            }
            refundBase = adjustment.refundAmount() != null
                ? adjustment.refundAmount()
                : DecimalMath.sum(new ArrayList<>(adjustment.lineRefunds().values()));
            if (refundBase.signum() < 0) {
                return Result.err(ErrorCode.INVALID_ADJUSTMENT, "refund amount must not be negative");
            }
            if (strict) {
                BigDecimal previouslyRefunded = priorRefundBase(store, original);
                if (refundBase.compareTo(originalBase) > 0 || previouslyRefunded.add(refundBase).compareTo(originalBase) > 0) {
                    return Result.err(ErrorCode.ERR_EXCEEDS_ORIGINAL,
                        "refund " + refundBase.toPlainString() + " (already refunded " + previouslyRefunded.toPlainString()
                            + ") exceeds original base " + originalBase.toPlainString());
                }
            }
            if (original.breakdown().isEmpty()) {
                if (strict) {
                    return Result.err(ErrorCode.ERR_NO_BREAKDOWN, "entry " + originalEntryId + " has no breakdown");
                }
                plan = RefundAllocator.globalPlan(original.totalFee(), refundBase, originalBase, scale);
                fallback = true;
            } else {
                plan = RefundAllocator.plan(original.breakdown(), refundBase, originalBase, scale);
            }
        }

        BigDecimal feeAdjustment = plan.refunded().negate();
        BigDecimal running = runningTotal(store, original.transactionId(), scale);
        if (strict && !opts.allowNegativeRunningTotal()) {
            if (running.add(feeAdjustment).signum() < 0) {
                return Result.err(ErrorCode.ERR_NEGATIVE_RUNNING_TOTAL,
                    "adjustment " + feeAdjustment.toPlainString() + " would take the running total of "
                        + running.toPlainString() + " below zero");
            }
        }

        LedgerEntry entry = new LedgerEntry(
            null,
            original.transactionId(),
            adjustment.eventType(),
            EntryStatus.ACTIVE,
            original.currency(),
            feeAdjustment,
            negatedBreakdown(original.breakdown(), plan),
            RefundAllocator.allocate(original.allocation(), plan, scale),
            List.of(),
            original.policySnapshot(),
            original.inputSnapshot(),
            original.signature(),
            adjustment.idempotencyKey(),
            original.entryId(),
            original.source(),
            plan.items(),
            new AdjustmentDetails(adjustment.mode(), refundBase, adjustment.reason(), adjustment.lineRefunds(),
                coverage, fallback),
            Instant.now(clock),
            opts.meta()
        );
        long entryId = store.saveEntry(entry);
        store.updateEntryStatus(original.entryId(), EntryStatus.ADJUSTED);
        LedgerEntry saved = entry.withEntryId(entryId);
        log.info("Adjusted entry={} with entry={} type={} mode={} fee_adjustment={}",
            original.entryId(), entryId, adjustment.eventType(), adjustment.mode(), feeAdjustment.toPlainString());
        return Result.ok(new AdjustOutcome(saved, feeAdjustment, running.add(feeAdjustment), false));
    }

    private Result<SettleOutcome> replay(LedgerEntry existing, FeeCalculation calculation) {
        if (!existing.isSettlement()) {
            return Result.err(ErrorCode.IDEMPOTENCY_CONFLICT,
                "idempotency_key " + existing.idempotencyKey() + " belongs to adjustment " + existing.entryId());
        }
        if (!Objects.equals(existing.signature(), calculation.signature())) {
            return Result.err(ErrorCode.IDEMPOTENCY_CONFLICT,
                "idempotency_key " + existing.idempotencyKey() + " was used for a different calculation");
        }
        log.info("Settlement replayed for idempotency_key={} entry={}", existing.idempotencyKey(), existing.entryId());
        return Result.ok(new SettleOutcome(existing, summarize(existing.breakdown()), existing.warnings(), true));
    }

    private static BigDecimal runningTotal(EntryStore store, String transactionId, int scale) {
        return DecimalMath.sum(store.loadByTransaction(transactionId).stream().map(LedgerEntry::totalFee).toList(), scale);
    }

    private BigDecimal priorRefundBase(EntryStore store, LedgerEntry original) {
        return DecimalMath.sum(store.loadByTransaction(original.transactionId()).stream()
            .filter(e -> Objects.equals(e.parentEntryId(), original.entryId()))
            .filter(e -> e.adjustment() != null && e.adjustment().refundBase() != null)
            .map(e -> e.adjustment().refundBase())
            .toList());
    }

    /** Original rows with their amounts replaced by the negated refund of each component. */
    private List<BreakdownEntry> negatedBreakdown(List<BreakdownEntry> original, RefundAllocator.RefundPlan plan) {
        if (plan.items().isEmpty()) {
            return List.of();
        }
        Map<String, BigDecimal> refunds = new LinkedHashMap<>();
        plan.items().forEach(item -> refunds.put(item.componentId(), item.refundedFee()));
        return original.stream()
            .map(e -> e.withAmount(refunds.getOrDefault(e.componentId(), BigDecimal.ZERO).negate()))
            .toList();
    }

    private Coverage coverage(List<String> lineIds, Map<String, BigDecimal> lineRefunds) {
        if (lineRefunds.isEmpty()) {
            return new Coverage(lineIds, List.of());
        }
        List<String> affected = new ArrayList<>();
        List<String> unaffected = new ArrayList<>();
        for (String lineId : lineIds) {
            BigDecimal refunded = lineRefunds.get(lineId);
            if (refunded != null && refunded.signum() > 0) {
                affected.add(lineId);
            } else {
                unaffected.add(lineId);
            }
        }
        return new Coverage(affected, unaffected);
    }

    static TransactionFees totals(String transactionId, List<LedgerEntry> entries) {
        BigDecimal totalFees = BigDecimal.ZERO;
        BigDecimal totalAdjustments = BigDecimal.ZERO;
        String currency = null;
        for (LedgerEntry entry : entries) {
            if (currency == null) {
                currency = entry.currency();
            }
            if (entry.isSettlement()) {
                totalFees = totalFees.add(entry.totalFee());
            } else {
                totalAdjustments = totalAdjustments.add(entry.totalFee());
            }
        }
        int scale = entries.isEmpty() ? 2 : entries.get(0).precision();
        return new TransactionFees(
            transactionId,
            currency,
            DecimalMath.round(totalFees, scale),
            DecimalMath.round(totalAdjustments, scale),
            DecimalMath.round(totalFees.add(totalAdjustments), scale),
            entries.size()
        );
    }

    private List<FeeSummaryItem> summarize(List<BreakdownEntry> breakdown) {
        List<FeeSummaryItem> items = new ArrayList<>();
        for (BreakdownEntry entry : breakdown) {
            if (!entry.applied()) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            putIfPresent(details, "base", entry.baseUsed());
            putIfPresent(details, "rate", entry.rate());
            putIfPresent(details, "fixed", entry.fixed());
            putIfPresent(details, "tier", entry.tier());
            if (!entry.tierSelected().isEmpty()) {
                details.put("tier_selected", entry.tierSelected());
            }
            putIfPresent(details, "cap_delta", entry.capDelta());
            putIfPresent(details, "override_reason", entry.overrideReason());
            items.add(new FeeSummaryItem(entry.componentId(), entry.name(), entry.type(), entry.amount(),
                entry.tags(), entry.lineIds(), details));
        }
        return items;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static CalculationOptions calculationOptions(LedgerOptions options) {
        return new CalculationOptions(options.strict(), options.defaultProration());
    }
}
