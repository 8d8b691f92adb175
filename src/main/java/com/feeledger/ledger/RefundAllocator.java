package com.feeledger.ledger;

import com.feeledger.engine.BreakdownEntry;
import com.feeledger.engine.LineAllocation;
import com.feeledger.engine.LineContribution;
import com.feeledger.math.DecimalMath;
import com.feeledger.policy.RefundBehavior;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component-aware refund computation over an original settlement.
 *
 * For each original component, in original order:
 * - tagged {@code non_refundable} or {@code refundable=false}: contributes zero
 * - PROPORTIONAL: {@code amount * ratio}
 * - FIXED_ONLY: as PROPORTIONAL for fixed_unit / fixed_order, zero otherwise
 * - NONE: zero
 * where {@code ratio = refundAmount / original order net} (zero when the base is zero).
 * With {@code cap_refund_to_original} the contribution never exceeds the original amount.
 */
public final class RefundAllocator {

    static final String REASON_NOT_APPLIED = "not_applied";
    static final String REASON_NON_REFUNDABLE_TAG = "non_refundable_tag";
    static final String REASON_NOT_REFUNDABLE = "not_refundable";
    static final String REASON_BEHAVIOR_NONE = "behavior_none";
    static final String REASON_NOT_FIXED = "fixed_only_excluded";
    static final String REASON_PROPORTIONAL = "proportional";
    static final String REASON_FIXED_ONLY = "fixed_only";
    static final String REASON_CAPPED = "capped_to_original";

    private RefundAllocator() {
    }

    /**
     * @param refunded  positive total given back, the sum of {@code items[].refundedFee}
     */
    public record RefundPlan(BigDecimal ratio, BigDecimal refunded, List<RefundPlanItem> items) {}

    public static BigDecimal ratio(BigDecimal refundAmount, BigDecimal originalBase) {
        return DecimalMath.divOrZero(refundAmount, originalBase, DecimalMath.RATIO_SCALE);
    }

    public static RefundPlan plan(List<BreakdownEntry> breakdown, BigDecimal refundAmount,
                                  BigDecimal originalBase, int scale) {
        BigDecimal ratio = ratio(refundAmount, originalBase);
        List<RefundPlanItem> items = new ArrayList<>();
        BigDecimal refunded = BigDecimal.ZERO.setScale(scale);
        for (BreakdownEntry entry : breakdown) {
            RefundPlanItem item = refundFor(entry, ratio, scale);
            items.add(item);
            refunded = refunded.add(item.refundedFee());
        }
        return new RefundPlan(ratio, refunded, items);
    }

    /** Global proportional refund for entries that carry no breakdown. */
    public static RefundPlan globalPlan(BigDecimal totalFee, BigDecimal refundAmount,
                                        BigDecimal originalBase, int scale) {
        BigDecimal ratio = ratio(refundAmount, originalBase);
        BigDecimal refunded = DecimalMath.round(DecimalMath.mul(totalFee, ratio), scale);
        refunded = clampToOriginal(refunded, DecimalMath.round(totalFee, scale));
        return new RefundPlan(ratio, refunded, List.of());
    }

    static RefundPlanItem refundFor(BreakdownEntry entry, BigDecimal ratio, int scale) {
        BigDecimal zero = BigDecimal.ZERO.setScale(scale);
        RefundBehavior behavior = entry.refund().behavior();
        boolean refundable = !entry.isNonRefundable();
        if (!entry.applied() || entry.amount().signum() == 0) {
            return item(entry, ratio, zero, refundable, REASON_NOT_APPLIED);
        }
        if (entry.tags().contains(BreakdownEntry.NON_REFUNDABLE_TAG)) {
            return item(entry, ratio, zero, false, REASON_NON_REFUNDABLE_TAG);
        }
        if (!entry.refund().refundable()) {
            return item(entry, ratio, zero, false, REASON_NOT_REFUNDABLE);
        }
        if (behavior == RefundBehavior.NONE) {
            return item(entry, ratio, zero, true, REASON_BEHAVIOR_NONE);
        }
        if (behavior == RefundBehavior.FIXED_ONLY && !entry.isFixedType()) {
            return item(entry, ratio, zero, true, REASON_NOT_FIXED);
        }

        BigDecimal refund = DecimalMath.round(DecimalMath.mul(entry.amount(), ratio), scale);
        String reason = behavior == RefundBehavior.FIXED_ONLY ? REASON_FIXED_ONLY : REASON_PROPORTIONAL;
        if (entry.refund().capRefundToOriginal()) {
            BigDecimal capped = clampToOriginal(refund, entry.amount());
            if (capped.compareTo(refund) != 0) {
                reason = REASON_CAPPED;
            }
            refund = capped;
        }
        return item(entry, ratio, refund, true, reason);
    }

    /**
     * Splits each component's refund across the lines of the original
     * allocation, weighted by that component's original line contributions.
     * Returns negative (debit) amounts.
     */
    public static List<LineAllocation> allocate(List<LineAllocation> original, RefundPlan plan, int scale) {
        Map<String, List<LineContribution>> byLine = new LinkedHashMap<>();
        original.forEach(line -> byLine.put(line.lineId(), new ArrayList<>()));

        if (plan.items().isEmpty()) {
            allocateTotal(original, plan.refunded(), scale, byLine);
        }
        for (RefundPlanItem item : plan.items()) {
            if (item.refundedFee().signum() == 0) {
                continue;
            }
            List<String> lineIds = new ArrayList<>();
            List<LineContribution> originals = new ArrayList<>();
            for (LineAllocation line : original) {
                for (LineContribution contribution : line.components()) {
                    if (contribution.componentId().equals(item.componentId())) {
                        lineIds.add(line.lineId());
                        originals.add(contribution);
                    }
                }
            }
            if (originals.isEmpty()) {
                continue;
            }
            List<BigDecimal> shares = DecimalMath.allocate(item.refundedFee().negate(),
                originals.stream().map(LineContribution::amount).toList(), scale);
            for (int i = 0; i < originals.size(); i++) {
                LineContribution source = originals.get(i);
                byLine.get(lineIds.get(i)).add(new LineContribution(
                    item.componentId(), shares.get(i), source.prorationMethod(), source.prorationWeight()));
            }
        }

        List<LineAllocation> result = new ArrayList<>();
        byLine.forEach((lineId, contributions) -> result.add(new LineAllocation(
            lineId,
            DecimalMath.sum(contributions.stream().map(LineContribution::amount).toList(), scale),
            contributions)));
        return result;
    }

    private static void allocateTotal(List<LineAllocation> original, BigDecimal refunded, int scale,
                                      Map<String, List<LineContribution>> byLine) {
        if (refunded.signum() == 0 || original.isEmpty()) {
            return;
        }
        List<BigDecimal> shares = DecimalMath.allocate(refunded.negate(),
            original.stream().map(LineAllocation::feeAmount).toList(), scale);
        for (int i = 0; i < original.size(); i++) {
            byLine.get(original.get(i).lineId()).add(new LineContribution(null, shares.get(i), null, null));
        }
    }

    private static BigDecimal clampToOriginal(BigDecimal refund, BigDecimal original) {
        return original.signum() >= 0 ? refund.min(original) : refund.max(original);
    }

    private static RefundPlanItem item(BreakdownEntry entry, BigDecimal ratio, BigDecimal refunded,
                                       boolean refundable, String reason) {
        return new RefundPlanItem(entry.componentId(), entry.type(), entry.amount(), ratio, refunded,
            refundable, entry.refund().behavior(), reason);
    }
}
