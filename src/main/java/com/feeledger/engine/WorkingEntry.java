package com.feeledger.engine;

import com.feeledger.policy.FeeComponent;
import com.feeledger.policy.TierBracket;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable breakdown row used while a calculation runs. Frozen into a
 * {@link BreakdownEntry} once every component has been evaluated.
 */
final class WorkingEntry {

    final FeeComponent component;
    BigDecimal amount;
    BigDecimal baseUsed;
    BigDecimal rate;
    BigDecimal fixed;
    Integer tierIndex;
    TierBracket tier;
    final Map<String, Integer> tierSelected = new LinkedHashMap<>();
    /** Unrounded per-line amounts of a line-scoped tier; allocation weights when present. */
    final Map<String, BigDecimal> lineAmounts = new LinkedHashMap<>();
    BigDecimal capDelta;
    BigDecimal targetSumBefore;
    String capBound;
    final List<String> targetIds = new ArrayList<>();
    String overrideReason;
    boolean applied = true;
    String discardReason;
    List<PricedLine> lines = List.of();

    WorkingEntry(FeeComponent component, int scale) {
        this.component = component;
        this.amount = BigDecimal.ZERO.setScale(scale);
    }

    void discard(String reason, int scale) {
        applied = false;
        discardReason = reason;
        amount = BigDecimal.ZERO.setScale(scale);
    }

    /** Applied fee-producing entry that a cap or override may rewrite. */
    boolean isRewritable() {
        return applied && !(component instanceof FeeComponent.Rewriting);
    }

    BreakdownEntry freeze() {
        return new BreakdownEntry(
            component.id(),
            component.header().name(),
            component.type(),
            component.scope(),
            amount,
            baseUsed,
            rate,
            fixed,
            tierIndex,
            tier,
            capDelta,
            targetSumBefore,
            capBound,
            targetIds,
            overrideReason,
            applied,
            discardReason,
            component.tags(),
            component.header().refund(),
            component.header().proration(),
            lines.stream().map(PricedLine::lineId).toList(),
            tierSelected
        );
    }
}
