package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;
import com.feeledger.math.DecimalMath;
import com.feeledger.policy.FeeComponent;

import java.math.BigDecimal;
import java.util.List;

/**
 * Applies the components that rewrite earlier breakdown rows: caps and overrides.
 * Nothing else in the engine changes an amount after it was first recorded.
 */
final class ComponentRewriter {

    static final String OVERRIDE_EXCLUDED = "override_excluded";
    static final String CAP_NO_TARGETS = "cap_no_targets";

    private ComponentRewriter() {
    }

    /**
     * Clamps the summed amount of the targeted prior entries to the cap's bounds
     * and pushes the delta back onto the targets in proportion to their amounts.
     * The last target absorbs the rounding remainder; a zero sum splits equally.
     */
    static void applyCap(FeeComponent.Cap cap, WorkingEntry capEntry, List<WorkingEntry> prior,
                         EvaluationContext ctx) {
        int scale = ctx.scale();
        List<WorkingEntry> targets = prior.stream()
            .filter(WorkingEntry::isRewritable)
            .filter(e -> cap.targets().isEmpty()
                || cap.targets().matches(e.component.id(), e.component.tags(), e.component.type(), e.component.scope()))
            .toList();

        if (targets.isEmpty()) {
            ErrorCode code = cap.targets().isEmpty() ? ErrorCode.CAP_TARGETS_EMPTY : ErrorCode.CAP_TARGETS_NO_MATCH;
            String message = cap.id() + ": cap has no matching prior components";
            if (ctx.strict()) {
                throw new FeeCalculationException(code, message);
            }
            ctx.warn(code, message, cap.id());
            capEntry.discard(CAP_NO_TARGETS, scale);
            return;
        }

        BigDecimal min = cap.min() != null ? DecimalMath.round(cap.min(), scale) : null;
        BigDecimal max = cap.max() != null ? DecimalMath.round(cap.max(), scale) : null;
        List<BigDecimal> amounts = targets.stream().map(e -> e.amount).toList();
        BigDecimal before = DecimalMath.sum(amounts, scale);
        BigDecimal clamped = DecimalMath.clamp(before, min, max);
        BigDecimal delta = before.subtract(clamped);

        capEntry.targetSumBefore = before;
        capEntry.capDelta = delta;
        capEntry.targetIds.addAll(targets.stream().map(e -> e.component.id()).toList());
        if (delta.signum() > 0) {
            capEntry.capBound = "max";
        } else if (delta.signum() < 0) {
            capEntry.capBound = "min";
        }
        if (delta.signum() == 0) {
            return;
        }

        List<BigDecimal> shares = DecimalMath.allocate(delta, amounts, scale);
        for (int i = 0; i < targets.size(); i++) {
            WorkingEntry target = targets.get(i);
            target.amount = target.amount.subtract(shares.get(i));
            target.capDelta = DecimalMath.add(target.capDelta, shares.get(i));
            target.capBound = capEntry.capBound;
        }
        ctx.logCap(cap.id(), before, clamped);
    }

    /** Rewrites the prior entries the override matches. */
    static void applyOverride(FeeComponent.OverrideRule override, WorkingEntry overrideEntry,
                              List<WorkingEntry> prior, int scale) {
        for (WorkingEntry entry : prior) {
            if (entry.isRewritable() && override.excludes(entry.component)) {
                exclude(override, entry, scale);
                overrideEntry.targetIds.add(entry.component.id());
            }
        }
    }

    /** Zeroes the entry, or sets it to the override's replacement amount. */
    static void exclude(FeeComponent.OverrideRule override, WorkingEntry entry, int scale) {
        String reason = override.reason() != null ? override.reason() : override.id();
        if (override.replaceAmount() != null) {
            entry.amount = DecimalMath.round(override.replaceAmount(), scale);
            entry.overrideReason = reason;
            return;
        }
        entry.discard(OVERRIDE_EXCLUDED, scale);
        entry.overrideReason = reason;
    }
}
