package com.feeledger.engine;

import com.feeledger.math.DecimalMath;
import com.feeledger.policy.ProrationMethod;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits every applied component amount across the lines it applies to.
 *
 * Each line's weight is its net, gross, quantity or 1 depending on the
 * proration method. A line-scoped tier is weighted by the amount each line
 * was charged at its own bracket. When all weights are zero the split is
 * equal. Shares are rounded to the policy precision and the last line absorbs
 * the remainder, so per-line sums reconcile exactly to the component amount.
 */
final class Allocator {

    static final int WEIGHT_SCALE = 6;

    private Allocator() {
    }

    static List<LineAllocation> allocate(List<WorkingEntry> entries, List<PricedLine> lines,
                                         ProrationMethod defaultMethod, int scale) {
        Map<String, List<LineContribution>> byLine = new LinkedHashMap<>();
        lines.forEach(line -> byLine.put(line.lineId(), new ArrayList<>()));

        for (WorkingEntry entry : entries) {
            if (!entry.isRewritable() || entry.amount.signum() == 0 || entry.lines.isEmpty()) {
                continue;
            }
            ProrationMethod configured = entry.component.header().proration() != null
                ? entry.component.header().proration() : defaultMethod;
            ProrationMethod method = configured;
            List<BigDecimal> weights = entry.lineAmounts.isEmpty()
                ? entry.lines.stream().map(line -> weight(line, configured)).toList()
                : entry.lines.stream()
                    .map(line -> entry.lineAmounts.getOrDefault(line.lineId(), BigDecimal.ZERO))
                    .toList();
            BigDecimal weightSum = DecimalMath.sum(weights);
            if (weightSum.signum() == 0) {
                method = ProrationMethod.EQUAL;
                weights = entry.lines.stream().map(line -> BigDecimal.ONE).toList();
                weightSum = BigDecimal.valueOf(entry.lines.size());
            }
            List<BigDecimal> shares = DecimalMath.allocate(entry.amount, weights, scale);
            for (int i = 0; i < entry.lines.size(); i++) {
                BigDecimal ratio = weights.get(i).divide(weightSum, WEIGHT_SCALE, RoundingMode.HALF_UP);
                byLine.get(entry.lines.get(i).lineId())
                    .add(new LineContribution(entry.component.id(), shares.get(i), method, ratio));
            }
        }

        List<LineAllocation> allocation = new ArrayList<>();
        byLine.forEach((lineId, contributions) -> allocation.add(new LineAllocation(
            lineId,
            DecimalMath.sum(contributions.stream().map(LineContribution::amount).toList(), scale),
            contributions)));
        return allocation;
    }

    static BigDecimal weight(PricedLine line, ProrationMethod method) {
        return switch (method) {
            case BY_NET -> line.net();
            case BY_GROSS -> line.gross();
            case BY_QUANTITY -> line.quantity();
            case EQUAL -> BigDecimal.ONE;
        };
    }
}
