package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;
import com.feeledger.policy.Condition;
import com.feeledger.policy.LineSelector;
import com.feeledger.policy.Operator;

import java.util.List;
import java.util.Optional;

/**
 * Picks the lines a line-scoped component applies to. A missing field makes
 * its condition false; in strict mode it is an error instead.
 */
final class LineSelectorEvaluator {

    private LineSelectorEvaluator() {
    }

    static List<PricedLine> select(String componentId, LineSelector selector, List<PricedLine> lines, boolean strict) {
        if (selector == null) {
            return lines;
        }
        boolean include = selector.mode() == LineSelector.Mode.INCLUDE;
        return lines.stream()
            .filter(line -> matches(componentId, selector, line, strict) == include)
            .toList();
    }

    private static boolean matches(String componentId, LineSelector selector, PricedLine line, boolean strict) {
        boolean where = selector.where().stream().allMatch(c -> test(componentId, c, line, strict));
        if (!where) {
            return false;
        }
        if (selector.anyOf().isEmpty()) {
            return true;
        }
        return selector.anyOf().stream()
            .anyMatch(group -> group.stream().allMatch(c -> test(componentId, c, line, strict)));
    }

    private static boolean test(String componentId, Condition condition, PricedLine line, boolean strict) {
        Optional<Object> value = line.value(condition.field());
        if (value.isEmpty() && strict
                && condition.operator() != Operator.EXISTS && condition.operator() != Operator.NOT_EXISTS) {
            throw new FeeCalculationException(ErrorCode.LINE_SELECTOR_FIELD_MISSING,
                componentId + ": line " + line.lineId() + " has no field '" + condition.field() + "'");
        }
        return ConditionEvaluator.matches(condition, value);
    }
}
