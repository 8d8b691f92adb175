package com.feeledger.engine;

import com.feeledger.policy.Condition;
import com.feeledger.policy.Operator;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a single {@link Condition} against a resolved field value.
 *
 * Equality compares numerically when both sides are numeric, otherwise as
 * strings. Ordering operators need two numbers and are false otherwise.
 */
final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    static boolean matches(Condition condition, Optional<Object> actual) {
        Operator operator = condition.operator();
        Object expected = condition.value();
        if (operator == Operator.EXISTS) {
            return actual.isPresent();
        }
        if (operator == Operator.NOT_EXISTS) {
            return actual.isEmpty();
        }
        if (actual.isEmpty()) {
            return operator == Operator.NEQ || operator == Operator.NOT_IN;
        }
        Object value = actual.get();
        return switch (operator) {
            case EQ -> same(value, expected);
            case NEQ -> !same(value, expected);
            case GT -> compare(value, expected) > 0;
            case GTE -> compare(value, expected) >= 0;
            case LT -> compareOrMax(value, expected) < 0;
            case LTE -> compareOrMax(value, expected) <= 0;
            case IN -> expected instanceof Collection<?> options && options.stream().anyMatch(o -> same(value, o));
            case NOT_IN -> !(expected instanceof Collection<?> options) || options.stream().noneMatch(o -> same(value, o));
            case CONTAINS -> contains(value, expected);
            case HAS_FLAG -> hasFlag(value, expected);
            case EXISTS, NOT_EXISTS -> throw new IllegalStateException("handled above");
        };
    }

    /** Resolves a dot path against nested maps. */
    static Optional<Object> resolvePath(Map<String, Object> root, String path) {
        Object current = root;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(part)) {
                return Optional.empty();
            }
            current = map.get(part);
        }
        return Optional.ofNullable(current);
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static boolean same(Object a, Object b) {
        BigDecimal left = a instanceof Boolean ? null : toDecimal(a);
        BigDecimal right = b instanceof Boolean ? null : toDecimal(b);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(String.valueOf(a), String.valueOf(b));
    }

    /** -1, 0, 1 or {@link Integer#MIN_VALUE} when either side is not numeric. */
    private static int compare(Object a, Object b) {
        BigDecimal left = toDecimal(a);
        BigDecimal right = toDecimal(b);
        if (left == null || right == null) {
            return Integer.MIN_VALUE;
        }
        return left.compareTo(right);
    }

    private static int compareOrMax(Object a, Object b) {
        int result = compare(a, b);
        return result == Integer.MIN_VALUE ? Integer.MAX_VALUE : result;
    }

    private static boolean contains(Object value, Object expected) {
        if (value instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> same(item, expected));
        }
        return expected != null && String.valueOf(value).contains(String.valueOf(expected));
    }

    private static boolean hasFlag(Object value, Object expected) {
        if (value instanceof Collection<?> flags) {
            return flags.stream().anyMatch(flag -> same(flag, expected));
        }
        if (value instanceof Map<?, ?> flags) {
            return Boolean.TRUE.equals(flags.get(String.valueOf(expected)));
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return false;
    }
}
