package com.feeledger.math;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fixed-precision decimal arithmetic for every money computation.
 *
 * Values are {@link BigDecimal}s (never binary floats). Division and rounding
 * take an explicit scale; the rounding mode is HALF_UP unless a caller passes
 * another one.
 */
public final class DecimalMath {

    public static final RoundingMode DEFAULT_ROUNDING = RoundingMode.HALF_UP;

    /** Scale used for intermediate ratios (refund ratios, proration weights). */
    public static final int RATIO_SCALE = 10;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DecimalMath() {
    }

    public static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a decimal value: " + raw, ex);
        }
    }

    public static String format(BigDecimal value, int scale) {
        return round(orZero(value), scale).toPlainString();
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return orZero(a).add(orZero(b));
    }

    public static BigDecimal sub(BigDecimal a, BigDecimal b) {
        return orZero(a).subtract(orZero(b));
    }

    public static BigDecimal mul(BigDecimal a, BigDecimal b) {
        return orZero(a).multiply(orZero(b));
    }

    public static BigDecimal div(BigDecimal dividend, BigDecimal divisor, int scale) {
        return div(dividend, divisor, scale, DEFAULT_ROUNDING);
    }

    public static BigDecimal div(BigDecimal dividend, BigDecimal divisor, int scale, RoundingMode mode) {
        if (divisor == null || divisor.signum() == 0) {
            throw new DivisionByZeroException("Division by zero: " + orZero(dividend).toPlainString() + " / 0");
        }
        return orZero(dividend).divide(divisor, scale, mode);
    }

    /** Division that yields zero instead of failing when the divisor is zero. */
    public static BigDecimal divOrZero(BigDecimal dividend, BigDecimal divisor, int scale) {
        if (divisor == null || divisor.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return div(dividend, divisor, scale);
    }

    /** {@code value * percent / 100}, unrounded. */
    public static BigDecimal percentOf(BigDecimal value, BigDecimal percent) {
        return mul(value, percent).divide(HUNDRED);
    }

    public static BigDecimal round(BigDecimal value, int scale) {
        return round(value, scale, DEFAULT_ROUNDING);
    }

    public static BigDecimal round(BigDecimal value, int scale, RoundingMode mode) {
        return orZero(value).setScale(scale, mode);
    }

    public static int compare(BigDecimal a, BigDecimal b) {
        return orZero(a).compareTo(orZero(b));
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    public static BigDecimal negate(BigDecimal value) {
        return orZero(value).negate();
    }

    public static BigDecimal abs(BigDecimal value) {
        return orZero(value).abs();
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return compare(a, b) <= 0 ? orZero(a) : orZero(b);
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return compare(a, b) >= 0 ? orZero(a) : orZero(b);
    }

    /** Clamps to {@code [min, max]}; a null bound is open. */
    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        BigDecimal result = orZero(value);
        if (min != null && result.compareTo(min) < 0) {
            result = min;
        }
        if (max != null && result.compareTo(max) > 0) {
            result = max;
        }
        return result;
    }

    public static BigDecimal sum(Collection<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            total = total.add(orZero(v));
        }
        return total;
    }

    public static BigDecimal sum(Collection<BigDecimal> values, int scale) {
        return round(sum(values), scale);
    }

    /**
     * Splits {@code amount} across buckets in proportion to {@code weights}.
     * Every share is rounded to {@code scale} and the last bucket absorbs the
     * rounding remainder, so the shares always add up to the rounded amount.
     * When all weights are zero the split is equal.
     */
    public static List<BigDecimal> allocate(BigDecimal amount, List<BigDecimal> weights, int scale) {
        if (weights.isEmpty()) {
            return List.of();
        }
        BigDecimal total = round(amount, scale);
        BigDecimal weightSum = sum(weights);
        boolean equalSplit = weightSum.signum() == 0;
        BigDecimal count = BigDecimal.valueOf(weights.size());

        List<BigDecimal> shares = new ArrayList<>(weights.size());
        BigDecimal assigned = BigDecimal.ZERO.setScale(scale);
        for (int i = 0; i < weights.size(); i++) {
            BigDecimal share;
            if (i == weights.size() - 1) {
                share = total.subtract(assigned);
            } else if (equalSplit) {
                share = div(total, count, scale);
            } else {
                share = round(total.multiply(orZero(weights.get(i))).divide(weightSum, scale + RATIO_SCALE, DEFAULT_ROUNDING), scale);
            }
            shares.add(share);
            assigned = assigned.add(share);
        }
        return shares;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
