package com.feeledger.engine;

import com.feeledger.policy.ProrationMethod;

/**
 * @param strict            null defers to the policy's own strict flag
 * @param defaultProration  used by components without a proration method
 */
public record CalculationOptions(Boolean strict, ProrationMethod defaultProration) {

    public static final CalculationOptions DEFAULTS = new CalculationOptions(null, ProrationMethod.BY_NET);

    public CalculationOptions {
        defaultProration = defaultProration != null ? defaultProration : ProrationMethod.BY_NET;
    }

    public static CalculationOptions strictMode() {
        return new CalculationOptions(true, ProrationMethod.BY_NET);
    }
}
