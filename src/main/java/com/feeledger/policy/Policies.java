package com.feeledger.policy;

import java.math.BigDecimal;
import java.util.List;

/**
 * Factories for common single-component policies.
 */
public final class Policies {

    private Policies() {
    }

    /** One order-scoped RATE component on {@code net}. */
    public static FeePolicy simpleRate(String policyKey, String channelKey, String currency, BigDecimal rate) {
        FeeComponent component = new FeeComponent.Rate(ComponentHeader.of(policyKey + "_rate", Scope.ORDER), rate);
        return FeePolicy.of(policyKey, channelKey, currency, List.of(component));
    }

    /** One order-scoped TIER component on {@code net} with closed-closed brackets. */
    public static FeePolicy tiered(String policyKey, String channelKey, String currency, List<TierBracket> tiers) {
        FeeComponent component = new FeeComponent.Tier(ComponentHeader.of(policyKey + "_tier", Scope.ORDER),
            TierBy.BASE, TierBoundary.CLOSED_CLOSED, tiers);
        return FeePolicy.of(policyKey, channelKey, currency, List.of(component));
    }
}
