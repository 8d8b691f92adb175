package com.feeledger.policy;

import java.time.LocalDate;
import java.util.List;

/**
 * A versioned set of fee components for a channel. Immutable once a ledger
 * entry references it; later edits publish a new version.
 *
 * @param precision      decimal scale of every computed amount
 * @param strict         turns soft anomalies (unmatched tier, empty cap targets) into errors
 * @param effectiveFrom  inclusive; null means always
 * @param effectiveTo    inclusive; null means open-ended
 * @param priority       higher wins when several policies are effective at once
 * @param scopeId        null for the global policy of the channel
 */
public record FeePolicy(
    String policyKey,
    int version,
    String channelKey,
    String currency,
    int precision,
    boolean strict,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    int priority,
    String scopeId,
    List<FeeComponent> components
) {

    public static final int DEFAULT_PRECISION = 2;

    public FeePolicy {
        components = components != null ? List.copyOf(components) : List.of();
    }

    public static FeePolicy of(String policyKey, String channelKey, String currency, List<FeeComponent> components) {
        return new FeePolicy(policyKey, 1, channelKey, currency, DEFAULT_PRECISION, false,
            null, null, 0, null, components);
    }

    public boolean isEffectiveOn(LocalDate date) {
        return (effectiveFrom == null || !date.isBefore(effectiveFrom))
            && (effectiveTo == null || !date.isAfter(effectiveTo));
    }

    public FeePolicy withComponents(List<FeeComponent> newComponents) {
        return new FeePolicy(policyKey, version, channelKey, currency, precision, strict,
            effectiveFrom, effectiveTo, priority, scopeId, newComponents);
    }

    public FeePolicy withStrict(boolean newStrict) {
        return new FeePolicy(policyKey, version, channelKey, currency, precision, newStrict,
            effectiveFrom, effectiveTo, priority, scopeId, components);
    }

    public FeePolicy withPrecision(int newPrecision) {
        return new FeePolicy(policyKey, version, channelKey, currency, newPrecision, strict,
            effectiveFrom, effectiveTo, priority, scopeId, components);
    }

    public FeePolicy withEffectiveRange(LocalDate from, LocalDate to) {
        return new FeePolicy(policyKey, version, channelKey, currency, precision, strict,
            from, to, priority, scopeId, components);
    }

    public FeePolicy withVersion(int newVersion) {
        return new FeePolicy(policyKey, newVersion, channelKey, currency, precision, strict,
            effectiveFrom, effectiveTo, priority, scopeId, components);
    }

    public FeePolicy withScope(String newScopeId, int newPriority) {
        return new FeePolicy(policyKey, version, channelKey, currency, precision, strict,
            effectiveFrom, effectiveTo, newPriority, newScopeId, components);
    }
}
