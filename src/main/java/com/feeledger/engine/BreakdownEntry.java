package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.policy.ComponentType;
import com.feeledger.policy.ProrationMethod;
import com.feeledger.policy.RefundConfig;
import com.feeledger.policy.Scope;
import com.feeledger.policy.TierBracket;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-component result of a calculation, including components that were
 * evaluated but not applied.
 *
 * @param amount           signed, at the policy's precision
 * @param capDelta         on a cap entry: targeted sum before minus after;
 *                         on a targeted entry: the part of that delta it absorbed
 * @param targetSumBefore  cap entries only
 * @param capBound         {@code "max"} or {@code "min"} when a cap changed its targets
 * @param targetIds        components a cap constrained or an override rewrote
 * @param refund           refund rules snapshot, used by later adjustments
 * @param lineIds          lines the amount is allocated over
 * @param tierSelected     line-scoped tiers: bracket index chosen for each charged line
 */
public record BreakdownEntry(
    @JsonProperty("component_id") String componentId,
    @JsonProperty("name") String name,
    @JsonProperty("type") ComponentType type,
    @JsonProperty("scope") Scope scope,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("base_used") BigDecimal baseUsed,
    @JsonProperty("rate") BigDecimal rate,
    @JsonProperty("fixed") BigDecimal fixed,
    @JsonProperty("tier_index") Integer tierIndex,
    @JsonProperty("tier") TierBracket tier,
    @JsonProperty("cap_delta") BigDecimal capDelta,
    @JsonProperty("target_sum_before") BigDecimal targetSumBefore,
    @JsonProperty("cap_bound") String capBound,
    @JsonProperty("target_ids") List<String> targetIds,
    @JsonProperty("override_reason") String overrideReason,
    @JsonProperty("applied") boolean applied,
    @JsonProperty("discard_reason") String discardReason,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("refund") RefundConfig refund,
    @JsonProperty("proration") ProrationMethod proration,
    @JsonProperty("line_ids") List<String> lineIds,
    @JsonProperty("tier_selected") Map<String, Integer> tierSelected
) {

    public static final String NON_REFUNDABLE_TAG = "non_refundable";

    public BreakdownEntry {
        targetIds = targetIds != null ? List.copyOf(targetIds) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        lineIds = lineIds != null ? List.copyOf(lineIds) : List.of();
        refund = refund != null ? refund : RefundConfig.DEFAULT;
        tierSelected = tierSelected != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(tierSelected)) : Map.of();
    }

    public boolean isNonRefundable() {
        return tags.contains(NON_REFUNDABLE_TAG) || !refund.refundable();
    }

    public boolean isFixedType() {
        return type == ComponentType.FIXED_UNIT || type == ComponentType.FIXED_ORDER;
    }

    public BreakdownEntry withAmount(BigDecimal newAmount) {
        return new BreakdownEntry(componentId, name, type, scope, newAmount, baseUsed, rate, fixed, tierIndex, tier,
            capDelta, targetSumBefore, capBound, targetIds, overrideReason, applied, discardReason, tags, refund,
            proration, lineIds, tierSelected);
    }
}
