package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.policy.ComponentType;
import com.feeledger.policy.RefundBehavior;

import java.math.BigDecimal;

/**
 * How one original component contributed to a refund.
 *
 * @param refundedFee  positive amount given back; the adjustment entry carries it negated
 * @param reasonCode   why the contribution is what it is, e.g. {@code non_refundable_tag}
 */
public record RefundPlanItem(
    @JsonProperty("component_id") String componentId,
    @JsonProperty("type") ComponentType type,
    @JsonProperty("original_fee") BigDecimal originalFee,
    @JsonProperty("refund_ratio") BigDecimal refundRatio,
    @JsonProperty("refunded_fee") BigDecimal refundedFee,
    @JsonProperty("refundable") boolean refundable,
    @JsonProperty("behavior") RefundBehavior behavior,
    @JsonProperty("reason_code") String reasonCode
) {
}
