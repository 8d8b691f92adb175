package com.feeledger.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RefundConfig(
    @JsonProperty("refundable") boolean refundable,
    @JsonProperty("behavior") RefundBehavior behavior,
    @JsonProperty("cap_refund_to_original") boolean capRefundToOriginal
) {

    public static final RefundConfig DEFAULT = new RefundConfig(true, RefundBehavior.PROPORTIONAL, true);

    public RefundConfig {
        behavior = behavior != null ? behavior : RefundBehavior.PROPORTIONAL;
    }
}
