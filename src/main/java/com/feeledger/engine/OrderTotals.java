package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Order-level amounts. Any null field defaults to the sum over the lines
 * (shipping defaults to zero).
 */
public record OrderTotals(
    @JsonProperty("net") BigDecimal net,
    @JsonProperty("gross") BigDecimal gross,
    @JsonProperty("tax") BigDecimal tax,
    @JsonProperty("shipping") BigDecimal shipping,
    @JsonProperty("quantity") BigDecimal quantity
) {

    public static final OrderTotals EMPTY = new OrderTotals(null, null, null, null, null);
}
