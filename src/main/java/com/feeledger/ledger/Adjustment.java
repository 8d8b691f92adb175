package com.feeledger.ledger;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request to adjust a settled entry.
 *
 * @param eventType     ADJUST, REFUND or CHARGEBACK; null means ADJUST
 * @param refundAmount  order amount being refunded (AUTO); defaults to the sum of {@code lineRefunds}
 * @param feeAmount     fee to debit (MANUAL); sign is ignored
 * @param currency      checked against the original in strict mode
 * @param lineRefunds   per-line refunded amounts, keyed by line id
 */
public record Adjustment(
    EventType eventType,
    AdjustmentMode mode,
    BigDecimal refundAmount,
    BigDecimal feeAmount,
    String currency,
    String reason,
    Map<String, BigDecimal> lineRefunds,
    String idempotencyKey
) {

    public Adjustment {
        eventType = eventType != null ? eventType : EventType.ADJUST;
        mode = mode != null ? mode : AdjustmentMode.AUTO;
        lineRefunds = lineRefunds != null ? Map.copyOf(lineRefunds) : Map.of();
    }

    public static Adjustment refund(BigDecimal refundAmount, String reason) {
        return new Adjustment(EventType.REFUND, AdjustmentMode.AUTO, refundAmount, null, null, reason, null, null);
    }

    public static Adjustment manual(BigDecimal feeAmount, String reason) {
        return new Adjustment(EventType.ADJUST, AdjustmentMode.MANUAL, null, feeAmount, null, reason, null, null);
    }

    public Adjustment withCurrency(String newCurrency) {
        return new Adjustment(eventType, mode, refundAmount, feeAmount, newCurrency, reason, lineRefunds, idempotencyKey);
    }

    public Adjustment withLineRefunds(Map<String, BigDecimal> newLineRefunds) {
        return new Adjustment(eventType, mode, refundAmount, feeAmount, currency, reason, newLineRefunds, idempotencyKey);
    }

    public Adjustment withIdempotencyKey(String newKey) {
        return new Adjustment(eventType, mode, refundAmount, feeAmount, currency, reason, lineRefunds, newKey);
    }
}
