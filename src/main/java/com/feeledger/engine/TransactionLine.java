package com.feeledger.engine;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One transaction line as supplied by the caller. Either {@code net} or
 * {@code gross} must be present; everything else is derived when missing.
 *
 * @param taxRate     percentage used to derive net from gross when {@code tax} is absent
 * @param attributes  free-form line fields visible to line selectors and base expressions
 */
public record TransactionLine(
    String lineId,
    BigDecimal net,
    BigDecimal gross,
    BigDecimal tax,
    BigDecimal taxRate,
    BigDecimal quantity,
    Map<String, Object> attributes
) {

    public TransactionLine {
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public static TransactionLine ofNet(String lineId, BigDecimal net) {
        return new TransactionLine(lineId, net, null, null, null, null, null);
    }

    public static TransactionLine ofNet(String lineId, BigDecimal net, BigDecimal quantity) {
        return new TransactionLine(lineId, net, null, null, null, quantity, null);
    }

    public TransactionLine withAttributes(Map<String, Object> newAttributes) {
        return new TransactionLine(lineId, net, gross, tax, taxRate, quantity, newAttributes);
    }

    public TransactionLine withTax(BigDecimal newTax) {
        return new TransactionLine(lineId, net, gross, newTax, taxRate, quantity, attributes);
    }
}
