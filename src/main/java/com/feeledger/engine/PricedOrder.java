package com.feeledger.engine;

import java.math.BigDecimal;
import java.util.Optional;

public record PricedOrder(
    BigDecimal net,
    BigDecimal gross,
    BigDecimal tax,
    BigDecimal shipping,
    BigDecimal quantity,
    int lineCount
) {

    public Optional<BigDecimal> amount(String field) {
        return switch (field) {
            case "net" -> Optional.of(net);
            case "gross" -> Optional.of(gross);
            case "tax" -> Optional.of(tax);
            case "shipping" -> Optional.of(shipping);
            case "quantity" -> Optional.of(quantity);
            case "line_count" -> Optional.of(BigDecimal.valueOf(lineCount));
            default -> Optional.empty();
        };
    }

    public OrderTotals toTotals() {
        return new OrderTotals(net, gross, tax, shipping, quantity);
    }
}
