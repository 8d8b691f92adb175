package com.feeledger.engine;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * A transaction line after amount normalization: every monetary field is set.
 *
 * @param index  position in the caller's line list; allocation remainders go to the highest index
 */
public record PricedLine(
    int index,
    String lineId,
    BigDecimal net,
    BigDecimal gross,
    BigDecimal tax,
    BigDecimal quantity,
    BigDecimal unitPrice,
    Map<String, Object> attributes
) {

    static final String ATTRIBUTE_PREFIX = "attributes.";

    /** Numeric field used by base expressions. */
    public Optional<BigDecimal> amount(String field) {
        return switch (field) {
            case "net" -> Optional.of(net);
            case "gross" -> Optional.of(gross);
            case "tax" -> Optional.of(tax);
            case "quantity" -> Optional.of(quantity);
            case "unit_price" -> Optional.of(unitPrice);
            default -> value(field).map(ConditionEvaluator::toDecimal);
        };
    }

    /** Raw field used by line selectors; falls back to attributes. */
    public Optional<Object> value(String field) {
        return switch (field) {
            case "line_id" -> Optional.ofNullable(lineId);
            case "net" -> Optional.of(net);
            case "gross" -> Optional.of(gross);
            case "tax" -> Optional.of(tax);
            case "quantity" -> Optional.of(quantity);
            case "unit_price" -> Optional.of(unitPrice);
            default -> {
                String key = field.startsWith(ATTRIBUTE_PREFIX) ? field.substring(ATTRIBUTE_PREFIX.length()) : field;
                yield Optional.ofNullable(attributes.get(key));
            }
        };
    }
}
