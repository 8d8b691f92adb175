package com.feeledger.policy;

/**
 * A single predicate {@code field operator value}. A component's conditions are
 * ANDed; a line selector reuses the same shape for line fields.
 *
 * @param field   dot path resolved against the evaluation context (e.g. {@code order.net}, {@code attributes.sku})
 * @param value   literal compared against the field; a list for {@code in}/{@code not_in}; ignored by {@code exists}
 */
public record Condition(String field, Operator operator, Object value) {
}
