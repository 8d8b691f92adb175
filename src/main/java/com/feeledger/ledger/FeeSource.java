package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Business object a ledger entry belongs to, e.g. {@code (sales, order, 42, null)}.
 */
public record FeeSource(
    @JsonProperty("module") String module,
    @JsonProperty("object_type") String objectType,
    @JsonProperty("object_id") String objectId,
    @JsonProperty("scope_id") String scopeId
) {

    public static FeeSource of(String module, String objectType, String objectId) {
        return new FeeSource(module, objectType, objectId, null);
    }
}
