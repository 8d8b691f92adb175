package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeledger.error.ErrorCode;

/**
 * Soft anomaly on an otherwise successful calculation. Strict mode turns the
 * same conditions into errors.
 */
public record CalculationWarning(
    @JsonProperty("code") ErrorCode code,
    @JsonProperty("message") String message,
    @JsonProperty("component_id") String componentId
) {
}
