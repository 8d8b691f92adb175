package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * @param asOf  the transaction date policies were resolved for; null when not given
 */
public record CalculationMeta(
    @JsonProperty("signature") String signature,
    @JsonProperty("policy_hash") String policyHash,
    @JsonProperty("policy_key") String policyKey,
    @JsonProperty("policy_version") int policyVersion,
    @JsonProperty("precision") int precision,
    @JsonProperty("strict") boolean strict,
    @JsonProperty("engine_version") String engineVersion,
    @JsonProperty("as_of") LocalDate asOf
) {
}
