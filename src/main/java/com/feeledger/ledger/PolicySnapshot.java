package com.feeledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PolicySnapshot(
    @JsonProperty("policy_key") String policyKey,
    @JsonProperty("version") int version,
    @JsonProperty("component_count") int componentCount,
    @JsonProperty("policy_hash") String policyHash,
    @JsonProperty("precision") int precision,
    @JsonProperty("channel_key") String channelKey
) {
}
