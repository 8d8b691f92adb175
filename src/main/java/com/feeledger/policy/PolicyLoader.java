package com.feeledger.policy;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Effective-dated policy resolution for a channel.
 */
public interface PolicyLoader {

    Optional<FeePolicy> load(String channelKey, LocalDate asOf);

    /**
     * Resolves a scope-specific policy, falling back to the channel's global
     * policy. Loaders without scoped policies ignore {@code scopeId}.
     */
    default Optional<FeePolicy> load(String channelKey, LocalDate asOf, String scopeId) {
        return load(channelKey, asOf);
    }
}
