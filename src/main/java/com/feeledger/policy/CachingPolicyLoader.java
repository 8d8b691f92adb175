package com.feeledger.policy;

import java.time.LocalDate;
import java.util.Optional;

public class CachingPolicyLoader implements PolicyLoader {

    private final PolicyLoader delegate;
    private final PolicyCache cache;

    public CachingPolicyLoader(PolicyLoader delegate, PolicyCache cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public Optional<FeePolicy> load(String channelKey, LocalDate asOf) {
        return load(channelKey, asOf, null);
    }

    @Override
    public Optional<FeePolicy> load(String channelKey, LocalDate asOf, String scopeId) {
        return cache.get(new PolicyCache.Key(channelKey, asOf, scopeId),
            () -> delegate.load(channelKey, asOf, scopeId));
    }
}
