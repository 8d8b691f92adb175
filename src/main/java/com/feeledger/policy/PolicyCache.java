package com.feeledger.policy;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Explicit cache of resolved policies keyed by {@code (channel_key, as_of, scope_id)}.
 * Only hits are cached; a miss is re-resolved on the next call. Callers that
 * publish a new policy version invalidate the affected channel.
 *
 * Every distinct {@code as_of} day is its own key, so the cache holds at most
 * {@code maxEntries} keys and evicts the least recently used one beyond that.
 */
public class PolicyCache {

    public static final int DEFAULT_MAX_ENTRIES = 1024;

    public record Key(String channelKey, LocalDate asOf, String scopeId) {}

    private final Map<Key, FeePolicy> entries;

    public PolicyCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public PolicyCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, FeePolicy> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public Optional<FeePolicy> get(Key key, Supplier<Optional<FeePolicy>> resolver) {
        synchronized (entries) {
            FeePolicy cached = entries.get(key);
            if (cached != null) {
                return Optional.of(cached);
            }
        }
        Optional<FeePolicy> resolved = resolver.get();
        resolved.ifPresent(policy -> {
            synchronized (entries) {
                entries.putIfAbsent(key, policy);
            }
        });
        return resolved;
    }

    public void invalidate(String channelKey) {
        synchronized (entries) {
            entries.keySet().removeIf(key -> Objects.equals(key.channelKey(), channelKey));
        }
    }

    public void invalidateAll() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
