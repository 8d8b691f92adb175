package com.feeledger.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPolicyRepositoryTest {

    private static final LocalDate JAN = LocalDate.of(2024, 1, 1);
    private static final LocalDate JUN = LocalDate.of(2024, 6, 1);

    private InMemoryPolicyRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPolicyRepository(new PolicyValidator());
    }

    @Nested
    @DisplayName("Effective-dated resolution")
    class Resolution {

        @Test
        void load_picksPolicyEffectiveOnDate() {
            repository.register(rate("old", "5").withEffectiveRange(JAN, JUN.minusDays(1)));
            repository.register(rate("new", "4").withEffectiveRange(JUN, null));

            assertEquals("old", repository.load("marketplace", LocalDate.of(2024, 3, 1)).orElseThrow().policyKey());
            assertEquals("new", repository.load("marketplace", JUN).orElseThrow().policyKey());
            assertTrue(repository.load("marketplace", LocalDate.of(2023, 12, 31)).isEmpty());
        }

        @Test
        void load_prefersHigherPriority() {
            repository.register(rate("base", "5").withEffectiveRange(JAN, null));
            repository.register(rate("promo", "2").withEffectiveRange(JUN, JUN.plusDays(30)).withScope(null, 10));

            assertEquals("promo", repository.load("marketplace", JUN.plusDays(1)).orElseThrow().policyKey());
            assertEquals("base", repository.load("marketplace", JUN.plusDays(31)).orElseThrow().policyKey());
        }

        @Test
        void load_prefersScopedPolicyAndFallsBackToGlobal() {
            repository.register(rate("global", "5"));
            repository.register(rate("tenant", "3").withScope("tenant-a", 0));

            assertEquals("tenant", repository.load("marketplace", JAN, "tenant-a").orElseThrow().policyKey());
            assertEquals("global", repository.load("marketplace", JAN, "tenant-b").orElseThrow().policyKey());
            assertEquals("global", repository.load("marketplace", JAN).orElseThrow().policyKey());
        }

        @Test
        void load_unknownChannelIsEmpty() {
            repository.register(rate("global", "5"));
            assertTrue(repository.load("pos", JAN).isEmpty());
        }
    }

    @Nested
    @DisplayName("Registration rules")
    class Registration {

        @Test
        void register_rejectsDuplicateVersion() {
            repository.register(rate("standard", "5"));
            assertThrows(PolicyViolationException.class, () -> repository.register(rate("standard", "6")));
        }

        @Test
        void register_rejectsOverlapAtSamePriority() {
            repository.register(rate("a", "5").withEffectiveRange(JAN, JUN));
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> repository.register(rate("b", "4").withEffectiveRange(JUN, null)));
            assertTrue(ex.getMessage().contains("overlaps"));
        }

        @Test
        void register_acceptsNewVersionWithDisjointRange() {
            repository.register(rate("standard", "5").withEffectiveRange(JAN, JUN.minusDays(1)));
            repository.register(rate("standard", "4").withVersion(2).withEffectiveRange(JUN, null));

            assertTrue(repository.findByKey("standard", 2).isPresent());
            assertEquals(1, repository.listActive(JUN).size());
        }

        @Test
        void register_validatesPolicy() {
            FeePolicy invalid = rate("standard", "5").withPrecision(-1);
            assertThrows(PolicyViolationException.class, () -> repository.register(invalid));
        }
    }

    @Nested
    @DisplayName("Explicit policy cache")
    class Cache {

        @Test
        void cachingLoader_resolvesOncePerKey() {
            AtomicInteger calls = new AtomicInteger();
            PolicyLoader counting = (channel, asOf) -> {
                calls.incrementAndGet();
                return repository.load(channel, asOf);
            };
            repository.register(rate("standard", "5"));
            PolicyCache cache = new PolicyCache();
            CachingPolicyLoader loader = new CachingPolicyLoader(counting, cache);

            loader.load("marketplace", JAN);
            loader.load("marketplace", JAN);
            loader.load("marketplace", JUN);

            assertEquals(2, calls.get());
            assertEquals(2, cache.size());
        }

        @Test
        void cache_doesNotRememberMisses() {
            PolicyCache cache = new PolicyCache();
            CachingPolicyLoader loader = new CachingPolicyLoader(repository, cache);

            assertTrue(loader.load("marketplace", JAN).isEmpty());
            repository.register(rate("standard", "5"));
            assertTrue(loader.load("marketplace", JAN).isPresent());
        }

        @Test
        void cache_evictsLeastRecentlyUsedBeyondBound() {
            PolicyCache cache = new PolicyCache(2);
            PolicyCache.Key jan = new PolicyCache.Key("marketplace", JAN, null);
            PolicyCache.Key jun = new PolicyCache.Key("marketplace", JUN, null);
            PolicyCache.Key pos = new PolicyCache.Key("pos", JAN, null);
            cache.get(jan, () -> Optional.of(rate("a", "5")));
            cache.get(jun, () -> Optional.of(rate("b", "5")));
            cache.get(jan, Optional::empty);
            cache.get(pos, () -> Optional.of(rate("c", "5")));

            assertEquals(2, cache.size());
            assertTrue(cache.get(jan, Optional::empty).isPresent());
            assertTrue(cache.get(jun, Optional::empty).isEmpty());
        }

        @Test
        void invalidate_dropsOnlyThatChannel() {
            PolicyCache cache = new PolicyCache();
            cache.get(new PolicyCache.Key("marketplace", JAN, null), () -> Optional.of(rate("a", "5")));
            cache.get(new PolicyCache.Key("pos", JAN, null), () -> Optional.of(rate("b", "5")));

            cache.invalidate("marketplace");
            assertEquals(1, cache.size());

            cache.invalidateAll();
            assertEquals(0, cache.size());
        }
    }

    // ---- helpers ----

    private static FeePolicy rate(String policyKey, String rate) {
        return Policies.simpleRate(policyKey, "marketplace", "EUR", new BigDecimal(rate));
    }
}
