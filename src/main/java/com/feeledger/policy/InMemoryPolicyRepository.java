package com.feeledger.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Policy store with effective-dated resolution.
 *
 * Resolution order for {@code (channel, asOf, scope)}:
 * - policies of the requested scope effective on {@code asOf}, else the channel's global policies
 * - highest priority first, then the latest effective_from, then the highest version
 *
 * Registered versions are immutable: re-registering a known
 * {@code (policy_key, version)} is rejected.
 */
public class InMemoryPolicyRepository implements PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPolicyRepository.class);

    private static final Comparator<FeePolicy> PREFERENCE = Comparator
        .comparingInt(FeePolicy::priority)
        .thenComparing(p -> p.effectiveFrom() != null ? p.effectiveFrom() : LocalDate.MIN)
        .thenComparingInt(FeePolicy::version);

    private final CopyOnWriteArrayList<FeePolicy> policies = new CopyOnWriteArrayList<>();
    private final PolicyValidator validator;

    public InMemoryPolicyRepository(PolicyValidator validator) {
        this.validator = validator;
    }

    public synchronized void register(FeePolicy policy) {
        validator.validate(policy);
        if (findByKey(policy.policyKey(), policy.version()).isPresent()) {
            throw new PolicyViolationException(
                "policy " + policy.policyKey() + " v" + policy.version() + " is already registered");
        }
        if (overlaps(policy)) {
            throw new PolicyViolationException("policy " + policy.policyKey() + " v" + policy.version()
                + " overlaps another policy for channel " + policy.channelKey() + " with the same priority");
        }
        policies.add(policy);
        log.info("Registered fee policy key={} version={} channel={} scope={}",
            policy.policyKey(), policy.version(), policy.channelKey(), policy.scopeId());
    }

    @Override
    public Optional<FeePolicy> load(String channelKey, LocalDate asOf) {
        return load(channelKey, asOf, null);
    }

    @Override
    public Optional<FeePolicy> load(String channelKey, LocalDate asOf, String scopeId) {
        if (scopeId != null) {
            Optional<FeePolicy> scoped = best(channelKey, asOf, scopeId);
            if (scoped.isPresent()) {
                return scoped;
            }
        }
        return best(channelKey, asOf, null);
    }

    public Optional<FeePolicy> findByKey(String policyKey, int version) {
        return policies.stream()
            .filter(p -> p.policyKey().equals(policyKey) && p.version() == version)
            .findFirst();
    }

    public List<FeePolicy> listActive(LocalDate asOf) {
        return policies.stream()
            .filter(p -> p.isEffectiveOn(asOf))
            .sorted(Comparator.comparing(FeePolicy::channelKey).thenComparing(PREFERENCE.reversed()))
            .toList();
    }

    /**
     * True when another policy for the same channel and scope, with the same
     * priority, is effective on some day of the candidate's range.
     */
    public boolean overlaps(FeePolicy candidate) {
        return policies.stream()
            .filter(p -> p.channelKey().equals(candidate.channelKey()))
            .filter(p -> Objects.equals(p.scopeId(), candidate.scopeId()))
            .filter(p -> p.priority() == candidate.priority())
            .filter(p -> !p.policyKey().equals(candidate.policyKey()) || p.version() != candidate.version())
            .anyMatch(p -> rangesOverlap(p.effectiveFrom(), p.effectiveTo(),
                candidate.effectiveFrom(), candidate.effectiveTo()));
    }

    private Optional<FeePolicy> best(String channelKey, LocalDate asOf, String scopeId) {
        return policies.stream()
            .filter(p -> p.channelKey().equals(channelKey))
            .filter(p -> Objects.equals(p.scopeId(), scopeId))
            .filter(p -> p.isEffectiveOn(asOf))
            .max(PREFERENCE);
    }

    private static boolean rangesOverlap(LocalDate fromA, LocalDate toA, LocalDate fromB, LocalDate toB) {
        LocalDate startA = fromA != null ? fromA : LocalDate.MIN;
        LocalDate endA = toA != null ? toA : LocalDate.MAX;
        LocalDate startB = fromB != null ? fromB : LocalDate.MIN;
        LocalDate endB = toB != null ? toB : LocalDate.MAX;
        return !startA.isAfter(endB) && !startB.isAfter(endA);
    }
}
