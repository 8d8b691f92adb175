package com.feeledger.policy;

import com.feeledger.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a policy before it is registered or evaluated.
 * Throws {@link PolicyViolationException} on the first violation found.
 */
@Component
public class PolicyValidator {

    public static final int MAX_PRECISION = 10;

    public void validate(FeePolicy policy) {
        requireNonNull(policy, "policy cannot be null");
        requireString(policy.policyKey(), "policy_key is required");
        requireString(policy.channelKey(), "channel_key is required");
        requireString(policy.currency(), "currency is required");
        if (policy.version() < 1) {
            throw new PolicyViolationException("version must be >= 1");
        }
        if (policy.precision() < 0 || policy.precision() > MAX_PRECISION) {
            throw new PolicyViolationException("precision must be between 0 and " + MAX_PRECISION);
        }
        if (policy.effectiveFrom() != null && policy.effectiveTo() != null
                && policy.effectiveTo().isBefore(policy.effectiveFrom())) {
            throw new PolicyViolationException("effective_to must not be before effective_from");
        }

        Set<String> ids = new HashSet<>();
        for (FeeComponent component : policy.components()) {
            requireNonNull(component, "components must not contain null entries");
            String id = component.id();
            if (id == null || id.isBlank()) {
                throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, "component id is required");
            }
            if (!ids.add(id)) {
                throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, "duplicate component id: " + id);
            }
            validateHeader(component.header());
            validateComponent(component);
        }
    }

    private void validateHeader(ComponentHeader header) {
        validateBase(header.id(), header.base());
        for (Condition condition : header.conditions()) {
            validateCondition(header.id(), condition, ErrorCode.INVALID_COMPONENT);
        }
        LineSelector selector = header.lineSelector();
        if (selector != null) {
            if (selector.isEmpty()) {
                throw new PolicyViolationException(ErrorCode.LINE_SELECTOR_EMPTY,
                    header.id() + ": line_selector needs at least one where or any_of condition");
            }
            selector.where().forEach(c -> validateCondition(header.id(), c, ErrorCode.LINE_SELECTOR_BAD_OPERATOR));
            for (List<Condition> group : selector.anyOf()) {
                if (group.isEmpty()) {
                    throw new PolicyViolationException(ErrorCode.LINE_SELECTOR_EMPTY,
                        header.id() + ": line_selector.any_of groups must not be empty");
                }
                group.forEach(c -> validateCondition(header.id(), c, ErrorCode.LINE_SELECTOR_BAD_OPERATOR));
            }
        }
    }

    private void validateBase(String componentId, BaseSpec base) {
        if (base instanceof BaseSpec.FieldRef ref) {
            if (ref.field() == null || ref.field().isBlank()) {
                throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC, componentId + ": base field is required");
            }
        } else if (base instanceof BaseSpec.Add add) {
            if (add.left() == null || add.right() == null) {
                throw new PolicyViolationException(ErrorCode.INVALID_BASE_SPEC, componentId + ": add needs two operands");
            }
            validateBase(componentId, add.left());
            validateBase(componentId, add.right());
        }
    }

    private void validateCondition(String componentId, Condition condition, ErrorCode code) {
        if (condition.field() == null || condition.field().isBlank()) {
            throw new PolicyViolationException(code, componentId + ": condition field is required");
        }
        if (condition.operator() == null) {
            throw new PolicyViolationException(code, componentId + ": condition operator is required");
        }
        if ((condition.operator() == Operator.IN || condition.operator() == Operator.NOT_IN)
                && !(condition.value() instanceof List<?>)) {
            throw new PolicyViolationException(code,
                componentId + ": " + condition.operator().getValue() + " needs a list value");
        }
    }

    private void validateComponent(FeeComponent component) {
        String id = component.id();
        switch (component.type()) {
            case RATE -> requireAmount(((FeeComponent.Rate) component).rate(), id + ": rate is required");
            case RATE_PP -> requireAmount(((FeeComponent.RatePp) component).pp(), id + ": pp is required");
            case FIXED_UNIT -> requireAmount(((FeeComponent.FixedUnit) component).fixed(), id + ": fixed is required");
            case FIXED_ORDER -> requireAmount(((FeeComponent.FixedOrder) component).fixed(), id + ": fixed is required");
            case TIER -> validateTier((FeeComponent.Tier) component);
            case CAP -> validateCap((FeeComponent.Cap) component);
            case OVERRIDE -> {
                FeeComponent.OverrideRule override = (FeeComponent.OverrideRule) component;
                if (override.excludes().isEmpty() && override.excludeTags().isEmpty()) {
                    throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT,
                        id + ": override needs excludes or exclude_tags");
                }
            }
        }
    }

    private void validateTier(FeeComponent.Tier tier) {
        if (tier.tiers().isEmpty()) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, tier.id() + ": tiers must not be empty");
        }
        for (TierBracket bracket : tier.tiers()) {
            if (bracket.min() == null) {
                throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, tier.id() + ": tier min is required");
            }
            if (bracket.max() != null && bracket.max().compareTo(bracket.min()) < 0) {
                throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT,
                    tier.id() + ": tier max must be >= min");
            }
            if (bracket.rate() == null && bracket.fixed() == null) {
                throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT,
                    tier.id() + ": tier needs a rate or a fixed amount");
            }
        }
    }

    private void validateCap(FeeComponent.Cap cap) {
        if (cap.min() == null && cap.max() == null) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, cap.id() + ": cap needs min or max");
        }
        if (cap.min() != null && cap.max() != null && cap.min().compareTo(cap.max()) > 0) {
            throw new PolicyViolationException(ErrorCode.CAP_INVALID_BOUNDS,
                cap.id() + ": cap min " + cap.min().toPlainString() + " exceeds max " + cap.max().toPlainString());
        }
    }

    private void requireAmount(BigDecimal value, String message) {
        if (value == null) {
            throw new PolicyViolationException(ErrorCode.INVALID_COMPONENT, message);
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new PolicyViolationException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new PolicyViolationException(message);
        }
    }
}
