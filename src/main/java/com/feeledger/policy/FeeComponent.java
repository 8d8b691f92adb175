package com.feeledger.policy;

import java.math.BigDecimal;
import java.util.List;

/**
 * One fee rule within a policy. Each variant carries only the fields its type
 * needs; the engine dispatches over the variants exhaustively.
 *
 * Only {@link Rewriting} variants (cap and override) may change amounts that
 * earlier components already recorded.
 */
public sealed interface FeeComponent {

    ComponentHeader header();

    ComponentType type();

    default String id() {
        return header().id();
    }

    default List<String> tags() {
        return header().tags();
    }

    default Scope scope() {
        return header().scope();
    }

    /** {@code amount = base * rate / 100}. */
    record Rate(ComponentHeader header, BigDecimal rate) implements FeeComponent {
        @Override
        public ComponentType type() {
            return ComponentType.RATE;
        }
    }

    /** Percentage points; computed like {@link Rate}. */
    record RatePp(ComponentHeader header, BigDecimal pp) implements FeeComponent {
        @Override
        public ComponentType type() {
            return ComponentType.RATE_PP;
        }
    }

    /** {@code amount = fixed * quantity}. */
    record FixedUnit(ComponentHeader header, BigDecimal fixed) implements FeeComponent {
        @Override
        public ComponentType type() {
            return ComponentType.FIXED_UNIT;
        }
    }

    /** Applied once regardless of line count. */
    record FixedOrder(ComponentHeader header, BigDecimal fixed) implements FeeComponent {
        @Override
        public ComponentType type() {
            return ComponentType.FIXED_ORDER;
        }
    }

    record Tier(ComponentHeader header, TierBy tierBy, TierBoundary boundary, List<TierBracket> tiers) implements FeeComponent {

        public Tier {
            tierBy = tierBy != null ? tierBy : TierBy.BASE;
            boundary = boundary != null ? boundary : TierBoundary.CLOSED_CLOSED;
            tiers = tiers != null ? List.copyOf(tiers) : List.of();
        }

        @Override
        public ComponentType type() {
            return ComponentType.TIER;
        }
    }

    sealed interface Rewriting extends FeeComponent {
    }

    /** Clamps the summed amount of its targets to {@code [min, max]}; a null bound is open. */
    record Cap(ComponentHeader header, BigDecimal min, BigDecimal max, CapTargets targets) implements Rewriting {

        public Cap {
            targets = targets != null ? targets : CapTargets.ALL;
        }

        @Override
        public ComponentType type() {
            return ComponentType.CAP;
        }
    }

    /**
     * Zeroes out the components named in {@code excludes} or tagged with one of
     * {@code excludeTags}, or sets them to {@code replaceAmount} when present.
     */
    record OverrideRule(ComponentHeader header, List<String> excludes, List<String> excludeTags,
                    BigDecimal replaceAmount, String reason) implements Rewriting {

        public OverrideRule {
            excludes = excludes != null ? List.copyOf(excludes) : List.of();
            excludeTags = excludeTags != null ? List.copyOf(excludeTags) : List.of();
        }

        @Override
        public ComponentType type() {
            return ComponentType.OVERRIDE;
        }

        public boolean excludes(FeeComponent component) {
            return excludes.contains(component.id())
                || component.tags().stream().anyMatch(excludeTags::contains);
        }
    }
}
