package com.feeledger.policy;

import java.util.List;

/**
 * Restricts a line-scoped component to a subset of lines. A line matches when
 * every {@code where} condition holds and, if {@code anyOf} is non-empty, at
 * least one of its AND-groups holds. {@code EXCLUDE} mode inverts the match.
 */
public record LineSelector(Mode mode, List<Condition> where, List<List<Condition>> anyOf, boolean requireMatch) {

    public enum Mode { INCLUDE, EXCLUDE }

    public LineSelector {
        mode = mode != null ? mode : Mode.INCLUDE;
        where = where != null ? List.copyOf(where) : List.of();
        anyOf = anyOf != null ? anyOf.stream().map(List::copyOf).toList() : List.of();
    }

    public boolean isEmpty() {
        return where.isEmpty() && anyOf.isEmpty();
    }
}
