package com.feeledger.policy;

import java.util.List;

/**
 * Attributes shared by every component variant.
 *
 * @param precedence    lower runs first; ties keep declaration order
 * @param base          amount expression; defaults to {@code net}
 * @param lineSelector  null when the component applies to every line
 * @param proration     null falls back to the calculation's default method
 */
public record ComponentHeader(
    String id,
    String name,
    Scope scope,
    int precedence,
    BaseSpec base,
    List<String> tags,
    List<Condition> conditions,
    LineSelector lineSelector,
    ProrationMethod proration,
    RefundConfig refund
) {

    public static final int DEFAULT_PRECEDENCE = 100;

    public ComponentHeader {
        name = name != null ? name : id;
        scope = scope != null ? scope : Scope.ORDER;
        base = base != null ? base : BaseSpec.NET;
        tags = tags != null ? List.copyOf(tags) : List.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        refund = refund != null ? refund : RefundConfig.DEFAULT;
    }

    /** Header with defaults for everything but id and scope. */
    public static ComponentHeader of(String id, Scope scope) {
        return new ComponentHeader(id, id, scope, DEFAULT_PRECEDENCE, null, List.of(), List.of(), null, null, null);
    }

    public ComponentHeader withTags(List<String> newTags) {
        return new ComponentHeader(id, name, scope, precedence, base, newTags, conditions, lineSelector, proration, refund);
    }

    public ComponentHeader withPrecedence(int newPrecedence) {
        return new ComponentHeader(id, name, scope, newPrecedence, base, tags, conditions, lineSelector, proration, refund);
    }

    public ComponentHeader withBase(BaseSpec newBase) {
        return new ComponentHeader(id, name, scope, precedence, newBase, tags, conditions, lineSelector, proration, refund);
    }

    public ComponentHeader withConditions(List<Condition> newConditions) {
        return new ComponentHeader(id, name, scope, precedence, base, tags, newConditions, lineSelector, proration, refund);
    }

    public ComponentHeader withLineSelector(LineSelector newSelector) {
        return new ComponentHeader(id, name, scope, precedence, base, tags, conditions, newSelector, proration, refund);
    }

    public ComponentHeader withProration(ProrationMethod newProration) {
        return new ComponentHeader(id, name, scope, precedence, base, tags, conditions, lineSelector, newProration, refund);
    }

    public ComponentHeader withRefund(RefundConfig newRefund) {
        return new ComponentHeader(id, name, scope, precedence, base, tags, conditions, lineSelector, proration, newRefund);
    }
}
