package com.feeledger.engine;

import com.feeledger.policy.TierBoundary;
import com.feeledger.policy.TierBracket;

import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalInt;

/**
 * First bracket in declared order whose range contains the value wins.
 */
final class TierResolver {

    private TierResolver() {
    }

    static OptionalInt resolve(List<TierBracket> tiers, TierBoundary boundary, BigDecimal value) {
        for (int i = 0; i < tiers.size(); i++) {
            if (contains(tiers.get(i), boundary, value)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    static boolean contains(TierBracket bracket, TierBoundary boundary, BigDecimal value) {
        if (value.compareTo(bracket.min()) < 0) {
            return false;
        }
        if (bracket.max() == null) {
            return true;
        }
        int cmp = value.compareTo(bracket.max());
        return boundary == TierBoundary.CLOSED_OPEN ? cmp < 0 : cmp <= 0;
    }
}
