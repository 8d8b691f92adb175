package com.feeledger.policy;

import java.math.BigDecimal;

/**
 * One tier bracket. A null {@code max} is open-ended. The amount for a matched
 * bracket is {@code base * rate / 100} plus {@code fixed}; either may be absent.
 */
public record TierBracket(BigDecimal min, BigDecimal max, BigDecimal rate, BigDecimal fixed) {
}
