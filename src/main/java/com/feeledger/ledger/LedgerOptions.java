package com.feeledger.ledger;

import com.feeledger.policy.ProrationMethod;

import java.util.Map;

/**
 * @param strict                      null defers to the policy (settle) or false (adjust)
 * @param allowNegativeRunningTotal   lets a strict adjustment push the transaction's net fee below zero
 */
public record LedgerOptions(
    Boolean strict,
    FeeSource source,
    boolean allowNegativeRunningTotal,
    ProrationMethod defaultProration,
    Map<String, String> meta
) {

    public static final LedgerOptions DEFAULTS = new LedgerOptions(null, null, false, null, Map.of());

    public LedgerOptions {
        meta = meta != null ? Map.copyOf(meta) : Map.of();
    }

    public static LedgerOptions strictMode() {
        return new LedgerOptions(true, null, false, null, Map.of());
    }

    public LedgerOptions withSource(FeeSource newSource) {
        return new LedgerOptions(strict, newSource, allowNegativeRunningTotal, defaultProration, meta);
    }

    public LedgerOptions withStrict(Boolean newStrict) {
        return new LedgerOptions(newStrict, source, allowNegativeRunningTotal, defaultProration, meta);
    }

    public LedgerOptions allowingNegativeRunningTotal() {
        return new LedgerOptions(strict, source, true, defaultProration, meta);
    }
}
