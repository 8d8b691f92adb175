package com.feeledger.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every failure a public operation can report. Callers branch on the code;
 * the message is for humans only.
 */
public enum ErrorCode {
    // Ledger
    MISSING_CHANNEL,
    MISSING_CALLBACK,
    NO_POLICY,
    ERR_LEDGER_ENTRY_NOT_FOUND,
    ERR_NO_BREAKDOWN,
    ERR_EXCEEDS_ORIGINAL,
    ERR_LINE_NOT_FOUND,
    ERR_CURRENCY_MISMATCH,
    ERR_NEGATIVE_RUNNING_TOTAL,
    INVALID_ADJUSTMENT,
    IDEMPOTENCY_CONFLICT,
    PERSISTENCE_FAILED,

    // Calculation engine
    INVALID_COMPONENT,
    MISSING_BASE_FIELD,
    MISSING_LINES,
    INVALID_LINE,
    INVALID_BASE_SPEC,
    INVALID_POLICY,
    TIER_NOT_FOUND,
    CAP_INVALID_BOUNDS,
    CAP_TARGETS_EMPTY,
    CAP_TARGETS_NO_MATCH,
    LINE_SELECTOR_EMPTY,
    LINE_SELECTOR_BAD_OPERATOR,
    LINE_SELECTOR_FIELD_MISSING,
    LINE_SELECTOR_NO_MATCH,
    LINE_SELECTOR_NOT_ALLOWED_FOR_ORDER,
    DIVISION_BY_ZERO;

    @JsonValue
    public String getValue() {
        return name();
    }
}
