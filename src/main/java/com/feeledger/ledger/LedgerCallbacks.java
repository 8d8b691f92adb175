package com.feeledger.ledger;

import com.feeledger.policy.PolicyLoader;

/**
 * Collaborators injected into every ledger operation. Either may be null for
 * operations that do not need it; an operation that does fails with
 * {@code MISSING_CALLBACK}.
 */
public record LedgerCallbacks(PolicyLoader policyLoader, EntryStore entryStore) {
}
