package com.feeledger.ledger;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence the ledger depends on. Implementations own the transaction
 * boundary and the row locking that serializes concurrent adjustments.
 */
public interface EntryStore {

    /** Persists a new entry with all its child rows and returns the assigned id. */
    long saveEntry(LedgerEntry entry);

    Optional<LedgerEntry> loadEntry(long entryId);

    /**
     * Loads an entry and locks it until the surrounding {@link #inTransaction}
     * ends. Two adjustments of the same entry never interleave.
     */
    default Optional<LedgerEntry> loadEntryForUpdate(long entryId) {
        return loadEntry(entryId);
    }

    void updateEntryStatus(long entryId, EntryStatus status);

    List<LedgerEntry> loadByTransaction(String transactionId);

    Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey);

    /**
     * Runs {@code work} atomically: either every write inside it becomes
     * visible or none does. An exception thrown by {@code work} rolls back.
     */
    default <T> T inTransaction(Supplier<T> work) {
        return work.get();
    }
}
