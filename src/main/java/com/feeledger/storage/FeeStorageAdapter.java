package com.feeledger.storage;

import com.feeledger.engine.FeeCalculation;
import com.feeledger.error.Result;
import com.feeledger.ledger.EventType;
import com.feeledger.ledger.FeeSource;
import com.feeledger.ledger.LedgerEntry;
import com.feeledger.policy.FeePolicy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistence contract for ledger entries, addressed by {@link FeeSource}.
 *
 * Entries are stored as a header plus child collections (components,
 * component tags, lines, line components, warnings, refund plan) so that
 * component- and line-level queries do not need to decode whole entries.
 */
public interface FeeStorageAdapter {

    /** Persists a successful calculation as a SETTLE entry. */
    Result<Long> persist(FeeCalculation result, FeeSource source, FeePolicy policy, PersistOptions options);

    Result<Long> persistAdjustment(LedgerEntry adjustment);

    Optional<LedgerEntry> loadEntry(long entryId, LoadOptions options);

    Optional<LedgerEntry> loadLatest(FeeSource source);

    List<LedgerEntry> loadAllForSource(FeeSource source);

    /** @param eventType null counts every entry */
    long countForSource(FeeSource source, EventType eventType);

    /** Streams the source's entries in id order, assembling {@code batchSize} at a time. */
    Stream<LedgerEntry> iterateForSource(FeeSource source, int batchSize);

    RunningTotals getRunningTotals(FeeSource source);

    /** Net component amount per tag over every entry of the source. */
    Map<String, BigDecimal> getTotalsByTag(FeeSource source);

    /** @param version null matches every version */
    List<LedgerEntry> findByPolicy(String policyKey, Integer version);
}
