package com.feeledger.storage;

import java.time.Instant;
import java.util.Map;

/**
 * @param transactionId  null uses the source object id
 */
public record PersistOptions(String transactionId, String idempotencyKey, Instant createdAt, Map<String, String> meta) {

    public PersistOptions {
        meta = meta != null ? Map.copyOf(meta) : Map.of();
    }
}
