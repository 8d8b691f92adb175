package com.feeledger.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculation input.
 *
 * @param order    explicit order totals; null fields fall back to line sums
 * @param asOf     date used for effective-dated policy resolution; null means today
 * @param context  free-form values visible to component conditions
 */
public record FeeTransaction(
    String transactionId,
    String channelKey,
    List<TransactionLine> lines,
    OrderTotals order,
    LocalDate asOf,
    String idempotencyKey,
    String currency,
    Map<String, Object> context
) {

    public FeeTransaction {
        lines = lines != null ? List.copyOf(lines) : List.of();
        order = order != null ? order : OrderTotals.EMPTY;
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String transactionId;
        private String channelKey;
        private final List<TransactionLine> lines = new ArrayList<>();
        private OrderTotals order;
        private LocalDate asOf;
        private String idempotencyKey;
        private String currency;
        private Map<String, Object> context;

        private Builder() {
        }

        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder channelKey(String channelKey) {
            this.channelKey = channelKey;
            return this;
        }

        public Builder line(TransactionLine line) {
            this.lines.add(line);
            return this;
        }

        public Builder lines(List<TransactionLine> lines) {
            this.lines.addAll(lines);
            return this;
        }

        public Builder order(OrderTotals order) {
            this.order = order;
            return this;
        }

        public Builder asOf(LocalDate asOf) {
            this.asOf = asOf;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public FeeTransaction build() {
            return new FeeTransaction(transactionId, channelKey, lines, order, asOf, idempotencyKey, currency, context);
        }
    }
}
