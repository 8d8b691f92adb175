package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-call state of one calculation. Never shared between calls.
 */
final class EvaluationContext {

    private static final Logger log = LoggerFactory.getLogger(FeeCalculationEngine.class);

    private static final String ORDER_PREFIX = "order.";
    private static final String CONTEXT_PREFIX = "context.";

    private final AmountModel.Normalized input;
    private final String channelKey;
    private final Map<String, Object> context;
    private final boolean strict;
    private final int scale;
    private final List<CalculationWarning> warnings = new ArrayList<>();

    EvaluationContext(AmountModel.Normalized input, FeeTransaction transaction, boolean strict, int scale) {
        this.input = input;
        this.channelKey = transaction.channelKey();
        this.context = transaction.context();
        this.strict = strict;
        this.scale = scale;
    }

    List<PricedLine> lines() {
        return input.lines();
    }

    PricedOrder order() {
        return input.order();
    }

    boolean strict() {
        return strict;
    }

    int scale() {
        return scale;
    }

    List<CalculationWarning> warnings() {
        return warnings;
    }

    void warn(ErrorCode code, String message, String componentId) {
        log.warn("Fee calculation warning code={} component={}: {}", code, componentId, message);
        warnings.add(new CalculationWarning(code, message, componentId));
    }

    void logCap(String capId, BigDecimal before, BigDecimal after) {
        log.debug("Cap {} clamped targeted sum {} -> {}", capId, before.toPlainString(), after.toPlainString());
    }

    /**
     * Resolves a condition field: {@code order.*} against order totals,
     * {@code context.*} against the caller context, then the bare names
     * {@code channel_key} and {@code line_count}, then the context, then order totals.
     */
    Optional<Object> resolve(String field) {
        if (field.startsWith(ORDER_PREFIX)) {
            return input.order().amount(field.substring(ORDER_PREFIX.length())).map(Object.class::cast);
        }
        if (field.startsWith(CONTEXT_PREFIX)) {
            return ConditionEvaluator.resolvePath(context, field.substring(CONTEXT_PREFIX.length()));
        }
        if ("channel_key".equals(field)) {
            return Optional.ofNullable(channelKey);
        }
        Optional<Object> fromContext = ConditionEvaluator.resolvePath(context, field);
        if (fromContext.isPresent()) {
            return fromContext;
        }
        return input.order().amount(field).map(Object.class::cast);
    }
}
