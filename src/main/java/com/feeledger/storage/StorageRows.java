package com.feeledger.storage;

import com.feeledger.error.ErrorCode;
import com.feeledger.ledger.AdjustmentMode;
import com.feeledger.ledger.EntryStatus;
import com.feeledger.ledger.EventType;
import com.feeledger.policy.ComponentType;
import com.feeledger.policy.ProrationMethod;
import com.feeledger.policy.RefundBehavior;
import com.feeledger.policy.Scope;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Table rows of the normalized entry layout. One header row per entry;
 * every child row carries its entry id and, where order matters, a position.
 */
final class StorageRows {

    private StorageRows() {
    }

    record EntryRow(
        long id,
        String transactionId,
        EventType eventType,
        EntryStatus status,
        String currency,
        BigDecimal totalFee,
        String signature,
        String idempotencyKey,
        Long parentEntryId,
        String module,
        String objectType,
        String objectId,
        String scopeId,
        String policyKey,
        Integer policyVersion,
        Integer componentCount,
        String policyHash,
        Integer precision,
        String channelKey,
        Integer linesCount,
        BigDecimal orderNet,
        BigDecimal orderGross,
        BigDecimal orderTax,
        BigDecimal orderShipping,
        BigDecimal orderQuantity,
        AdjustmentMode adjustmentMode,
        BigDecimal refundBase,
        String adjustmentReason,
        boolean fallback,
        Instant createdAt,
        Map<String, String> meta
    ) {

        EntryRow withStatus(EntryStatus newStatus) {
            return new EntryRow(id, transactionId, eventType, newStatus, currency, totalFee, signature,
                idempotencyKey, parentEntryId, module, objectType, objectId, scopeId, policyKey, policyVersion,
                componentCount, policyHash, precision, channelKey, linesCount, orderNet, orderGross, orderTax,
                orderShipping, orderQuantity, adjustmentMode, refundBase, adjustmentReason, fallback, createdAt, meta);
        }
    }

    record ComponentRow(
        long entryId,
        int position,
        String componentId,
        String name,
        ComponentType type,
        Scope scope,
        BigDecimal amount,
        BigDecimal baseUsed,
        BigDecimal rate,
        BigDecimal fixed,
        Integer tierIndex,
        BigDecimal tierMin,
        BigDecimal tierMax,
        BigDecimal tierRate,
        BigDecimal tierFixed,
        BigDecimal capDelta,
        BigDecimal targetSumBefore,
        String capBound,
        List<String> targetIds,
        String overrideReason,
        boolean applied,
        String discardReason,
        boolean refundable,
        RefundBehavior refundBehavior,
        boolean capRefundToOriginal,
        ProrationMethod proration,
        List<String> lineIds,
        Map<String, Integer> tierSelected
    ) {}

    record ComponentTagRow(long entryId, String componentId, String tag) {}

    record LineRow(long entryId, int position, String lineId, BigDecimal feeAmount) {}

    /** {@code componentId} is null for a refund split by line fee when the entry had no breakdown. */
    record LineComponentRow(
        long entryId,
        String lineId,
        int position,
        String componentId,
        BigDecimal amount,
        ProrationMethod prorationMethod,
        BigDecimal prorationWeight
    ) {}

    record WarningRow(long entryId, int position, ErrorCode code, String message, String componentId) {}

    record RefundPlanRow(
        long entryId,
        int position,
        String componentId,
        ComponentType type,
        BigDecimal originalFee,
        BigDecimal refundRatio,
        BigDecimal refundedFee,
        boolean refundable,
        RefundBehavior behavior,
        String reasonCode
    ) {}

    /**
     * One row per original line an adjustment covered.
     *
     * @param refundAmount  the caller-given line refund, null when none was given
     */
    record AdjustmentLineRow(long entryId, int position, String lineId, BigDecimal refundAmount, boolean affected) {}

    /** Line ids of the settled input, in input order. */
    record InputLineRow(long entryId, int position, String lineId) {}
}
