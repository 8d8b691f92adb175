package com.feeledger.integration;

import com.feeledger.engine.FeeTransaction;
import com.feeledger.engine.LineAllocation;
import com.feeledger.engine.TransactionLine;
import com.feeledger.ledger.AdjustOutcome;
import com.feeledger.ledger.EntryStatus;
import com.feeledger.ledger.FeeLedgerService;
import com.feeledger.ledger.FeeSource;
import com.feeledger.ledger.LedgerEntry;
import com.feeledger.ledger.SettleOutcome;
import com.feeledger.ledger.TransactionFees;
import com.feeledger.storage.InMemoryFeeStorageAdapter;
import com.feeledger.storage.RunningTotals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement and refund against the bundled marketplace and wholesale policies:
 *
 * settle (commission + handling + platform) -> allocation per line
 * -> full refund -> platform fee stays, everything else returned
 * -> running totals and tag totals from storage
 */
@SpringBootTest
class SettleAndRefundIntegrationTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    @Autowired FeeLedgerService ledger;
    @Autowired InMemoryFeeStorageAdapter storage;

    @Test
    @DisplayName("Marketplace order: settle, allocate, refund in full, platform fee retained")
    void marketplace_settleThenFullRefund() {
        String txId = "tx-" + UUID.randomUUID();
        FeeSource source = FeeSource.of("sales", "order", txId);

        // 1. Settle: commission 5% of 1000, handling 0.25 x 3 units, platform 1.00
        SettleOutcome settled = ledger.settle(marketplaceOrder(txId), source).orElseThrow();
        LedgerEntry entry = settled.entry();
        assertEquals(new BigDecimal("51.75"), entry.totalFee());
        assertEquals("marketplace_standard", entry.policySnapshot().policyKey());
        assertEquals(3, settled.fees().size());

        Map<String, BigDecimal> byLine = feeByLine(entry.allocation());
        assertEquals(new BigDecimal("31.00"), byLine.get("l1"));
        assertEquals(new BigDecimal("20.75"), byLine.get("l2"));

        // 2. Full refund of the order amount
        AdjustOutcome refund = ledger.refund(entry.entryId(), new BigDecimal("1000"), "order returned").orElseThrow();
        assertEquals(new BigDecimal("-50.75"), refund.feeAdjustment());
        assertEquals(new BigDecimal("1.00"), refund.runningTotal());

        // 3. Ledger view
        TransactionFees fees = ledger.getTransactionFees(txId).orElseThrow();
        assertEquals(new BigDecimal("51.75"), fees.totalFees());
        assertEquals(new BigDecimal("-50.75"), fees.totalAdjustments());
        assertEquals(new BigDecimal("1.00"), fees.netFees());
        assertEquals("EUR", fees.currency());

        // 4. Storage view
        assertEquals(EntryStatus.ADJUSTED, storage.loadEntry(entry.entryId()).orElseThrow().status());
        RunningTotals totals = storage.getRunningTotals(source);
        assertEquals(new BigDecimal("1.00"), totals.netFees());
        assertEquals(2, totals.entryCount());

        Map<String, BigDecimal> byTag = storage.getTotalsByTag(source);
        assertEquals(0, BigDecimal.ZERO.compareTo(byTag.get("commission")));
        assertEquals(0, BigDecimal.ZERO.compareTo(byTag.get("handling")));
        assertEquals(0, BigDecimal.ONE.compareTo(byTag.get("platform")));
    }

    @Test
    @DisplayName("Wholesale order: top tier applies, cap limits the tier fee")
    void wholesale_tierAndCap() {
        LedgerEntry below = ledger.settle(wholesaleOrder("20000"), (FeeSource) null).orElseThrow().entry();
        assertEquals(new BigDecimal("410.00"), below.totalFee());
        assertEquals(2, below.breakdown().get(0).tierIndex());

        LedgerEntry capped = ledger.settle(wholesaleOrder("30000"), (FeeSource) null).orElseThrow().entry();
        assertEquals(new BigDecimal("500.00"), capped.totalFee());
        assertEquals(new BigDecimal("110.00"), capped.breakdown().get(0).capDelta());
        assertEquals("max", capped.breakdown().get(0).capBound());
    }

    @Test
    @DisplayName("Partial refund keeps allocation reconciled with the fee adjustment")
    void marketplace_partialRefundReconciles() {
        String txId = "tx-" + UUID.randomUUID();
        LedgerEntry entry = ledger.settle(marketplaceOrder(txId), FeeSource.of("sales", "order", txId))
            .orElseThrow().entry();

        AdjustOutcome refund = ledger.refund(entry.entryId(), new BigDecimal("250"), "one item").orElseThrow();

        // 25% of commission (12.50) plus 25% of handling (0.19)
        assertEquals(new BigDecimal("-12.69"), refund.feeAdjustment());
        BigDecimal allocated = refund.entry().allocation().stream()
            .map(LineAllocation::feeAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, refund.feeAdjustment().compareTo(allocated));
    }

    // ---- helpers ----

    private static FeeTransaction marketplaceOrder(String txId) {
        return FeeTransaction.builder()
            .transactionId(txId)
            .channelKey("marketplace")
            .asOf(AS_OF)
            .lines(List.of(
                TransactionLine.ofNet("l1", new BigDecimal("600"), new BigDecimal("2")),
                TransactionLine.ofNet("l2", new BigDecimal("400"), BigDecimal.ONE)))
            .build();
    }

    private static FeeTransaction wholesaleOrder(String net) {
        return FeeTransaction.builder()
            .transactionId("tx-" + UUID.randomUUID())
            .channelKey("wholesale")
            .asOf(AS_OF)
            .line(TransactionLine.ofNet("w1", new BigDecimal(net)))
            .build();
    }

    private static Map<String, BigDecimal> feeByLine(List<LineAllocation> allocation) {
        Map<String, BigDecimal> byLine = new LinkedHashMap<>();
        allocation.forEach(line -> byLine.put(line.lineId(), line.feeAmount()));
        return byLine;
    }
}
