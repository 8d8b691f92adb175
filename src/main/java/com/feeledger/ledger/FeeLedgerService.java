package com.feeledger.ledger;

import com.feeledger.config.FeeLedgerProperties;
import com.feeledger.engine.FeeCalculation;
import com.feeledger.engine.FeeTransaction;
import com.feeledger.engine.LineAllocation;
import com.feeledger.engine.TransactionLine;
import com.feeledger.error.Result;
import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.PolicyLoader;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * {@link FeeLedger} bound to the application's policy loader and entry store,
 * with option defaults taken from {@code feeledger.*}.
 */
@Service
public class FeeLedgerService {

    private final FeeLedger ledger;
    private final LedgerCallbacks callbacks;
    private final FeeLedgerProperties properties;

    public FeeLedgerService(FeeLedger ledger,
                            PolicyLoader policyLoader,
                            EntryStore entryStore,
                            FeeLedgerProperties properties) {
        this.ledger = ledger;
        this.callbacks = new LedgerCallbacks(policyLoader, entryStore);
        this.properties = properties;
    }

    public Result<SettleOutcome> settle(FeeTransaction transaction, FeeSource source) {
        return ledger.settle(transaction, callbacks, defaults().withSource(source));
    }

    public Result<SettleOutcome> settle(FeeTransaction transaction, LedgerOptions options) {
        return ledger.settle(transaction, callbacks, options);
    }

    public Result<FeeCalculation> simulate(FeeTransaction transaction, FeePolicy policy) {
        return ledger.simulate(transaction, policy, defaults());
    }

    public Result<LineAllocation> calculateForItem(TransactionLine item, FeePolicy policy) {
        return ledger.calculateForItem(item, policy, defaults());
    }

    public Result<AdjustOutcome> refund(long entryId, BigDecimal refundAmount, String reason) {
        return adjust(entryId, Adjustment.refund(refundAmount, reason));
    }

    public Result<AdjustOutcome> adjust(long entryId, Adjustment adjustment) {
        return ledger.adjust(entryId, adjustment, callbacks, defaults());
    }

    public Result<AdjustOutcome> adjust(long entryId, Adjustment adjustment, LedgerOptions options) {
        return ledger.adjust(entryId, adjustment, callbacks, options);
    }

    public Result<TransactionFees> getTransactionFees(String transactionId) {
        return ledger.getTransactionFees(transactionId, callbacks);
    }

    /** Options carrying the configured strictness and default proration. */
    public LedgerOptions defaults() {
        return new LedgerOptions(properties.isStrict() ? Boolean.TRUE : null, null, false,
            properties.getDefaultProration(), null);
    }
}
