package com.feeledger.storage;

import com.feeledger.engine.BreakdownEntry;
import com.feeledger.engine.CalculationWarning;
import com.feeledger.engine.FeeCalculation;
import com.feeledger.engine.LineAllocation;
import com.feeledger.engine.LineContribution;
import com.feeledger.engine.OrderTotals;
import com.feeledger.error.ErrorCode;
import com.feeledger.error.Result;
import com.feeledger.ledger.AdjustmentDetails;
import com.feeledger.ledger.Coverage;
import com.feeledger.ledger.EntryStatus;
import com.feeledger.ledger.EntryStore;
import com.feeledger.ledger.EventType;
import com.feeledger.ledger.FeeSource;
import com.feeledger.ledger.InputSnapshot;
import com.feeledger.ledger.LedgerEntry;
import com.feeledger.ledger.PolicySnapshot;
import com.feeledger.ledger.RefundPlanItem;
import com.feeledger.math.DecimalMath;
import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.RefundConfig;
import com.feeledger.policy.TierBracket;
import com.feeledger.storage.StorageRows.AdjustmentLineRow;
import com.feeledger.storage.StorageRows.ComponentRow;
import com.feeledger.storage.StorageRows.ComponentTagRow;
import com.feeledger.storage.StorageRows.EntryRow;
import com.feeledger.storage.StorageRows.InputLineRow;
import com.feeledger.storage.StorageRows.LineComponentRow;
import com.feeledger.storage.StorageRows.LineRow;
import com.feeledger.storage.StorageRows.RefundPlanRow;
import com.feeledger.storage.StorageRows.WarningRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * In-memory storage in the normalized row layout.
 *
 * Writes inside {@link #inTransaction} are staged per thread and become
 * visible together on commit; an exception discards them. Ids come from a
 * sequence, so a rolled-back entry leaves a gap. {@link #loadEntryForUpdate}
 * takes a per-entry lock held until the transaction ends. The idempotency key
 * is unique: a commit that would duplicate one fails.
 */
@Component
public class InMemoryFeeStorageAdapter implements FeeStorageAdapter, EntryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFeeStorageAdapter.class);

    private final ConcurrentSkipListMap<Long, EntryRow> entries = new ConcurrentSkipListMap<>();
    private final CopyOnWriteArrayList<ComponentRow> components = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ComponentTagRow> componentTags = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<LineRow> lines = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<LineComponentRow> lineComponents = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<WarningRow> warnings = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RefundPlanRow> refundPlan = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<AdjustmentLineRow> adjustmentLines = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<InputLineRow> inputLines = new CopyOnWriteArrayList<>();

    private final AtomicLong sequence = new AtomicLong(0);
    private final ReadWriteLock tableLock = new ReentrantReadWriteLock();
    private final Map<Long, ReentrantLock> rowLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<StagedWrites> current = new ThreadLocal<>();
    private final Clock clock;

    public InMemoryFeeStorageAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryFeeStorageAdapter(Clock clock) {
        this.clock = clock;
    }

    // ---- EntryStore ----

    @Override
    public long saveEntry(LedgerEntry entry) {
        return inTransaction(() -> {
            long id = sequence.incrementAndGet();
            current.get().bundles.add(toRows(entry, id));
            return id;
        });
    }

    @Override
    public Optional<LedgerEntry> loadEntry(long entryId) {
        return loadEntry(entryId, LoadOptions.FULL);
    }

    @Override
    public Optional<LedgerEntry> loadEntryForUpdate(long entryId) {
        StagedWrites tx = current.get();
        if (tx == null) {
            throw new IllegalStateException("loadEntryForUpdate needs an active transaction");
        }
        if (!tx.locks.containsKey(entryId)) {
            tx.locks.put(entryId, acquireRowLock(entryId));
        }
        return loadEntry(entryId, LoadOptions.FULL);
    }

    /** Retries when the lock it waited on was dropped from the map by its previous holder. */
    private ReentrantLock acquireRowLock(long entryId) {
        while (true) {
            ReentrantLock lock = rowLocks.computeIfAbsent(entryId, id -> new ReentrantLock());
            lock.lock();
            if (rowLocks.get(entryId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private void releaseRowLocks(Map<Long, ReentrantLock> held) {
        held.forEach((entryId, lock) -> {
            lock.unlock();
            rowLocks.computeIfPresent(entryId, (id, l) -> l.isLocked() || l.hasQueuedThreads() ? l : null);
        });
    }

    int heldRowLockCount() {
        return rowLocks.size();
    }

    @Override
    public void updateEntryStatus(long entryId, EntryStatus status) {
        inTransaction(() -> {
            StagedWrites tx = current.get();
            boolean staged = tx.bundles.stream().anyMatch(b -> b.header().id() == entryId);
            if (!staged && !entries.containsKey(entryId)) {
                throw new IllegalArgumentException("ledger entry " + entryId + " does not exist");
            }
            tx.statusUpdates.put(entryId, status);
            return null;
        });
    }

    @Override
    public List<LedgerEntry> loadByTransaction(String transactionId) {
        return select(row -> Objects.equals(row.transactionId(), transactionId));
    }

    @Override
    public Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return select(row -> idempotencyKey.equals(row.idempotencyKey())).stream().findFirst();
    }

    /** Joins a transaction already open on this thread. */
    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (current.get() != null) {
            return work.get();
        }
        StagedWrites tx = new StagedWrites();
        current.set(tx);
        try {
            T result = work.get();
            commit(tx);
            return result;
        } catch (RuntimeException ex) {
            log.warn("Rolling back {} staged entries: {}", tx.bundles.size(), ex.getMessage());
            throw ex;
        } finally {
            current.remove();
            releaseRowLocks(tx.locks);
        }
    }

    // ---- FeeStorageAdapter ----

    @Override
    public Result<Long> persist(FeeCalculation result, FeeSource source, FeePolicy policy, PersistOptions options) {
        if (result == null || policy == null) {
            return Result.err(ErrorCode.PERSISTENCE_FAILED, "calculation and policy are required");
        }
        PersistOptions opts = options != null ? options : new PersistOptions(null, null, null, null);
        String transactionId = opts.transactionId() != null ? opts.transactionId()
            : source != null && source.objectId() != null ? source.objectId()
            : UUID.randomUUID().toString();
        Instant createdAt = opts.createdAt() != null ? opts.createdAt() : Instant.now(clock);
        LedgerEntry entry = LedgerEntry.settlement(result, policy, transactionId, source, opts.idempotencyKey(),
            createdAt, opts.meta());
        try {
            return Result.ok(saveEntry(entry));
        } catch (RuntimeException ex) {
            return Result.err(ErrorCode.PERSISTENCE_FAILED, "entry could not be persisted: " + ex.getMessage());
        }
    }

    @Override
    public Result<Long> persistAdjustment(LedgerEntry adjustment) {
        if (adjustment == null || adjustment.isSettlement() || adjustment.parentEntryId() == null) {
            return Result.err(ErrorCode.INVALID_ADJUSTMENT, "an adjustment needs a non-SETTLE event type and a parent entry");
        }
        try {
            return inTransaction(() -> {
                if (loadEntryForUpdate(adjustment.parentEntryId()).isEmpty()) {
                    return Result.err(ErrorCode.ERR_LEDGER_ENTRY_NOT_FOUND,
                        "ledger entry " + adjustment.parentEntryId() + " not found");
                }
                long id = saveEntry(adjustment);
                updateEntryStatus(adjustment.parentEntryId(), EntryStatus.ADJUSTED);
                return Result.ok(id);
            });
        } catch (RuntimeException ex) {
            return Result.err(ErrorCode.PERSISTENCE_FAILED, "adjustment could not be persisted: " + ex.getMessage());
        }
    }

    @Override
    public Optional<LedgerEntry> loadEntry(long entryId, LoadOptions options) {
        tableLock.readLock().lock();
        try {
            EntryRow row = entries.get(entryId);
            return row == null ? Optional.empty() : Optional.of(assemble(row, options));
        } finally {
            tableLock.readLock().unlock();
        }
    }

    @Override
    public Optional<LedgerEntry> loadLatest(FeeSource source) {
        List<LedgerEntry> all = loadAllForSource(source);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public List<LedgerEntry> loadAllForSource(FeeSource source) {
        return select(row -> matches(row, source));
    }

    @Override
    public long countForSource(FeeSource source, EventType eventType) {
        return entries.values().stream()
            .filter(row -> matches(row, source))
            .filter(row -> eventType == null || row.eventType() == eventType)
            .count();
    }

    @Override
    public Stream<LedgerEntry> iterateForSource(FeeSource source, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        List<Long> ids = entries.values().stream()
            .filter(row -> matches(row, source))
            .map(EntryRow::id)
            .toList();
        int batches = (ids.size() + batchSize - 1) / batchSize;
        return IntStream.range(0, batches)
            .mapToObj(b -> ids.subList(b * batchSize, Math.min(ids.size(), (b + 1) * batchSize)))
            .flatMap(batch -> batch.stream().map(id -> loadEntry(id, LoadOptions.FULL)).flatMap(Optional::stream));
    }

    @Override
    public RunningTotals getRunningTotals(FeeSource source) {
        BigDecimal settled = BigDecimal.ZERO;
        BigDecimal adjusted = BigDecimal.ZERO;
        long count = 0;
        int scale = 2;
        for (EntryRow row : entries.values()) {
            if (!matches(row, source)) {
                continue;
            }
            if (count == 0 && row.precision() != null) {
                scale = row.precision();
            }
            count++;
            if (row.eventType() == EventType.SETTLE) {
                settled = settled.add(row.totalFee());
            } else {
                adjusted = adjusted.add(row.totalFee());
            }
        }
        return new RunningTotals(
            DecimalMath.round(settled, scale),
            DecimalMath.round(adjusted, scale),
            DecimalMath.round(settled.add(adjusted), scale),
            count
        );
    }

    @Override
    public Map<String, BigDecimal> getTotalsByTag(FeeSource source) {
        Set<Long> ids = new HashSet<>();
        entries.values().stream().filter(row -> matches(row, source)).forEach(row -> ids.add(row.id()));
        Map<String, BigDecimal> totals = new TreeMap<>();
        for (ComponentTagRow tag : componentTags) {
            if (!ids.contains(tag.entryId())) {
                continue;
            }
            components.stream()
                .filter(c -> c.entryId() == tag.entryId() && c.componentId().equals(tag.componentId()))
                .forEach(c -> totals.merge(tag.tag(), c.amount(), BigDecimal::add));
        }
        return totals;
    }

    @Override
    public List<LedgerEntry> findByPolicy(String policyKey, Integer version) {
        return select(row -> Objects.equals(row.policyKey(), policyKey)
            && (version == null || Objects.equals(row.policyVersion(), version)));
    }

    // ---- transaction plumbing ----

    private static final class StagedWrites {
        final List<EntryBundle> bundles = new ArrayList<>();
        final Map<Long, EntryStatus> statusUpdates = new LinkedHashMap<>();
        final Map<Long, ReentrantLock> locks = new LinkedHashMap<>();
    }

    private record EntryBundle(
        EntryRow header,
        List<ComponentRow> components,
        List<ComponentTagRow> tags,
        List<LineRow> lines,
        List<LineComponentRow> lineComponents,
        List<WarningRow> warnings,
        List<RefundPlanRow> refundPlan,
        List<AdjustmentLineRow> adjustmentLines,
        List<InputLineRow> inputLines
    ) {}

    private void commit(StagedWrites tx) {
        if (tx.bundles.isEmpty() && tx.statusUpdates.isEmpty()) {
            return;
        }
        tableLock.writeLock().lock();
        try {
            Set<String> keys = new HashSet<>();
            entries.values().forEach(row -> {
                if (row.idempotencyKey() != null) {
                    keys.add(row.idempotencyKey());
                }
            });
            for (EntryBundle bundle : tx.bundles) {
                String key = bundle.header().idempotencyKey();
                if (key != null && !keys.add(key)) {
                    throw new IllegalStateException("duplicate idempotency_key " + key);
                }
            }
            for (EntryBundle bundle : tx.bundles) {
                entries.put(bundle.header().id(), bundle.header());
                components.addAll(bundle.components());
                componentTags.addAll(bundle.tags());
                lines.addAll(bundle.lines());
                lineComponents.addAll(bundle.lineComponents());
                warnings.addAll(bundle.warnings());
                refundPlan.addAll(bundle.refundPlan());
                adjustmentLines.addAll(bundle.adjustmentLines());
                inputLines.addAll(bundle.inputLines());
            }
            tx.statusUpdates.forEach((id, status) -> entries.computeIfPresent(id, (k, row) -> row.withStatus(status)));
            log.debug("Committed {} entries and {} status updates", tx.bundles.size(), tx.statusUpdates.size());
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    private List<LedgerEntry> select(Predicate<EntryRow> filter) {
        tableLock.readLock().lock();
        try {
            return entries.values().stream()
                .filter(filter)
                .map(row -> assemble(row, LoadOptions.FULL))
                .toList();
        } finally {
            tableLock.readLock().unlock();
        }
    }

    private static boolean matches(EntryRow row, FeeSource source) {
        return source != null
            && Objects.equals(row.module(), source.module())
            && Objects.equals(row.objectType(), source.objectType())
            && Objects.equals(row.objectId(), source.objectId())
            && Objects.equals(row.scopeId(), source.scopeId());
    }

    // ---- entry <-> rows ----

    private static EntryBundle toRows(LedgerEntry entry, long id) {
        FeeSource source = entry.source();
        PolicySnapshot policy = entry.policySnapshot();
        InputSnapshot input = entry.inputSnapshot();
        OrderTotals order = input != null && input.orderTotals() != null ? input.orderTotals() : OrderTotals.EMPTY;
        AdjustmentDetails adjustment = entry.adjustment();

        EntryRow header = new EntryRow(
            id,
            entry.transactionId(),
            entry.eventType(),
            entry.status() != null ? entry.status() : EntryStatus.ACTIVE,
            entry.currency(),
            entry.totalFee(),
            entry.signature(),
            entry.idempotencyKey(),
            entry.parentEntryId(),
            source != null ? source.module() : null,
            source != null ? source.objectType() : null,
            source != null ? source.objectId() : null,
            source != null ? source.scopeId() : null,
            policy != null ? policy.policyKey() : null,
            policy != null ? policy.version() : null,
            policy != null ? policy.componentCount() : null,
            policy != null ? policy.policyHash() : null,
            policy != null ? policy.precision() : null,
            policy != null ? policy.channelKey() : null,
            input != null ? input.linesCount() : null,
            order.net(),
            order.gross(),
            order.tax(),
            order.shipping(),
            order.quantity(),
            adjustment != null ? adjustment.mode() : null,
            adjustment != null ? adjustment.refundBase() : null,
            adjustment != null ? adjustment.reason() : null,
            adjustment != null && adjustment.fallback(),
            entry.createdAt(),
            entry.meta()
        );

        List<ComponentRow> componentRows = new ArrayList<>();
        List<ComponentTagRow> tagRows = new ArrayList<>();
        for (int i = 0; i < entry.breakdown().size(); i++) {
            BreakdownEntry b = entry.breakdown().get(i);
            TierBracket tier = b.tier();
            componentRows.add(new ComponentRow(id, i, b.componentId(), b.name(), b.type(), b.scope(), b.amount(),
                b.baseUsed(), b.rate(), b.fixed(), b.tierIndex(),
                tier != null ? tier.min() : null, tier != null ? tier.max() : null,
                tier != null ? tier.rate() : null, tier != null ? tier.fixed() : null,
                b.capDelta(), b.targetSumBefore(), b.capBound(), b.targetIds(), b.overrideReason(), b.applied(),
                b.discardReason(), b.refund().refundable(), b.refund().behavior(), b.refund().capRefundToOriginal(),
                b.proration(), b.lineIds(), b.tierSelected()));
            b.tags().forEach(tag -> tagRows.add(new ComponentTagRow(id, b.componentId(), tag)));
        }

        List<LineRow> lineRows = new ArrayList<>();
        List<LineComponentRow> lineComponentRows = new ArrayList<>();
        for (int i = 0; i < entry.allocation().size(); i++) {
            LineAllocation line = entry.allocation().get(i);
            lineRows.add(new LineRow(id, i, line.lineId(), line.feeAmount()));
            for (int j = 0; j < line.components().size(); j++) {
                LineContribution c = line.components().get(j);
                lineComponentRows.add(new LineComponentRow(id, line.lineId(), j, c.componentId(), c.amount(),
                    c.prorationMethod(), c.prorationWeight()));
            }
        }

        List<WarningRow> warningRows = new ArrayList<>();
        for (int i = 0; i < entry.warnings().size(); i++) {
            CalculationWarning w = entry.warnings().get(i);
            warningRows.add(new WarningRow(id, i, w.code(), w.message(), w.componentId()));
        }

        List<RefundPlanRow> planRows = new ArrayList<>();
        for (int i = 0; i < entry.refundPlan().size(); i++) {
            RefundPlanItem p = entry.refundPlan().get(i);
            planRows.add(new RefundPlanRow(id, i, p.componentId(), p.type(), p.originalFee(), p.refundRatio(),
                p.refundedFee(), p.refundable(), p.behavior(), p.reasonCode()));
        }

        List<AdjustmentLineRow> adjustmentRows = new ArrayList<>();
        if (adjustment != null) {
            int position = 0;
            for (String lineId : adjustment.coverage().affectedLineIds()) {
                adjustmentRows.add(new AdjustmentLineRow(id, position++, lineId,
                    adjustment.lineRefunds().get(lineId), true));
            }
            for (String lineId : adjustment.coverage().unaffectedLineIds()) {
                adjustmentRows.add(new AdjustmentLineRow(id, position++, lineId,
                    adjustment.lineRefunds().get(lineId), false));
            }
        }

        List<InputLineRow> inputRows = new ArrayList<>();
        if (input != null) {
            for (int i = 0; i < input.lineIds().size(); i++) {
                inputRows.add(new InputLineRow(id, i, input.lineIds().get(i)));
            }
        }

        return new EntryBundle(header, componentRows, tagRows, lineRows, lineComponentRows, warningRows, planRows,
            adjustmentRows, inputRows);
    }

    private LedgerEntry assemble(EntryRow row, LoadOptions options) {
        long id = row.id();
        List<BreakdownEntry> breakdown = options.components()
            ? components.stream()
                .filter(c -> c.entryId() == id)
                .sorted(Comparator.comparingInt(ComponentRow::position))
                .map(c -> toBreakdown(c, tagsOf(id, c.componentId())))
                .toList()
            : List.of();

        List<LineAllocation> allocation = options.lines()
            ? lines.stream()
                .filter(l -> l.entryId() == id)
                .sorted(Comparator.comparingInt(LineRow::position))
                .map(l -> new LineAllocation(l.lineId(), l.feeAmount(), contributionsOf(id, l.lineId())))
                .toList()
            : List.of();

        List<CalculationWarning> warningList = options.warnings()
            ? warnings.stream()
                .filter(w -> w.entryId() == id)
                .sorted(Comparator.comparingInt(WarningRow::position))
                .map(w -> new CalculationWarning(w.code(), w.message(), w.componentId()))
                .toList()
            : List.of();

        List<RefundPlanItem> plan = options.refundPlan()
            ? refundPlan.stream()
                .filter(p -> p.entryId() == id)
                .sorted(Comparator.comparingInt(RefundPlanRow::position))
                .map(p -> new RefundPlanItem(p.componentId(), p.type(), p.originalFee(), p.refundRatio(),
                    p.refundedFee(), p.refundable(), p.behavior(), p.reasonCode()))
                .toList()
            : List.of();

        PolicySnapshot policy = row.policyKey() == null ? null : new PolicySnapshot(row.policyKey(),
            row.policyVersion(), row.componentCount(), row.policyHash(), row.precision(), row.channelKey());
        InputSnapshot input = row.linesCount() == null ? null : new InputSnapshot(
            row.linesCount(),
            new OrderTotals(row.orderNet(), row.orderGross(), row.orderTax(), row.orderShipping(), row.orderQuantity()),
            inputLines.stream()
                .filter(l -> l.entryId() == id)
                .sorted(Comparator.comparingInt(InputLineRow::position))
                .map(InputLineRow::lineId)
                .toList());
        FeeSource source = row.module() == null && row.objectType() == null && row.objectId() == null
            ? null : new FeeSource(row.module(), row.objectType(), row.objectId(), row.scopeId());

        return new LedgerEntry(id, row.transactionId(), row.eventType(), row.status(), row.currency(),
            row.totalFee(), breakdown, allocation, warningList, policy, input, row.signature(), row.idempotencyKey(),
            row.parentEntryId(), source, plan, adjustmentOf(row), row.createdAt(), row.meta());
    }

    private AdjustmentDetails adjustmentOf(EntryRow row) {
        if (row.adjustmentMode() == null) {
            return null;
        }
        Map<String, BigDecimal> lineRefunds = new LinkedHashMap<>();
        List<String> affected = new ArrayList<>();
        List<String> unaffected = new ArrayList<>();
        adjustmentLines.stream()
            .filter(a -> a.entryId() == row.id())
            .sorted(Comparator.comparingInt(AdjustmentLineRow::position))
            .forEach(a -> {
                if (a.refundAmount() != null) {
                    lineRefunds.put(a.lineId(), a.refundAmount());
                }
                (a.affected() ? affected : unaffected).add(a.lineId());
            });
        return new AdjustmentDetails(row.adjustmentMode(), row.refundBase(), row.adjustmentReason(), lineRefunds,
            new Coverage(affected, unaffected), row.fallback());
    }

    private List<String> tagsOf(long entryId, String componentId) {
        return componentTags.stream()
            .filter(t -> t.entryId() == entryId && t.componentId().equals(componentId))
            .map(ComponentTagRow::tag)
            .toList();
    }

    private List<LineContribution> contributionsOf(long entryId, String lineId) {
        return lineComponents.stream()
            .filter(c -> c.entryId() == entryId && c.lineId().equals(lineId))
            .sorted(Comparator.comparingInt(LineComponentRow::position))
            .map(c -> new LineContribution(c.componentId(), c.amount(), c.prorationMethod(), c.prorationWeight()))
            .toList();
    }

    private static BreakdownEntry toBreakdown(ComponentRow c, List<String> tags) {
        TierBracket tier = c.tierIndex() == null ? null
            : new TierBracket(c.tierMin(), c.tierMax(), c.tierRate(), c.tierFixed());
        return new BreakdownEntry(c.componentId(), c.name(), c.type(), c.scope(), c.amount(), c.baseUsed(),
            c.rate(), c.fixed(), c.tierIndex(), tier, c.capDelta(), c.targetSumBefore(), c.capBound(),
            c.targetIds(), c.overrideReason(), c.applied(), c.discardReason(), tags,
            new RefundConfig(c.refundable(), c.refundBehavior(), c.capRefundToOriginal()), c.proration(),
            c.lineIds(), c.tierSelected());
    }
}
