package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;
import com.feeledger.error.Result;
import com.feeledger.math.DecimalMath;
import com.feeledger.math.DivisionByZeroException;
import com.feeledger.policy.ComponentHeader;
import com.feeledger.policy.FeeComponent;
import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.PolicyHasher;
import com.feeledger.policy.PolicyValidator;
import com.feeledger.policy.Scope;
import com.feeledger.policy.TierBracket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fee calculation engine: transaction + policy in, breakdown + per-line allocation out.
 *
 * Evaluation:
 * 1. Components are sorted by precedence (stable; ties keep declaration order).
 * 2. A component whose conditions fail is recorded as {@code condition_not_met}.
 * 3. Fee components compute their base over their lines and an amount by type,
 *    rounded to the policy precision.
 * 4. Caps and overrides rewrite amounts recorded by earlier components.
 * 5. Every applied amount is allocated across its lines.
 *
 * Pure and thread-safe: no I/O, no shared mutable state. Structural failures
 * come back as an error {@link Result}; nothing is thrown across this boundary.
 */
public class FeeCalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(FeeCalculationEngine.class);

    public static final String ENGINE_VERSION = "2.0";

    static final String CONDITION_NOT_MET = "condition_not_met";
    static final String SELECTOR_NO_MATCH = "selector_no_match";
    static final String NO_TIER_MATCH = "no_tier_match";

    private final PolicyValidator validator;
    private final PolicyHasher hasher;

    public FeeCalculationEngine(PolicyValidator validator, PolicyHasher hasher) {
        this.validator = validator;
        this.hasher = hasher;
    }

    public Result<FeeCalculation> calculate(FeeTransaction transaction, FeePolicy policy) {
        return calculate(transaction, policy, CalculationOptions.DEFAULTS);
    }

    public Result<FeeCalculation> calculate(FeeTransaction transaction, FeePolicy policy, CalculationOptions options) {
        if (transaction == null) {
            return Result.err(ErrorCode.MISSING_LINES, "transaction is required");
        }
        if (policy == null) {
            return Result.err(ErrorCode.INVALID_POLICY, "policy is required");
        }
        CalculationOptions effective = options != null ? options : CalculationOptions.DEFAULTS;
        try {
            validator.validate(policy);
            return Result.ok(evaluate(transaction, policy, effective));
        } catch (FeeCalculationException ex) {
            log.warn("Fee calculation failed policy={} code={}: {}",
                policy.policyKey(), ex.getErrorCode(), ex.getMessage());
            return Result.err(ex.getErrorCode(), ex.getMessage());
        } catch (DivisionByZeroException ex) {
            log.warn("Fee calculation failed policy={}: {}", policy.policyKey(), ex.getMessage());
            return Result.err(ErrorCode.DIVISION_BY_ZERO, ex.getMessage());
        }
    }

    private FeeCalculation evaluate(FeeTransaction transaction, FeePolicy policy, CalculationOptions options) {
        boolean strict = options.strict() != null ? options.strict() : policy.strict();
        int scale = policy.precision();
        AmountModel.Normalized input = AmountModel.normalize(transaction);
        EvaluationContext ctx = new EvaluationContext(input, transaction, strict, scale);

        List<FeeComponent> ordered = new ArrayList<>(policy.components());
        ordered.sort(Comparator.comparingInt(c -> c.header().precedence()));

        List<WorkingEntry> entries = new ArrayList<>();
        List<FeeComponent.OverrideRule> activeOverrides = new ArrayList<>();
        for (FeeComponent component : ordered) {
            WorkingEntry entry = new WorkingEntry(component, scale);
            List<WorkingEntry> prior = List.copyOf(entries);
            entries.add(entry);

            if (!conditionsHold(component.header(), ctx)) {
                entry.discard(CONDITION_NOT_MET, scale);
                log.debug("Component {} skipped: {}", component.id(), CONDITION_NOT_MET);
                continue;
            }
            if (component instanceof FeeComponent.Cap cap) {
                ComponentRewriter.applyCap(cap, entry, prior, ctx);
                continue;
            }
            if (component instanceof FeeComponent.OverrideRule override) {
                ComponentRewriter.applyOverride(override, entry, prior, scale);
                activeOverrides.add(override);
                continue;
            }

            List<PricedLine> lines = applicableLines(component, ctx);
            if (lines.isEmpty()) {
                entry.discard(SELECTOR_NO_MATCH, scale);
                continue;
            }
            entry.lines = lines;
            evaluateFee(component, entry, ctx);

            Optional<FeeComponent.OverrideRule> excludedBy = activeOverrides.stream()
                .filter(o -> o.excludes(component))
                .findFirst();
            if (excludedBy.isPresent() && entry.applied) {
                ComponentRewriter.exclude(excludedBy.get(), entry, scale);
            }
            log.debug("Component {} amount={} base={}", component.id(), entry.amount, entry.baseUsed);
        }

        List<LineAllocation> allocation = Allocator.allocate(entries, input.lines(), options.defaultProration(), scale);
        List<BreakdownEntry> breakdown = entries.stream().map(WorkingEntry::freeze).toList();
        BigDecimal totalFee = DecimalMath.sum(breakdown.stream().map(BreakdownEntry::amount).toList(), scale);

        String policyHash = hasher.hash(policy);
        String signature = SignatureGenerator.sign(ENGINE_VERSION, policyHash, transaction.channelKey(), input,
            scale, totalFee, breakdown);
        CalculationMeta meta = new CalculationMeta(signature, policyHash, policy.policyKey(), policy.version(),
            scale, strict, ENGINE_VERSION, transaction.asOf());

        return new FeeCalculation(policy.currency(), totalFee, breakdown, allocation, ctx.warnings(), meta,
            explain(entries, allocation), input.order().toTotals());
    }

    private boolean conditionsHold(ComponentHeader header, EvaluationContext ctx) {
        return header.conditions().stream()
            .allMatch(c -> ConditionEvaluator.matches(c, ctx.resolve(c.field())));
    }

    private List<PricedLine> applicableLines(FeeComponent component, EvaluationContext ctx) {
        ComponentHeader header = component.header();
        if (header.scope() == Scope.ORDER) {
            if (header.lineSelector() != null) {
                String message = component.id() + ": line_selector is ignored on an order-scoped component";
                if (ctx.strict()) {
                    throw new FeeCalculationException(ErrorCode.LINE_SELECTOR_NOT_ALLOWED_FOR_ORDER, message);
                }
                ctx.warn(ErrorCode.LINE_SELECTOR_NOT_ALLOWED_FOR_ORDER, message, component.id());
            }
            return ctx.lines();
        }
        List<PricedLine> selected = LineSelectorEvaluator.select(component.id(), header.lineSelector(),
            ctx.lines(), ctx.strict());
        if (selected.isEmpty() && header.lineSelector() != null && header.lineSelector().requireMatch()) {
            String message = component.id() + ": line_selector matched no lines";
            if (ctx.strict()) {
                throw new FeeCalculationException(ErrorCode.LINE_SELECTOR_NO_MATCH, message);
            }
            ctx.warn(ErrorCode.LINE_SELECTOR_NO_MATCH, message, component.id());
        }
        return selected;
    }

    private void evaluateFee(FeeComponent component, WorkingEntry entry, EvaluationContext ctx) {
        int scale = ctx.scale();
        BigDecimal base = baseUsed(component, entry.lines, ctx);
        BigDecimal quantity = component.scope() == Scope.ORDER
            ? ctx.order().quantity()
            : DecimalMath.sum(entry.lines.stream().map(PricedLine::quantity).toList());
        entry.baseUsed = base;

        BigDecimal raw = switch (component.type()) {
            case RATE -> {
                entry.rate = ((FeeComponent.Rate) component).rate();
                yield DecimalMath.percentOf(base, entry.rate);
            }
            case RATE_PP -> {
                entry.rate = ((FeeComponent.RatePp) component).pp();
                yield DecimalMath.percentOf(base, entry.rate);
            }
            case FIXED_UNIT -> {
                entry.fixed = ((FeeComponent.FixedUnit) component).fixed();
                yield DecimalMath.mul(entry.fixed, quantity);
            }
            case FIXED_ORDER -> {
                entry.fixed = ((FeeComponent.FixedOrder) component).fixed();
                yield entry.fixed;
            }
            case TIER -> evaluateTier((FeeComponent.Tier) component, entry, base, quantity, ctx);
            case CAP, OVERRIDE -> throw new IllegalStateException(component.id() + " is not a fee component");
        };
        if (entry.applied) {
            entry.amount = DecimalMath.round(raw, scale);
        }
    }

    /**
     * Order-scoped tier: one bracket picked from the order's tier value, its
     * rate applied to the base and its fixed amount added once.
     */
    private BigDecimal evaluateTier(FeeComponent.Tier tier, WorkingEntry entry, BigDecimal base,
                                    BigDecimal quantity, EvaluationContext ctx) {
        if (tier.scope() == Scope.LINE) {
            return evaluateLineTier(tier, entry, ctx);
        }
        BigDecimal value = tierValue(tier, base, quantity);
        OptionalInt match = TierResolver.resolve(tier.tiers(), tier.boundary(), value);
        if (match.isEmpty()) {
            String message = tier.id() + ": no tier bracket contains " + value.toPlainString();
            if (ctx.strict()) {
                throw new FeeCalculationException(ErrorCode.TIER_NOT_FOUND, message);
            }
            ctx.warn(ErrorCode.TIER_NOT_FOUND, message, tier.id());
            entry.discard(NO_TIER_MATCH, ctx.scale());
            return BigDecimal.ZERO;
        }
        selectBracket(tier, entry, match.getAsInt());
        return tierAmount(tier.tiers().get(match.getAsInt()), base, BigDecimal.ONE);
    }

    /**
     * Line-scoped tier: every line picks its own bracket from its own tier
     * value and is charged at that bracket. Lines with no bracket contribute
     * nothing; the component is discarded only when no line matched.
     */
    private BigDecimal evaluateLineTier(FeeComponent.Tier tier, WorkingEntry entry, EvaluationContext ctx) {
        BigDecimal total = BigDecimal.ZERO;
        List<String> unmatched = new ArrayList<>();
        for (PricedLine line : entry.lines) {
            BigDecimal base = BaseSpecEvaluator.evaluate(tier.id(), tier.header().base(), line::amount,
                "line " + line.lineId());
            OptionalInt match = TierResolver.resolve(tier.tiers(), tier.boundary(),
                tierValue(tier, base, line.quantity()));
            if (match.isEmpty()) {
                unmatched.add(line.lineId());
                continue;
            }
            BigDecimal amount = tierAmount(tier.tiers().get(match.getAsInt()), base, line.quantity());
            entry.tierSelected.put(line.lineId(), match.getAsInt());
            entry.lineAmounts.put(line.lineId(), amount);
            total = total.add(amount);
        }
        if (!unmatched.isEmpty()) {
            String message = tier.id() + ": no tier bracket for lines " + String.join(", ", unmatched);
            if (ctx.strict()) {
                throw new FeeCalculationException(ErrorCode.TIER_NOT_FOUND, message);
            }
            ctx.warn(ErrorCode.TIER_NOT_FOUND, message, tier.id());
            if (entry.tierSelected.isEmpty()) {
                entry.discard(NO_TIER_MATCH, ctx.scale());
                return BigDecimal.ZERO;
            }
        }
        // a single bracket shared by every charged line is also reported on the entry itself
        if (entry.tierSelected.values().stream().distinct().count() == 1) {
            selectBracket(tier, entry, entry.tierSelected.values().iterator().next());
        }
        return total;
    }

    private static BigDecimal tierValue(FeeComponent.Tier tier, BigDecimal base, BigDecimal quantity) {
        return switch (tier.tierBy()) {
            case BASE -> base;
            case UNIT_PRICE -> DecimalMath.divOrZero(base, quantity, DecimalMath.RATIO_SCALE);
            case QUANTITY -> quantity;
        };
    }

    private static BigDecimal tierAmount(TierBracket bracket, BigDecimal base, BigDecimal units) {
        BigDecimal amount = bracket.rate() != null ? DecimalMath.percentOf(base, bracket.rate()) : BigDecimal.ZERO;
        return bracket.fixed() != null ? amount.add(bracket.fixed().multiply(units)) : amount;
    }

    private static void selectBracket(FeeComponent.Tier tier, WorkingEntry entry, int index) {
        TierBracket bracket = tier.tiers().get(index);
        entry.tierIndex = index;
        entry.tier = bracket;
        entry.rate = bracket.rate();
        entry.fixed = bracket.fixed();
    }

    private BigDecimal baseUsed(FeeComponent component, List<PricedLine> lines, EvaluationContext ctx) {
        ComponentHeader header = component.header();
        if (header.scope() == Scope.ORDER) {
            return BaseSpecEvaluator.evaluate(component.id(), header.base(), ctx.order()::amount, "order");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (PricedLine line : lines) {
            total = total.add(BaseSpecEvaluator.evaluate(component.id(), header.base(), line::amount,
                "line " + line.lineId()));
        }
        return total;
    }

    private ExplainPlan explain(List<WorkingEntry> entries, List<LineAllocation> allocation) {
        Map<String, String> discarded = new LinkedHashMap<>();
        entries.stream()
            .filter(e -> !e.applied)
            .forEach(e -> discarded.put(e.component.id(), e.discardReason));
        Map<String, Integer> coverage = new LinkedHashMap<>();
        for (LineAllocation line : allocation) {
            for (LineContribution contribution : line.components()) {
                coverage.merge(contribution.componentId(), 1, Integer::sum);
            }
        }
        boolean capTargeting = entries.stream()
            .anyMatch(e -> e.applied && e.component instanceof FeeComponent.Cap);
        return new ExplainPlan(
            entries.stream().map(e -> e.component.id()).toList(),
            (int) entries.stream().filter(e -> e.applied).count(),
            discarded,
            capTargeting,
            coverage
        );
    }
}
