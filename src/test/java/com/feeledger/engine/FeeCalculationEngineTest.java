package com.feeledger.engine;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.Result;
import com.feeledger.policy.BaseSpec;
import com.feeledger.policy.CapTargets;
import com.feeledger.policy.ComponentHeader;
import com.feeledger.policy.ComponentType;
import com.feeledger.policy.Condition;
import com.feeledger.policy.FeeComponent;
import com.feeledger.policy.FeePolicy;
import com.feeledger.policy.LineSelector;
import com.feeledger.policy.Operator;
import com.feeledger.policy.Policies;
import com.feeledger.policy.PolicyHasher;
import com.feeledger.policy.PolicyValidator;
import com.feeledger.policy.ProrationMethod;
import com.feeledger.policy.Scope;
import com.feeledger.policy.TierBoundary;
import com.feeledger.policy.TierBracket;
import com.feeledger.policy.TierBy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeeCalculationEngineTest {

    private FeeCalculationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FeeCalculationEngine(new PolicyValidator(), new PolicyHasher());
    }

    @Nested
    @DisplayName("Rate and fixed components")
    class RatesAndFixed {

        @Test
        void rate_fivePercentOfNet() {
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                Policies.simpleRate("standard", "marketplace", "EUR", new BigDecimal("5")));

            assertEquals(new BigDecimal("50.00"), calc.totalFee());
            BreakdownEntry rate = entry(calc, "standard_rate");
            assertEquals(new BigDecimal("50.00"), rate.amount());
            assertEquals(0, new BigDecimal("1000").compareTo(rate.baseUsed()));
            assertTrue(rate.applied());
            assertEquals("EUR", calc.currency());
        }

        @Test
        void ratePp_computedLikeRate() {
            FeeComponent pp = new FeeComponent.RatePp(ComponentHeader.of("pp", Scope.ORDER), new BigDecimal("1.5"));
            FeeCalculation calc = calculate(tx(line("l1", "200")), policy(pp));
            assertEquals(new BigDecimal("3.00"), calc.totalFee());
        }

        @Test
        void fixedUnit_multipliesLineQuantity() {
            FeeComponent unit = new FeeComponent.FixedUnit(
                ComponentHeader.of("handling", Scope.LINE).withProration(ProrationMethod.BY_QUANTITY), new BigDecimal("0.25"));
            FeeCalculation calc = calculate(tx(
                TransactionLine.ofNet("l1", new BigDecimal("10"), new BigDecimal("2")),
                TransactionLine.ofNet("l2", new BigDecimal("10"), new BigDecimal("3"))), policy(unit));

            assertEquals(new BigDecimal("1.25"), calc.totalFee());
            assertEquals(new BigDecimal("0.50"), allocation(calc, "l1").feeAmount());
            assertEquals(new BigDecimal("0.75"), allocation(calc, "l2").feeAmount());
        }

        @Test
        void fixedOrder_appliedOnce() {
            FeeComponent fixed = new FeeComponent.FixedOrder(ComponentHeader.of("platform", Scope.ORDER), BigDecimal.ONE);
            FeeCalculation calc = calculate(tx(line("l1", "10"), line("l2", "20"), line("l3", "30")), policy(fixed));
            assertEquals(new BigDecimal("1.00"), calc.totalFee());
        }

        @Test
        void grossOnlyLine_derivesNetFromTaxRate() {
            TransactionLine gross = new TransactionLine("l1", null, new BigDecimal("119"), null,
                new BigDecimal("19"), null, null);
            FeeCalculation calc = calculate(tx(gross),
                Policies.simpleRate("standard", "marketplace", "EUR", BigDecimal.TEN));
            assertEquals(new BigDecimal("10.00"), calc.totalFee());
            assertEquals(0, new BigDecimal("19").compareTo(calc.orderTotals().tax()));
        }
    }

    @Nested
    @DisplayName("Allocation")
    class Allocation {

        @Test
        void byNet_splitsSixHundredFourHundred() {
            FeeCalculation calc = calculate(tx(line("l1", "600"), line("l2", "400")),
                Policies.simpleRate("standard", "marketplace", "EUR", new BigDecimal("5")));

            assertEquals(new BigDecimal("30.00"), allocation(calc, "l1").feeAmount());
            assertEquals(new BigDecimal("20.00"), allocation(calc, "l2").feeAmount());
            LineContribution contribution = allocation(calc, "l1").components().get(0);
            assertEquals(ProrationMethod.BY_NET, contribution.prorationMethod());
            assertEquals(new BigDecimal("0.600000"), contribution.prorationWeight());
        }

        @Test
        void equalSplit_lastLineTakesRemainder() {
            FeeComponent fixed = new FeeComponent.FixedOrder(
                ComponentHeader.of("platform", Scope.ORDER).withProration(ProrationMethod.EQUAL), BigDecimal.ONE);
            FeeCalculation calc = calculate(tx(line("l1", "10"), line("l2", "20"), line("l3", "30")), policy(fixed));

            assertEquals(List.of(new BigDecimal("0.33"), new BigDecimal("0.33"), new BigDecimal("0.34")),
                calc.allocation().stream().map(LineAllocation::feeAmount).toList());
        }

        @Test
        void zeroWeights_fallBackToEqual() {
            FeeComponent fixed = new FeeComponent.FixedOrder(ComponentHeader.of("platform", Scope.ORDER), BigDecimal.ONE);
            FeeCalculation calc = calculate(tx(line("l1", "0"), line("l2", "0")), policy(fixed));

            assertEquals(new BigDecimal("0.50"), allocation(calc, "l1").feeAmount());
            assertEquals(ProrationMethod.EQUAL, allocation(calc, "l1").components().get(0).prorationMethod());
        }

        @Test
        void allocationAlwaysReconcilesToTotal() {
            FeeCalculation calc = calculate(tx(line("l1", "33.33"), line("l2", "33.33"), line("l3", "33.34")),
                policy(rate("a", "3.7"), rate("b", "1.1")));

            BigDecimal allocated = calc.allocation().stream().map(LineAllocation::feeAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal breakdown = calc.breakdown().stream().map(BreakdownEntry::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, calc.totalFee().compareTo(allocated));
            assertEquals(0, calc.totalFee().compareTo(breakdown));
        }
    }

    @Nested
    @DisplayName("Caps")
    class Caps {

        @Test
        void cap_clampsRateToMaxAndRecordsDelta() {
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                policy(rate("commission", "5"), cap("cap", null, "30", CapTargets.ALL)));

            assertEquals(new BigDecimal("30.00"), calc.totalFee());
            BreakdownEntry commission = entry(calc, "commission");
            assertEquals(new BigDecimal("30.00"), commission.amount());
            assertEquals(new BigDecimal("20.00"), commission.capDelta());
            assertEquals("max", commission.capBound());

            BreakdownEntry cap = entry(calc, "cap");
            assertEquals(new BigDecimal("0.00"), cap.amount());
            assertEquals(new BigDecimal("20.00"), cap.capDelta());
            assertEquals(new BigDecimal("50.00"), cap.targetSumBefore());
            assertEquals(List.of("commission"), cap.targetIds());
            assertTrue(calc.explainPlan().capTargeting());
        }

        @Test
        void cap_distributesDeltaProportionally() {
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                policy(rate("a", "5"), rate("b", "3"), cap("cap", null, "40", CapTargets.ALL)));

            assertEquals(new BigDecimal("25.00"), entry(calc, "a").amount());
            assertEquals(new BigDecimal("15.00"), entry(calc, "b").amount());
            assertEquals(new BigDecimal("40.00"), calc.totalFee());
        }

        @Test
        void cap_minRaisesAmount() {
            FeeComponent fixed = new FeeComponent.FixedOrder(ComponentHeader.of("platform", Scope.ORDER), BigDecimal.ONE);
            FeeCalculation calc = calculate(tx(line("l1", "10")), policy(fixed, cap("floor", "2", null, CapTargets.ALL)));

            assertEquals(new BigDecimal("2.00"), entry(calc, "platform").amount());
            assertEquals("min", entry(calc, "floor").capBound());
            assertEquals(new BigDecimal("-1.00"), entry(calc, "floor").capDelta());
        }

        @Test
        void cap_onlyTouchesTargets() {
            CapTargets byType = new CapTargets(List.of(), List.of(), List.of(ComponentType.RATE), List.of());
            FeeComponent fixed = new FeeComponent.FixedOrder(ComponentHeader.of("platform", Scope.ORDER), BigDecimal.TEN);
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                policy(rate("commission", "5"), fixed, cap("cap", null, "30", byType)));

            assertEquals(new BigDecimal("30.00"), entry(calc, "commission").amount());
            assertEquals(new BigDecimal("10.00"), entry(calc, "platform").amount());
            assertEquals(new BigDecimal("40.00"), calc.totalFee());
        }

        @Test
        void cap_withoutPriorComponents_warnsInLenientMode() {
            FeeCalculation calc = calculate(tx(line("l1", "1000")), policy(cap("cap", null, "30", CapTargets.ALL)));

            assertFalse(entry(calc, "cap").applied());
            assertEquals(ErrorCode.CAP_TARGETS_EMPTY, calc.warnings().get(0).code());
        }

        @Test
        void cap_unmatchedTargets_failInStrictMode() {
            CapTargets missing = new CapTargets(List.of("nope"), List.of(), List.of(), List.of());
            Result<FeeCalculation> result = engine.calculate(tx(line("l1", "1000")),
                policy(rate("commission", "5"), cap("cap", null, "30", missing)), CalculationOptions.strictMode());

            assertEquals(ErrorCode.CAP_TARGETS_NO_MATCH, result.errorCode());
        }
    }

    @Nested
    @DisplayName("Tiers")
    class Tiers {

        private final List<TierBracket> brackets = List.of(
            new TierBracket(BigDecimal.ZERO, new BigDecimal("1000"), new BigDecimal("4"), null),
            new TierBracket(new BigDecimal("1000"), null, new BigDecimal("3"), null));

        @Test
        void closedClosed_firstMatchingBracketWins() {
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                Policies.tiered("vol", "wholesale", "EUR", brackets));

            BreakdownEntry tier = entry(calc, "vol_tier");
            assertEquals(new BigDecimal("40.00"), tier.amount());
            assertEquals(0, tier.tierIndex());
        }

        @Test
        void closedOpen_upperBoundExclusive() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("vol", Scope.ORDER),
                TierBy.BASE, TierBoundary.CLOSED_OPEN, brackets);
            FeeCalculation calc = calculate(tx(line("l1", "1000")), policy(tier));

            assertEquals(new BigDecimal("30.00"), entry(calc, "vol").amount());
            assertEquals(1, entry(calc, "vol").tierIndex());
        }

        @Test
        void lineScopedFixed_multipliesQuantity() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("units", Scope.LINE),
                TierBy.QUANTITY, null, List.of(new TierBracket(BigDecimal.ZERO, null, null, BigDecimal.ONE)));
            FeeCalculation calc = calculate(tx(
                TransactionLine.ofNet("l1", BigDecimal.TEN, new BigDecimal("2")),
                TransactionLine.ofNet("l2", BigDecimal.TEN, new BigDecimal("3"))), policy(tier));

            assertEquals(new BigDecimal("5.00"), calc.totalFee());
        }

        @Test
        void unitPrice_selectsBracketByBaseOverQuantity() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("unit", Scope.ORDER), TierBy.UNIT_PRICE, null,
                List.of(new TierBracket(BigDecimal.ZERO, new BigDecimal("20"), new BigDecimal("5"), null),
                    new TierBracket(new BigDecimal("20"), null, new BigDecimal("3"), null)));
            FeeCalculation calc = calculate(tx(TransactionLine.ofNet("l1", new BigDecimal("100"), new BigDecimal("4"))),
                policy(tier));

            assertEquals(new BigDecimal("3.00"), calc.totalFee());
        }

        @Test
        @DisplayName("Line-scoped unit price tier: each line is charged at its own bracket")
        void lineScopedUnitPrice_eachLinePicksOwnBracket() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("unit", Scope.LINE), TierBy.UNIT_PRICE, null,
                List.of(new TierBracket(BigDecimal.ZERO, new BigDecimal("100"), new BigDecimal("5"), null),
                    new TierBracket(new BigDecimal("100"), null, new BigDecimal("2"), null)));
            FeeCalculation calc = calculate(tx(line("l1", "10"), line("l2", "1000")), policy(tier));

            // 5% of 10 plus 2% of 1000
            assertEquals(new BigDecimal("20.50"), calc.totalFee());
            BreakdownEntry entry = entry(calc, "unit");
            assertEquals(Map.of("l1", 0, "l2", 1), entry.tierSelected());
            assertNull(entry.tierIndex());
            assertEquals(List.of(new BigDecimal("0.50"), new BigDecimal("20.00")),
                calc.allocation().stream().map(LineAllocation::feeAmount).toList());
        }

        @Test
        @DisplayName("Line-scoped tier: unmatched lines are skipped with a warning")
        void lineScoped_unmatchedLineSkipped() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("unit", Scope.LINE), TierBy.BASE, null,
                List.of(new TierBracket(new BigDecimal("100"), null, BigDecimal.ONE, null)));
            FeeCalculation calc = calculate(tx(line("l1", "10"), line("l2", "1000")), policy(tier));

            assertEquals(new BigDecimal("10.00"), calc.totalFee());
            assertEquals(Map.of("l2", 0), entry(calc, "unit").tierSelected());
            assertEquals(0, entry(calc, "unit").tierIndex());
            assertEquals(ErrorCode.TIER_NOT_FOUND, calc.warnings().get(0).code());

            FeePolicy strict = policy(tier).withStrict(true);
            assertEquals(ErrorCode.TIER_NOT_FOUND,
                engine.calculate(tx(line("l1", "10"), line("l2", "1000")), strict).errorCode());
        }

        @Test
        void noMatchingBracket_warnsInLenientMode() {
            FeeCalculation calc = calculate(tx(line("l1", "50")), Policies.tiered("vol", "wholesale", "EUR",
                List.of(new TierBracket(new BigDecimal("100"), null, BigDecimal.ONE, null))));

            assertEquals(new BigDecimal("0.00"), calc.totalFee());
            assertEquals("no_tier_match", entry(calc, "vol_tier").discardReason());
            assertEquals(ErrorCode.TIER_NOT_FOUND, calc.warnings().get(0).code());
        }

        @Test
        void noMatchingBracket_failsInStrictMode() {
            FeePolicy policy = Policies.tiered("vol", "wholesale", "EUR",
                List.of(new TierBracket(new BigDecimal("100"), null, BigDecimal.ONE, null))).withStrict(true);
            assertEquals(ErrorCode.TIER_NOT_FOUND, engine.calculate(tx(line("l1", "50")), policy).errorCode());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void override_zeroesPriorTaggedComponent() {
            FeeComponent commission = new FeeComponent.Rate(
                ComponentHeader.of("commission", Scope.ORDER).withTags(List.of("commission")), new BigDecimal("5"));
            FeeComponent promo = override("promo", 200, null);
            FeeCalculation calc = calculate(tx(line("l1", "1000")), policy(commission, promo));

            BreakdownEntry excluded = entry(calc, "commission");
            assertFalse(excluded.applied());
            assertEquals("override_excluded", excluded.discardReason());
            assertEquals("launch", excluded.overrideReason());
            assertEquals(new BigDecimal("0.00"), calc.totalFee());
            assertEquals(List.of("commission"), entry(calc, "promo").targetIds());
        }

        @Test
        void override_excludesLaterComponentsToo() {
            FeeComponent commission = new FeeComponent.Rate(
                ComponentHeader.of("commission", Scope.ORDER).withTags(List.of("commission")), new BigDecimal("5"));
            FeeCalculation calc = calculate(tx(line("l1", "1000")), policy(override("promo", 10, null), commission));

            assertFalse(entry(calc, "commission").applied());
            assertEquals(new BigDecimal("0.00"), calc.totalFee());
        }

        @Test
        void override_replaceAmountKeepsComponentApplied() {
            FeeComponent commission = new FeeComponent.Rate(
                ComponentHeader.of("commission", Scope.ORDER).withTags(List.of("commission")), new BigDecimal("5"));
            FeeCalculation calc = calculate(tx(line("l1", "1000")),
                policy(commission, override("promo", 200, BigDecimal.TEN)));

            assertTrue(entry(calc, "commission").applied());
            assertEquals(new BigDecimal("10.00"), calc.totalFee());
        }
    }

    @Nested
    @DisplayName("Conditions and line selectors")
    class Selection {

        @Test
        void condition_onOrderTotals() {
            FeeComponent large = new FeeComponent.Rate(ComponentHeader.of("large", Scope.ORDER)
                .withConditions(List.of(new Condition("order.net", Operator.GTE, new BigDecimal("500")))), BigDecimal.ONE);

            assertEquals(new BigDecimal("10.00"), calculate(tx(line("l1", "1000")), policy(large)).totalFee());
            FeeCalculation small = calculate(tx(line("l1", "100")), policy(large));
            assertEquals("condition_not_met", small.explainPlan().discarded().get("large"));
            assertEquals(0, small.explainPlan().eligibleCount());
        }

        @Test
        void condition_onNestedContext() {
            FeeComponent gold = new FeeComponent.FixedOrder(ComponentHeader.of("gold", Scope.ORDER)
                .withConditions(List.of(new Condition("context.customer.tier", Operator.EQ, "gold"))), BigDecimal.ONE);
            FeeTransaction transaction = FeeTransaction.builder()
                .channelKey("marketplace")
                .line(line("l1", "10"))
                .context(Map.of("customer", Map.of("tier", "gold")))
                .build();

            assertEquals(new BigDecimal("1.00"), calculate(transaction, policy(gold)).totalFee());
        }

        @Test
        void selector_includeRestrictsLines() {
            FeeCalculation calc = calculate(categorized(), policy(booksOnly(LineSelector.Mode.INCLUDE, false)));

            assertEquals(new BigDecimal("30.00"), calc.totalFee());
            assertEquals(new BigDecimal("30.00"), allocation(calc, "l1").feeAmount());
            assertEquals(new BigDecimal("0.00"), allocation(calc, "l2").feeAmount());
            assertEquals(List.of("l1"), entry(calc, "books").lineIds());
        }

        @Test
        void selector_excludeInvertsMatch() {
            FeeCalculation calc = calculate(categorized(), policy(booksOnly(LineSelector.Mode.EXCLUDE, false)));
            assertEquals(new BigDecimal("20.00"), calc.totalFee());
        }

        @Test
        void selector_requireMatch_warnsOrFails() {
            FeeComponent music = new FeeComponent.Rate(ComponentHeader.of("music", Scope.LINE)
                .withLineSelector(new LineSelector(null,
                    List.of(new Condition("attributes.category", Operator.EQ, "music")), List.of(), true)),
                new BigDecimal("5"));

            FeeCalculation lenient = calculate(categorized(), policy(music));
            assertEquals("selector_no_match", entry(lenient, "music").discardReason());
            assertEquals(ErrorCode.LINE_SELECTOR_NO_MATCH, lenient.warnings().get(0).code());

            assertEquals(ErrorCode.LINE_SELECTOR_NO_MATCH,
                engine.calculate(categorized(), policy(music), CalculationOptions.strictMode()).errorCode());
        }

        @Test
        void selector_missingFieldFailsInStrictMode() {
            FeeTransaction partial = tx(line("l1", "600").withAttributes(Map.of("category", "books")), line("l2", "400"));
            Result<FeeCalculation> result = engine.calculate(partial, policy(booksOnly(LineSelector.Mode.INCLUDE, false)),
                CalculationOptions.strictMode());
            assertEquals(ErrorCode.LINE_SELECTOR_FIELD_MISSING, result.errorCode());
        }

        @Test
        void selector_onOrderScope_isIgnoredWithWarning() {
            FeeComponent order = new FeeComponent.Rate(ComponentHeader.of("order", Scope.ORDER)
                .withLineSelector(new LineSelector(null,
                    List.of(new Condition("attributes.category", Operator.EQ, "books")), List.of(), false)),
                new BigDecimal("5"));

            FeeCalculation calc = calculate(categorized(), policy(order));
            assertEquals(new BigDecimal("50.00"), calc.totalFee());
            assertEquals(ErrorCode.LINE_SELECTOR_NOT_ALLOWED_FOR_ORDER, calc.warnings().get(0).code());
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class Errors {

        @Test
        void noLines_isMissingLines() {
            FeeTransaction empty = FeeTransaction.builder().channelKey("marketplace").build();
            assertEquals(ErrorCode.MISSING_LINES, engine.calculate(empty, policy(rate("a", "5"))).errorCode());
        }

        @Test
        void lineWithoutAmounts_isInvalidLine() {
            TransactionLine blank = new TransactionLine("l1", null, null, null, null, null, null);
            assertEquals(ErrorCode.INVALID_LINE, engine.calculate(tx(blank), policy(rate("a", "5"))).errorCode());
        }

        @Test
        void unknownBaseField_isMissingBaseField() {
            FeeComponent onShipping = new FeeComponent.Rate(
                ComponentHeader.of("ship", Scope.LINE).withBase(BaseSpec.field("shipping")),
                BigDecimal.ONE);
            Result<FeeCalculation> result = engine.calculate(tx(line("l1", "10")), policy(onShipping));

            assertEquals(ErrorCode.MISSING_BASE_FIELD, result.errorCode());
        }

        @Test
        void invalidPolicy_isReportedNotThrown() {
            Result<FeeCalculation> result = engine.calculate(tx(line("l1", "10")), policy(rate("a", "5"), rate("a", "1")));
            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.INVALID_COMPONENT, result.errorCode());
        }
    }

    @Nested
    @DisplayName("Determinism and explain plan")
    class Determinism {

        @Test
        void sameInput_sameSignature() {
            FeePolicy policy = policy(rate("a", "5"), cap("cap", null, "30", CapTargets.ALL));
            FeeCalculation first = calculate(tx(line("l1", "600"), line("l2", "400")), policy);
            FeeCalculation second = calculate(tx(line("l1", "600"), line("l2", "400")), policy);

            assertEquals(first.signature(), second.signature());
            assertEquals(first.breakdown(), second.breakdown());
            assertTrue(first.meta().policyHash().startsWith("v2:"));
            assertEquals(FeeCalculationEngine.ENGINE_VERSION, first.meta().engineVersion());
        }

        @Test
        void differentInput_differentSignature() {
            FeePolicy policy = policy(rate("a", "5"));
            assertNotEquals(calculate(tx(line("l1", "600")), policy).signature(),
                calculate(tx(line("l1", "601")), policy).signature());
        }

        @Test
        void precedenceOrdersEvaluation_tiesKeepDeclarationOrder() {
            FeeComponent late = new FeeComponent.Rate(ComponentHeader.of("late", Scope.ORDER).withPrecedence(300), BigDecimal.ONE);
            FeeCalculation calc = calculate(tx(line("l1", "100")), policy(late, rate("b", "1"), rate("a", "1")));

            assertEquals(List.of("b", "a", "late"), calc.explainPlan().evaluationOrder());
            assertEquals(List.of("b", "a", "late"), calc.breakdown().stream().map(BreakdownEntry::componentId).toList());
        }
    }

    // ---- helpers ----

    private FeeCalculation calculate(FeeTransaction transaction, FeePolicy policy) {
        return engine.calculate(transaction, policy).orElseThrow();
    }

    private static FeeTransaction tx(TransactionLine... lines) {
        return FeeTransaction.builder().channelKey("marketplace").lines(List.of(lines)).build();
    }

    private static TransactionLine line(String id, String net) {
        return TransactionLine.ofNet(id, new BigDecimal(net));
    }

    private static FeeTransaction categorized() {
        return tx(line("l1", "600").withAttributes(Map.of("category", "books")),
            line("l2", "400").withAttributes(Map.of("category", "toys")));
    }

    private static FeeComponent booksOnly(LineSelector.Mode mode, boolean requireMatch) {
        return new FeeComponent.Rate(ComponentHeader.of("books", Scope.LINE)
            .withLineSelector(new LineSelector(mode,
                List.of(new Condition("attributes.category", Operator.EQ, "books")), List.of(), requireMatch)),
            new BigDecimal("5"));
    }

    private static FeeComponent rate(String id, String rate) {
        return new FeeComponent.Rate(ComponentHeader.of(id, Scope.ORDER), new BigDecimal(rate));
    }

    private static FeeComponent cap(String id, String min, String max, CapTargets targets) {
        return new FeeComponent.Cap(ComponentHeader.of(id, Scope.ORDER).withPrecedence(500),
            min != null ? new BigDecimal(min) : null, max != null ? new BigDecimal(max) : null, targets);
    }

    private static FeeComponent override(String id, int precedence, BigDecimal replaceAmount) {
        return new FeeComponent.OverrideRule(ComponentHeader.of(id, Scope.ORDER).withPrecedence(precedence),
            List.of(), List.of("commission"), replaceAmount, "launch");
    }

    private static FeePolicy policy(FeeComponent... components) {
        return FeePolicy.of("test", "marketplace", "EUR", List.of(components));
    }

    private static BreakdownEntry entry(FeeCalculation calc, String componentId) {
        return calc.breakdown().stream()
            .filter(e -> e.componentId().equals(componentId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no breakdown entry " + componentId));
    }

    private static LineAllocation allocation(FeeCalculation calc, String lineId) {
        return calc.allocation().stream()
            .filter(a -> a.lineId().equals(lineId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no allocation for " + lineId));
    }
}
