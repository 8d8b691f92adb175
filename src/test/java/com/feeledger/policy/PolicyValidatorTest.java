package com.feeledger.policy;

import com.feeledger.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyValidatorTest {

    private PolicyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PolicyValidator();
    }

    @Nested
    @DisplayName("Policy header")
    class Header {

        @Test
        void validPolicy_passes() {
            assertDoesNotThrow(() -> validator.validate(policy(rate("commission", "5"))));
        }

        @Test
        void missingChannel_rejected() {
            FeePolicy policy = new FeePolicy("p", 1, null, "EUR", 2, false, null, null, 0, null, List.of());
            PolicyViolationException ex = assertThrows(PolicyViolationException.class, () -> validator.validate(policy));
            assertEquals(ErrorCode.INVALID_POLICY, ex.getErrorCode());
            assertTrue(ex.getMessage().contains("channel_key"));
        }

        @Test
        void precisionOutOfRange_rejected() {
            FeePolicy policy = policy(rate("commission", "5")).withPrecision(11);
            assertThrows(PolicyViolationException.class, () -> validator.validate(policy));
        }

        @Test
        void effectiveRangeReversed_rejected() {
            FeePolicy policy = policy(rate("commission", "5"))
                .withEffectiveRange(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 1, 1));
            assertThrows(PolicyViolationException.class, () -> validator.validate(policy));
        }

        @Test
        void duplicateComponentIds_rejected() {
            FeePolicy policy = policy(rate("commission", "5"), rate("commission", "2"));
            PolicyViolationException ex = assertThrows(PolicyViolationException.class, () -> validator.validate(policy));
            assertEquals(ErrorCode.INVALID_COMPONENT, ex.getErrorCode());
        }
    }

    @Nested
    @DisplayName("Component fields")
    class Components {

        @Test
        void rateWithoutRate_rejected() {
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(new FeeComponent.Rate(ComponentHeader.of("r", Scope.ORDER), null))));
            assertEquals(ErrorCode.INVALID_COMPONENT, ex.getErrorCode());
        }

        @Test
        void capMinAboveMax_rejected() {
            FeeComponent cap = new FeeComponent.Cap(ComponentHeader.of("cap", Scope.ORDER),
                new BigDecimal("40"), new BigDecimal("30"), CapTargets.ALL);
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(rate("commission", "5"), cap)));
            assertEquals(ErrorCode.CAP_INVALID_BOUNDS, ex.getErrorCode());
        }

        @Test
        void capWithoutBounds_rejected() {
            FeeComponent cap = new FeeComponent.Cap(ComponentHeader.of("cap", Scope.ORDER), null, null, null);
            assertThrows(PolicyViolationException.class, () -> validator.validate(policy(cap)));
        }

        @Test
        void overrideWithoutExcludes_rejected() {
            FeeComponent override = new FeeComponent.OverrideRule(ComponentHeader.of("promo", Scope.ORDER),
                List.of(), List.of(), null, "promo");
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(override)));
            assertEquals(ErrorCode.INVALID_COMPONENT, ex.getErrorCode());
        }

        @Test
        void tierWithoutBrackets_rejected() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("t", Scope.ORDER), null, null, List.of());
            assertThrows(PolicyViolationException.class, () -> validator.validate(policy(tier)));
        }

        @Test
        void tierBracketNeedsRateOrFixed() {
            FeeComponent tier = new FeeComponent.Tier(ComponentHeader.of("t", Scope.ORDER), null, null,
                List.of(new TierBracket(BigDecimal.ZERO, null, null, null)));
            assertThrows(PolicyViolationException.class, () -> validator.validate(policy(tier)));
        }
    }

    @Nested
    @DisplayName("Conditions and selectors")
    class Selectors {

        @Test
        void emptySelector_rejected() {
            ComponentHeader header = ComponentHeader.of("r", Scope.LINE)
                .withLineSelector(new LineSelector(null, List.of(), List.of(), false));
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(new FeeComponent.Rate(header, BigDecimal.ONE))));
            assertEquals(ErrorCode.LINE_SELECTOR_EMPTY, ex.getErrorCode());
        }

        @Test
        void inOperatorNeedsList() {
            ComponentHeader header = ComponentHeader.of("r", Scope.LINE)
                .withLineSelector(new LineSelector(null,
                    List.of(new Condition("attributes.category", Operator.IN, "books")), List.of(), false));
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(new FeeComponent.Rate(header, BigDecimal.ONE))));
            assertEquals(ErrorCode.LINE_SELECTOR_BAD_OPERATOR, ex.getErrorCode());
        }

        @Test
        void blankBaseField_rejected() {
            ComponentHeader header = ComponentHeader.of("r", Scope.ORDER).withBase(BaseSpec.field(" "));
            PolicyViolationException ex = assertThrows(PolicyViolationException.class,
                () -> validator.validate(policy(new FeeComponent.Rate(header, BigDecimal.ONE))));
            assertEquals(ErrorCode.INVALID_BASE_SPEC, ex.getErrorCode());
        }
    }

    // ---- helpers ----

    private static FeeComponent rate(String id, String rate) {
        return new FeeComponent.Rate(ComponentHeader.of(id, Scope.ORDER), new BigDecimal(rate));
    }

    private static FeePolicy policy(FeeComponent... components) {
        return FeePolicy.of("standard", "marketplace", "EUR", List.of(components));
    }
}
