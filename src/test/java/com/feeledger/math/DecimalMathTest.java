package com.feeledger.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecimalMathTest {

    @Nested
    @DisplayName("Rounding and formatting")
    class Rounding {

        @Test
        void round_usesHalfUpByDefault() {
            assertEquals(new BigDecimal("2.35"), DecimalMath.round(new BigDecimal("2.345"), 2));
            assertEquals(new BigDecimal("-2.35"), DecimalMath.round(new BigDecimal("-2.345"), 2));
        }

        @Test
        void round_acceptsExplicitMode() {
            assertEquals(new BigDecimal("2.34"), DecimalMath.round(new BigDecimal("2.345"), 2, RoundingMode.HALF_EVEN));
        }

        @Test
        void format_padsToScale() {
            assertEquals("1.50", DecimalMath.format(new BigDecimal("1.5"), 2));
            assertEquals("0.00", DecimalMath.format(null, 2));
        }

        @Test
        void parse_blankIsZero_garbageFails() {
            assertEquals(0, BigDecimal.ZERO.compareTo(DecimalMath.parse("  ")));
            assertEquals(new BigDecimal("12.30"), DecimalMath.parse(" 12.30 "));
            assertThrows(IllegalArgumentException.class, () -> DecimalMath.parse("12,3x"));
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        void percentOf_isExact() {
            assertEquals(0, new BigDecimal("50").compareTo(DecimalMath.percentOf(new BigDecimal("1000"), new BigDecimal("5"))));
            assertEquals(0, new BigDecimal("0.0333").compareTo(DecimalMath.percentOf(new BigDecimal("1.11"), new BigDecimal("3"))));
        }

        @Test
        void div_byZeroFails() {
            assertThrows(DivisionByZeroException.class, () -> DecimalMath.div(BigDecimal.ONE, BigDecimal.ZERO, 2));
            assertThrows(ArithmeticException.class, () -> DecimalMath.div(BigDecimal.ONE, null, 2));
        }

        @Test
        void divOrZero_yieldsZeroForZeroDivisor() {
            assertEquals(new BigDecimal("0.00"), DecimalMath.divOrZero(BigDecimal.TEN, BigDecimal.ZERO, 2));
            assertEquals(new BigDecimal("3.33"), DecimalMath.divOrZero(BigDecimal.TEN, new BigDecimal("3"), 2));
        }

        @Test
        void clamp_treatsNullBoundsAsOpen() {
            assertEquals(new BigDecimal("30"), DecimalMath.clamp(new BigDecimal("50"), null, new BigDecimal("30")));
            assertEquals(new BigDecimal("5"), DecimalMath.clamp(new BigDecimal("2"), new BigDecimal("5"), null));
            assertEquals(new BigDecimal("7"), DecimalMath.clamp(new BigDecimal("7"), null, null));
        }

        @Test
        void sum_ignoresNullsAndRounds() {
            List<BigDecimal> values = Arrays.asList(new BigDecimal("1.005"), null, new BigDecimal("2"));
            assertEquals(new BigDecimal("3.01"), DecimalMath.sum(values, 2));
        }
    }

    @Nested
    @DisplayName("Proportional allocation")
    class Allocation {

        @Test
        void allocate_lastBucketTakesRemainder() {
            List<BigDecimal> shares = DecimalMath.allocate(new BigDecimal("100.00"),
                List.of(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE), 2);
            assertEquals(List.of(new BigDecimal("33.33"), new BigDecimal("33.33"), new BigDecimal("33.34")), shares);
        }

        @Test
        void allocate_followsWeights() {
            List<BigDecimal> shares = DecimalMath.allocate(new BigDecimal("50.00"),
                List.of(new BigDecimal("600"), new BigDecimal("400")), 2);
            assertEquals(List.of(new BigDecimal("30.00"), new BigDecimal("20.00")), shares);
        }

        @Test
        void allocate_zeroWeightsSplitEqually() {
            List<BigDecimal> shares = DecimalMath.allocate(BigDecimal.TEN,
                List.of(BigDecimal.ZERO, BigDecimal.ZERO), 2);
            assertEquals(List.of(new BigDecimal("5.00"), new BigDecimal("5.00")), shares);
        }

        @Test
        void allocate_negativeAmountKeepsSign() {
            List<BigDecimal> shares = DecimalMath.allocate(new BigDecimal("-0.05"),
                List.of(BigDecimal.ONE, BigDecimal.ONE), 2);
            assertEquals(0, new BigDecimal("-0.05").compareTo(shares.get(0).add(shares.get(1))));
        }

        @Test
        void allocate_noBucketsYieldsEmpty() {
            assertTrue(DecimalMath.allocate(BigDecimal.ONE, List.of(), 2).isEmpty());
        }
    }
}
