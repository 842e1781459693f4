package com.ili.analysis.growth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GrowthCalculatorTest {

    @Nested
    @DisplayName("Rate")
    class Rate {

        @Test
        void testRate() {
            assertEquals(3.0 / 7.0, GrowthCalculator.rate(15.0, 18.0, 7.0), 1e-12);
            assertEquals(-0.5, GrowthCalculator.rate(20.0, 18.0, 4.0), 1e-12);
        }

        @Test
        void testMissingInput() {
            assertNull(GrowthCalculator.rate(null, 18.0, 7.0));
            assertNull(GrowthCalculator.rate(15.0, null, 7.0));
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -1.0, Double.NaN})
        void testInvalidYears(double years) {
            assertThrows(IllegalArgumentException.class, () -> GrowthCalculator.rate(15.0, 18.0, years));
        }
    }

    @Nested
    @DisplayName("Remaining life")
    class RemainingLife {

        @Test
        void testGrowing() {
            assertEquals(144.67, GrowthCalculator.remainingLife(18.0, 3.0 / 7.0, 80.0), 1e-9);
        }

        @Test
        void testNotGrowing() {
            assertEquals(Double.POSITIVE_INFINITY, GrowthCalculator.remainingLife(18.0, 0.0, 80.0));
            assertEquals(Double.POSITIVE_INFINITY, GrowthCalculator.remainingLife(18.0, -0.2, 80.0));
        }

        @Test
        @DisplayName("Already critical takes precedence over a non-positive rate")
        void testAlreadyCritical() {
            assertEquals(0.0, GrowthCalculator.remainingLife(85.0, 1.0, 80.0));
            assertEquals(0.0, GrowthCalculator.remainingLife(80.0, -1.0, 80.0));
        }

        @Test
        void testMissing() {
            assertNull(GrowthCalculator.remainingLife(null, 1.0, 80.0));
            assertNull(GrowthCalculator.remainingLife(20.0, null, 80.0));
        }
    }

    @Nested
    @DisplayName("Projection")
    class Projection {

        @Test
        void testPositiveGrowth() {
            assertEquals(20.14, GrowthCalculator.projectDepth(18.0, 3.0 / 7.0, 5.0), 1e-9);
        }

        @Test
        @DisplayName("Shrinkage keeps the current depth")
        void testNegativeGrowth() {
            assertEquals(18.0, GrowthCalculator.projectDepth(18.0, -1.0, 5.0), 1e-9);
        }

        @Test
        void testMissing() {
            assertNull(GrowthCalculator.projectDepth(null, 1.0, 5.0));
        }
    }
}
