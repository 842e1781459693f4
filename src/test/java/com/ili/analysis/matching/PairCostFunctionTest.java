package com.ili.analysis.matching;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.Orientation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static com.ili.analysis.Features.anomaly;
import static com.ili.analysis.Features.metalLoss;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PairCostFunction Tests")
class PairCostFunctionTest {

    private final PairCostFunction costFunction = new PairCostFunction(MatchingCriteria.defaults());

    private static FeatureRecord runB(FeatureRecord record, double corrected) {
        return record.withCorrectedDistance(corrected);
    }

    @Nested
    @DisplayName("Hard gates")
    class Gates {

        @Test
        @DisplayName("Should reject pairs beyond the distance tolerance")
        void testDistanceGate() {
            FeatureRecord a = metalLoss("A", "a", 100.0, 90.0, 20.0);
            FeatureRecord b = runB(metalLoss("B", "b", 0.0, 90.0, 20.0), 110.5);
            assertTrue(costFunction.cost(a, b).isEmpty());
        }

        @Test
        @DisplayName("Should reject pairs beyond the clock tolerance, across 12 o'clock too")
        void testClockGate() {
            FeatureRecord a = metalLoss("A", "a", 100.0, 355.0, 20.0);
            assertTrue(costFunction.cost(a, runB(metalLoss("B", "b", 0.0, 30.0, 20.0), 100.0)).isEmpty());
            assertTrue(costFunction.cost(a, runB(metalLoss("B", "b", 0.0, 5.0, 20.0), 100.0)).isPresent());
        }

        @Test
        @DisplayName("Missing clock should not gate")
        void testMissingClock() {
            FeatureRecord a = metalLoss("A", "a", 100.0, null, 20.0);
            assertTrue(costFunction.cost(a, runB(metalLoss("B", "b", 0.0, 200.0, 20.0), 100.0)).isPresent());
        }

        @Test
        @DisplayName("Different categories should never match by default")
        void testTypeGate() {
            FeatureRecord dent = anomaly("A", "a", 100.0, 90.0, 2.0, FeatureCategory.DENT);
            FeatureRecord loss = runB(metalLoss("B", "b", 0.0, 90.0, 2.0), 100.0);
            assertTrue(costFunction.cost(dent, loss).isEmpty());
        }

        @Test
        @DisplayName("Known and different orientations should not match")
        void testOrientationGate() {
            FeatureRecord a = metalLoss("A", "a", 100.0, 90.0, 20.0);
            FeatureRecord b = FeatureRecord.builder().featureId("b").distance(100.0).clockDeg(90.0)
                    .category(FeatureCategory.METAL_LOSS).orientation(Orientation.ID).build();
            assertFalse(costFunction.attributesCompatible(a, b));

            FeatureRecord unknown = FeatureRecord.builder().featureId("c").distance(100.0).clockDeg(90.0)
                    .category(FeatureCategory.METAL_LOSS).build();
            assertTrue(costFunction.attributesCompatible(a, unknown));
        }

        @Test
        @DisplayName("Compatible categories should match with the type penalty")
        void testCompatibleCategories() {
            CategoryCompatibility compatibility = CategoryCompatibility.of(
                    Map.of(FeatureCategory.METAL_LOSS, Set.of(FeatureCategory.MANUFACTURING_ANOMALY)));
            PairCostFunction relaxed = new PairCostFunction(new MatchingCriteria(10, 15, 15,
                    CostWeights.defaultWeights(), compatibility));

            FeatureRecord a = anomaly("A", "a", 100.0, 90.0, 20.0, FeatureCategory.MANUFACTURING_ANOMALY);
            FeatureRecord b = runB(metalLoss("B", "b", 0.0, 90.0, 20.0), 100.0);

            OptionalDouble cost = relaxed.cost(a, b);
            assertTrue(cost.isPresent());
            assertEquals(10.0, cost.getAsDouble(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Cost")
    class Cost {

        @Test
        @DisplayName("Should combine weighted distance, clock, depth and size differences")
        void testWeightedSum() {
            FeatureRecord a = FeatureRecord.builder().featureId("a").distance(100.0).clockDeg(90.0)
                    .category(FeatureCategory.METAL_LOSS).depthPct(15.0).lengthIn(2.0).widthIn(1.0).build();
            FeatureRecord b = FeatureRecord.builder().featureId("b").distance(0.0).clockDeg(100.0)
                    .category(FeatureCategory.METAL_LOSS).depthPct(18.0).lengthIn(2.5).widthIn(1.5).build()
                    .withCorrectedDistance(101.0);

            // 1.0*1 + 0.5*10 + 0.1*3 + 0.05*(0.5+0.5)
            assertEquals(6.35, costFunction.cost(a, b).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("Missing measurements should contribute nothing")
        void testMissingMeasurements() {
            FeatureRecord a = FeatureRecord.builder().featureId("a").distance(100.0)
                    .category(FeatureCategory.METAL_LOSS).build();
            FeatureRecord b = FeatureRecord.builder().featureId("b").distance(0.0)
                    .category(FeatureCategory.METAL_LOSS).depthPct(40.0).build().withCorrectedDistance(102.0);
            assertEquals(2.0, costFunction.cost(a, b).getAsDouble(), 1e-9);
        }

        @ParameterizedTest
        @DisplayName("Cost should be non-negative and grow with distance difference")
        @ValueSource(doubles = {0.0, 0.5, 2.0, 5.0, 9.0})
        void testMonotonicInDistance(double offset) {
            FeatureRecord a = metalLoss("A", "a", 100.0, 90.0, 20.0);
            double near = costFunction.cost(a, runB(metalLoss("B", "b", 0.0, 90.0, 22.0), 100.0 + offset)).getAsDouble();
            double far = costFunction.cost(a, runB(metalLoss("B", "b", 0.0, 90.0, 22.0), 100.0 + offset + 0.75)).getAsDouble();

            assertTrue(near >= 0.0);
            assertTrue(far > near);
        }
    }
}
