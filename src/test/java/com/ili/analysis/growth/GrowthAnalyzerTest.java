package com.ili.analysis.growth;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.MatchStatus;
import com.ili.analysis.matching.MatchedPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ili.analysis.Features.anomaly;
import static com.ili.analysis.Features.pair;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrowthAnalyzer Tests")
class GrowthAnalyzerTest {

    private GrowthAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new GrowthAnalyzer();
    }

    @Test
    @DisplayName("Should compute rate, remaining life and projection for one pair")
    void testSinglePair() {
        GrowthAnalysis analysis = analyzer.analyze(List.of(pair("a1", 100.0, 15.0, "b1", 18.0)), 7.0);

        assertEquals(1, analysis.rows().size());
        PairGrowth row = analysis.rows().get(0);
        assertEquals(0.4286, row.depthGrowthRate(), 1e-4);
        assertEquals(144.67, row.remainingLifeYears(), 0.01);
        assertEquals(20.14, row.projectedDepthPct(), 1e-9);
        assertEquals(0.0, row.lengthGrowthRate(), 1e-9);
        assertFalse(row.negativeGrowth());
        assertFalse(row.alreadyCritical());
        assertEquals(5.0, row.forecastYears());
    }

    @Test
    @DisplayName("Should flag negative growth and already critical anomalies")
    void testFlags() {
        GrowthAnalysis analysis = analyzer.analyze(List.of(
                pair("shrinking", 100.0, 20.0, "b1", 18.0),
                pair("critical", 200.0, 78.0, "b2", 85.0)), 5.0);

        assertEquals(1, analysis.negativeGrowthCount());
        assertEquals(1, analysis.alreadyCriticalCount());

        PairGrowth critical = analysis.rows().stream()
                .filter(r -> r.pair().featureIdA().equals("critical")).findFirst().orElseThrow();
        assertEquals(0.0, critical.remainingLifeYears());
        PairGrowth shrinking = analysis.rows().stream()
                .filter(r -> r.pair().featureIdA().equals("shrinking")).findFirst().orElseThrow();
        assertEquals(Double.POSITIVE_INFINITY, shrinking.remainingLifeYears());
        assertEquals(18.0, shrinking.projectedDepthPct());
    }

    @Test
    @DisplayName("Missing depth should yield null metrics, not errors")
    void testMissingDepth() {
        PairGrowth row = analyzer.computeGrowth(pair("a1", 100.0, null, "b1", 18.0), 7.0);

        assertNull(row.depthGrowthRate());
        assertNull(row.remainingLifeYears());
        assertNull(row.projectedDepthPct());
        assertFalse(row.negativeGrowth());
    }

    @Test
    @DisplayName("Should summarize growth per category")
    void testSummary() {
        FeatureRecord dentA = anomaly("A", "d1", 500.0, 90.0, null, FeatureCategory.DENT);
        FeatureRecord dentB = anomaly("B", "d2", 500.0, 90.0, null, FeatureCategory.DENT).withCorrectedDistance(500.0);
        MatchedPair dent = new MatchedPair(dentA, dentB, 0, 0.0, 0.0, 0.0, MatchStatus.MATCHED);

        GrowthAnalysis analysis = analyzer.analyze(List.of(
                pair("a1", 100.0, 10.0, "b1", 12.0),
                pair("a2", 200.0, 10.0, "b2", 9.0),
                dent), 10.0);

        List<GrowthSummary> summary = analysis.summary();
        assertEquals(2, summary.size());

        GrowthSummary dents = summary.get(0);
        assertEquals(FeatureCategory.DENT, dents.category());
        assertEquals(0, dents.count());
        assertNull(dents.meanGrowth());

        GrowthSummary metalLoss = summary.get(1);
        assertEquals(FeatureCategory.METAL_LOSS, metalLoss.category());
        assertEquals(2, metalLoss.count());
        assertEquals(0.05, metalLoss.meanGrowth(), 1e-9);
        assertEquals(0.05, metalLoss.medianGrowth(), 1e-9);
        assertEquals(0.2, metalLoss.maxGrowth(), 1e-9);
        assertEquals(0.2121, metalLoss.stdGrowth(), 1e-9);
        assertEquals(50.0, metalLoss.pctNegative(), 1e-9);
    }

    @Test
    @DisplayName("A single rate should have no standard deviation")
    void testSingleRateStd() {
        List<GrowthSummary> summary = analyzer.summarize(List.of(
                analyzer.computeGrowth(pair("a1", 100.0, 10.0, "b1", 12.0), 2.0)));

        assertEquals(1, summary.get(0).count());
        assertNull(summary.get(0).stdGrowth());
    }

    @Test
    @DisplayName("Dig list should be capped and follow severity order")
    void testDigList() {
        GrowthAnalysis analysis = analyzer.analyze(List.of(
                pair("a1", 100.0, 10.0, "b1", 12.0),
                pair("a2", 200.0, 10.0, "b2", 40.0),
                pair("a3", 300.0, 10.0, "b3", 11.0)), 5.0);

        List<PairGrowth> top = analysis.digList(2);
        assertEquals(2, top.size());
        assertEquals("a2", top.get(0).pair().featureIdA());
        assertEquals(3, analysis.digList(10).size());
        assertThrows(IllegalArgumentException.class, () -> analysis.digList(-1));
    }

    @Test
    void testNoPairs() {
        GrowthAnalysis analysis = analyzer.analyze(List.of(), 5.0);
        assertTrue(analysis.rows().isEmpty());
        assertTrue(analysis.summary().isEmpty());
    }

    @Test
    void testInvalidYears() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(List.of(), 0.0));
    }
}
