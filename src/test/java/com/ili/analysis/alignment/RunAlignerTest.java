package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.SurveyRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ili.analysis.Features.metalLoss;
import static com.ili.analysis.Features.weld;
import static org.junit.jupiter.api.Assertions.*;

class RunAlignerTest {

    private final RunAligner aligner = new RunAligner();

    @Test
    @DisplayName("Single shared weld should align with a constant offset of -2 ft")
    void testSingleControlPoint() {
        SurveyRun runA = new SurveyRun("A", List.of(weld("A", "w1", 0.0, 1), metalLoss("A", "m1", 100.0, 90.0, 15.0)));
        SurveyRun runB = new SurveyRun("B", List.of(weld("B", "w1", 2.0, 1), metalLoss("B", "m1", 103.0, 90.0, 18.0)));

        AlignmentResult result = aligner.align(runA, runB);

        assertEquals(1, result.segments().size());
        assertEquals(-2.0, result.segments().get(0).shift(), 1e-9);
        assertEquals(AlignmentQuality.CONSTANT_OFFSET, result.quality());
        assertTrue(result.quality().isDegraded());
        FeatureRecord anomaly = result.alignedRunB().features().get(1);
        assertEquals(101.0, anomaly.correctedDistance(), 1e-9);
        assertEquals(103.0, anomaly.distance());
    }

    @Test
    @DisplayName("Every Run-B record should carry a corrected distance")
    void testAllRecordsCorrected() {
        SurveyRun runA = new SurveyRun("A", List.of(weld("A", "w1", 0.0, 1), weld("A", "w2", 100.0, 2)));
        SurveyRun runB = new SurveyRun("B", List.of(weld("B", "w1", 0.0, 1), weld("B", "w2", 110.0, 2),
                metalLoss("B", "m1", 55.0, null, 20.0)));

        AlignmentResult result = aligner.align(runA, runB);

        assertEquals(AlignmentQuality.PIECEWISE, result.quality());
        result.alignedRunB().features().forEach(f -> assertNotNull(f.correctedDistance()));
        assertEquals(50.0, result.alignedRunB().features().get(2).correctedDistance(), 1e-9);
        assertTrue(result.maxAbsResidual().getAsDouble() < 1e-2);
    }

    @Test
    @DisplayName("No control points should leave distances unchanged")
    void testIdentity() {
        SurveyRun runA = new SurveyRun("A", List.of(metalLoss("A", "m1", 100.0, 90.0, 15.0)));
        SurveyRun runB = new SurveyRun("B", List.of(metalLoss("B", "m1", 103.0, 90.0, 18.0)));

        AlignmentResult result = aligner.align(runA, runB);

        assertEquals(AlignmentQuality.IDENTITY, result.quality());
        assertEquals(103.0, result.alignedRunB().features().get(0).correctedDistance());
        assertTrue(result.maxAbsResidual().isEmpty());
    }
}
