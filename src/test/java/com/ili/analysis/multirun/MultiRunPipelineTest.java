package com.ili.analysis.multirun;

import com.ili.analysis.api.AnalysisInputException;
import com.ili.analysis.core.model.SurveyRun;
import com.ili.analysis.growth.model.AccelerationTrend;
import com.ili.analysis.growth.model.MultiRunGrowthResult;
import com.ili.analysis.metrics.MetricsService;
import com.ili.analysis.api.AnalysisOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.ili.analysis.Features.metalLoss;
import static com.ili.analysis.Features.weld;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("MultiRunPipeline Tests")
class MultiRunPipelineTest {

    @Mock
    private MetricsService metricsService;

    private MultiRunPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new MultiRunPipeline(AnalysisOptions.defaults(), metricsService);
    }

    private static SurveyRun survey(String runId, double weldOffset, double anomalyDepth) {
        return new SurveyRun(runId, List.of(
                weld(runId, "GW-1", 0.0 + weldOffset, 1),
                metalLoss(runId, "ML-1", 500.0 + weldOffset, 90.0, anomalyDepth),
                weld(runId, "GW-2", 1000.0 + weldOffset, 2)));
    }

    @Test
    @DisplayName("Should track one anomaly across three surveys and fit a model")
    void testThreeRuns() {
        MultiRunResult result = pipeline.run(
                List.of(survey("2007", 0.0, 10.0), survey("2015", 3.0, 18.0), survey("2022", 1.5, 26.0)),
                List.of(8.0, 7.0));

        assertEquals(List.of("2007", "2015", "2022"), result.runIds());
        assertArrayEquals(new double[]{0.0, 8.0, 15.0}, result.times(), 1e-12);
        assertEquals(2, result.steps().size());
        assertEquals(1, result.tracks().size());
        assertEquals(3, result.tracks().get(0).detectionCount());

        assertEquals(1, result.trackGrowth().size());
        MultiRunGrowthResult growth = result.trackGrowth().get(0);
        assertEquals("linear", growth.modelName());
        assertEquals(AccelerationTrend.STABLE, growth.acceleration().trend());
        assertEquals(0, result.acceleratingCount());

        verify(metricsService).incrementModelSelected("linear");
        verify(metricsService).recordStageDuration(eq("pairwise"), any(Duration.class));
        verify(metricsService).recordStageDuration(eq("multirun_growth"), any(Duration.class));
    }

    @Test
    @DisplayName("Two surveys should build tracks without growth models")
    void testTwoRuns() {
        MultiRunResult result = pipeline.run(
                List.of(survey("2015", 0.0, 10.0), survey("2020", 1.0, 12.0)), List.of(5.0));

        assertEquals(1, result.tracks().size());
        assertTrue(result.trackGrowth().isEmpty());
    }

    @Test
    void testTooFewRuns() {
        assertThrows(AnalysisInputException.class,
                () -> pipeline.run(List.of(survey("2015", 0.0, 10.0)), List.of()));
    }

    @Test
    void testGapCountMismatch() {
        assertThrows(AnalysisInputException.class, () -> pipeline.run(
                List.of(survey("a", 0.0, 10.0), survey("b", 0.0, 11.0), survey("c", 0.0, 12.0)),
                List.of(5.0)));
    }

    @Test
    void testNonPositiveGap() {
        assertThrows(AnalysisInputException.class, () -> pipeline.run(
                List.of(survey("a", 0.0, 10.0), survey("b", 0.0, 11.0)), List.of(0.0)));
        assertThrows(AnalysisInputException.class, () -> pipeline.run(
                List.of(survey("a", 0.0, 10.0), survey("b", 0.0, 11.0)), Arrays.asList((Double) null)));
    }

    @Test
    void testMissingRun() {
        assertThrows(AnalysisInputException.class, () -> pipeline.run(
                Arrays.asList(survey("a", 0.0, 10.0), null), List.of(5.0)));
    }
}
