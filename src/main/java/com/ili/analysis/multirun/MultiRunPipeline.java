package com.ili.analysis.multirun;

import com.ili.analysis.alignment.AlignmentResult;
import com.ili.analysis.alignment.RunAligner;
import com.ili.analysis.api.AnalysisInputException;
import com.ili.analysis.api.AnalysisOptions;
import com.ili.analysis.core.model.SurveyRun;
import com.ili.analysis.growth.model.AccelerationDetector;
import com.ili.analysis.growth.model.GrowthModelFitter;
import com.ili.analysis.growth.model.MultiRunGrowthAnalyzer;
import com.ili.analysis.growth.model.MultiRunGrowthResult;
import com.ili.analysis.logging.LogContext;
import com.ili.analysis.matching.AnomalyMatcher;
import com.ili.analysis.matching.MatchedPair;
import com.ili.analysis.matching.MatchingResult;
import com.ili.analysis.metrics.MetricsService;
import com.ili.analysis.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks anomalies across three or more chronologically ordered surveys.
 *
 * <p>Consecutive pairs are aligned and matched independently, the matches are chained into
 * tracks, and every track with a depth in each survey gets a growth-model fit and
 * acceleration check. Pairs are processed in order.</p>
 */
public class MultiRunPipeline {
    private static final Logger log = LoggerFactory.getLogger(MultiRunPipeline.class);

    private static final int MIN_RUNS_FOR_MODELS = 3;

    private final RunAligner aligner;
    private final AnomalyMatcher matcher;
    private final TrackBuilder trackBuilder;
    private final MultiRunGrowthAnalyzer growthAnalyzer;
    private final AccelerationDetector accelerationDetector;
    private final MetricsService metricsService;

    public MultiRunPipeline() {
        this(AnalysisOptions.defaults(), new NoOpMetricsService());
    }

    public MultiRunPipeline(AnalysisOptions options, MetricsService metricsService) {
        this.aligner = new RunAligner();
        this.matcher = new AnomalyMatcher(options.toMatchingCriteria());
        this.trackBuilder = new TrackBuilder();
        this.growthAnalyzer = new MultiRunGrowthAnalyzer(new GrowthModelFitter(options.getInformationCriterion()),
                options.getCriticalDepthPct(), options.getForecastYears());
        this.accelerationDetector = new AccelerationDetector(options.getAccelerationThresholdPct());
        this.metricsService = metricsService;
    }

    /**
     * Runs multi-survey tracking.
     *
     * @param runs     surveys in chronological order
     * @param yearGaps elapsed years between each consecutive pair
     * @throws AnalysisInputException if fewer than two runs are given, a run is missing,
     *                                the gap count does not match or a gap is not positive
     */
    public MultiRunResult run(List<SurveyRun> runs, List<Double> yearGaps) {
        validate(runs, yearGaps);
        List<String> runIds = runs.stream().map(SurveyRun::runId).toList();

        try (LogContext ctx = LogContext.forMultiRun(LogContext.generateAnalysisId(), runIds)) {
            log.info("multirun.started runs={}", String.join(" -> ", runIds));

            long start = System.nanoTime();
            List<PairwiseStep> steps = new ArrayList<>(runs.size() - 1);
            List<List<MatchedPair>> pairMatches = new ArrayList<>(runs.size() - 1);
            for (int i = 0; i < runs.size() - 1; i++) {
                SurveyRun runA = runs.get(i);
                SurveyRun runB = runs.get(i + 1);
                AlignmentResult alignment = aligner.align(runA, runB);
                MatchingResult matching = matcher.match(runA, alignment.alignedRunB(), alignment.matchedControlPoints());
                steps.add(new PairwiseStep(runA.runId(), runB.runId(), yearGaps.get(i), alignment, matching));
                pairMatches.add(matching.matched());
                log.info("Pair {} -> {}: {} matches", runA.runId(), runB.runId(), matching.matched().size());
            }
            metricsService.recordStageDuration("pairwise", Duration.ofNanos(System.nanoTime() - start));

            List<AnomalyTrack> tracks = trackBuilder.build(pairMatches, runIds);

            double[] times = new double[runs.size()];
            for (int i = 1; i < times.length; i++) {
                times[i] = times[i - 1] + yearGaps.get(i - 1);
            }

            List<MultiRunGrowthResult> growth = new ArrayList<>();
            if (runs.size() >= MIN_RUNS_FOR_MODELS) {
                start = System.nanoTime();
                for (AnomalyTrack track : tracks) {
                    if (!track.hasCompleteDepthHistory()) {
                        continue;
                    }
                    growth.add(analyzeTrack(track, times, yearGaps));
                }
                metricsService.recordStageDuration("multirun_growth", Duration.ofNanos(System.nanoTime() - start));
            }

            MultiRunResult result = new MultiRunResult(runIds, times, steps, tracks, growth);
            log.info("multirun.completed tracks={} analysed={} accelerating={}",
                    tracks.size(), growth.size(), result.acceleratingCount());
            return result;
        }
    }

    private MultiRunGrowthResult analyzeTrack(AnomalyTrack track, double[] times, List<Double> yearGaps) {
        double[] depths = track.depths().stream().mapToDouble(Double::doubleValue).toArray();
        MultiRunGrowthResult result = growthAnalyzer.analyze(String.valueOf(track.trackId()), times, depths);
        metricsService.incrementModelSelected(result.modelName());
        double[] rates = AccelerationDetector.intervalRates(track.depths(), yearGaps);
        return result.withAcceleration(accelerationDetector.detect(rates));
    }

    private static void validate(List<SurveyRun> runs, List<Double> yearGaps) {
        if (runs == null || runs.size() < 2) {
            throw new AnalysisInputException("At least two survey runs are required");
        }
        for (int i = 0; i < runs.size(); i++) {
            if (runs.get(i) == null) {
                throw new AnalysisInputException("Survey run at position " + i + " is missing");
            }
        }
        if (yearGaps == null || yearGaps.size() != runs.size() - 1) {
            throw new AnalysisInputException("Expected " + (runs.size() - 1) + " year gaps for "
                    + runs.size() + " runs, got " + (yearGaps == null ? 0 : yearGaps.size()));
        }
        for (int i = 0; i < yearGaps.size(); i++) {
            Double gap = yearGaps.get(i);
            if (gap == null || !(gap > 0)) {
                throw new AnalysisInputException("Year gap " + i + " must be positive, got " + gap);
            }
        }
    }
}
