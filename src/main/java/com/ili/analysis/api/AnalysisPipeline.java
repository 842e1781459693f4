package com.ili.analysis.api;

import com.ili.analysis.alignment.AlignmentResult;
import com.ili.analysis.alignment.ControlPointResidual;
import com.ili.analysis.alignment.RunAligner;
import com.ili.analysis.clustering.AnomalyClusterer;
import com.ili.analysis.clustering.ClusteringResult;
import com.ili.analysis.core.model.MatchStatus;
import com.ili.analysis.core.model.SurveyRun;
import com.ili.analysis.growth.GrowthAnalysis;
import com.ili.analysis.growth.GrowthAnalyzer;
import com.ili.analysis.growth.PairGrowth;
import com.ili.analysis.growth.SeverityScorer;
import com.ili.analysis.logging.LogContext;
import com.ili.analysis.matching.AnomalyMatcher;
import com.ili.analysis.matching.MatchingResult;
import com.ili.analysis.metrics.MetricsService;
import com.ili.analysis.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Main entry point for two-survey analysis: alignment, anomaly matching, growth and severity,
 * and optional clustering.
 *
 * <p>Usage:</p>
 * <pre>
 * AnalysisPipeline pipeline = AnalysisPipeline.builder()
 *     .options(AnalysisOptions.builder().distTolFt(8.0).build())
 *     .build();
 * AnalysisResult result = pipeline.analyze(run2015, run2022, 7.0);
 * </pre>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 */
public class AnalysisPipeline {
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisOptions options;
    private final RunAligner aligner;
    private final AnomalyMatcher matcher;
    private final GrowthAnalyzer growthAnalyzer;
    private final MetricsService metricsService;

    private AnalysisPipeline(Builder builder) {
        this.options = builder.options;
        this.aligner = builder.aligner != null ? builder.aligner : new RunAligner();
        this.matcher = new AnomalyMatcher(options.toMatchingCriteria());
        this.growthAnalyzer = new GrowthAnalyzer(options.getCriticalDepthPct(), options.getForecastYears(),
                builder.severityScorer != null ? builder.severityScorer : new SeverityScorer());
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Runs the full analysis of two surveys.
     *
     * @param runA         reference (earlier) survey
     * @param runB         later survey
     * @param yearsBetween elapsed years between the surveys
     * @throws AnalysisInputException if a run is missing or {@code yearsBetween} is not positive
     */
    public AnalysisResult analyze(SurveyRun runA, SurveyRun runB, double yearsBetween) {
        if (runA == null || runB == null) {
            throw new AnalysisInputException("Both survey runs are required");
        }
        if (!(yearsBetween > 0)) {
            throw new AnalysisInputException("years between runs must be positive, got " + yearsBetween);
        }

        String analysisId = LogContext.generateAnalysisId();
        try (LogContext ctx = LogContext.forAnalysis(analysisId, runA.runId(), runB.runId())) {
            log.info("analysis.started runA={} ({} features) runB={} ({} features) years={}",
                    runA.runId(), runA.size(), runB.runId(), runB.size(), yearsBetween);

            AlignmentResult alignment = timed("alignment", () -> aligner.align(runA, runB));
            metricsService.recordControlPoints(alignment.matchedControlPoints().size());
            for (ControlPointResidual residual : alignment.residuals()) {
                metricsService.recordResidual(Math.abs(residual.residualFt()));
            }
            if (alignment.quality().isDegraded()) {
                log.warn("alignment.degraded quality={} controlPoints={}",
                        alignment.quality(), alignment.matchedControlPoints().size());
            }

            MatchingResult matching = timed("matching", () ->
                    matcher.match(runA, alignment.alignedRunB(), alignment.matchedControlPoints()));
            metricsService.incrementMatchOutcome(MatchStatus.MATCHED, matching.confidentCount());
            metricsService.incrementMatchOutcome(MatchStatus.UNCERTAIN, matching.uncertainCount());
            metricsService.incrementMatchOutcome(MatchStatus.MISSING, matching.missing().size());
            metricsService.incrementMatchOutcome(MatchStatus.NEW, matching.added().size());

            GrowthAnalysis growth = timed("growth", () -> growthAnalyzer.analyze(matching.matched(), yearsBetween));
            for (PairGrowth row : growth.rows()) {
                metricsService.recordSeverityScore(row.severityScore());
            }

            Optional<ClusteringResult> clustering = Optional.empty();
            if (options.isClusteringEnabled()) {
                AnomalyClusterer clusterer = new AnomalyClusterer(options.getClusteringEpsilon().getAsDouble(),
                        options.getClusteringMode(), options.getClusteringMinSamples());
                clustering = Optional.of(timed("clustering", () -> clusterer.cluster(growth.rows())));
            }

            log.info("analysis.completed matched={} missing={} new={} segments={}",
                    matching.matched().size(), matching.missing().size(), matching.added().size(),
                    matching.segmentCount());
            return new AnalysisResult(analysisId, runA.runId(), runB.runId(), yearsBetween,
                    alignment, matching, growth, clustering);
        }
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    private <T> T timed(String stage, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            return work.get();
        } finally {
            metricsService.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AnalysisOptions options = AnalysisOptions.defaults();
        private RunAligner aligner;
        private SeverityScorer severityScorer;
        private MetricsService metricsService;

        public Builder options(AnalysisOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom aligner, e.g. with a different spacing tolerance.
         */
        public Builder aligner(RunAligner aligner) {
            this.aligner = aligner;
            return this;
        }

        public Builder severityScorer(SeverityScorer severityScorer) {
            this.severityScorer = severityScorer;
            return this;
        }

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public AnalysisPipeline build() {
            if (options == null) {
                throw new IllegalStateException("AnalysisOptions is required");
            }
            return new AnalysisPipeline(this);
        }
    }
}
