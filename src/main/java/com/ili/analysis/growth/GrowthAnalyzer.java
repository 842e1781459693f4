package com.ili.analysis.growth;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.matching.MatchedPair;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts matched pairs from two surveys into growth rates, remaining life,
 * forecast depth and severity ranking.
 */
public class GrowthAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GrowthAnalyzer.class);

    public static final double DEFAULT_CRITICAL_DEPTH_PCT = 80.0;
    public static final double DEFAULT_FORECAST_YEARS = 5.0;
    private static final double EIGHTY_PCT = 80.0;

    private final double criticalDepthPct;
    private final double forecastYears;
    private final SeverityScorer severityScorer;

    public GrowthAnalyzer() {
        this(DEFAULT_CRITICAL_DEPTH_PCT, DEFAULT_FORECAST_YEARS, new SeverityScorer());
    }

    public GrowthAnalyzer(double criticalDepthPct, double forecastYears, SeverityScorer severityScorer) {
        if (criticalDepthPct <= 0) {
            throw new IllegalArgumentException("criticalDepthPct must be positive");
        }
        if (forecastYears < 0) {
            throw new IllegalArgumentException("forecastYears must be non-negative");
        }
        this.criticalDepthPct = criticalDepthPct;
        this.forecastYears = forecastYears;
        this.severityScorer = severityScorer;
    }

    /**
     * Runs the full two-survey growth analysis.
     *
     * @param matched       matched anomaly pairs
     * @param yearsBetween  elapsed years between the surveys
     * @throws IllegalArgumentException if {@code yearsBetween} is not positive
     */
    public GrowthAnalysis analyze(List<MatchedPair> matched, double yearsBetween) {
        if (!(yearsBetween > 0)) {
            throw new IllegalArgumentException("yearsBetween must be positive, got " + yearsBetween);
        }
        if (matched.isEmpty()) {
            log.warn("No matched anomalies; skipping growth calculation");
            return new GrowthAnalysis(List.of(), List.of());
        }

        log.info("Growth analysis: {} pairs, {} year gap, critical={}%, forecast={} yr",
                matched.size(), yearsBetween, criticalDepthPct, forecastYears);
        List<PairGrowth> rows = new ArrayList<>(matched.size());
        for (MatchedPair pair : matched) {
            rows.add(computeGrowth(pair, yearsBetween));
        }

        List<PairGrowth> scored = severityScorer.score(rows);
        List<GrowthSummary> summary = summarize(scored);
        GrowthAnalysis analysis = new GrowthAnalysis(scored, summary);

        DescriptiveStatistics valid = new DescriptiveStatistics();
        scored.stream().filter(PairGrowth::hasDepthGrowth).forEach(r -> valid.addValue(r.depthGrowthRate()));
        log.info("growth.completed anomalies={} validRates={} meanRate={} maxRate={} negative={} alreadyCritical={}",
                scored.size(), valid.getN(),
                valid.getN() > 0 ? valid.getMean() : 0.0,
                valid.getN() > 0 ? valid.getMax() : 0.0,
                analysis.negativeGrowthCount(), analysis.alreadyCriticalCount());
        return analysis;
    }

    /**
     * Growth metrics of a single pair, before severity scoring.
     */
    public PairGrowth computeGrowth(MatchedPair pair, double yearsBetween) {
        Double depthRate = GrowthCalculator.rate(pair.depthA(), pair.depthB(), yearsBetween);
        Double lengthRate = GrowthCalculator.rate(pair.lengthA(), pair.lengthB(), yearsBetween);
        Double widthRate = GrowthCalculator.rate(pair.widthA(), pair.widthB(), yearsBetween);
        Double depthB = pair.depthB();

        return new PairGrowth(pair,
                depthRate,
                lengthRate,
                widthRate,
                depthRate != null && depthRate < 0,
                GrowthCalculator.remainingLife(depthB, depthRate, criticalDepthPct),
                depthB != null && depthB >= criticalDepthPct,
                GrowthCalculator.remainingLife(depthB, depthRate, EIGHTY_PCT),
                GrowthCalculator.projectDepth(depthB, depthRate, forecastYears),
                forecastYears,
                0.0);
    }

    /**
     * Depth growth-rate statistics per feature category, ordered by category label.
     */
    public List<GrowthSummary> summarize(List<PairGrowth> rows) {
        Map<String, List<PairGrowth>> byCategory = new TreeMap<>();
        for (PairGrowth row : rows) {
            byCategory.computeIfAbsent(row.pair().category().getLabel(), k -> new ArrayList<>()).add(row);
        }

        List<GrowthSummary> summary = new ArrayList<>();
        for (List<PairGrowth> group : byCategory.values()) {
            FeatureCategory category = group.get(0).pair().category();
            DescriptiveStatistics stats = new DescriptiveStatistics();
            group.stream().filter(PairGrowth::hasDepthGrowth).forEach(r -> stats.addValue(r.depthGrowthRate()));
            long n = stats.getN();
            if (n == 0) {
                summary.add(new GrowthSummary(category, 0, null, null, null, null, null));
                continue;
            }
            long negative = group.stream().filter(PairGrowth::negativeGrowth).count();
            summary.add(new GrowthSummary(category, n,
                    GrowthCalculator.round(stats.getMean(), 4),
                    GrowthCalculator.round(stats.getPercentile(50), 4),
                    GrowthCalculator.round(stats.getMax(), 4),
                    n > 1 ? GrowthCalculator.round(stats.getStandardDeviation(), 4) : null,
                    GrowthCalculator.round(negative * 100.0 / n, 4)));
        }
        return summary;
    }

    public double getCriticalDepthPct() {
        return criticalDepthPct;
    }

    public double getForecastYears() {
        return forecastYears;
    }
}
