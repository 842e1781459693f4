package com.ili.analysis.growth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks anomalies for the dig list.
 *
 * <pre>
 * score = 100 * (wGrowth * norm(max(rate, 0)) + wDepth * norm(depthB) + wRemaining * norm(1 / remainingLife))
 * </pre>
 * <p>Each signal is min-max normalized within the scored set. Missing signals count as 0,
 * and the inverse remaining life is 0 when remaining life is infinite, zero or unknown.
 * A signal with no spread normalizes to 0 for every row.</p>
 */
public class SeverityScorer {
    private static final Logger log = LoggerFactory.getLogger(SeverityScorer.class);

    private static final double FLAT_RANGE = 1e-12;

    private final double growthWeight;
    private final double depthWeight;
    private final double remainingWeight;

    public SeverityScorer() {
        this(0.4, 0.35, 0.25);
    }

    public SeverityScorer(double growthWeight, double depthWeight, double remainingWeight) {
        if (growthWeight < 0 || depthWeight < 0 || remainingWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = growthWeight + depthWeight + remainingWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
        this.growthWeight = growthWeight;
        this.depthWeight = depthWeight;
        this.remainingWeight = remainingWeight;
    }

    /**
     * Scores every row and returns a new list sorted by descending score.
     */
    public List<PairGrowth> score(List<PairGrowth> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }
        int n = rows.size();
        double[] growth = new double[n];
        double[] depth = new double[n];
        double[] inverseRemaining = new double[n];
        for (int i = 0; i < n; i++) {
            PairGrowth row = rows.get(i);
            growth[i] = row.depthGrowthRate() != null ? Math.max(row.depthGrowthRate(), 0.0) : 0.0;
            depth[i] = row.pair().depthB() != null ? row.pair().depthB() : 0.0;
            inverseRemaining[i] = inverse(row.remainingLifeYears());
        }
        double[] g = minMax(growth);
        double[] d = minMax(depth);
        double[] r = minMax(inverseRemaining);

        List<PairGrowth> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double score = (growthWeight * g[i] + depthWeight * d[i] + remainingWeight * r[i]) * 100.0;
            scored.add(rows.get(i).withSeverityScore(GrowthCalculator.round(score, 2)));
        }
        scored.sort(Comparator.comparingDouble(PairGrowth::severityScore).reversed());

        log.info("Severity scores: max={}, min={}",
                scored.get(0).severityScore(), scored.get(n - 1).severityScore());
        return scored;
    }

    private static double inverse(Double remainingLife) {
        if (remainingLife == null || remainingLife == 0.0 || remainingLife.isInfinite() || remainingLife.isNaN()) {
            return 0.0;
        }
        return 1.0 / remainingLife;
    }

    private static double[] minMax(double[] values) {
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        double[] normalized = new double[values.length];
        if (hi - lo < FLAT_RANGE) {
            return normalized;
        }
        for (int i = 0; i < values.length; i++) {
            normalized[i] = (values[i] - lo) / (hi - lo);
        }
        return normalized;
    }
}
