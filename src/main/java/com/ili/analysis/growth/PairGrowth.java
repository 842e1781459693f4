package com.ili.analysis.growth;

import com.ili.analysis.matching.MatchedPair;

import java.util.Objects;

/**
 * Growth metrics of one matched anomaly pair.
 * {@code null} means "no data" (an input measurement was missing on either side).
 *
 * @param pair                  the matched pair
 * @param depthGrowthRate       depth growth, %WT per year
 * @param lengthGrowthRate      length growth, inches per year
 * @param widthGrowthRate       width growth, inches per year
 * @param negativeGrowth        depth growth rate is negative (likely measurement noise)
 * @param remainingLifeYears    years until the critical depth; {@code +Infinity} when not growing
 * @param alreadyCritical       current depth at or above the critical depth
 * @param yearsTo80Pct          years until 80 %WT with the same rules as remaining life
 * @param projectedDepthPct     depth at the forecast horizon
 * @param forecastYears         forecast horizon used
 * @param severityScore         0-100 composite ranking, assigned by {@link SeverityScorer}
 */
public record PairGrowth(
        MatchedPair pair,
        Double depthGrowthRate,
        Double lengthGrowthRate,
        Double widthGrowthRate,
        boolean negativeGrowth,
        Double remainingLifeYears,
        boolean alreadyCritical,
        Double yearsTo80Pct,
        Double projectedDepthPct,
        double forecastYears,
        double severityScore
) {
    public PairGrowth {
        Objects.requireNonNull(pair, "pair is required");
    }

    public PairGrowth withSeverityScore(double score) {
        return new PairGrowth(pair, depthGrowthRate, lengthGrowthRate, widthGrowthRate, negativeGrowth,
                remainingLifeYears, alreadyCritical, yearsTo80Pct, projectedDepthPct, forecastYears, score);
    }

    public boolean hasDepthGrowth() {
        return depthGrowthRate != null;
    }
}
