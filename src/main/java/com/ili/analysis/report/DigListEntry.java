package com.ili.analysis.report;

/**
 * One row of the dig list. Non-finite numbers are {@code null}.
 */
public record DigListEntry(
        int rank,
        String featureIdA,
        String featureIdB,
        String featureType,
        double distanceA,
        Double clockDegA,
        Double depthPctA,
        Double depthPctB,
        Double depthGrowthPctPerYr,
        Double remainingLifeYr,
        Double projectedDepthPct,
        double severityScore,
        String status
) {
}
