package com.ili.analysis.clustering;

/**
 * Aggregates of one interaction zone. Values are rounded to 4 decimals.
 *
 * @param clusterId              cluster label
 * @param anomalyCount           members
 * @param centroidDistanceFt     mean Run-A distance
 * @param spanFt                 max minus min Run-A distance
 * @param averageDepthPct        mean Run-B depth, {@code null} if no member reports one
 * @param totalMetalLossArea     sum of Run-B length x width, missing dimensions counting as 0
 * @param clusterGrowthRate      mean depth growth rate, {@code null} if no member has one
 */
public record ClusterMetrics(
        int clusterId,
        int anomalyCount,
        double centroidDistanceFt,
        double spanFt,
        Double averageDepthPct,
        double totalMetalLossArea,
        Double clusterGrowthRate
) {
}
