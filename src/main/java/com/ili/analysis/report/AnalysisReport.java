package com.ili.analysis.report;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured summary of one two-survey analysis, serialised as JSON by {@link AnalysisReportWriter}.
 * Non-finite numbers are carried as {@code null}.
 */
public record AnalysisReport(
        PipelineRun pipelineRun,
        AlignmentStats alignment,
        MatchingStats matching,
        GrowthStats growthSummary,
        List<TypeSummary> growthByFeatureType,
        List<DigListEntry> top10Severity,
        @JsonInclude(JsonInclude.Include.NON_NULL) ClusteringStats clustering
) {
    public AnalysisReport {
        growthByFeatureType = List.copyOf(growthByFeatureType);
        top10Severity = List.copyOf(top10Severity);
    }

    public record PipelineRun(String analysisId, String runA, String runB, double yearsBetween) {}

    public record AlignmentStats(int controlPointsMatched, int segments, String quality,
                                 Double maxResidualFt, Double meanResidualFt) {}

    public record MatchingStats(int totalMatched, long confident, long uncertain,
                                int missingRunAOnly, int newRunBOnly) {}

    public record GrowthStats(long anomaliesWithGrowthData, Double meanGrowthPctPerYr,
                              Double medianGrowthPctPerYr, Double maxGrowthPctPerYr,
                              long negativeGrowthCount, long alreadyCriticalCount) {}

    public record TypeSummary(String featureType, long count, Double meanGrowthPctPerYr,
                              Double medianGrowthPctPerYr, Double maxGrowthPctPerYr,
                              Double stdGrowthPctPerYr, Double pctNegativeGrowth) {}

    public record ClusteringStats(int clusters, long unclustered) {}
}
