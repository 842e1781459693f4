package com.ili.analysis.report;

import com.ili.analysis.alignment.AlignmentResult;
import com.ili.analysis.api.AnalysisResult;
import com.ili.analysis.clustering.ClusteringResult;
import com.ili.analysis.growth.GrowthAnalysis;
import com.ili.analysis.growth.GrowthSummary;
import com.ili.analysis.growth.PairGrowth;
import com.ili.analysis.matching.MatchingResult;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Builds the {@link AnalysisReport} of an analysis result.
 */
public final class AnalysisReportBuilder {

    public static final int TOP_SEVERITY = 10;

    private AnalysisReportBuilder() {
        // Utility class
    }

    public static AnalysisReport build(AnalysisResult result) {
        AlignmentResult alignment = result.alignment();
        MatchingResult matching = result.matching();
        GrowthAnalysis growth = result.growth();

        AnalysisReport.PipelineRun run = new AnalysisReport.PipelineRun(
                result.analysisId(), result.runIdA(), result.runIdB(), result.yearsBetween());

        AnalysisReport.AlignmentStats alignmentStats = new AnalysisReport.AlignmentStats(
                alignment.matchedControlPoints().size(),
                alignment.segments().size(),
                alignment.quality().name(),
                round(alignment.maxAbsResidual(), 6),
                round(alignment.meanAbsResidual(), 6));

        AnalysisReport.MatchingStats matchingStats = new AnalysisReport.MatchingStats(
                matching.matched().size(),
                matching.confidentCount(),
                matching.uncertainCount(),
                matching.missing().size(),
                matching.added().size());

        List<AnalysisReport.TypeSummary> byType = growth.summary().stream()
                .map(AnalysisReportBuilder::toTypeSummary)
                .toList();

        List<DigListEntry> top = DigList.top(growth.rows(), TOP_SEVERITY);

        AnalysisReport.ClusteringStats clustering = result.clustering()
                .map(AnalysisReportBuilder::toClusteringStats)
                .orElse(null);

        return new AnalysisReport(run, alignmentStats, matchingStats, growthStats(growth), byType, top, clustering);
    }

    private static AnalysisReport.GrowthStats growthStats(GrowthAnalysis growth) {
        DescriptiveStatistics valid = new DescriptiveStatistics();
        for (PairGrowth row : growth.rows()) {
            if (row.depthGrowthRate() != null && Double.isFinite(row.depthGrowthRate())) {
                valid.addValue(row.depthGrowthRate());
            }
        }
        boolean any = valid.getN() > 0;
        return new AnalysisReport.GrowthStats(
                valid.getN(),
                any ? round(valid.getMean(), 4) : null,
                any ? round(valid.getPercentile(50), 4) : null,
                any ? round(valid.getMax(), 4) : null,
                growth.negativeGrowthCount(),
                growth.alreadyCriticalCount());
    }

    private static AnalysisReport.TypeSummary toTypeSummary(GrowthSummary summary) {
        return new AnalysisReport.TypeSummary(summary.category().getLabel(), summary.count(),
                DigList.finite(summary.meanGrowth()),
                DigList.finite(summary.medianGrowth()),
                DigList.finite(summary.maxGrowth()),
                DigList.finite(summary.stdGrowth()),
                DigList.finite(summary.pctNegative()));
    }

    private static AnalysisReport.ClusteringStats toClusteringStats(ClusteringResult clustering) {
        return new AnalysisReport.ClusteringStats(clustering.clusterCount(), clustering.noiseCount());
    }

    private static Double round(OptionalDouble value, int decimals) {
        return value.isPresent() ? round(value.getAsDouble(), decimals) : null;
    }

    private static Double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return null;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
