package com.ili.analysis.api;

import com.ili.analysis.alignment.AlignmentResult;
import com.ili.analysis.clustering.ClusteringResult;
import com.ili.analysis.growth.GrowthAnalysis;
import com.ili.analysis.matching.MatchingResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything produced by one two-survey analysis.
 *
 * @param analysisId   identifier of this run, also present in the logging context
 * @param runIdA       reference survey
 * @param runIdB       later survey
 * @param yearsBetween elapsed years between the surveys
 * @param alignment    aligned Run B, segments, residuals and alignment quality
 * @param matching     matched, missing and new anomalies
 * @param growth       growth rows in dig-list order plus per-category summary
 * @param clustering   interaction zones, when clustering is enabled
 */
public record AnalysisResult(
        String analysisId,
        String runIdA,
        String runIdB,
        double yearsBetween,
        AlignmentResult alignment,
        MatchingResult matching,
        GrowthAnalysis growth,
        Optional<ClusteringResult> clustering
) {
    public AnalysisResult {
        Objects.requireNonNull(analysisId, "analysisId is required");
        Objects.requireNonNull(alignment, "alignment is required");
        Objects.requireNonNull(matching, "matching is required");
        Objects.requireNonNull(growth, "growth is required");
        clustering = clustering != null ? clustering : Optional.empty();
    }
}
