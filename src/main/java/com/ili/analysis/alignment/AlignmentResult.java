package com.ili.analysis.alignment;

import com.ili.analysis.core.model.SurveyRun;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Output of aligning Run B onto Run A.
 *
 * @param alignedRunB          copy of Run B whose records carry {@code correctedDistance}
 * @param segments             piecewise transform, ordered by {@code bStart}
 * @param matchedControlPoints control points used to derive the transform, ordered by Run-A distance
 * @param residuals            per-control-point alignment error
 * @param quality              degradation level
 */
public record AlignmentResult(
        SurveyRun alignedRunB,
        List<AlignmentSegment> segments,
        List<ControlPointPair> matchedControlPoints,
        List<ControlPointResidual> residuals,
        AlignmentQuality quality
) {
    public AlignmentResult {
        Objects.requireNonNull(alignedRunB, "alignedRunB is required");
        Objects.requireNonNull(quality, "quality is required");
        segments = List.copyOf(segments);
        matchedControlPoints = List.copyOf(matchedControlPoints);
        residuals = List.copyOf(residuals);
    }

    public OptionalDouble maxAbsResidual() {
        return residuals.stream().mapToDouble(r -> Math.abs(r.residualFt())).max();
    }

    public OptionalDouble meanAbsResidual() {
        return residuals.stream().mapToDouble(r -> Math.abs(r.residualFt())).average();
    }
}
