package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.SurveyRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Piecewise-linear correction of Run-B distances into Run A's coordinate frame.
 *
 * <p>For consecutive matched control points {@code (a0, b0) -> (a1, b1)}:</p>
 * <pre>
 * scale = (a1 - a0) / (b1 - b0)
 * shift = a0 - scale * b0
 * </pre>
 * <p>Coincident Run-B distances fall back to a pure offset. The first segment extends to negative
 * infinity and the last to positive infinity.</p>
 */
public final class PiecewiseTransform {
    private static final Logger log = LoggerFactory.getLogger(PiecewiseTransform.class);

    private static final double DEGENERATE_SPAN = 1e-9;
    private static final double ROUNDING = 1e4;

    private final List<AlignmentSegment> segments;

    private PiecewiseTransform(List<AlignmentSegment> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * Derives the transform from control points ordered by Run-A distance.
     * Zero points yield the identity; one point yields a constant offset.
     */
    public static PiecewiseTransform fit(List<ControlPointPair> controlPoints) {
        List<ControlPointPair> cps = controlPoints.stream()
                .sorted(Comparator.comparingDouble(ControlPointPair::distanceA))
                .toList();

        if (cps.isEmpty()) {
            log.error("No matched control points; applying identity transform");
            return new PiecewiseTransform(List.of(AlignmentSegment.identity()));
        }

        if (cps.size() == 1) {
            ControlPointPair only = cps.get(0);
            double shift = only.distanceA() - only.distanceB();
            log.warn("Only one control point matched; applying constant offset {}", shift);
            return new PiecewiseTransform(List.of(new AlignmentSegment(0,
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 1.0, shift)));
        }

        List<AlignmentSegment> segments = new ArrayList<>(cps.size() - 1);
        int last = cps.size() - 2;
        for (int i = 0; i <= last; i++) {
            ControlPointPair p0 = cps.get(i);
            ControlPointPair p1 = cps.get(i + 1);
            double spanB = p1.distanceB() - p0.distanceB();
            double scale;
            double shift;
            if (Math.abs(spanB) < DEGENERATE_SPAN) {
                scale = 1.0;
                shift = p0.distanceA() - p0.distanceB();
            } else {
                scale = (p1.distanceA() - p0.distanceA()) / spanB;
                shift = p0.distanceA() - scale * p0.distanceB();
            }
            segments.add(new AlignmentSegment(i,
                    i == 0 ? Double.NEGATIVE_INFINITY : p0.distanceB(),
                    i == last ? Double.POSITIVE_INFINITY : p1.distanceB(),
                    i == 0 ? Double.NEGATIVE_INFINITY : p0.distanceA(),
                    i == last ? Double.POSITIVE_INFINITY : p1.distanceA(),
                    scale, shift));
        }
        log.info("Computed {} alignment segments from {} control points", segments.size(), cps.size());
        return new PiecewiseTransform(segments);
    }

    public List<AlignmentSegment> segments() {
        return segments;
    }

    /**
     * Finds the segment whose {@code bStart} is the greatest value not exceeding the raw distance.
     * Distances before the first boundary use the first segment.
     */
    public AlignmentSegment segmentFor(double rawDistanceB) {
        int lo = 0;
        int hi = segments.size() - 1;
        int found = 0;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (segments.get(mid).bStart() <= rawDistanceB) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return segments.get(found);
    }

    /**
     * Corrects one raw Run-B distance, rounded to 4 decimals.
     */
    public double correct(double rawDistanceB) {
        return Math.round(segmentFor(rawDistanceB).apply(rawDistanceB) * ROUNDING) / ROUNDING;
    }

    /**
     * Returns a copy of the run with {@code correctedDistance} set on every record.
     */
    public SurveyRun apply(SurveyRun runB) {
        List<FeatureRecord> corrected = runB.features().stream()
                .map(f -> f.withCorrectedDistance(correct(f.distance())))
                .toList();
        return new SurveyRun(runB.runId(), corrected);
    }

    /**
     * Residual at each control point: corrected Run-B distance minus Run-A distance.
     */
    public List<ControlPointResidual> residuals(List<ControlPointPair> controlPoints) {
        return controlPoints.stream()
                .map(cp -> {
                    double corrected = correct(cp.distanceB());
                    return new ControlPointResidual(cp.jointNumber(), cp.distanceA(), cp.distanceB(),
                            corrected, corrected - cp.distanceA());
                })
                .toList();
    }
}
