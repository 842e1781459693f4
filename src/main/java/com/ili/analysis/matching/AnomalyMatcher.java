package com.ili.analysis.matching;

import com.ili.analysis.alignment.ControlPointPair;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.MatchStatus;
import com.ili.analysis.core.model.SurveyRun;
import com.ili.analysis.rules.ClockPositions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Segment-wise anomaly matching between a reference survey and an aligned later survey.
 *
 * <p>The line is cut at the Run-A distances of the matched control points into half-open
 * intervals {@code (lo, hi]}. Run-A anomalies are placed by raw distance, Run-B anomalies by
 * corrected distance. Each segment is solved independently: candidate pairs are gated and
 * costed, infeasible cells get {@link #INFEASIBLE_COST}, and the optimal one-to-one assignment
 * is taken. Assigned cells still at the sentinel are discarded.</p>
 */
public class AnomalyMatcher {
    private static final Logger log = LoggerFactory.getLogger(AnomalyMatcher.class);

    /** Cost of an infeasible pair in the assignment matrix. */
    public static final double INFEASIBLE_COST = 1e6;

    private final MatchingCriteria criteria;
    private final PairCostFunction costFunction;

    public AnomalyMatcher() {
        this(MatchingCriteria.defaults());
    }

    public AnomalyMatcher(MatchingCriteria criteria) {
        this.criteria = criteria;
        this.costFunction = new PairCostFunction(criteria);
    }

    /**
     * Matches anomalies (non-control-point features) of the two runs.
     *
     * @param runA          reference run
     * @param alignedRunB   Run B carrying corrected distances
     * @param controlPoints matched control points defining the segments
     */
    public MatchingResult match(SurveyRun runA, SurveyRun alignedRunB, List<ControlPointPair> controlPoints) {
        List<FeatureRecord> anomaliesA = anomalies(runA.features());
        List<FeatureRecord> anomaliesB = anomalies(alignedRunB.features());
        log.info("Matchable anomalies: Run A={}, Run B={}", anomaliesA.size(), anomaliesB.size());

        double[] boundaries = segmentBoundaries(controlPoints);
        int segmentCount = boundaries.length - 1;
        log.info("Processing {} segments", segmentCount);

        List<MatchedPair> matched = new ArrayList<>();
        List<UnmatchedFeature> missing = new ArrayList<>();
        List<UnmatchedFeature> added = new ArrayList<>();

        for (int seg = 0; seg < segmentCount; seg++) {
            double lo = boundaries[seg];
            double hi = boundaries[seg + 1];
            List<FeatureRecord> segA = anomaliesA.stream()
                    .filter(f -> f.distance() > lo && f.distance() <= hi)
                    .toList();
            List<FeatureRecord> segB = anomaliesB.stream()
                    .filter(f -> f.alignedDistance() > lo && f.alignedDistance() <= hi)
                    .toList();
            if (segA.isEmpty() && segB.isEmpty()) {
                continue;
            }
            assignSegment(seg, segA, segB, matched, missing, added);
        }

        MatchingResult result = new MatchingResult(matched, missing, added, segmentCount);
        log.info("Matching complete: {} matched ({} confident, {} uncertain), {} missing (Run A only), {} new (Run B only)",
                matched.size(), result.confidentCount(), result.uncertainCount(), missing.size(), added.size());
        return result;
    }

    /**
     * Solves one segment and appends its matched and unmatched features to the supplied lists.
     */
    void assignSegment(int segmentId, List<FeatureRecord> segA, List<FeatureRecord> segB,
                       List<MatchedPair> matched, List<UnmatchedFeature> missing, List<UnmatchedFeature> added) {
        int nA = segA.size();
        int nB = segB.size();
        BitSet assignedA = new BitSet(nA);
        BitSet assignedB = new BitSet(nB);

        if (nA > 0 && nB > 0) {
            double[][] cost = new double[nA][nB];
            boolean anyFeasible = false;
            for (int i = 0; i < nA; i++) {
                for (int j = 0; j < nB; j++) {
                    OptionalDouble c = costFunction.cost(segA.get(i), segB.get(j));
                    if (c.isPresent()) {
                        cost[i][j] = c.getAsDouble();
                        anyFeasible = true;
                    } else {
                        cost[i][j] = INFEASIBLE_COST;
                    }
                }
            }

            if (anyFeasible) {
                int[] assignment = HungarianAssignment.solve(cost);
                for (int i = 0; i < nA; i++) {
                    int j = assignment[i];
                    if (j < 0 || cost[i][j] >= INFEASIBLE_COST) {
                        continue;
                    }
                    assignedA.set(i);
                    assignedB.set(j);
                    matched.add(toPair(segmentId, segA.get(i), segB.get(j), cost[i][j]));
                }
            }
            log.debug("Segment {}: {} x {} anomalies, {} matched",
                    segmentId, nA, nB, assignedA.cardinality());
        }

        for (int i = 0; i < nA; i++) {
            if (!assignedA.get(i)) {
                missing.add(UnmatchedFeature.missing(segA.get(i)));
            }
        }
        for (int j = 0; j < nB; j++) {
            if (!assignedB.get(j)) {
                added.add(UnmatchedFeature.added(segB.get(j)));
            }
        }
    }

    public MatchingCriteria getCriteria() {
        return criteria;
    }

    private MatchedPair toPair(int segmentId, FeatureRecord a, FeatureRecord b, double cost) {
        MatchStatus status = cost > criteria.costThreshold() ? MatchStatus.UNCERTAIN : MatchStatus.MATCHED;
        double deltaDistance = Math.abs(a.distance() - b.alignedDistance());
        Double deltaClock = ClockPositions.angularDistance(a.clockDeg(), b.clockDeg());
        return new MatchedPair(a, b, segmentId,
                round(cost, 4),
                round(deltaDistance, 4),
                deltaClock != null ? round(deltaClock, 2) : null,
                status);
    }

    private static List<FeatureRecord> anomalies(List<FeatureRecord> features) {
        return features.stream().filter(f -> !f.isControlPoint()).toList();
    }

    private static double[] segmentBoundaries(List<ControlPointPair> controlPoints) {
        double[] cps = controlPoints.stream().mapToDouble(ControlPointPair::distanceA).sorted().toArray();
        double[] boundaries = new double[cps.length + 2];
        boundaries[0] = Double.NEGATIVE_INFINITY;
        System.arraycopy(cps, 0, boundaries, 1, cps.length);
        boundaries[boundaries.length - 1] = Double.POSITIVE_INFINITY;
        return boundaries;
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
