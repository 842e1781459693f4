package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-identifies control points between two runs.
 *
 * <p>Strategies are tried in order and the first one that succeeds wins:</p>
 * <ol>
 *   <li>Joint number: girth welds carrying the same joint number in both runs.
 *       Accepted when at least two pairs result.</li>
 *   <li>Sequence: girth welds paired by ordinal rank, rejecting a pair whose spacing to the
 *       previously accepted pair differs between the runs by more than the allowed fraction.</li>
 * </ol>
 */
public class ControlPointMatcher {
    private static final Logger log = LoggerFactory.getLogger(ControlPointMatcher.class);

    public static final double DEFAULT_MAX_SPACING_DIFF = 0.20;
    private static final int MIN_JOINT_MATCHES = 2;

    private final FeatureCategory referenceCategory;
    private final double maxSpacingDiff;

    public ControlPointMatcher() {
        this(FeatureCategory.GIRTH_WELD, DEFAULT_MAX_SPACING_DIFF);
    }

    public ControlPointMatcher(FeatureCategory referenceCategory, double maxSpacingDiff) {
        if (maxSpacingDiff < 0.0) {
            throw new IllegalArgumentException("maxSpacingDiff must be non-negative");
        }
        this.referenceCategory = referenceCategory;
        this.maxSpacingDiff = maxSpacingDiff;
    }

    /**
     * Matches control points using joint numbers, falling back to sequence matching.
     *
     * @return matched pairs ordered by Run-A distance; empty when nothing could be matched
     */
    public List<ControlPointPair> match(List<FeatureRecord> controlPointsA, List<FeatureRecord> controlPointsB) {
        List<ControlPointPair> byJoint = matchByJoint(controlPointsA, controlPointsB);
        if (byJoint.size() >= MIN_JOINT_MATCHES) {
            return byJoint;
        }
        log.info("Joint-based matching insufficient ({}); falling back to sequence", byJoint.size());
        return matchBySequence(controlPointsA, controlPointsB);
    }

    /**
     * Inner-joins reference welds on joint number. Duplicate joint numbers within a run keep the
     * occurrence nearest the start of the line.
     */
    public List<ControlPointPair> matchByJoint(List<FeatureRecord> controlPointsA, List<FeatureRecord> controlPointsB) {
        Map<Integer, FeatureRecord> jointsA = firstByJoint(controlPointsA);
        Map<Integer, FeatureRecord> jointsB = firstByJoint(controlPointsB);

        if (jointsA.isEmpty() || jointsB.isEmpty()) {
            log.warn("No {} with joint numbers for matching", referenceCategory.getLabel());
            return List.of();
        }

        List<ControlPointPair> pairs = new ArrayList<>();
        for (Map.Entry<Integer, FeatureRecord> entry : jointsA.entrySet()) {
            FeatureRecord b = jointsB.get(entry.getKey());
            if (b != null) {
                FeatureRecord a = entry.getValue();
                pairs.add(new ControlPointPair(entry.getKey(), a.distance(), b.distance(),
                        referenceCategory, a.featureId(), b.featureId()));
            }
        }
        pairs.sort(Comparator.comparingDouble(ControlPointPair::distanceA));

        log.info("Matched {} {} by joint number", pairs.size(), referenceCategory.getLabel());
        return List.copyOf(pairs);
    }

    /**
     * Pairs reference welds by ordinal rank, guarding against an extra or missing weld
     * desynchronizing the sequence.
     */
    public List<ControlPointPair> matchBySequence(List<FeatureRecord> controlPointsA, List<FeatureRecord> controlPointsB) {
        List<FeatureRecord> a = referenceFeaturesByDistance(controlPointsA);
        List<FeatureRecord> b = referenceFeaturesByDistance(controlPointsB);

        int n = Math.min(a.size(), b.size());
        if (n == 0) {
            log.warn("No {} features for sequence-based matching", referenceCategory.getLabel());
            return List.of();
        }

        List<ControlPointPair> accepted = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < n; i++) {
            FeatureRecord fa = a.get(i);
            FeatureRecord fb = b.get(i);
            if (!accepted.isEmpty()) {
                ControlPointPair previous = accepted.get(accepted.size() - 1);
                double spacingA = fa.distance() - previous.distanceA();
                double spacingB = fb.distance() - previous.distanceB();
                if (spacingA > 0 && Math.abs(spacingB - spacingA) / spacingA > maxSpacingDiff) {
                    rejected++;
                    continue;
                }
            }
            accepted.add(new ControlPointPair(fa.jointNumber(), fa.distance(), fb.distance(),
                    referenceCategory, fa.featureId(), fb.featureId()));
        }

        if (rejected > 0) {
            log.warn("Sequence matching: rejected {} pairs with spacing diff > {}%",
                    rejected, Math.round(maxSpacingDiff * 100));
        }
        accepted.sort(Comparator.comparingDouble(ControlPointPair::distanceA));
        log.info("Matched {} control points by sequence ({})", accepted.size(), referenceCategory.getLabel());
        return List.copyOf(accepted);
    }

    private Map<Integer, FeatureRecord> firstByJoint(List<FeatureRecord> controlPoints) {
        Map<Integer, FeatureRecord> byJoint = new LinkedHashMap<>();
        for (FeatureRecord feature : referenceFeaturesByDistance(controlPoints)) {
            if (feature.jointNumber() != null) {
                byJoint.putIfAbsent(feature.jointNumber(), feature);
            }
        }
        return byJoint;
    }

    private List<FeatureRecord> referenceFeaturesByDistance(List<FeatureRecord> controlPoints) {
        return controlPoints.stream()
                .filter(f -> f.category() == referenceCategory)
                .sorted(Comparator.comparingDouble(FeatureRecord::distance))
                .toList();
    }
}
