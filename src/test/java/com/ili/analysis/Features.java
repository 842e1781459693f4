package com.ili.analysis;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.MatchStatus;
import com.ili.analysis.core.model.Orientation;
import com.ili.analysis.matching.MatchedPair;

/**
 * Test fixtures for survey features.
 */
public final class Features {

    private Features() {
        // Utility class
    }

    public static FeatureRecord weld(String runId, String featureId, double distance, Integer joint) {
        return FeatureRecord.builder()
                .runId(runId)
                .featureId(featureId)
                .distance(distance)
                .jointNumber(joint)
                .category(FeatureCategory.GIRTH_WELD)
                .build();
    }

    public static FeatureRecord metalLoss(String runId, String featureId, double distance, Double clockDeg, Double depth) {
        return anomaly(runId, featureId, distance, clockDeg, depth, FeatureCategory.METAL_LOSS);
    }

    public static FeatureRecord anomaly(String runId, String featureId, double distance, Double clockDeg,
                                        Double depth, FeatureCategory category) {
        return FeatureRecord.builder()
                .runId(runId)
                .featureId(featureId)
                .distance(distance)
                .clockDeg(clockDeg)
                .category(category)
                .orientation(Orientation.OD)
                .depthPct(depth)
                .lengthIn(1.0)
                .widthIn(1.0)
                .build();
    }

    /**
     * A confidently matched pair with Run B aligned onto its raw distance.
     */
    public static MatchedPair pair(String idA, double distanceA, Double depthA, String idB, Double depthB) {
        FeatureRecord a = metalLoss("A", idA, distanceA, 90.0, depthA);
        FeatureRecord b = metalLoss("B", idB, distanceA, 90.0, depthB).withCorrectedDistance(distanceA);
        return new MatchedPair(a, b, 0, 0.0, 0.0, 0.0, MatchStatus.MATCHED);
    }
}
