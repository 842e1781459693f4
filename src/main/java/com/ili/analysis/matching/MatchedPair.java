package com.ili.analysis.matching;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.MatchStatus;

import java.util.Objects;

/**
 * A Run-A anomaly re-identified in Run B.
 *
 * @param featureA        the Run-A record
 * @param featureB        the aligned Run-B record
 * @param segmentId       alignment segment the pair was solved in
 * @param cost            assignment cost, rounded to 4 decimals
 * @param deltaDistanceFt aligned distance difference, rounded to 4 decimals
 * @param deltaClockDeg   clock difference rounded to 2 decimals, or {@code null} if either clock is absent
 * @param status          {@link MatchStatus#MATCHED} or {@link MatchStatus#UNCERTAIN}
 */
public record MatchedPair(
        FeatureRecord featureA,
        FeatureRecord featureB,
        int segmentId,
        double cost,
        double deltaDistanceFt,
        Double deltaClockDeg,
        MatchStatus status
) {
    public MatchedPair {
        Objects.requireNonNull(featureA, "featureA is required");
        Objects.requireNonNull(featureB, "featureB is required");
        Objects.requireNonNull(status, "status is required");
        if (!status.isMatch()) {
            throw new IllegalArgumentException("Matched pair status must be MATCHED or UNCERTAIN, got " + status);
        }
        if (cost < 0.0) {
            throw new IllegalArgumentException("cost must be non-negative");
        }
    }

    public String featureIdA() {
        return featureA.featureId();
    }

    public String featureIdB() {
        return featureB.featureId();
    }

    public double distanceA() {
        return featureA.distance();
    }

    public double correctedDistanceB() {
        return featureB.alignedDistance();
    }

    public Double clockDegA() {
        return featureA.clockDeg();
    }

    /**
     * Category of the Run-A side.
     */
    public FeatureCategory category() {
        return featureA.category();
    }

    public Double depthA() {
        return featureA.depthPct();
    }

    public Double depthB() {
        return featureB.depthPct();
    }

    public Double lengthA() {
        return featureA.lengthIn();
    }

    public Double lengthB() {
        return featureB.lengthIn();
    }

    public Double widthA() {
        return featureA.widthIn();
    }

    public Double widthB() {
        return featureB.widthIn();
    }

    public boolean isUncertain() {
        return status == MatchStatus.UNCERTAIN;
    }
}
