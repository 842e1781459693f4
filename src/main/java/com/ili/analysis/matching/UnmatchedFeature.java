package com.ili.analysis.matching;

import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.core.model.MatchStatus;

import java.util.Objects;

/**
 * An anomaly present in only one of the two surveys.
 *
 * @param feature the record
 * @param status  {@link MatchStatus#MISSING} for Run-A only, {@link MatchStatus#NEW} for Run-B only
 */
public record UnmatchedFeature(FeatureRecord feature, MatchStatus status) {

    public UnmatchedFeature {
        Objects.requireNonNull(feature, "feature is required");
        if (status != MatchStatus.MISSING && status != MatchStatus.NEW) {
            throw new IllegalArgumentException("Unmatched status must be MISSING or NEW, got " + status);
        }
    }

    public static UnmatchedFeature missing(FeatureRecord feature) {
        return new UnmatchedFeature(feature, MatchStatus.MISSING);
    }

    public static UnmatchedFeature added(FeatureRecord feature) {
        return new UnmatchedFeature(feature, MatchStatus.NEW);
    }
}
