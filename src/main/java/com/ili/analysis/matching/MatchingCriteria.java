package com.ili.analysis.matching;

import java.util.Objects;

/**
 * Tolerances and cost settings for one anomaly-matching run.
 *
 * @param distanceToleranceFt maximum aligned-distance difference of a candidate pair, feet
 * @param clockToleranceDeg   maximum clock-position difference of a candidate pair, degrees
 * @param costThreshold       accepted pairs costing more than this are labelled UNCERTAIN
 * @param weights             cost weights
 * @param compatibility       category compatibility table
 */
public record MatchingCriteria(
        double distanceToleranceFt,
        double clockToleranceDeg,
        double costThreshold,
        CostWeights weights,
        CategoryCompatibility compatibility
) {
    public static final double DEFAULT_DISTANCE_TOLERANCE_FT = 10.0;
    public static final double DEFAULT_CLOCK_TOLERANCE_DEG = 15.0;
    public static final double DEFAULT_COST_THRESHOLD = 15.0;

    public MatchingCriteria {
        if (distanceToleranceFt < 0 || clockToleranceDeg < 0 || costThreshold < 0) {
            throw new IllegalArgumentException("Tolerances and cost threshold must be non-negative");
        }
        Objects.requireNonNull(weights, "weights is required");
        Objects.requireNonNull(compatibility, "compatibility is required");
    }

    public static MatchingCriteria defaults() {
        return new MatchingCriteria(DEFAULT_DISTANCE_TOLERANCE_FT, DEFAULT_CLOCK_TOLERANCE_DEG,
                DEFAULT_COST_THRESHOLD, CostWeights.defaultWeights(), CategoryCompatibility.identityOnly());
    }
}
