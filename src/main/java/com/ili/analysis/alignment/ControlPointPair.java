package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureCategory;

import java.util.Objects;

/**
 * A fixed feature re-identified in both surveys.
 *
 * @param jointNumber joint number shared by both sides, or {@code null} when matched by sequence
 * @param distanceA   distance in the reference run (Run A)
 * @param distanceB   raw distance in the run being aligned (Run B)
 * @param category    control-point category
 * @param featureIdA  Run-A feature id
 * @param featureIdB  Run-B feature id
 */
public record ControlPointPair(
        Integer jointNumber,
        double distanceA,
        double distanceB,
        FeatureCategory category,
        String featureIdA,
        String featureIdB
) {
    public ControlPointPair {
        Objects.requireNonNull(category, "category is required");
    }

    public static ControlPointPair of(double distanceA, double distanceB) {
        return new ControlPointPair(null, distanceA, distanceB, FeatureCategory.GIRTH_WELD, null, null);
    }
}
