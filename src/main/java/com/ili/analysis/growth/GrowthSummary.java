package com.ili.analysis.growth;

import com.ili.analysis.core.model.FeatureCategory;

/**
 * Depth growth-rate statistics for one feature category.
 * Statistics are {@code null} when the category has no rate to summarize
 * ({@code stdGrowth} needs at least two).
 */
public record GrowthSummary(
        FeatureCategory category,
        long count,
        Double meanGrowth,
        Double medianGrowth,
        Double maxGrowth,
        Double stdGrowth,
        Double pctNegative
) {
}
