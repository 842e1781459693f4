package com.ili.analysis.matching;

import com.ili.analysis.core.model.FeatureCategory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides which feature categories may be matched to each other across surveys.
 * Identical categories are always compatible; anything else must be listed explicitly.
 */
public final class CategoryCompatibility {

    private final Map<FeatureCategory, Set<FeatureCategory>> interchangeable;

    private CategoryCompatibility(Map<FeatureCategory, Set<FeatureCategory>> interchangeable) {
        this.interchangeable = interchangeable;
    }

    /**
     * Identity only: a dent never matches a metal-loss feature.
     */
    public static CategoryCompatibility identityOnly() {
        return new CategoryCompatibility(Map.of());
    }

    /**
     * Creates a compatibility table. Listed pairs are made symmetric.
     */
    public static CategoryCompatibility of(Map<FeatureCategory, Set<FeatureCategory>> pairs) {
        Map<FeatureCategory, Set<FeatureCategory>> table = new EnumMap<>(FeatureCategory.class);
        pairs.forEach((from, targets) -> {
            for (FeatureCategory to : targets) {
                table.computeIfAbsent(from, k -> EnumSet.noneOf(FeatureCategory.class)).add(to);
                table.computeIfAbsent(to, k -> EnumSet.noneOf(FeatureCategory.class)).add(from);
            }
        });
        return new CategoryCompatibility(table);
    }

    public boolean compatible(FeatureCategory a, FeatureCategory b) {
        if (a == b) {
            return true;
        }
        Set<FeatureCategory> allowed = interchangeable.get(a);
        return allowed != null && allowed.contains(b);
    }
}
