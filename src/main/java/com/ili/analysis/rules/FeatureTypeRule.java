package com.ili.analysis.rules;

import com.ili.analysis.core.model.FeatureCategory;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps a lowercase label fragment to a feature category.
 * A rule applies when the label equals the pattern or contains it.
 */
public record FeatureTypeRule(String pattern, FeatureCategory category) {

    public FeatureTypeRule {
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(category, "category is required");
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        pattern = pattern.toLowerCase(Locale.ROOT);
    }

    public boolean matches(String lowerLabel) {
        return lowerLabel.equals(pattern) || lowerLabel.contains(pattern);
    }
}
