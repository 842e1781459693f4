package com.ili.analysis.rules;

import com.ili.analysis.core.model.FeatureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes free-text vendor event descriptions into {@link FeatureCategory} values.
 * Rules are tried longest pattern first, so "metal loss manufacturing" wins over "metal loss".
 */
public class FeatureTypeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(FeatureTypeNormalizer.class);

    private final List<FeatureTypeRule> rules;

    public FeatureTypeNormalizer() {
        this.rules = new ArrayList<>();
    }

    public FeatureTypeNormalizer(List<FeatureTypeRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(FeatureTypeRule rule) {
        rules.add(rule);
        sortRules();
    }

    public List<FeatureTypeRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a raw label.
     *
     * @return the matched category, {@link FeatureCategory#UNKNOWN} for a null label,
     *         {@link FeatureCategory#OTHER} when no rule applies
     */
    public FeatureCategory normalize(String rawLabel) {
        if (rawLabel == null) {
            return FeatureCategory.UNKNOWN;
        }
        String lower = rawLabel.trim().toLowerCase(Locale.ROOT);
        for (FeatureTypeRule rule : rules) {
            if (rule.matches(lower)) {
                log.trace("Label '{}' matched pattern '{}' -> {}", rawLabel, rule.pattern(), rule.category());
                return rule.category();
            }
        }
        return FeatureCategory.OTHER;
    }

    /**
     * Normalizes a label of arbitrary type; anything other than text is {@link FeatureCategory#UNKNOWN}.
     */
    public FeatureCategory normalize(Object rawLabel) {
        return rawLabel instanceof String s ? normalize(s) : FeatureCategory.UNKNOWN;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt((FeatureTypeRule r) -> r.pattern().length()).reversed());
    }
}
