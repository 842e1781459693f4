package com.ili.analysis.alignment;

import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.core.model.FeatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects fixed pipeline features usable as alignment references.
 */
public class ControlPointExtractor {
    private static final Logger log = LoggerFactory.getLogger(ControlPointExtractor.class);

    private final Set<FeatureCategory> categories;

    public ControlPointExtractor() {
        this(FeatureCategory.controlPointCategories());
    }

    public ControlPointExtractor(Set<FeatureCategory> categories) {
        this.categories = Set.copyOf(categories);
    }

    /**
     * Returns the control points of a run, sorted by distance.
     */
    public List<FeatureRecord> extract(List<FeatureRecord> features) {
        List<FeatureRecord> controlPoints = features.stream()
                .filter(f -> categories.contains(f.category()))
                .sorted(Comparator.comparingDouble(FeatureRecord::distance))
                .toList();

        if (log.isInfoEnabled()) {
            Map<FeatureCategory, Integer> counts = new EnumMap<>(FeatureCategory.class);
            controlPoints.forEach(f -> counts.merge(f.category(), 1, Integer::sum));
            log.info("Extracted {} control points {}", controlPoints.size(), counts);
        }
        return controlPoints;
    }
}
