package com.ili.analysis.rules;

import com.ili.analysis.core.model.FeatureCategory;

import java.util.List;

/**
 * Built-in label table covering the event descriptions used by common ILI vendors.
 * Rules with patterns of equal length are tried in declaration order.
 */
public final class DefaultFeatureTypeRules {

    private DefaultFeatureTypeRules() {
        // Utility class
    }

    /**
     * Creates a normalizer loaded with every default rule.
     */
    public static FeatureTypeNormalizer createDefaultNormalizer() {
        return new FeatureTypeNormalizer(getRules());
    }

    public static List<FeatureTypeRule> getRules() {
        return List.of(
                new FeatureTypeRule("girth weld", FeatureCategory.GIRTH_WELD),
                new FeatureTypeRule("girthweld", FeatureCategory.GIRTH_WELD),
                new FeatureTypeRule("girth weld anomaly", FeatureCategory.GIRTH_WELD_ANOMALY),
                new FeatureTypeRule("metal loss", FeatureCategory.METAL_LOSS),
                new FeatureTypeRule("cluster", FeatureCategory.METAL_LOSS),
                new FeatureTypeRule("dent", FeatureCategory.DENT),
                new FeatureTypeRule("bend", FeatureCategory.BEND),
                new FeatureTypeRule("field bend", FeatureCategory.BEND),
                new FeatureTypeRule("valve", FeatureCategory.VALVE),
                new FeatureTypeRule("tee", FeatureCategory.TEE),
                new FeatureTypeRule("stopple tee", FeatureCategory.TEE),
                new FeatureTypeRule("tap", FeatureCategory.TAP),
                new FeatureTypeRule("flange", FeatureCategory.FLANGE),
                new FeatureTypeRule("support", FeatureCategory.SUPPORT),
                new FeatureTypeRule("attachment", FeatureCategory.ATTACHMENT),
                new FeatureTypeRule("agm", FeatureCategory.AGM),
                new FeatureTypeRule("above ground marker", FeatureCategory.AGM),
                new FeatureTypeRule("magnet", FeatureCategory.MARKER),
                new FeatureTypeRule("cathodic protection point", FeatureCategory.MARKER),

                // Repairs
                new FeatureTypeRule("sleeve", FeatureCategory.SLEEVE),
                new FeatureTypeRule("composite wrap", FeatureCategory.COMPOSITE_WRAP),
                new FeatureTypeRule("repair marker", FeatureCategory.REPAIR_MARKER),
                new FeatureTypeRule("recoat", FeatureCategory.RECOAT),
                new FeatureTypeRule("casing", FeatureCategory.CASING),

                // Manufacturing
                new FeatureTypeRule("metal loss manufacturing", FeatureCategory.MANUFACTURING_ANOMALY),
                new FeatureTypeRule("metal loss-manufacturing", FeatureCategory.MANUFACTURING_ANOMALY),
                new FeatureTypeRule("seam weld manufacturing", FeatureCategory.MANUFACTURING_ANOMALY),
                new FeatureTypeRule("seam weld anomaly", FeatureCategory.SEAM_WELD_ANOMALY),
                new FeatureTypeRule("seam weld dent", FeatureCategory.DENT),

                // Area start/end markers
                new FeatureTypeRule("area start", FeatureCategory.AREA_MARKER),
                new FeatureTypeRule("area end", FeatureCategory.AREA_MARKER),
                new FeatureTypeRule("start ", FeatureCategory.AREA_MARKER),
                new FeatureTypeRule("end ", FeatureCategory.AREA_MARKER)
        );
    }
}
