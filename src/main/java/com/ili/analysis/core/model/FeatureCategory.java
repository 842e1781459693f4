package com.ili.analysis.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized feature-type categories shared by every survey vendor.
 * Fixed pipeline features (welds, valves, fittings) double as control points.
 */
public enum FeatureCategory {
    GIRTH_WELD("girth_weld"),
    GIRTH_WELD_ANOMALY("girth_weld_anomaly"),
    METAL_LOSS("metal_loss"),
    DENT("dent"),
    BEND("bend"),
    VALVE("valve"),
    TEE("tee"),
    TAP("tap"),
    FLANGE("flange"),
    SUPPORT("support"),
    ATTACHMENT("attachment"),
    AGM("agm"),
    MARKER("marker"),
    SLEEVE("sleeve"),
    COMPOSITE_WRAP("composite_wrap"),
    REPAIR_MARKER("repair_marker"),
    RECOAT("recoat"),
    CASING("casing"),
    MANUFACTURING_ANOMALY("manufacturing_anomaly"),
    SEAM_WELD_ANOMALY("seam_weld_anomaly"),
    AREA_MARKER("area_marker"),
    OTHER("other"),
    UNKNOWN("unknown");

    private static final Set<FeatureCategory> CONTROL_POINTS =
            EnumSet.of(GIRTH_WELD, VALVE, TEE, TAP, FLANGE, BEND);

    private final String label;

    FeatureCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true for fixed features assumed immobile between surveys.
     */
    public boolean isControlPoint() {
        return CONTROL_POINTS.contains(this);
    }

    /**
     * The control-point categories: girth_weld, valve, tee, tap, flange, bend.
     */
    public static Set<FeatureCategory> controlPointCategories() {
        return EnumSet.copyOf(CONTROL_POINTS);
    }

    /**
     * Resolves a canonical label such as {@code metal_loss}. Unrecognized labels map to {@link #UNKNOWN}.
     */
    public static FeatureCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (FeatureCategory category : values()) {
            if (category.label.equals(key)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
