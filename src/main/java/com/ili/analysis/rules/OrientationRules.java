package com.ili.analysis.rules;

import com.ili.analysis.core.model.Orientation;

import java.util.Locale;

/**
 * Maps vendor orientation labels onto {@link Orientation}.
 */
public final class OrientationRules {

    private OrientationRules() {
        // Utility class
    }

    public static Orientation normalize(String label) {
        if (label == null) {
            return Orientation.UNKNOWN;
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "ID", "INTERNAL", "INT" -> Orientation.ID;
            case "OD", "EXTERNAL", "EXT" -> Orientation.OD;
            default -> Orientation.UNKNOWN;
        };
    }
}
