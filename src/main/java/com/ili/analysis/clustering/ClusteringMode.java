package com.ili.analysis.clustering;

import java.util.Locale;

/**
 * Feature space used for density clustering.
 */
public enum ClusteringMode {
    /** Run-A distance only. */
    ONE_D,
    /** Run-A distance plus clock position scaled so a full turn spans epsilon. */
    TWO_D;

    /**
     * Parses {@code 1d} / {@code 2d} (case-insensitive) or the constant name.
     */
    public static ClusteringMode fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Clustering mode is required");
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "1d", "one_d" -> ONE_D;
            case "2d", "two_d" -> TWO_D;
            default -> throw new IllegalArgumentException("Unknown clustering mode: " + label);
        };
    }
}
