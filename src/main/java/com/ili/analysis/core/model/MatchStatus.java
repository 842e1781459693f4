package com.ili.analysis.core.model;

/**
 * Outcome of re-identifying a feature between two surveys.
 */
public enum MatchStatus {
    /**
     * Matched with cost at or below the uncertainty threshold.
     */
    MATCHED,

    /**
     * Matched, but the assignment cost exceeded the uncertainty threshold.
     * Should be verified before its growth figures are trusted.
     */
    UNCERTAIN,

    /**
     * Present in the earlier survey only.
     */
    MISSING,

    /**
     * Present in the later survey only.
     */
    NEW;

    public boolean isMatch() {
        return this == MATCHED || this == UNCERTAIN;
    }
}
