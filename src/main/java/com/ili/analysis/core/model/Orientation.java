package com.ili.analysis.core.model;

/**
 * Wall surface on which an anomaly was detected.
 */
public enum Orientation {
    /** Internal (inner diameter) surface. */
    ID,
    /** External (outer diameter) surface. */
    OD,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
