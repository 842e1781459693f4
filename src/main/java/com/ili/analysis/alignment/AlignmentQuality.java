package com.ili.analysis.alignment;

/**
 * How well the runs could be tied together, by number of matched control points.
 */
public enum AlignmentQuality {
    /**
     * Two or more control points: one linear segment between each consecutive pair.
     */
    PIECEWISE,

    /**
     * Exactly one control point: a single constant offset over the whole run.
     */
    CONSTANT_OFFSET,

    /**
     * No control points: distances are left unchanged. Downstream results are low confidence.
     */
    IDENTITY;

    public static AlignmentQuality forControlPointCount(int count) {
        if (count >= 2) {
            return PIECEWISE;
        }
        return count == 1 ? CONSTANT_OFFSET : IDENTITY;
    }

    public boolean isDegraded() {
        return this != PIECEWISE;
    }
}
