package com.ili.analysis.alignment;

/**
 * One piece of the piecewise-linear distance correction:
 * {@code corrected = scale * rawDistanceB + shift} for raw Run-B distances in {@code [bStart, bEnd)}.
 * The first segment starts at negative infinity and the last ends at positive infinity.
 */
public record AlignmentSegment(
        int segmentId,
        double bStart,
        double bEnd,
        double aStart,
        double aEnd,
        double scale,
        double shift
) {
    public static AlignmentSegment identity() {
        return new AlignmentSegment(0, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 1.0, 0.0);
    }

    public double apply(double rawDistance) {
        return scale * rawDistance + shift;
    }
}
