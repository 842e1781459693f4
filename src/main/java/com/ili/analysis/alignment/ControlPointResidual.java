package com.ili.analysis.alignment;

/**
 * Alignment error at one matched control point: {@code correctedB - distanceA}, in feet.
 */
public record ControlPointResidual(
        Integer jointNumber,
        double distanceA,
        double distanceB,
        double correctedB,
        double residualFt
) {
}
