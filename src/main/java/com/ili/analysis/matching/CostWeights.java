package com.ili.analysis.matching;

/**
 * Weights of the anomaly-pair matching cost.
 * Depth and size are weighted low because they are expected to change between surveys;
 * distance and clock position are the primary signals.
 */
public record CostWeights(
        double distanceWeight,
        double clockWeight,
        double depthWeight,
        double sizeWeight,
        double typePenalty
) {
    public CostWeights {
        if (distanceWeight < 0 || clockWeight < 0 || depthWeight < 0 || sizeWeight < 0 || typePenalty < 0) {
            throw new IllegalArgumentException("Cost weights must be non-negative");
        }
    }

    /**
     * dist 1.0, clock 0.5, depth 0.1, size 0.05, type penalty 10.0.
     */
    public static CostWeights defaultWeights() {
        return new CostWeights(1.0, 0.5, 0.1, 0.05, 10.0);
    }

    /**
     * Weights relying on location only, ignoring depth and size changes.
     */
    public static CostWeights locationOnly() {
        return new CostWeights(1.0, 0.5, 0.0, 0.0, 10.0);
    }
}
