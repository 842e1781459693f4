package com.ili.analysis.growth;

/**
 * Closed-form growth formulas for a single anomaly pair. Missing inputs yield {@code null}.
 */
public final class GrowthCalculator {

    private GrowthCalculator() {
        // Utility class
    }

    /**
     * {@code (later - earlier) / years}.
     *
     * @throws IllegalArgumentException if {@code years} is not positive
     */
    public static Double rate(Double earlier, Double later, double years) {
        if (!(years > 0)) {
            throw new IllegalArgumentException("years between surveys must be positive, got " + years);
        }
        if (earlier == null || later == null) {
            return null;
        }
        return (later - earlier) / years;
    }

    /**
     * Years until {@code depth} reaches {@code criticalDepth}.
     * <ul>
     *   <li>depth already at or above critical: 0</li>
     *   <li>rate &lt;= 0: positive infinity</li>
     *   <li>otherwise: {@code (critical - depth) / rate}, rounded to 2 decimals</li>
     * </ul>
     *
     * @return the estimate, or {@code null} when depth or rate is missing
     */
    public static Double remainingLife(Double depth, Double rate, double criticalDepth) {
        if (depth == null || rate == null) {
            return null;
        }
        if (depth >= criticalDepth) {
            return 0.0;
        }
        if (rate <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return round((criticalDepth - depth) / rate, 2);
    }

    /**
     * Depth after {@code years}, extrapolating only positive growth; shrinkage keeps the current depth.
     *
     * @return the projected depth rounded to 2 decimals, or {@code null} when depth or rate is missing
     */
    public static Double projectDepth(Double depth, Double rate, double years) {
        if (depth == null || rate == null) {
            return null;
        }
        double projected = rate > 0 ? depth + rate * years : depth;
        return round(projected, 2);
    }

    static double round(double value, int decimals) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return value;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
