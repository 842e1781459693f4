package com.ili.analysis.growth.model;

/**
 * Model-selection criteria. Lower is better. Both are positive infinity for
 * {@code n <= 0} or {@code rss <= 0}, which keeps degenerate fits out of selection.
 */
public enum InformationCriterion {

    /** n*ln(RSS/n) + 2k */
    AIC {
        @Override
        public double compute(int n, int k, double rss) {
            if (n <= 0 || rss <= 0) {
                return Double.POSITIVE_INFINITY;
            }
            return n * Math.log(rss / n) + 2.0 * k;
        }
    },

    /** n*ln(RSS/n) + k*ln(n) */
    BIC {
        @Override
        public double compute(int n, int k, double rss) {
            if (n <= 0 || rss <= 0) {
                return Double.POSITIVE_INFINITY;
            }
            return n * Math.log(rss / n) + k * Math.log(n);
        }
    };

    public abstract double compute(int n, int k, double rss);
}
