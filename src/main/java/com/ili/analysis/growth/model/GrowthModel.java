package com.ili.analysis.growth.model;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;

/**
 * Candidate depth-versus-time growth curves. {@code t} is years since the first survey.
 */
public enum GrowthModel implements ParametricUnivariateFunction {

    /** d = a + b*t */
    LINEAR("linear", 2) {
        @Override
        public double value(double t, double... p) {
            return p[0] + p[1] * t;
        }

        @Override
        public double[] gradient(double t, double... p) {
            return new double[]{1.0, t};
        }

        @Override
        double[] initialGuess(double[] t, double[] d) {
            return new double[]{d[0], overallSlope(t, d)};
        }
    },

    /** d = a * exp(b*t) */
    EXPONENTIAL("exponential", 2) {
        @Override
        public double value(double t, double... p) {
            return p[0] * Math.exp(p[1] * t);
        }

        @Override
        public double[] gradient(double t, double... p) {
            double e = Math.exp(p[1] * t);
            return new double[]{e, p[0] * t * e};
        }

        @Override
        double[] initialGuess(double[] t, double[] d) {
            double a = Math.max(d[0], MIN_POSITIVE);
            double last = Math.max(d[d.length - 1], MIN_POSITIVE);
            double span = t[t.length - 1] - t[0];
            double b = span > 0 ? Math.log(last / a) / span : 0.01;
            return new double[]{a, b};
        }
    },

    /** d = a * (t + 1)^b, shifted so the first survey (t = 0) is defined */
    POWER_LAW("power_law", 2) {
        @Override
        public double value(double t, double... p) {
            return p[0] * Math.pow(t + 1.0, p[1]);
        }

        @Override
        public double[] gradient(double t, double... p) {
            double base = t + 1.0;
            double pow = Math.pow(base, p[1]);
            return new double[]{pow, p[0] * pow * Math.log(base)};
        }

        @Override
        double[] initialGuess(double[] t, double[] d) {
            double a = Math.max(d[0], MIN_POSITIVE);
            double last = Math.max(d[d.length - 1], MIN_POSITIVE);
            double logSpan = Math.log(t[t.length - 1] + 1.0);
            double b = logSpan > 0 ? Math.log(last / a) / logSpan : 0.5;
            return new double[]{a, b};
        }
    },

    /** d = a + b*t + c*t^2 */
    QUADRATIC("quadratic", 3) {
        @Override
        public double value(double t, double... p) {
            return p[0] + p[1] * t + p[2] * t * t;
        }

        @Override
        public double[] gradient(double t, double... p) {
            return new double[]{1.0, t, t * t};
        }

        @Override
        double[] initialGuess(double[] t, double[] d) {
            return new double[]{d[0], overallSlope(t, d), 0.0};
        }
    };

    private static final double MIN_POSITIVE = 1e-3;

    private final String label;
    private final int parameterCount;

    GrowthModel(String label, int parameterCount) {
        this.label = label;
        this.parameterCount = parameterCount;
    }

    public String getLabel() {
        return label;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    /**
     * Starting point for the least-squares search, derived from the observations (sorted by time).
     */
    abstract double[] initialGuess(double[] t, double[] d);

    private static double overallSlope(double[] t, double[] d) {
        double span = t[t.length - 1] - t[0];
        return span > 0 ? (d[d.length - 1] - d[0]) / span : 0.0;
    }
}
