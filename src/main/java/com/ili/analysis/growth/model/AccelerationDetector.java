package com.ili.analysis.growth.model;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Compares the two most recent consecutive-interval growth rates of a track.
 */
public class AccelerationDetector {

    public static final double DEFAULT_THRESHOLD_PCT = 50.0;

    private final double thresholdPct;

    public AccelerationDetector() {
        this(DEFAULT_THRESHOLD_PCT);
    }

    public AccelerationDetector(double thresholdPct) {
        if (!(thresholdPct >= 0)) {
            throw new IllegalArgumentException("thresholdPct must be non-negative, got " + thresholdPct);
        }
        this.thresholdPct = thresholdPct;
    }

    /**
     * Interval growth rates {@code (d[i+1] - d[i]) / gap[i]}; intervals with a non-positive gap are skipped.
     */
    public static double[] intervalRates(List<Double> depths, List<Double> gaps) {
        if (gaps.size() != depths.size() - 1) {
            throw new IllegalArgumentException("Expected " + (depths.size() - 1) + " gaps, got " + gaps.size());
        }
        return IntStream.range(0, gaps.size())
                .filter(i -> gaps.get(i) > 0)
                .mapToDouble(i -> (depths.get(i + 1) - depths.get(i)) / gaps.get(i))
                .toArray();
    }

    /**
     * Classifies the change from the second-to-last rate to the last one.
     */
    public AccelerationResult detect(double[] rates) {
        if (rates.length < 2) {
            return new AccelerationResult(AccelerationTrend.INSUFFICIENT_DATA, null,
                    "insufficient data: need at least two interval rates");
        }
        double earlier = rates[rates.length - 2];
        double later = rates[rates.length - 1];

        if (earlier <= 0) {
            if (later > 0) {
                return new AccelerationResult(AccelerationTrend.ACCELERATING, Double.POSITIVE_INFINITY,
                        String.format("accelerating: growth started (%.3f -> %.3f %%WT/yr)", earlier, later));
            }
            return new AccelerationResult(AccelerationTrend.STABLE, 0.0,
                    String.format("stable: no positive growth (%.3f -> %.3f %%WT/yr)", earlier, later));
        }

        double changePct = (later - earlier) / earlier * 100.0;
        double rounded = Math.round(changePct * 100.0) / 100.0;
        if (changePct > thresholdPct) {
            return new AccelerationResult(AccelerationTrend.ACCELERATING, rounded,
                    String.format("accelerating: rate up %.1f%% (%.3f -> %.3f %%WT/yr)", changePct, earlier, later));
        }
        if (changePct < -thresholdPct) {
            return new AccelerationResult(AccelerationTrend.DECELERATING, rounded,
                    String.format("decelerating: rate down %.1f%% (%.3f -> %.3f %%WT/yr)", -changePct, earlier, later));
        }
        return new AccelerationResult(AccelerationTrend.STABLE, rounded,
                String.format("stable: rate change %.1f%% within %.0f%%", changePct, thresholdPct));
    }

    public double getThresholdPct() {
        return thresholdPct;
    }
}
