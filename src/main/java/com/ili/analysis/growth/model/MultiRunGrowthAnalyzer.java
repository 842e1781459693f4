package com.ili.analysis.growth.model;

import com.ili.analysis.growth.GrowthAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Per-track growth analysis over three or more surveys.
 *
 * <p>Two observations use the straight-line slope between them. Three or more are fitted with
 * every candidate model and the best one by information criterion drives the current rate,
 * forecast and remaining life.</p>
 */
public class MultiRunGrowthAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(MultiRunGrowthAnalyzer.class);

    private final GrowthModelFitter fitter;
    private final double criticalDepthPct;
    private final double forecastYears;

    public MultiRunGrowthAnalyzer() {
        this(new GrowthModelFitter(), GrowthAnalyzer.DEFAULT_CRITICAL_DEPTH_PCT, GrowthAnalyzer.DEFAULT_FORECAST_YEARS);
    }

    public MultiRunGrowthAnalyzer(GrowthModelFitter fitter, double criticalDepthPct, double forecastYears) {
        this.fitter = fitter;
        this.criticalDepthPct = criticalDepthPct;
        this.forecastYears = forecastYears;
    }

    /**
     * Analyses one track.
     *
     * @param trackId track identifier
     * @param times   years since the first survey, ascending
     * @param depths  depth %WT at each time
     * @throws IllegalArgumentException if the arrays differ in length or hold fewer than two observations
     */
    public MultiRunGrowthResult analyze(String trackId, double[] times, double[] depths) {
        if (times.length != depths.length) {
            throw new IllegalArgumentException("times and depths must have the same length");
        }
        int n = times.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least two observations are required, got " + n);
        }
        double lastT = times[n - 1];
        double lastDepth = depths[n - 1];

        if (n == 2) {
            double span = times[1] - times[0];
            Double rate = span > 0 ? (depths[1] - depths[0]) / span : null;
            return new MultiRunGrowthResult(trackId, n, MultiRunGrowthResult.TWO_POINT, Optional.empty(),
                    rate != null ? round(rate, 4) : null,
                    rate != null ? round(lastDepth + rate * forecastYears, 2) : null,
                    linearRemainingLife(lastDepth, rate),
                    List.of(), null);
        }

        Optional<ModelSelection> selection = fitter.selectBest(times, depths);
        if (selection.isEmpty()) {
            log.warn("No growth model could be fitted for track {}", trackId);
            return new MultiRunGrowthResult(trackId, n, MultiRunGrowthResult.NO_MODEL, Optional.empty(),
                    null, null, null, fitter.fitAll(times, depths), null);
        }

        ModelFit best = selection.get().best();
        OptionalDouble life = GrowthModelFitter.remainingLife(best, lastT, criticalDepthPct);
        log.debug("Track {}: model={} rss={} {}={}", trackId, best.model().getLabel(), best.rss(),
                fitter.getCriterion(), best.criterion(fitter.getCriterion()));
        return new MultiRunGrowthResult(trackId, n, best.model().getLabel(), Optional.of(best),
                round(GrowthModelFitter.rateAt(best, lastT), 4),
                round(GrowthModelFitter.forecast(best, lastT, forecastYears), 2),
                life.isPresent() ? life.getAsDouble() : Double.POSITIVE_INFINITY,
                selection.get().allFits(), null);
    }

    private Double linearRemainingLife(double depth, Double rate) {
        if (rate == null) {
            return null;
        }
        if (depth >= criticalDepthPct) {
            return 0.0;
        }
        if (rate <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return round((criticalDepthPct - depth) / rate, 2);
    }

    private static double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return value;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public double getCriticalDepthPct() {
        return criticalDepthPct;
    }

    public double getForecastYears() {
        return forecastYears;
    }
}
