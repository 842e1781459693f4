package com.ili.analysis.growth.model;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Fits non-linear growth curves to one anomaly's depth history and selects among them.
 *
 * <p>Each candidate is fitted by Levenberg-Marquardt least squares. A candidate that fails to
 * converge, yields non-finite parameters, or has fewer observations than parameters is excluded.
 * Selection minimizes the configured information criterion. Candidates that interpolate the data
 * exactly (as many parameters as observations) are only considered when no candidate has residual
 * degrees of freedom.</p>
 */
public class GrowthModelFitter {
    private static final Logger log = LoggerFactory.getLogger(GrowthModelFitter.class);

    public static final double DEFAULT_STEP_YEARS = 0.1;
    public static final double DEFAULT_HORIZON_YEARS = 200.0;
    private static final int MAX_ITERATIONS = 1_000;

    private final Set<GrowthModel> candidates;
    private final InformationCriterion criterion;

    public GrowthModelFitter() {
        this(EnumSet.allOf(GrowthModel.class), InformationCriterion.BIC);
    }

    public GrowthModelFitter(InformationCriterion criterion) {
        this(EnumSet.allOf(GrowthModel.class), criterion);
    }

    public GrowthModelFitter(Set<GrowthModel> candidates, InformationCriterion criterion) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate model is required");
        }
        this.candidates = EnumSet.copyOf(candidates);
        this.criterion = criterion;
    }

    /**
     * Fits one model.
     *
     * @param times  years since the first survey, ascending
     * @param depths depth %WT at each time
     * @return the fit, or empty when there are too few observations or the fit fails
     */
    public Optional<ModelFit> fit(double[] times, double[] depths, GrowthModel model) {
        if (times.length != depths.length) {
            throw new IllegalArgumentException("times and depths must have the same length");
        }
        int n = times.length;
        if (n < model.getParameterCount() || n == 0) {
            log.debug("Skipping {}: {} observations for {} parameters", model.getLabel(), n, model.getParameterCount());
            return Optional.empty();
        }

        WeightedObservedPoints points = new WeightedObservedPoints();
        for (int i = 0; i < n; i++) {
            points.add(times[i], depths[i]);
        }

        double[] params;
        try {
            params = SimpleCurveFitter.create(model, model.initialGuess(times, depths))
                    .withMaxIterations(MAX_ITERATIONS)
                    .fit(points.toList());
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            log.debug("Fit of {} failed: {}", model.getLabel(), e.getMessage());
            return Optional.empty();
        }

        double rss = 0.0;
        for (double p : params) {
            if (!Double.isFinite(p)) {
                log.debug("Fit of {} produced non-finite parameters", model.getLabel());
                return Optional.empty();
            }
        }
        for (int i = 0; i < n; i++) {
            double r = depths[i] - model.value(times[i], params);
            rss += r * r;
        }
        if (!Double.isFinite(rss)) {
            return Optional.empty();
        }
        return Optional.of(ModelFit.of(model, params, rss, n));
    }

    /**
     * Fits every candidate model, dropping those that fail.
     */
    public List<ModelFit> fitAll(double[] times, double[] depths) {
        List<ModelFit> fits = new ArrayList<>();
        for (GrowthModel model : candidates) {
            fit(times, depths, model).ifPresent(fits::add);
        }
        return fits;
    }

    /**
     * Fits every candidate and picks the one minimizing the information criterion.
     *
     * @return the selection, or empty when no candidate could be fitted or scored
     */
    public Optional<ModelSelection> selectBest(double[] times, double[] depths) {
        List<ModelFit> fits = fitAll(times, depths);
        if (fits.isEmpty()) {
            log.debug("No growth model could be fitted to {} observations", times.length);
            return Optional.empty();
        }

        Comparator<ModelFit> byCriterion = Comparator.comparingDouble(f -> f.criterion(criterion));
        Optional<ModelFit> best = fits.stream()
                .filter(f -> f.residualDegreesOfFreedom() > 0)
                .filter(f -> Double.isFinite(f.criterion(criterion)))
                .min(byCriterion);
        if (best.isEmpty()) {
            best = fits.stream()
                    .filter(f -> Double.isFinite(f.criterion(criterion)))
                    .min(byCriterion);
        }
        if (best.isEmpty()) {
            log.debug("All {} fitted models have undefined {}", fits.size(), criterion);
            return Optional.empty();
        }
        log.debug("Selected {} by {} from {} fits", best.get().model().getLabel(), criterion, fits.size());
        return Optional.of(new ModelSelection(best.get(), fits, criterion));
    }

    /**
     * Evaluates the fitted curve {@code forecastYears} after the last observation.
     */
    public static double forecast(ModelFit fit, double lastObservedTime, double forecastYears) {
        return fit.valueAt(lastObservedTime + forecastYears);
    }

    /**
     * Instantaneous growth rate of the fitted curve at {@code t}, %WT per year.
     */
    public static double rateAt(ModelFit fit, double t) {
        double h = 1e-3;
        return (fit.valueAt(t + h) - fit.valueAt(t - h)) / (2 * h);
    }

    /**
     * Years after the last observation until the fitted curve reaches {@code criticalDepth},
     * found by stepping forward in {@value #DEFAULT_STEP_YEARS}-year increments up to
     * {@value #DEFAULT_HORIZON_YEARS} years.
     *
     * @return 0 if already at or above critical; empty if the threshold is not crossed within the horizon
     */
    public static OptionalDouble remainingLife(ModelFit fit, double lastObservedTime, double criticalDepth) {
        return remainingLife(fit, lastObservedTime, criticalDepth, DEFAULT_STEP_YEARS, DEFAULT_HORIZON_YEARS);
    }

    public static OptionalDouble remainingLife(ModelFit fit, double lastObservedTime, double criticalDepth,
                                               double stepYears, double horizonYears) {
        if (!(stepYears > 0)) {
            throw new IllegalArgumentException("stepYears must be positive");
        }
        if (fit.valueAt(lastObservedTime) >= criticalDepth) {
            return OptionalDouble.of(0.0);
        }
        int steps = (int) Math.ceil(horizonYears / stepYears);
        for (int i = 1; i <= steps; i++) {
            double elapsed = i * stepYears;
            if (fit.valueAt(lastObservedTime + elapsed) >= criticalDepth) {
                return OptionalDouble.of(Math.round(elapsed * 10.0) / 10.0);
            }
        }
        return OptionalDouble.empty();
    }

    public InformationCriterion getCriterion() {
        return criterion;
    }
}
