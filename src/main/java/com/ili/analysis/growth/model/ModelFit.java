package com.ili.analysis.growth.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A fitted growth curve.
 *
 * @param model        the curve family
 * @param parameters   fitted parameters, in the order the model defines
 * @param rss          residual sum of squares
 * @param observations number of observations fitted
 * @param aic          Akaike information criterion
 * @param bic          Bayesian information criterion
 */
public record ModelFit(
        GrowthModel model,
        double[] parameters,
        double rss,
        int observations,
        double aic,
        double bic
) {
    static final double RSS_FLOOR = 1e-12;

    public ModelFit {
        Objects.requireNonNull(model, "model is required");
        parameters = parameters.clone();
        if (parameters.length != model.getParameterCount()) {
            throw new IllegalArgumentException("Expected " + model.getParameterCount()
                    + " parameters for " + model.getLabel() + ", got " + parameters.length);
        }
    }

    /**
     * Builds a fit and scores it. An exact fit is scored at {@value #RSS_FLOOR} so it stays selectable.
     */
    public static ModelFit of(GrowthModel model, double[] parameters, double rss, int observations) {
        int k = model.getParameterCount();
        double scored = Math.max(rss, RSS_FLOOR);
        return new ModelFit(model, parameters, rss, observations,
                InformationCriterion.AIC.compute(observations, k, scored),
                InformationCriterion.BIC.compute(observations, k, scored));
    }

    @Override
    public double[] parameters() {
        return parameters.clone();
    }

    /**
     * Evaluates the fitted curve at {@code t} years since the first survey.
     */
    public double valueAt(double t) {
        return model.value(t, parameters);
    }

    public double criterion(InformationCriterion criterion) {
        return criterion == InformationCriterion.AIC ? aic : bic;
    }

    /**
     * Residual degrees of freedom; 0 means the curve interpolates the observations exactly.
     */
    public int residualDegreesOfFreedom() {
        return observations - model.getParameterCount();
    }

    @Override
    public String toString() {
        return "ModelFit{" + model.getLabel() + ", params=" + Arrays.toString(parameters)
                + ", rss=" + rss + ", n=" + observations + ", aic=" + aic + ", bic=" + bic + '}';
    }
}
