package com.ili.analysis.growth.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Growth-model analysis of one anomaly track observed in several surveys.
 *
 * @param trackId             track identifier
 * @param runCount            number of observations analysed
 * @param modelName           selected model label, {@value #TWO_POINT} for two observations,
 *                            or {@value #NO_MODEL} when no candidate could be fitted
 * @param bestModel           the selected fit; empty for two observations or when every fit failed
 * @param currentRatePctPerYr instantaneous growth rate at the latest observation
 * @param forecastDepthPct    depth projected {@code forecastYears} beyond the latest observation
 * @param remainingLifeYears  years until the critical depth; {@code +Infinity} when not reached
 * @param allFits             every candidate that fitted
 * @param acceleration        acceleration detection, when run
 */
public record MultiRunGrowthResult(
        String trackId,
        int runCount,
        String modelName,
        Optional<ModelFit> bestModel,
        Double currentRatePctPerYr,
        Double forecastDepthPct,
        Double remainingLifeYears,
        List<ModelFit> allFits,
        AccelerationResult acceleration
) {
    public static final String TWO_POINT = "linear_2pt";
    public static final String NO_MODEL = "no model";

    public MultiRunGrowthResult {
        Objects.requireNonNull(trackId, "trackId is required");
        Objects.requireNonNull(modelName, "modelName is required");
        bestModel = bestModel != null ? bestModel : Optional.empty();
        allFits = allFits != null ? List.copyOf(allFits) : List.of();
    }

    public boolean hasModel() {
        return !NO_MODEL.equals(modelName);
    }

    public MultiRunGrowthResult withAcceleration(AccelerationResult result) {
        return new MultiRunGrowthResult(trackId, runCount, modelName, bestModel, currentRatePctPerYr,
                forecastDepthPct, remainingLifeYears, allFits, result);
    }
}
