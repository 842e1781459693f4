package com.ili.analysis.growth.model;

import java.util.Objects;

/**
 * Outcome of acceleration detection for one track.
 *
 * @param trend         detected trend
 * @param rateChangePct change of the latest interval rate relative to the previous one, in percent;
 *                      {@code +Infinity} when the previous rate was not positive and the latest is,
 *                      {@code null} when there are fewer than two rates
 * @param description   human-readable summary
 */
public record AccelerationResult(AccelerationTrend trend, Double rateChangePct, String description) {

    public AccelerationResult {
        Objects.requireNonNull(trend, "trend is required");
        Objects.requireNonNull(description, "description is required");
    }

    public boolean isAccelerating() {
        return trend == AccelerationTrend.ACCELERATING;
    }
}
