package com.ili.analysis.metrics;

import com.ili.analysis.core.model.MatchStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementMatchOutcome(MatchStatus status, long count) {
    }

    @Override
    public void recordControlPoints(int count) {
    }

    @Override
    public void recordResidual(double absoluteResidualFt) {
    }

    @Override
    public void recordSeverityScore(double score) {
    }

    @Override
    public void incrementModelSelected(String modelName) {
    }
}
