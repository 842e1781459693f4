package com.ili.analysis.metrics;

import com.ili.analysis.core.model.MatchStatus;

import java.time.Duration;

/**
 * Interface for recording analysis metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordStageDuration(String stage, Duration duration);

    void incrementMatchOutcome(MatchStatus status, long count);

    void recordControlPoints(int count);

    void recordResidual(double absoluteResidualFt);

    void recordSeverityScore(double score);

    void incrementModelSelected(String modelName);
}
