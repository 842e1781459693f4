package com.ili.analysis.metrics;

import com.ili.analysis.core.model.MatchStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code ili.stage.duration}: Timer (tag: stage)</li>
 *   <li>{@code ili.match.outcome}: Counter (tag: status)</li>
 *   <li>{@code ili.alignment.control_points}: Counter</li>
 *   <li>{@code ili.alignment.residual}: DistributionSummary, feet</li>
 *   <li>{@code ili.severity.score}: DistributionSummary</li>
 *   <li>{@code ili.growth.model.selected}: Counter (tag: model)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter controlPointCounter;
    private final DistributionSummary residualSummary;
    private final DistributionSummary severitySummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.controlPointCounter = Counter.builder("ili.alignment.control_points")
                .description("Number of control points matched between surveys")
                .register(registry);
        this.residualSummary = DistributionSummary.builder("ili.alignment.residual")
                .description("Absolute control-point residual after alignment")
                .baseUnit("feet")
                .register(registry);
        this.severitySummary = DistributionSummary.builder("ili.severity.score")
                .description("Distribution of anomaly severity scores")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("ili.stage.duration")
                        .description("Duration of analysis pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMatchOutcome(MatchStatus status, long count) {
        Counter counter = counterCache.computeIfAbsent("outcome:" + status.name(), k ->
                Counter.builder("ili.match.outcome")
                        .description("Anomaly matching outcomes")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordControlPoints(int count) {
        controlPointCounter.increment(count);
    }

    @Override
    public void recordResidual(double absoluteResidualFt) {
        residualSummary.record(absoluteResidualFt);
    }

    @Override
    public void recordSeverityScore(double score) {
        severitySummary.record(score);
    }

    @Override
    public void incrementModelSelected(String modelName) {
        Counter counter = counterCache.computeIfAbsent("model:" + modelName, k ->
                Counter.builder("ili.growth.model.selected")
                        .description("Growth models selected for multi-run tracks")
                        .tag("model", modelName)
                        .register(registry));
        counter.increment();
    }
}
