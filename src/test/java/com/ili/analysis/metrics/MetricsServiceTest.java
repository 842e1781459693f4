package com.ili.analysis.metrics;

import com.ili.analysis.core.model.MatchStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordStageDuration("alignment", Duration.ofMillis(100));
                noOp.incrementMatchOutcome(MatchStatus.MATCHED, 3);
                noOp.recordControlPoints(12);
                noOp.recordResidual(0.4);
                noOp.recordSeverityScore(87.5);
                noOp.incrementModelSelected("linear");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record stage durations as tagged timers")
        void recordStageDuration() {
            metrics.recordStageDuration("alignment", Duration.ofMillis(150));
            metrics.recordStageDuration("alignment", Duration.ofMillis(250));
            metrics.recordStageDuration("matching", Duration.ofMillis(50));

            Timer alignment = registry.find("ili.stage.duration").tag("stage", "alignment").timer();
            Timer matching = registry.find("ili.stage.duration").tag("stage", "matching").timer();

            assertNotNull(alignment);
            assertEquals(2, alignment.count());
            assertNotNull(matching);
            assertEquals(1, matching.count());
        }

        @Test
        @DisplayName("Should count match outcomes per status")
        void incrementMatchOutcome() {
            metrics.incrementMatchOutcome(MatchStatus.MATCHED, 5);
            metrics.incrementMatchOutcome(MatchStatus.MATCHED, 2);
            metrics.incrementMatchOutcome(MatchStatus.NEW, 1);

            Counter matched = registry.find("ili.match.outcome").tag("status", "MATCHED").counter();
            Counter added = registry.find("ili.match.outcome").tag("status", "NEW").counter();

            assertNotNull(matched);
            assertEquals(7.0, matched.count());
            assertNotNull(added);
            assertEquals(1.0, added.count());
        }

        @Test
        @DisplayName("Should count matched control points")
        void recordControlPoints() {
            metrics.recordControlPoints(10);
            metrics.recordControlPoints(4);

            Counter counter = registry.find("ili.alignment.control_points").counter();
            assertNotNull(counter);
            assertEquals(14.0, counter.count());
        }

        @Test
        @DisplayName("Should record residuals and severity scores as distributions")
        void recordDistributions() {
            metrics.recordResidual(0.5);
            metrics.recordResidual(1.5);
            metrics.recordSeverityScore(80.0);

            DistributionSummary residuals = registry.find("ili.alignment.residual").summary();
            assertNotNull(residuals);
            assertEquals(2, residuals.count());
            assertEquals(2.0, residuals.totalAmount(), 1e-9);
            assertEquals(1.5, residuals.max(), 1e-9);

            DistributionSummary severity = registry.find("ili.severity.score").summary();
            assertNotNull(severity);
            assertEquals(1, severity.count());
        }

        @Test
        @DisplayName("Should count selected growth models per model")
        void incrementModelSelected() {
            metrics.incrementModelSelected("linear");
            metrics.incrementModelSelected("linear");
            metrics.incrementModelSelected("exponential");

            Counter linear = registry.find("ili.growth.model.selected").tag("model", "linear").counter();
            Counter exponential = registry.find("ili.growth.model.selected").tag("model", "exponential").counter();

            assertNotNull(linear);
            assertEquals(2.0, linear.count());
            assertNotNull(exponential);
            assertEquals(1.0, exponential.count());
        }
    }
}
