package com.driftsentinel.core.metrics;

import com.driftsentinel.core.comparison.InsufficientData;
import com.driftsentinel.core.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EngineMetrics}.
 */
class EngineMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final EngineMetrics metrics = new EngineMetrics(registry);

    @Test
    @DisplayName("Tagged counters should be summed across tags")
    void shouldSumTaggedCounters() {
        metrics.alertEmitted(Severity.WARNING);
        metrics.alertEmitted(Severity.CRITICAL);
        metrics.alertEmitted(Severity.CRITICAL);

        assertThat(metrics.count("drift.alerts.emitted")).isEqualTo(3.0);
        assertThat(registry.get("drift.alerts.emitted").tag("severity", "critical").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Feature failures should have their own counter")
    void shouldSeparateFeatureFailures() {
        metrics.insufficient(InsufficientData.Reason.FEATURE_FAILURE);
        metrics.insufficient(InsufficientData.Reason.INSUFFICIENT_WINDOW);
        metrics.insufficient(InsufficientData.Reason.REFERENCE_EXPIRED);

        assertThat(metrics.count("drift.feature.failures")).isEqualTo(1.0);
        assertThat(metrics.count("drift.evaluations.insufficient")).isEqualTo(2.0);
        assertThat(registry.get("drift.evaluations.insufficient").tag("reason", "reference_expired").counter()
                .count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Queue gauge should follow the queue size")
    void shouldTrackQueueSize() {
        List<String> queue = new ArrayList<>();
        metrics.registerWindowQueue(queue);
        queue.add("w1");
        queue.add("w2");

        assertThat(registry.get("drift.windows.queued").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Untouched counters should read zero")
    void shouldReadZeroForUnknownCounter() {
        assertThat(metrics.count("drift.windows.sealed")).isZero();
    }
}
