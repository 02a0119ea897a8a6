package com.driftsentinel.core.metrics;

import com.driftsentinel.core.comparison.InsufficientData;
import com.driftsentinel.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Engine counters, registered on a Micrometer {@link MeterRegistry}.
 *
 * <pre>
 * drift.samples.accepted / rejected / late
 * drift.windows.sealed{forced}     drift.windows.shed     drift.windows.queued (gauge)
 * drift.metrics.computed           drift.evaluations.insufficient{reason}
 * drift.feature.failures           drift.changepoints.detected
 * drift.alerts.emitted{severity}   drift.alerts.suppressed   drift.alerts.dropped
 * </pre>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter samplesAccepted;
    private final Counter samplesRejected;
    private final Counter samplesLate;
    private final Counter windowsShed;
    private final Counter metricsComputed;
    private final Counter featureFailures;
    private final Counter changePoints;
    private final Counter alertsSuppressed;
    private final Counter alertsDropped;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.samplesAccepted = registry.counter("drift.samples.accepted");
        this.samplesRejected = registry.counter("drift.samples.rejected");
        this.samplesLate = registry.counter("drift.samples.late");
        this.windowsShed = registry.counter("drift.windows.shed");
        this.metricsComputed = registry.counter("drift.metrics.computed");
        this.featureFailures = registry.counter("drift.feature.failures");
        this.changePoints = registry.counter("drift.changepoints.detected");
        this.alertsSuppressed = registry.counter("drift.alerts.suppressed");
        this.alertsDropped = registry.counter("drift.alerts.dropped");
    }

    /**
     * @return metrics backed by a private in-memory registry
     */
    public static EngineMetrics inMemory() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    public void sampleAccepted() {
        samplesAccepted.increment();
    }

    public void sampleRejected() {
        samplesRejected.increment();
    }

    public void sampleLate() {
        samplesLate.increment();
    }

    public void windowSealed(boolean forced) {
        registry.counter("drift.windows.sealed", Tags.of("forced", String.valueOf(forced))).increment();
    }

    public void windowShed() {
        windowsShed.increment();
    }

    public void metricComputed() {
        metricsComputed.increment();
    }

    public void insufficient(InsufficientData.Reason reason) {
        if (reason == InsufficientData.Reason.FEATURE_FAILURE) {
            featureFailures.increment();
            return;
        }
        registry.counter("drift.evaluations.insufficient",
                Tags.of("reason", reason.name().toLowerCase(Locale.ROOT))).increment();
    }

    public void changePointDetected() {
        changePoints.increment();
    }

    public void alertEmitted(Severity severity) {
        registry.counter("drift.alerts.emitted",
                Tags.of("severity", severity.name().toLowerCase(Locale.ROOT))).increment();
    }

    public void alertSuppressed() {
        alertsSuppressed.increment();
    }

    public void alertDropped() {
        alertsDropped.increment();
    }

    /**
     * Expose the size of a queue as the {@code drift.windows.queued} gauge.
     */
    public void registerWindowQueue(Collection<?> queue) {
        Gauge.builder("drift.windows.queued", queue, Collection::size)
                .description("Sealed windows waiting for evaluation")
                .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Total of a counter across all its tags; 0 when it was never touched.
     */
    public double count(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }
}
