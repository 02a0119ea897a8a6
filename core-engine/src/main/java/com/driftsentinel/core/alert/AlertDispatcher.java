package com.driftsentinel.core.alert;

import com.driftsentinel.core.config.AlertSettings;
import com.driftsentinel.core.metrics.EngineMetrics;
import com.driftsentinel.core.model.Alert;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Delivers alerts to every configured {@link AlertSink}, retrying failures
 * with exponential backoff.
 *
 * <p>
 * Each sink is retried on its own, so a failing sink never blocks delivery to
 * the others. A delivery that exhausts its attempts is logged and counted as
 * dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<AlertSink> sinks;
    private final Retry retry;
    private final EngineMetrics metrics;

    public AlertDispatcher(List<AlertSink> sinks, AlertSettings settings, EngineMetrics metrics) {
        Objects.requireNonNull(settings, "AlertSettings must not be null");
        this.sinks = List.copyOf(sinks);
        this.metrics = Objects.requireNonNull(metrics, "EngineMetrics must not be null");

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getDispatchMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(settings.getDispatchBackoffMillis()),
                        settings.getDispatchBackoffMultiplier()))
                .retryExceptions(Exception.class)
                .build();
        this.retry = Retry.of("alert-dispatch", config);
        this.retry.getEventPublisher()
                .onRetry(event -> LOG.warn("Alert delivery attempt {} failed: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * @param alert the alert to deliver
     * @return {@code true} if every sink accepted it
     */
    public boolean dispatch(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        boolean delivered = true;
        for (AlertSink sink : sinks) {
            try {
                retry.executeCallable(() -> {
                    sink.publish(alert);
                    return null;
                });
            } catch (Exception e) {
                delivered = false;
                metrics.alertDropped();
                LOG.error("Dropping {} alert for '{}' on sink '{}' after {} attempt(s)", alert.getSeverity(),
                        alert.getFeature(), sink.name(), retry.getRetryConfig().getMaxAttempts(), e);
            }
        }
        return delivered;
    }

    public List<AlertSink> getSinks() {
        return sinks;
    }
}
