package com.driftsentinel.core.alert;

import com.driftsentinel.core.config.AlertSettings;
import com.driftsentinel.core.config.ThresholdBounds;
import com.driftsentinel.core.config.ThresholdConfig;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Turns metric values into rate-limited alerts.
 *
 * <h3>State Machine</h3>
 * <p>
 * Each (feature, metric kind) key is {@link AlertState#NORMAL},
 * {@link AlertState#WARNED} or {@link AlertState#ALERTED}, set from the
 * severity of the latest evaluation. Returning to {@code NORMAL} emits
 * nothing.
 * </p>
 *
 * <h3>Cooldown</h3>
 * <p>
 * Every evaluation that crosses a bound is an alert candidate. While the
 * key's cooldown is running a candidate is emitted only if its severity is
 * strictly higher than the last emitted one; otherwise it is suppressed. Each
 * emission restarts the cooldown. Time is the evaluated window's end, so
 * replays behave like live runs.
 * </p>
 *
 * <p>
 * Evaluation happens on a single thread; state reads are safe from any
 * thread.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    private final ThresholdConfig thresholds;
    private final Duration cooldown;

    private final Map<String, KeyState> states = new ConcurrentHashMap<>();

    public AlertManager(ThresholdConfig thresholds, AlertSettings settings) {
        this.thresholds = Objects.requireNonNull(thresholds, "ThresholdConfig must not be null");
        this.cooldown = Objects.requireNonNull(settings, "AlertSettings must not be null").cooldown();
    }

    /**
     * Evaluate a drift metric. Time basis is the metric's window end.
     */
    public AlertDecision evaluate(DriftMetric metric) {
        Objects.requireNonNull(metric, "DriftMetric must not be null");
        double value = metric.thresholdValue();
        return evaluate(metric.getFeature(), metric.getKind(), value, metric.getWindowEnd(),
                bounds -> Alert.builder()
                        .metric(metric)
                        .windowIndex(metric.getWindowIndex())
                        .details(String.format("%s of '%s' = %.4f crossed %s bound %.4f (window %d, reference v%d)",
                                metric.getKind().getConfigName(), metric.getFeature(), value,
                                bounds.severity.name().toLowerCase(Locale.ROOT), bounds.bound,
                                metric.getWindowIndex(), metric.getReferenceVersion())));
    }

    /**
     * Evaluate a change point by its magnitude.
     *
     * @param changePoint the detected change point
     * @param evaluatedAt end of the window whose sealing revealed it
     */
    public AlertDecision evaluate(ChangePoint changePoint, Instant evaluatedAt) {
        Objects.requireNonNull(changePoint, "ChangePoint must not be null");
        return evaluate(changePoint.getSeries(), MetricKind.CHANGE_POINT, changePoint.getMagnitude(), evaluatedAt,
                bounds -> Alert.builder()
                        .changePoint(changePoint)
                        .windowIndex(changePoint.getWindowIndex())
                        .details(String.format("Change point in '%s' at window %d: %.4f -> %.4f, magnitude %.2f"
                                + " crossed %s bound %.2f", changePoint.getSeries(), changePoint.getWindowIndex(),
                                changePoint.getMeanBefore(), changePoint.getMeanAfter(), changePoint.getMagnitude(),
                                bounds.severity.name().toLowerCase(Locale.ROOT), bounds.bound)));
    }

    public AlertState getState(String feature, MetricKind kind) {
        KeyState state = states.get(key(feature, kind));
        return state != null ? state.state : AlertState.NORMAL;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AlertDecision evaluate(String feature, MetricKind kind, double value, Instant at,
            Function<Crossing, Alert.Builder> alertFactory) {
        Optional<ThresholdBounds> bounds = thresholds.boundsFor(feature, kind);
        if (bounds.isEmpty()) {
            return AlertDecision.untracked(feature, kind);
        }

        KeyState state = states.computeIfAbsent(key(feature, kind), k -> new KeyState());
        Severity severity = bounds.get().classify(value).orElse(null);
        AlertState previous = state.state;
        state.state = AlertState.of(severity);
        if (previous != state.state) {
            LOG.debug("{} / {}: {} -> {} (value {})", feature, kind.getConfigName(), previous, state.state, value);
        }
        if (severity == null) {
            return new AlertDecision(feature, kind, previous, state.state, null, null, false);
        }

        boolean coolingDown = state.lastEmittedAt != null && at.isBefore(state.lastEmittedAt.plus(cooldown));
        if (coolingDown && !severity.isHigherThan(state.lastSeverity)) {
            LOG.warn("Suppressed {} alert for {} / {} (value {}): cooldown active since {}", severity, feature,
                    kind.getConfigName(), value, state.lastEmittedAt);
            return new AlertDecision(feature, kind, previous, state.state, severity, null, true);
        }

        Crossing crossing = new Crossing(severity, bounds.get().boundFor(severity));
        Alert alert = alertFactory.apply(crossing)
                .severity(severity)
                .feature(feature)
                .kind(kind)
                .value(value)
                .bound(crossing.bound)
                .timestamp(at)
                .build();
        state.lastEmittedAt = at;
        state.lastSeverity = severity;
        LOG.info("{} alert: {}", severity, alert.getDetails());
        return new AlertDecision(feature, kind, previous, state.state, severity, alert, false);
    }

    private static String key(String feature, MetricKind kind) {
        return feature + "/" + kind.name();
    }

    private static final class KeyState implements Serializable {
        private static final long serialVersionUID = 1L;

        private volatile AlertState state = AlertState.NORMAL;
        private Instant lastEmittedAt;
        private Severity lastSeverity;
    }

    private static final class Crossing {
        private final Severity severity;
        private final double bound;

        private Crossing(Severity severity, double bound) {
            this.severity = severity;
            this.bound = bound;
        }
    }
}
