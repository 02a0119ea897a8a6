package com.driftsentinel.core.alert;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Severity;

import java.util.Optional;

/**
 * Result of evaluating one metric value against its thresholds.
 *
 * @since 1.0.0
 */
public final class AlertDecision {

    private final String feature;
    private final MetricKind kind;
    private final AlertState previous;
    private final AlertState current;
    private final Severity severity;
    private final Alert alert;
    private final boolean suppressed;

    AlertDecision(String feature, MetricKind kind, AlertState previous, AlertState current,
            Severity severity, Alert alert, boolean suppressed) {
        this.feature = feature;
        this.kind = kind;
        this.previous = previous;
        this.current = current;
        this.severity = severity;
        this.alert = alert;
        this.suppressed = suppressed;
    }

    static AlertDecision untracked(String feature, MetricKind kind) {
        return new AlertDecision(feature, kind, AlertState.NORMAL, AlertState.NORMAL, null, null, false);
    }

    public String getFeature() {
        return feature;
    }

    public MetricKind getKind() {
        return kind;
    }

    public AlertState getPrevious() {
        return previous;
    }

    public AlertState getCurrent() {
        return current;
    }

    /**
     * @return the crossed severity, empty when the value is within bounds
     */
    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    /**
     * @return the emitted alert, empty when nothing crossed or the candidate
     *         was suppressed by the cooldown
     */
    public Optional<Alert> getAlert() {
        return Optional.ofNullable(alert);
    }

    public boolean isSuppressed() {
        return suppressed;
    }

    @Override
    public String toString() {
        return "AlertDecision{" + feature + "/" + kind + ": " + previous + " -> " + current
                + (alert != null ? ", emitted " + severity : "")
                + (suppressed ? ", suppressed" : "") + '}';
    }
}
