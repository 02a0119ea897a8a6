package com.driftsentinel.core.engine;

import com.driftsentinel.core.alert.AlertDecision;
import com.driftsentinel.core.comparison.ComparisonReport;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.Window;

import java.util.List;

/**
 * Everything the engine derived from one sealed window.
 *
 * @since 1.0.0
 */
public final class WindowEvaluation {

    private final Window window;
    private final ComparisonReport report;
    private final List<ChangePoint> changePoints;
    private final List<AlertDecision> decisions;
    private final List<Alert> alerts;
    private final boolean bootstrapped;

    WindowEvaluation(Window window, ComparisonReport report, List<ChangePoint> changePoints,
            List<AlertDecision> decisions, List<Alert> alerts, boolean bootstrapped) {
        this.window = window;
        this.report = report;
        this.changePoints = List.copyOf(changePoints);
        this.decisions = List.copyOf(decisions);
        this.alerts = List.copyOf(alerts);
        this.bootstrapped = bootstrapped;
    }

    public Window getWindow() {
        return window;
    }

    public ComparisonReport getReport() {
        return report;
    }

    public List<DriftMetric> getMetrics() {
        return report.getMetrics();
    }

    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public List<AlertDecision> getDecisions() {
        return decisions;
    }

    /**
     * @return alerts emitted for this window, in evaluation order
     */
    public List<Alert> getAlerts() {
        return alerts;
    }

    /**
     * @return {@code true} if this window completed the bootstrap reference
     */
    public boolean isBootstrapped() {
        return bootstrapped;
    }

    @Override
    public String toString() {
        return "WindowEvaluation{window=" + window.getIndex() + ", metrics=" + report.getMetrics().size()
                + ", changePoints=" + changePoints.size() + ", alerts=" + alerts.size()
                + (bootstrapped ? ", bootstrapped" : "") + '}';
    }
}
