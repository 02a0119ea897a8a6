package com.driftsentinel.core.config;

import com.driftsentinel.core.model.MetricKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the drift YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section except the feature lists and
 * {@code thresholds} is optional and falls back to defaults):
 * </p>
 *
 * <pre>
 * numericFeatures: [x]
 * categoricalFeatures: [level]
 * window:
 *   bucketSeconds: 60
 *   alignment: calendar
 * reference:
 *   policy: rolling_windows
 * alerts:
 *   cooldownSeconds: 300
 * thresholds:
 *   - feature: x
 *     metric: js_divergence
 *     warning: 0.1
 *     critical: 0.2
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Every tracked feature must have at
 * least one threshold; a configuration that fails validation must stop the
 * process before any data is processed.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Set<MetricKind> NUMERIC_METRICS =
            EnumSet.of(MetricKind.JS_DIVERGENCE, MetricKind.KS_TEST, MetricKind.MEAN_SHIFT);
    private static final Set<MetricKind> CATEGORICAL_METRICS =
            EnumSet.of(MetricKind.JS_DIVERGENCE, MetricKind.CHI_SQUARED);

    private List<String> numericFeatures = new ArrayList<>();
    private List<String> categoricalFeatures = new ArrayList<>();

    private IngestSettings ingest = new IngestSettings();
    private WindowSettings window = new WindowSettings();
    private ReferenceSettings reference = new ReferenceSettings();
    private ComparisonSettings comparison = new ComparisonSettings();
    private ChangePointSettings changePoint = new ChangePointSettings();
    private AlertSettings alerts = new AlertSettings();
    private PipelineSettings pipeline = new PipelineSettings();

    private List<ThresholdRule> thresholds = new ArrayList<>();

    /**
     * Validate every section and the thresholds against the tracked features.
     * Collects all errors and throws a single exception.
     *
     * @throws ConfigurationException if the configuration is unusable
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (numericFeatures.isEmpty() && categoricalFeatures.isEmpty()) {
            errors.add("At least one numeric or categorical feature must be tracked");
        }
        Set<String> seen = new HashSet<>();
        for (String f : tracked()) {
            if (f == null || f.isBlank()) {
                errors.add("Feature names must not be blank");
            } else if (!seen.add(f)) {
                errors.add("Feature '" + f + "' is declared more than once");
            }
        }

        ingest.validate(errors);
        window.validate(errors);
        reference.validate(errors);
        comparison.validate(errors);
        changePoint.validate(errors, numericFeatures, categoricalFeatures);
        alerts.validate(errors);
        pipeline.validate(errors);

        validateThresholds(errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Drift configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private void validateThresholds(List<String> errors) {
        Set<String> keys = new HashSet<>();
        Set<String> covered = new HashSet<>();
        String series = changePoint.isEnabled() ? changePoint.seriesName() : null;

        for (int i = 0; i < thresholds.size(); i++) {
            ThresholdRule rule = thresholds.get(i);
            if (rule == null) {
                errors.add("Threshold at index " + i + " is null");
                continue;
            }
            String feature = rule.getFeature();
            MetricKind kind;
            try {
                kind = MetricKind.fromConfigName(rule.getMetric());
            } catch (IllegalArgumentException e) {
                errors.add("Threshold for '" + feature + "': " + e.getMessage());
                continue;
            }
            if (!keys.add(feature + "/" + kind)) {
                errors.add("Duplicate threshold for '" + feature + "' / " + kind.getConfigName());
            }

            Set<MetricKind> allowed;
            if (kind == MetricKind.CHANGE_POINT) {
                allowed = feature != null && feature.equals(series) ? EnumSet.of(MetricKind.CHANGE_POINT)
                        : EnumSet.noneOf(MetricKind.class);
            } else if (numericFeatures.contains(feature)) {
                allowed = NUMERIC_METRICS;
            } else if (categoricalFeatures.contains(feature)) {
                allowed = CATEGORICAL_METRICS;
            } else {
                errors.add("Threshold names untracked feature '" + feature + "'");
                continue;
            }
            if (!allowed.contains(kind)) {
                errors.add("Metric '" + kind.getConfigName() + "' does not apply to '" + feature + "'");
                continue;
            }

            if (rule.getWarning() == null || rule.getCritical() == null) {
                errors.add("Threshold '" + feature + "' / " + kind.getConfigName()
                        + " requires both 'warning' and 'critical'");
                continue;
            }
            double w = rule.getWarning();
            double c = rule.getCritical();
            if (kind.isLowerWorse()) {
                if (!(w > 0 && w < 1 && c > 0 && c < 1)) {
                    errors.add("p-value bounds for '" + feature + "' / " + kind.getConfigName()
                            + " must lie in (0, 1)");
                } else if (c > w) {
                    errors.add("critical p-value bound for '" + feature + "' must be <= warning bound");
                }
            } else if (c < w) {
                errors.add("critical bound for '" + feature + "' / " + kind.getConfigName()
                        + " must be >= warning bound");
            }
            covered.add(feature);
        }

        for (String f : tracked()) {
            if (f != null && !covered.contains(f)) {
                errors.add("Missing threshold for tracked feature '" + f + "'");
            }
        }
        if (series != null && !covered.contains(series)) {
            errors.add("Missing change_point threshold for series '" + series + "'");
        }
    }

    /**
     * Build the immutable threshold lookup. Call after {@link #validate()}.
     *
     * @return threshold lookup
     */
    public ThresholdConfig thresholdConfig() {
        return ThresholdConfig.of(thresholds);
    }

    /**
     * @return numeric then categorical feature names, in declaration order
     */
    public List<String> tracked() {
        List<String> list = new ArrayList<>(numericFeatures);
        list.addAll(categoricalFeatures);
        return Collections.unmodifiableList(list);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getNumericFeatures() {
        return Collections.unmodifiableList(numericFeatures);
    }

    public void setNumericFeatures(List<String> numericFeatures) {
        this.numericFeatures = numericFeatures != null ? new ArrayList<>(numericFeatures) : new ArrayList<>();
    }

    public List<String> getCategoricalFeatures() {
        return Collections.unmodifiableList(categoricalFeatures);
    }

    public void setCategoricalFeatures(List<String> categoricalFeatures) {
        this.categoricalFeatures = categoricalFeatures != null ? new ArrayList<>(categoricalFeatures)
                : new ArrayList<>();
    }

    public IngestSettings getIngest() {
        return ingest;
    }

    public void setIngest(IngestSettings ingest) {
        this.ingest = ingest != null ? ingest : new IngestSettings();
    }

    public WindowSettings getWindow() {
        return window;
    }

    public void setWindow(WindowSettings window) {
        this.window = window != null ? window : new WindowSettings();
    }

    public ReferenceSettings getReference() {
        return reference;
    }

    public void setReference(ReferenceSettings reference) {
        this.reference = reference != null ? reference : new ReferenceSettings();
    }

    public ComparisonSettings getComparison() {
        return comparison;
    }

    public void setComparison(ComparisonSettings comparison) {
        this.comparison = comparison != null ? comparison : new ComparisonSettings();
    }

    public ChangePointSettings getChangePoint() {
        return changePoint;
    }

    public void setChangePoint(ChangePointSettings changePoint) {
        this.changePoint = changePoint != null ? changePoint : new ChangePointSettings();
    }

    public AlertSettings getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertSettings alerts) {
        this.alerts = alerts != null ? alerts : new AlertSettings();
    }

    public PipelineSettings getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineSettings pipeline) {
        this.pipeline = pipeline != null ? pipeline : new PipelineSettings();
    }

    public List<ThresholdRule> getThresholds() {
        return Collections.unmodifiableList(thresholds);
    }

    public void setThresholds(List<ThresholdRule> thresholds) {
        this.thresholds = thresholds != null ? new ArrayList<>(thresholds) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DriftConfig{" +
                "numericFeatures=" + numericFeatures +
                ", categoricalFeatures=" + categoricalFeatures +
                ", window=" + window +
                ", reference=" + reference +
                ", changePoint=" + changePoint +
                ", alerts=" + alerts +
                ", thresholds=" + thresholds.size() +
                '}';
    }
}
