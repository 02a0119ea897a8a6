package com.driftsentinel.core.config;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * One {@code thresholds} entry of the YAML configuration.
 *
 * <pre>
 * thresholds:
 *   - feature: x
 *     metric: js_divergence
 *     warning: 0.1
 *     critical: 0.2
 * </pre>
 *
 * @since 1.0.0
 */
public class ThresholdRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private String feature;

    private String metric;

    private Double warning;

    private Double critical;

    public ThresholdRule() {
    }

    public ThresholdRule(String feature, String metric, double warning, double critical) {
        this.feature = feature;
        setMetric(metric);
        this.warning = warning;
        this.critical = critical;
    }

    public String getFeature() {
        return feature;
    }

    public void setFeature(String feature) {
        this.feature = feature;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric != null ? metric.toLowerCase(Locale.ROOT) : null;
    }

    public Double getWarning() {
        return warning;
    }

    public void setWarning(Double warning) {
        this.warning = warning;
    }

    public Double getCritical() {
        return critical;
    }

    public void setCritical(Double critical) {
        this.critical = critical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRule that))
            return false;
        return Objects.equals(feature, that.feature) && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, metric);
    }

    @Override
    public String toString() {
        return "ThresholdRule{feature='" + feature + "', metric='" + metric + "', warning=" + warning
                + ", critical=" + critical + '}';
    }
}
