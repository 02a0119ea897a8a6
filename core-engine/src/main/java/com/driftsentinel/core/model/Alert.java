package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted when a drift signal crosses a configured bound.
 *
 * <p>
 * Alerts are terminal: once built they are never mutated or re-evaluated.
 * Exactly one of {@link #getMetric()} and {@link #getChangePoint()} is set,
 * depending on what triggered the alert.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code severity}, {@code feature}, {@code kind} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    private final String feature;
    private final MetricKind kind;
    private final double value;
    private final double bound;
    private final Instant timestamp;
    private final long windowIndex;
    private final String details;
    private final DriftMetric metric;
    private final ChangePoint changePoint;

    private Alert(Builder builder) {
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.feature = Objects.requireNonNull(builder.feature, "feature must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.value = builder.value;
        this.bound = builder.bound;
        this.windowIndex = builder.windowIndex;
        this.details = builder.details;
        this.metric = builder.metric;
        this.changePoint = builder.changePoint;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private Severity severity;
        private String feature;
        private MetricKind kind;
        private double value;
        private double bound;
        private Instant timestamp;
        private long windowIndex;
        private String details;
        private DriftMetric metric;
        private ChangePoint changePoint;

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder feature(String feature) {
            this.feature = feature;
            return this;
        }

        public Builder kind(MetricKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder bound(double bound) {
            this.bound = bound;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder windowIndex(long windowIndex) {
            this.windowIndex = windowIndex;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder metric(DriftMetric metric) {
            this.metric = metric;
            return this;
        }

        public Builder changePoint(ChangePoint changePoint) {
            this.changePoint = changePoint;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getFeature() {
        return feature;
    }

    public MetricKind getKind() {
        return kind;
    }

    public double getValue() {
        return value;
    }

    public double getBound() {
        return bound;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    public String getDetails() {
        return details;
    }

    public DriftMetric getMetric() {
        return metric;
    }

    public ChangePoint getChangePoint() {
        return changePoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return windowIndex == alert.windowIndex
                && severity == alert.severity
                && kind == alert.kind
                && feature.equals(alert.feature)
                && timestamp.equals(alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, feature, kind, timestamp, windowIndex);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "severity=" + severity +
                ", feature='" + feature + '\'' +
                ", kind=" + kind +
                ", value=" + value +
                ", bound=" + bound +
                ", timestamp=" + timestamp +
                ", window=" + windowIndex +
                ", details='" + details + '\'' +
                '}';
    }
}
