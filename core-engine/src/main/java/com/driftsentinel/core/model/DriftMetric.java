package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Result of one statistical test for one feature in one window-versus-reference
 * comparison.
 *
 * <p>
 * {@code pValue} is {@link Double#NaN} for metric kinds that are not
 * hypothesis tests. Use {@link #thresholdValue()} to obtain the number that
 * thresholds apply to.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String feature;
    private final MetricKind kind;
    private final double statistic;
    private final double pValue;
    private final long windowIndex;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final long referenceVersion;
    private final int windowSampleCount;

    private DriftMetric(Builder b) {
        this.feature = Objects.requireNonNull(b.feature, "feature must not be null");
        this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
        this.statistic = b.statistic;
        this.pValue = b.pValue;
        this.windowIndex = b.windowIndex;
        this.windowStart = Objects.requireNonNull(b.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        this.referenceVersion = b.referenceVersion;
        this.windowSampleCount = b.windowSampleCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the p-value for hypothesis tests, the statistic otherwise
     */
    public double thresholdValue() {
        return kind.isLowerWorse() ? pValue : statistic;
    }

    public String getFeature() {
        return feature;
    }

    public MetricKind getKind() {
        return kind;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public long getReferenceVersion() {
        return referenceVersion;
    }

    public int getWindowSampleCount() {
        return windowSampleCount;
    }

    public static class Builder {
        private String feature;
        private MetricKind kind;
        private double statistic;
        private double pValue = Double.NaN;
        private long windowIndex;
        private Instant windowStart;
        private Instant windowEnd;
        private long referenceVersion;
        private int windowSampleCount;

        public Builder feature(String feature) {
            this.feature = feature;
            return this;
        }

        public Builder kind(MetricKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder statistic(double statistic) {
            this.statistic = statistic;
            return this;
        }

        public Builder pValue(double pValue) {
            this.pValue = pValue;
            return this;
        }

        public Builder window(Window window) {
            this.windowIndex = window.getIndex();
            this.windowStart = window.getStart();
            this.windowEnd = window.getEnd();
            return this;
        }

        public Builder windowSampleCount(int windowSampleCount) {
            this.windowSampleCount = windowSampleCount;
            return this;
        }

        public Builder referenceVersion(long referenceVersion) {
            this.referenceVersion = referenceVersion;
            return this;
        }

        public DriftMetric build() {
            return new DriftMetric(this);
        }
    }

    @Override
    public String toString() {
        return "DriftMetric{" +
                "feature='" + feature + '\'' +
                ", kind=" + kind +
                ", statistic=" + statistic +
                ", pValue=" + pValue +
                ", window=" + windowIndex +
                ", reference=v" + referenceVersion +
                '}';
    }
}
