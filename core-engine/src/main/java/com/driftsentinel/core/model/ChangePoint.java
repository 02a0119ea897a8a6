package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An abrupt regime shift in a per-window scalar series.
 *
 * <p>
 * {@code windowIndex} and {@code timestamp} identify the first window of the
 * new regime. {@code magnitude} is the absolute difference between the segment
 * means on either side, expressed in standard deviations of the whole
 * horizon; it serves as the severity proxy for thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String series;
    private final long windowIndex;
    private final Instant timestamp;
    private final double meanBefore;
    private final double meanAfter;
    private final double magnitude;
    private final double penalty;
    private final String costModel;

    public ChangePoint(String series, long windowIndex, Instant timestamp,
            double meanBefore, double meanAfter, double magnitude,
            double penalty, String costModel) {
        this.series = Objects.requireNonNull(series, "series must not be null");
        this.windowIndex = windowIndex;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.meanBefore = meanBefore;
        this.meanAfter = meanAfter;
        this.magnitude = magnitude;
        this.penalty = penalty;
        this.costModel = costModel;
    }

    public String getSeries() {
        return series;
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getMeanBefore() {
        return meanBefore;
    }

    public double getMeanAfter() {
        return meanAfter;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public double getPenalty() {
        return penalty;
    }

    public String getCostModel() {
        return costModel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangePoint that))
            return false;
        return windowIndex == that.windowIndex
                && Double.compare(that.penalty, penalty) == 0
                && series.equals(that.series)
                && Objects.equals(costModel, that.costModel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(series, windowIndex, penalty, costModel);
    }

    @Override
    public String toString() {
        return String.format("ChangePoint{series='%s', window=%d, at=%s, %.4f -> %.4f, magnitude=%.2f, pen=%.2f}",
                series, windowIndex, timestamp, meanBefore, meanAfter, magnitude, penalty);
    }
}
