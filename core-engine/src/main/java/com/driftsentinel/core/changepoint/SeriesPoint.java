package com.driftsentinel.core.changepoint;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One value of the per-window scalar series.
 *
 * @since 1.0.0
 */
public final class SeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long windowIndex;
    private final Instant timestamp;
    private final double value;

    public SeriesPoint(long windowIndex, Instant timestamp, double value) {
        this.windowIndex = windowIndex;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    /**
     * @return start of the window the value was taken from
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "SeriesPoint{window=" + windowIndex + ", value=" + value + '}';
    }
}
