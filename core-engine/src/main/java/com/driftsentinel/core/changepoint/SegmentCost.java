package com.driftsentinel.core.changepoint;

/**
 * Cost of fitting a single segment {@code [start, end)} of a prepared series.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SegmentCost {

    /**
     * @param start first index, inclusive
     * @param end   last index, exclusive; {@code end > start}
     * @return the segment cost; lower is a better fit
     */
    double cost(int start, int end);
}
