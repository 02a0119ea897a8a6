package com.driftsentinel.core.model;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;

import java.io.Serializable;

/**
 * Frozen summary statistics of one numeric feature within a sealed window.
 *
 * @since 1.0.0
 */
public final class NumericSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long count;
    private final double mean;
    private final double standardDeviation;
    private final double min;
    private final double max;

    public NumericSummary(long count, double mean, double standardDeviation, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.min = min;
        this.max = max;
    }

    /**
     * Freeze a running commons-math summary.
     *
     * @param summary running statistics
     * @return immutable copy
     */
    public static NumericSummary of(StatisticalSummary summary) {
        return new NumericSummary(summary.getN(), summary.getMean(),
                summary.getStandardDeviation(), summary.getMin(), summary.getMax());
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    /** Sample standard deviation (bias-corrected). */
    public double getStandardDeviation() {
        return standardDeviation;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("NumericSummary{n=%d, mean=%.4f, sd=%.4f, min=%.4f, max=%.4f}",
                count, mean, standardDeviation, min, max);
    }
}
