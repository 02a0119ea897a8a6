package com.driftsentinel.core.comparison;

import com.driftsentinel.core.reference.FeatureReference;

import java.util.OptionalDouble;

/**
 * Absolute difference between window and reference means in units of the
 * reference standard deviation.
 *
 * @since 1.0.0
 */
public final class MeanShift {

    private MeanShift() {
        // utility class
    }

    /**
     * @return the shift, or empty when the reference has no spread
     */
    public static OptionalDouble compute(FeatureReference reference, double windowMean) {
        double sd = reference.getStandardDeviation();
        if (!(sd > 0) || Double.isNaN(windowMean)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(windowMean - reference.getMean()) / sd);
    }
}
