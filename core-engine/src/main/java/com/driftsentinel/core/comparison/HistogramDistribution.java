package com.driftsentinel.core.comparison;

import org.apache.commons.math3.distribution.AbstractRealDistribution;
import org.apache.commons.math3.random.JDKRandomGenerator;

/**
 * Continuous distribution whose CDF interpolates linearly inside each
 * histogram bin.
 *
 * <p>
 * Bin boundaries are {@code [min, e0, e1, ..., e(k-1), max]}. A bin of zero
 * width contributes a point mass at its boundary. Used to run a one-sample
 * KS test against a reference that only keeps bin weights.
 * </p>
 *
 * @since 1.0.0
 */
public class HistogramDistribution extends AbstractRealDistribution {

    private static final long serialVersionUID = 1L;

    private final double[] lower;
    private final double[] upper;
    private final double[] probability;

    /**
     * @param edges   inner bin edges, ascending
     * @param weights per-bin weights, {@code edges.length + 1} of them
     * @param min     smallest observed value
     * @param max     largest observed value
     */
    public HistogramDistribution(double[] edges, double[] weights, double min, double max) {
        super(new JDKRandomGenerator());
        if (weights.length != edges.length + 1) {
            throw new IllegalArgumentException("Expected " + (edges.length + 1) + " weights, got " + weights.length);
        }
        if (!(min <= max)) {
            throw new IllegalArgumentException("min must be <= max, got: " + min + " / " + max);
        }
        double total = 0;
        for (double w : weights) {
            total += w;
        }
        if (!(total > 0)) {
            throw new IllegalArgumentException("Histogram has no weight");
        }

        int bins = weights.length;
        this.lower = new double[bins];
        this.upper = new double[bins];
        this.probability = new double[bins];
        for (int i = 0; i < bins; i++) {
            lower[i] = i == 0 ? min : clamp(edges[i - 1], min, max);
            upper[i] = i == bins - 1 ? max : clamp(edges[i], min, max);
            probability[i] = weights[i] / total;
        }
    }

    @Override
    public double cumulativeProbability(double x) {
        if (x < lower[0]) {
            return 0;
        }
        if (x >= upper[upper.length - 1]) {
            return 1;
        }
        double cdf = 0;
        for (int i = 0; i < probability.length; i++) {
            if (x >= upper[i] && upper[i] > lower[i]) {
                cdf += probability[i];
            } else if (upper[i] == lower[i]) {
                if (x >= lower[i]) {
                    cdf += probability[i];
                }
            } else if (x > lower[i]) {
                cdf += probability[i] * (x - lower[i]) / (upper[i] - lower[i]);
            }
        }
        return Math.min(1.0, cdf);
    }

    @Override
    public double density(double x) {
        for (int i = 0; i < probability.length; i++) {
            if (upper[i] > lower[i] && x >= lower[i] && x < upper[i]) {
                return probability[i] / (upper[i] - lower[i]);
            }
        }
        return 0;
    }

    @Override
    public double getNumericalMean() {
        double mean = 0;
        for (int i = 0; i < probability.length; i++) {
            mean += probability[i] * 0.5 * (lower[i] + upper[i]);
        }
        return mean;
    }

    @Override
    public double getNumericalVariance() {
        double secondMoment = 0;
        for (int i = 0; i < probability.length; i++) {
            double mid = 0.5 * (lower[i] + upper[i]);
            double width = upper[i] - lower[i];
            secondMoment += probability[i] * (mid * mid + width * width / 12.0);
        }
        double mean = getNumericalMean();
        return Math.max(0, secondMoment - mean * mean);
    }

    @Override
    public double getSupportLowerBound() {
        return lower[0];
    }

    @Override
    public double getSupportUpperBound() {
        return upper[upper.length - 1];
    }

    @Override
    public boolean isSupportLowerBoundInclusive() {
        return true;
    }

    @Override
    public boolean isSupportUpperBoundInclusive() {
        return true;
    }

    @Override
    public boolean isSupportConnected() {
        return true;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
