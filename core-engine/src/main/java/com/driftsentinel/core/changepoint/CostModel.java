package com.driftsentinel.core.changepoint;

import java.util.Locale;

/**
 * Segment cost functions for PELT.
 *
 * <p>
 * Both models precompute prefix sums so every segment cost is O(1).
 * </p>
 *
 * @since 1.0.0
 */
public enum CostModel {

    /** Sum of squared deviations from the segment mean; detects mean changes. */
    L2 {
        @Override
        public SegmentCost prepare(double[] series) {
            PrefixSums p = new PrefixSums(series);
            return (start, end) -> {
                int n = end - start;
                double s = p.sum(start, end);
                return Math.max(0, p.sumSq(start, end) - s * s / n);
            };
        }
    },

    /**
     * Gaussian negative log-likelihood with the segment's own mean and
     * variance; detects mean and variance changes. Segment variance is floored
     * at {@link #VARIANCE_FLOOR} so constant segments stay finite.
     */
    NORMAL {
        @Override
        public SegmentCost prepare(double[] series) {
            PrefixSums p = new PrefixSums(series);
            return (start, end) -> {
                int n = end - start;
                double mean = p.sum(start, end) / n;
                double variance = Math.max(VARIANCE_FLOOR, p.sumSq(start, end) / n - mean * mean);
                return n * (Math.log(2 * Math.PI * variance) + 1);
            };
        }
    };

    /** Variance floor for {@link #NORMAL}, in units of the standardised series. */
    public static final double VARIANCE_FLOOR = 1e-3;

    /**
     * @param series the series to be segmented
     * @return a cost function over index ranges of {@code series}
     */
    public abstract SegmentCost prepare(double[] series);

    public String getConfigName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CostModel fromConfig(String value) {
        if ("l2".equalsIgnoreCase(value)) {
            return L2;
        }
        if ("normal".equalsIgnoreCase(value)) {
            return NORMAL;
        }
        throw new IllegalArgumentException("costModel must be 'l2' or 'normal', got: '" + value + "'");
    }

    private static final class PrefixSums {
        private final double[] sum;
        private final double[] sumSq;

        PrefixSums(double[] series) {
            sum = new double[series.length + 1];
            sumSq = new double[series.length + 1];
            for (int i = 0; i < series.length; i++) {
                sum[i + 1] = sum[i] + series[i];
                sumSq[i + 1] = sumSq[i] + series[i] * series[i];
            }
        }

        double sum(int start, int end) {
            return sum[end] - sum[start];
        }

        double sumSq(int start, int end) {
            return sumSq[end] - sumSq[start];
        }
    }
}
