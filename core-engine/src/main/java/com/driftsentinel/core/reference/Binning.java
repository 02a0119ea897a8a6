package com.driftsentinel.core.reference;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Quantile bin edges and histogram counting.
 *
 * <p>
 * Edges are the inner cut points only, strictly increasing. With {@code k}
 * edges there are {@code k + 1} bins: {@code (-inf, e0)},
 * {@code [e0, e1)}, ..., {@code [e(k-1), +inf)}. The outer bins are open so
 * values outside the reference range still land somewhere.
 * </p>
 *
 * @since 1.0.0
 */
public final class Binning {

    private Binning() {
        // utility class
    }

    /**
     * @param sorted reference values in ascending order
     * @param bins   requested number of bins, at least 2
     * @return distinct inner edges at the {@code 1/bins ... (bins-1)/bins}
     *         quantiles; fewer than {@code bins - 1} when the data has ties.
     *         When every quantile collapses onto the minimum the edges are
     *         {@code [min, nextUp(min)]}, isolating the tied value from
     *         anything below or above it.
     */
    public static double[] quantileEdges(double[] sorted, int bins) {
        if (sorted.length == 0 || bins < 2) {
            return new double[0];
        }
        Percentile percentile = new Percentile();
        percentile.setData(sorted);
        double[] raw = new double[bins - 1];
        for (int k = 1; k < bins; k++) {
            raw[k - 1] = percentile.evaluate(100.0 * k / bins);
        }
        // the lowest edge must exceed the minimum or bin 0 stays empty
        double[] edges = Arrays.stream(raw).filter(e -> e > sorted[0]).distinct().sorted().toArray();
        if (edges.length == 0) {
            return new double[] { sorted[0], Math.nextUp(sorted[0]) };
        }
        return edges;
    }

    /**
     * @return index of the bin holding {@code value}, in {@code [0, edges.length]}
     */
    public static int binOf(double[] edges, double value) {
        int idx = Arrays.binarySearch(edges, value);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /**
     * @return per-bin counts of {@code values}; length {@code edges.length + 1}
     */
    public static double[] histogram(double[] edges, double[] values) {
        double[] counts = new double[edges.length + 1];
        for (double v : values) {
            counts[binOf(edges, v)]++;
        }
        return counts;
    }
}
