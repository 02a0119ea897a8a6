package com.driftsentinel.core.changepoint;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pruned Exact Linear Time (PELT) optimal segmentation.
 *
 * <p>
 * Minimises the total segment cost plus {@code penalty} per change point,
 * with every segment at least {@code minSegmentLength} points long. A
 * candidate split {@code s} is pruned at step {@code t} once
 * {@code F(s) + C(s, t) > F(t)}; it can then never be optimal later.
 * </p>
 *
 * <p>
 * Stateless: {@link #segment(double[])} is a pure function of its input.
 * </p>
 *
 * @since 1.0.0
 */
public class PeltSegmenter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CostModel costModel;
    private final double penalty;
    private final int minSegmentLength;

    public PeltSegmenter(CostModel costModel, double penalty, int minSegmentLength) {
        this.costModel = Objects.requireNonNull(costModel, "costModel must not be null");
        if (!(penalty > 0) || Double.isInfinite(penalty)) {
            throw new IllegalArgumentException("penalty must be a finite value > 0, got: " + penalty);
        }
        if (minSegmentLength < 1) {
            throw new IllegalArgumentException("minSegmentLength must be >= 1, got: " + minSegmentLength);
        }
        this.penalty = penalty;
        this.minSegmentLength = minSegmentLength;
    }

    /**
     * @param series the series to segment
     * @return ascending start indexes of every segment after the first;
     *         empty when the series is too short to split
     */
    public List<Integer> segment(double[] series) {
        int n = series.length;
        if (n < 2 * minSegmentLength) {
            return List.of();
        }
        SegmentCost cost = costModel.prepare(series);

        double[] best = new double[n + 1];
        int[] lastSplit = new int[n + 1];
        best[0] = -penalty;

        List<Integer> candidates = new ArrayList<>();
        candidates.add(0);

        for (int t = minSegmentLength; t <= n; t++) {
            int fresh = t - minSegmentLength;
            if (fresh >= minSegmentLength) {
                candidates.add(fresh);
            }

            double min = Double.POSITIVE_INFINITY;
            int argMin = 0;
            double[] fit = new double[candidates.size()];
            for (int i = 0; i < candidates.size(); i++) {
                int s = candidates.get(i);
                fit[i] = best[s] + cost.cost(s, t);
                double total = fit[i] + penalty;
                if (total < min) {
                    min = total;
                    argMin = s;
                }
            }
            best[t] = min;
            lastSplit[t] = argMin;

            List<Integer> kept = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                if (fit[i] <= min) {
                    kept.add(candidates.get(i));
                }
            }
            candidates = kept;
        }

        List<Integer> splits = new ArrayList<>();
        for (int t = lastSplit[n]; t > 0; t = lastSplit[t]) {
            splits.add(t);
        }
        Collections.reverse(splits);
        return splits;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public double getPenalty() {
        return penalty;
    }

    public int getMinSegmentLength() {
        return minSegmentLength;
    }
}
