package com.driftsentinel.core.comparison;

import com.driftsentinel.core.reference.Binning;
import com.driftsentinel.core.reference.FeatureReference;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jensen-Shannon divergence with base-2 logarithms, so results lie in
 * {@code [0, 1]}.
 *
 * <p>
 * Numeric features are binned on the reference's own quantile edges;
 * categorical features are compared over the union of categories seen on
 * either side.
 * </p>
 *
 * @since 1.0.0
 */
public final class JensenShannonDivergence {

    private static final double LN2 = Math.log(2);

    private JensenShannonDivergence() {
        // utility class
    }

    /**
     * @param p non-negative weights, not necessarily normalised
     * @param q non-negative weights of the same length
     * @return the divergence in {@code [0, 1]}
     * @throws InsufficientDataException if either side has zero total weight
     */
    public static double divergence(double[] p, double[] q) throws InsufficientDataException {
        if (p.length != q.length) {
            throw new IllegalArgumentException("Distributions differ in length: " + p.length + " vs " + q.length);
        }
        double sp = sum(p);
        double sq = sum(q);
        if (sp <= 0 || sq <= 0) {
            throw new InsufficientDataException(InsufficientData.Reason.INSUFFICIENT_WINDOW,
                    "Cannot compute JS divergence over an empty distribution");
        }
        double js = 0;
        for (int i = 0; i < p.length; i++) {
            double pi = p[i] / sp;
            double qi = q[i] / sq;
            double mi = 0.5 * (pi + qi);
            if (pi > 0) {
                js += 0.5 * pi * Math.log(pi / mi);
            }
            if (qi > 0) {
                js += 0.5 * qi * Math.log(qi / mi);
            }
        }
        // clamp rounding noise
        return Math.min(1.0, Math.max(0.0, js / LN2));
    }

    public static double numeric(FeatureReference reference, double[] windowValues)
            throws InsufficientDataException {
        double[] edges = reference.getEdges();
        return divergence(reference.getBinWeights(), Binning.histogram(edges, windowValues));
    }

    public static double categorical(Map<String, Double> referenceWeights, Map<String, Long> windowCounts)
            throws InsufficientDataException {
        Set<String> categories = new LinkedHashSet<>(referenceWeights.keySet());
        categories.addAll(windowCounts.keySet());
        List<String> ordered = new ArrayList<>(categories);
        double[] p = new double[ordered.size()];
        double[] q = new double[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            p[i] = referenceWeights.getOrDefault(ordered.get(i), 0.0);
            q[i] = windowCounts.getOrDefault(ordered.get(i), 0L);
        }
        return divergence(p, q);
    }

    private static double sum(double[] values) {
        double s = 0;
        for (double v : values) {
            if (v < 0 || Double.isNaN(v)) {
                throw new IllegalArgumentException("Weights must be non-negative, got: " + v);
            }
            s += v;
        }
        return s;
    }
}
