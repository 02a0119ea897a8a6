package com.driftsentinel.core.reference;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Baseline of one feature inside a {@link ReferenceDistribution}.
 *
 * <p>
 * Three shapes exist:
 * </p>
 * <ul>
 * <li>{@link Shape#SAMPLES}: numeric, a sorted (possibly thinned) sample
 * array</li>
 * <li>{@link Shape#HISTOGRAM}: numeric, weights over fixed bin edges with the
 * observed min and max, produced by exponential decay</li>
 * <li>{@link Shape#CATEGORICAL}: a category weight table</li>
 * </ul>
 *
 * <p>
 * Numeric shapes carry the bin edges used for JS divergence. Edges are fixed
 * when a sample-based reference is built and survive every decay step.
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureReference implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Storage shape of a feature reference. */
    public enum Shape {
        SAMPLES,
        HISTOGRAM,
        CATEGORICAL
    }

    private final String feature;
    private final Shape shape;

    /** Effective number of observations (fractional under decay). */
    private final double weight;

    // numeric
    private final double[] samples;
    private final double[] edges;
    private final double[] binWeights;
    private final double min;
    private final double max;
    private final double weightedSum;
    private final double weightedSumSq;
    private final double mean;
    private final double standardDeviation;

    // categorical
    private final Map<String, Double> categoryWeights;

    private FeatureReference(String feature, Shape shape, double weight, double[] samples, double[] edges,
            double[] binWeights, double min, double max, double weightedSum, double weightedSumSq,
            double mean, double standardDeviation, Map<String, Double> categoryWeights) {
        this.feature = Objects.requireNonNull(feature, "feature must not be null");
        this.shape = shape;
        this.weight = weight;
        this.samples = samples;
        this.edges = edges;
        this.binWeights = binWeights;
        this.min = min;
        this.max = max;
        this.weightedSum = weightedSum;
        this.weightedSumSq = weightedSumSq;
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.categoryWeights = categoryWeights;
    }

    /**
     * Build a sample-based numeric reference.
     *
     * @param feature    feature name
     * @param values     observed values, any order
     * @param bins       number of JS divergence bins
     * @param maxSamples cap on stored samples; larger inputs are thinned evenly
     *                   across quantiles
     */
    public static FeatureReference ofSamples(String feature, double[] values, int bins, int maxSamples) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        SummaryStatistics stats = new SummaryStatistics();
        for (double v : sorted) {
            stats.addValue(v);
        }
        double[] edges = Binning.quantileEdges(sorted, bins);
        double[] stored = thin(sorted, maxSamples);
        boolean empty = sorted.length == 0;

        return new FeatureReference(feature, Shape.SAMPLES, sorted.length, stored, edges,
                Binning.histogram(edges, sorted),
                empty ? Double.NaN : sorted[0], empty ? Double.NaN : sorted[sorted.length - 1],
                stats.getSum(), stats.getSumsq(),
                empty ? Double.NaN : stats.getMean(),
                empty ? Double.NaN : stats.getStandardDeviation(),
                Map.of());
    }

    /**
     * Build a categorical reference from counts or weights.
     */
    public static FeatureReference ofCategories(String feature, Map<String, ? extends Number> counts) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double total = 0;
        for (Map.Entry<String, ? extends Number> e : counts.entrySet()) {
            double w = e.getValue().doubleValue();
            weights.put(e.getKey(), w);
            total += w;
        }
        return new FeatureReference(feature, Shape.CATEGORICAL, total, null, null, null,
                Double.NaN, Double.NaN, 0, 0, Double.NaN, Double.NaN, Collections.unmodifiableMap(weights));
    }

    /**
     * Scale existing numeric weights by {@code factor} and add the new values
     * on the existing bin edges. The result is always histogram-shaped.
     *
     * @param factor retention factor in {@code (0, 1)}
     * @param values values of the newly sealed window
     */
    public FeatureReference decayNumeric(double factor, double[] values) {
        if (shape == Shape.CATEGORICAL) {
            throw new IllegalStateException("Feature '" + feature + "' is categorical");
        }
        double[] added = Binning.histogram(edges, values);
        double[] merged = new double[binWeights.length];
        for (int i = 0; i < merged.length; i++) {
            merged[i] = factor * binWeights[i] + added[i];
        }

        double newMin = min;
        double newMax = max;
        double sum = factor * weightedSum;
        double sumSq = factor * weightedSumSq;
        for (double v : values) {
            newMin = Double.isNaN(newMin) ? v : Math.min(newMin, v);
            newMax = Double.isNaN(newMax) ? v : Math.max(newMax, v);
            sum += v;
            sumSq += v * v;
        }
        double w = factor * weight + values.length;
        double m = w > 0 ? sum / w : Double.NaN;
        double sd = w > 1 ? Math.sqrt(Math.max(0, (sumSq - sum * sum / w) / (w - 1))) : 0;

        return new FeatureReference(feature, Shape.HISTOGRAM, w, null, edges, merged, newMin, newMax,
                sum, sumSq, m, sd, Map.of());
    }

    /**
     * Scale existing category weights by {@code factor} and add the new counts.
     */
    public FeatureReference decayCategorical(double factor, Map<String, Long> counts) {
        if (shape != Shape.CATEGORICAL) {
            throw new IllegalStateException("Feature '" + feature + "' is numeric");
        }
        Map<String, Double> merged = new LinkedHashMap<>();
        categoryWeights.forEach((c, w) -> merged.put(c, factor * w));
        counts.forEach((c, n) -> merged.merge(c, n.doubleValue(), Double::sum));
        return ofCategories(feature, merged);
    }

    private static double[] thin(double[] sorted, int maxSamples) {
        if (sorted.length <= maxSamples) {
            return sorted;
        }
        double[] thinned = new double[maxSamples];
        for (int i = 0; i < maxSamples; i++) {
            thinned[i] = sorted[(int) ((i + 0.5) * sorted.length / maxSamples)];
        }
        return thinned;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getFeature() {
        return feature;
    }

    public Shape getShape() {
        return shape;
    }

    public boolean isNumeric() {
        return shape != Shape.CATEGORICAL;
    }

    /**
     * @return effective number of observations behind this reference
     */
    public double getWeight() {
        return weight;
    }

    /**
     * @return sorted stored samples; empty unless the shape is
     *         {@link Shape#SAMPLES}
     */
    public double[] getSamples() {
        return samples != null ? samples.clone() : new double[0];
    }

    public double[] getEdges() {
        return edges != null ? edges.clone() : new double[0];
    }

    /**
     * @return per-bin weights over {@link #getEdges()}
     */
    public double[] getBinWeights() {
        return binWeights != null ? binWeights.clone() : new double[0];
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public Map<String, Double> getCategoryWeights() {
        return categoryWeights;
    }

    @Override
    public String toString() {
        return "FeatureReference{feature='" + feature + "', shape=" + shape + ", weight=" + weight + '}';
    }
}
