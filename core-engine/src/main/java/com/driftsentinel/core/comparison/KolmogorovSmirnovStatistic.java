package com.driftsentinel.core.comparison;

import com.driftsentinel.core.reference.FeatureReference;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

/**
 * Kolmogorov-Smirnov test of a window against a numeric reference.
 *
 * <p>
 * A sample-based reference gets the two-sample test; a histogram-based one
 * gets the one-sample test against its {@link HistogramDistribution}.
 * </p>
 *
 * @since 1.0.0
 */
public final class KolmogorovSmirnovStatistic {

    private KolmogorovSmirnovStatistic() {
        // utility class
    }

    public static HypothesisResult test(FeatureReference reference, double[] windowValues)
            throws InsufficientDataException {
        if (reference.getShape() == FeatureReference.Shape.SAMPLES) {
            return twoSample(reference.getSamples(), windowValues);
        }
        return oneSample(new HistogramDistribution(reference.getEdges(), reference.getBinWeights(),
                reference.getMin(), reference.getMax()), windowValues);
    }

    /**
     * @return sup-distance between the two empirical CDFs and its p-value;
     *         symmetric in its arguments
     */
    public static HypothesisResult twoSample(double[] x, double[] y) throws InsufficientDataException {
        requireTwo(x, "reference");
        requireTwo(y, "window");
        KolmogorovSmirnovTest ks = new KolmogorovSmirnovTest();
        return new HypothesisResult(ks.kolmogorovSmirnovStatistic(x, y), ks.kolmogorovSmirnovTest(x, y));
    }

    public static HypothesisResult oneSample(HistogramDistribution reference, double[] data)
            throws InsufficientDataException {
        requireTwo(data, "window");
        KolmogorovSmirnovTest ks = new KolmogorovSmirnovTest();
        return new HypothesisResult(ks.kolmogorovSmirnovStatistic(reference, data),
                ks.kolmogorovSmirnovTest(reference, data));
    }

    private static void requireTwo(double[] values, String side) throws InsufficientDataException {
        if (values.length < 2) {
            throw new InsufficientDataException(
                    "reference".equals(side) ? InsufficientData.Reason.INSUFFICIENT_REFERENCE
                            : InsufficientData.Reason.INSUFFICIENT_WINDOW,
                    "KS test needs at least 2 " + side + " values, got " + values.length);
        }
    }
}
