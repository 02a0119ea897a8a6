package com.driftsentinel.core.comparison;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Window;
import com.driftsentinel.core.reference.FeatureReference;
import com.driftsentinel.core.reference.ReferenceDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Compares a sealed window against the reference, feature by feature.
 *
 * <h3>Numeric Features</h3>
 * <ul>
 * <li>{@link MetricKind#JS_DIVERGENCE} on the reference bin edges</li>
 * <li>{@link MetricKind#KS_TEST}, two-sample or one-sample depending on the
 * reference shape</li>
 * <li>{@link MetricKind#MEAN_SHIFT}, skipped when the reference has zero
 * spread</li>
 * </ul>
 *
 * <h3>Categorical Features</h3>
 * <ul>
 * <li>{@link MetricKind#JS_DIVERGENCE} over the union of categories</li>
 * <li>{@link MetricKind#CHI_SQUARED} on the 2 x K contingency table</li>
 * </ul>
 *
 * <p>
 * Each feature is evaluated in isolation: insufficient data and unexpected
 * failures are reported as {@link InsufficientData} outcomes and never stop
 * the remaining features. Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DistributionComparator implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(DistributionComparator.class);

    private final int windowMinSamples;
    private final int referenceMinSamples;
    private final List<String> numericFeatures;
    private final List<String> categoricalFeatures;

    public DistributionComparator(DriftConfig config) {
        this(config.getWindow().getMinSamples(), config.getReference().getMinSamples(),
                config.getNumericFeatures(), config.getCategoricalFeatures());
    }

    public DistributionComparator(int windowMinSamples, int referenceMinSamples,
            List<String> numericFeatures, List<String> categoricalFeatures) {
        this.windowMinSamples = windowMinSamples;
        this.referenceMinSamples = referenceMinSamples;
        this.numericFeatures = List.copyOf(numericFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    /**
     * @param window    sealed window; must not be {@code null}
     * @param reference current reference, or {@code null} if none exists yet
     * @return metrics and skipped outcomes for this window
     */
    public ComparisonReport compare(Window window, ReferenceDistribution reference) {
        Objects.requireNonNull(window, "Window must not be null");
        List<DriftMetric> metrics = new ArrayList<>();
        List<InsufficientData> skipped = new ArrayList<>();

        if (window.getCount() < windowMinSamples) {
            skipped.add(skip(null, InsufficientData.Reason.INSUFFICIENT_WINDOW, window,
                    "window has " + window.getCount() + " sample(s), needs " + windowMinSamples));
            return new ComparisonReport(window.getIndex(), metrics, skipped);
        }
        if (reference == null) {
            skipped.add(skip(null, InsufficientData.Reason.INSUFFICIENT_REFERENCE, window,
                    "no reference established"));
            return new ComparisonReport(window.getIndex(), metrics, skipped);
        }
        if (reference.isExpiredAt(window.getEnd())) {
            skipped.add(skip(null, InsufficientData.Reason.REFERENCE_EXPIRED, window,
                    "reference v" + reference.getVersion() + " expired at "
                            + reference.getValidUntil().orElse(null)));
            return new ComparisonReport(window.getIndex(), metrics, skipped);
        }

        for (String feature : numericFeatures) {
            evaluate(feature, window, reference, metrics, skipped, true);
        }
        for (String feature : categoricalFeatures) {
            evaluate(feature, window, reference, metrics, skipped, false);
        }

        LOG.debug("Window {} compared against reference v{}: {} metric(s), {} skipped",
                window.getIndex(), reference.getVersion(), metrics.size(), skipped.size());
        return new ComparisonReport(window.getIndex(), metrics, skipped);
    }

    // ---------------------------------------------------------------
    // Per-feature evaluation
    // ---------------------------------------------------------------

    private void evaluate(String feature, Window window, ReferenceDistribution reference,
            List<DriftMetric> metrics, List<InsufficientData> skipped, boolean numeric) {
        List<DriftMetric> featureMetrics = new ArrayList<>();
        try {
            Optional<FeatureReference> ref = reference.feature(feature);
            if (ref.isEmpty() || ref.get().getWeight() < referenceMinSamples) {
                throw new InsufficientDataException(InsufficientData.Reason.INSUFFICIENT_REFERENCE,
                        "reference has " + ref.map(FeatureReference::getWeight).orElse(0.0)
                                + " observation(s), needs " + referenceMinSamples);
            }
            if (numeric) {
                compareNumeric(feature, window, ref.get(), reference.getVersion(), featureMetrics);
            } else {
                compareCategorical(feature, window, ref.get(), reference.getVersion(), featureMetrics);
            }
            metrics.addAll(featureMetrics);
        } catch (InsufficientDataException e) {
            // metrics computed before the failing statistic still count
            metrics.addAll(featureMetrics);
            skipped.add(skip(feature, e.getReason(), window, e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Comparison of feature '{}' failed for window {}", feature, window.getIndex(), e);
            metrics.addAll(featureMetrics);
            skipped.add(new InsufficientData(feature, InsufficientData.Reason.FEATURE_FAILURE,
                    window.getIndex(), e.toString()));
        }
    }

    private void compareNumeric(String feature, Window window, FeatureReference ref, long version,
            List<DriftMetric> out) throws InsufficientDataException {
        double[] values = window.numericValues(feature);
        if (values.length < windowMinSamples) {
            throw new InsufficientDataException(InsufficientData.Reason.INSUFFICIENT_WINDOW,
                    "window has " + values.length + " value(s) for '" + feature + "', needs " + windowMinSamples);
        }

        out.add(metric(feature, MetricKind.JS_DIVERGENCE, window, values.length, version)
                .statistic(JensenShannonDivergence.numeric(ref, values))
                .build());

        HypothesisResult ks = KolmogorovSmirnovStatistic.test(ref, values);
        out.add(metric(feature, MetricKind.KS_TEST, window, values.length, version)
                .statistic(ks.getStatistic())
                .pValue(ks.getPValue())
                .build());

        double windowMean = window.getNumericSummaries().containsKey(feature)
                ? window.getNumericSummaries().get(feature).getMean()
                : Double.NaN;
        OptionalDouble shift = MeanShift.compute(ref, windowMean);
        if (shift.isPresent()) {
            out.add(metric(feature, MetricKind.MEAN_SHIFT, window, values.length, version)
                    .statistic(shift.getAsDouble())
                    .build());
        } else {
            LOG.debug("Mean shift for '{}' skipped: reference standard deviation is zero", feature);
        }
    }

    private void compareCategorical(String feature, Window window, FeatureReference ref, long version,
            List<DriftMetric> out) throws InsufficientDataException {
        long observed = window.categoryCounts(feature).values().stream().mapToLong(Long::longValue).sum();
        if (observed < windowMinSamples) {
            throw new InsufficientDataException(InsufficientData.Reason.INSUFFICIENT_WINDOW,
                    "window has " + observed + " value(s) for '" + feature + "', needs " + windowMinSamples);
        }
        int count = (int) observed;

        out.add(metric(feature, MetricKind.JS_DIVERGENCE, window, count, version)
                .statistic(JensenShannonDivergence.categorical(ref.getCategoryWeights(),
                        window.categoryCounts(feature)))
                .build());

        HypothesisResult chi = ChiSquaredIndependence.test(ref.getCategoryWeights(), window.categoryCounts(feature));
        out.add(metric(feature, MetricKind.CHI_SQUARED, window, count, version)
                .statistic(chi.getStatistic())
                .pValue(chi.getPValue())
                .build());
    }

    private static DriftMetric.Builder metric(String feature, MetricKind kind, Window window, int count,
            long version) {
        return DriftMetric.builder()
                .feature(feature)
                .kind(kind)
                .window(window)
                .windowSampleCount(count)
                .referenceVersion(version);
    }

    private static InsufficientData skip(String feature, InsufficientData.Reason reason, Window window,
            String detail) {
        LOG.warn("Skipping comparison{} for window {}: {} ({})",
                feature == null ? "" : " of '" + feature + "'", window.getIndex(), reason, detail);
        return new InsufficientData(feature, reason, window.getIndex(), detail);
    }
}
