package com.driftsentinel.core.comparison;

import com.driftsentinel.core.model.DriftMetric;

import java.util.List;

/**
 * Everything one window comparison produced.
 *
 * @since 1.0.0
 */
public final class ComparisonReport {

    private final long windowIndex;
    private final List<DriftMetric> metrics;
    private final List<InsufficientData> skipped;

    public ComparisonReport(long windowIndex, List<DriftMetric> metrics, List<InsufficientData> skipped) {
        this.windowIndex = windowIndex;
        this.metrics = List.copyOf(metrics);
        this.skipped = List.copyOf(skipped);
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    public List<DriftMetric> getMetrics() {
        return metrics;
    }

    /**
     * @return non-alerting outcomes, including isolated feature failures
     */
    public List<InsufficientData> getSkipped() {
        return skipped;
    }

    public long failureCount() {
        return skipped.stream().filter(s -> s.getReason() == InsufficientData.Reason.FEATURE_FAILURE).count();
    }

    @Override
    public String toString() {
        return "ComparisonReport{window=" + windowIndex + ", metrics=" + metrics.size()
                + ", skipped=" + skipped.size() + '}';
    }
}
