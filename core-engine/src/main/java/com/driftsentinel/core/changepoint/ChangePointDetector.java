package com.driftsentinel.core.changepoint;

import com.driftsentinel.core.config.ChangePointSettings;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.NumericSummary;
import com.driftsentinel.core.model.Window;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Detects regime changes in a per-window scalar series.
 *
 * <p>
 * Every sealed window contributes one value ({@link SeriesStatistic}). The
 * last {@code horizon} values are standardised and segmented from scratch
 * with {@link PeltSegmenter}; standardising makes the penalty independent of
 * the series' scale.
 * </p>
 *
 * <p>
 * A boundary is reported once, when it is confirmed: the segment after it is
 * longer than the minimum segment length, it lies more than
 * {@code minSegmentLength} windows past the last reported boundary, and the
 * regime before it has not mostly slid out of a full horizon. Boundaries
 * that jitter around an already reported shift, or that PELT places early
 * while the new regime is still shorter than a segment, are not reported.
 * </p>
 *
 * <p>
 * Magnitude is {@code |meanAfter - meanBefore|} in units of the horizon
 * standard deviation. Windows for which the statistic is undefined (a missing
 * feature, no categorical values) are left out of the series.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by the evaluation thread.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetector.class);

    private final String seriesName;
    private final SeriesStatistic statistic;
    private final String feature;
    private final String category;
    private final int horizon;
    private final int minSegmentLength;
    private final PeltSegmenter segmenter;

    private final Deque<SeriesPoint> history = new ArrayDeque<>();
    private long lastReported = Long.MIN_VALUE;

    public ChangePointDetector(ChangePointSettings settings) {
        Objects.requireNonNull(settings, "ChangePointSettings must not be null");
        this.seriesName = settings.seriesName();
        this.statistic = SeriesStatistic.fromConfig(settings.getStatistic());
        this.feature = settings.getFeature();
        this.category = settings.getCategory();
        this.horizon = settings.getHorizon();
        this.minSegmentLength = settings.getMinSegmentLength();
        this.segmenter = new PeltSegmenter(CostModel.fromConfig(settings.getCostModel()),
                settings.getPenalty(), settings.getMinSegmentLength());
    }

    /**
     * Append the window's value and report new change points.
     *
     * @param window a sealed window, in sealing order
     * @return change points first seen with this window, oldest first
     */
    public List<ChangePoint> onWindow(Window window) {
        OptionalDouble value = valueOf(window);
        if (value.isEmpty()) {
            LOG.debug("Series '{}' has no value for window {}", seriesName, window.getIndex());
            return List.of();
        }
        history.addLast(new SeriesPoint(window.getIndex(), window.getStart(), value.getAsDouble()));
        while (history.size() > horizon) {
            history.removeFirst();
        }

        List<SeriesPoint> series = new ArrayList<>(history);
        List<ChangePoint> fresh = new ArrayList<>();
        for (ChangePoint cp : detect(series)) {
            if (isConfirmed(series, cp.getWindowIndex())) {
                lastReported = cp.getWindowIndex();
                LOG.info("Change point in '{}' at window {}: {} -> {} (magnitude {})", seriesName,
                        cp.getWindowIndex(), cp.getMeanBefore(), cp.getMeanAfter(), cp.getMagnitude());
                fresh.add(cp);
            } else {
                LOG.debug("Change point in '{}' at window {} not reported (last reported {})", seriesName,
                        cp.getWindowIndex(), lastReported);
            }
        }
        return fresh;
    }

    private boolean isConfirmed(List<SeriesPoint> series, long windowIndex) {
        if (windowIndex <= lastReported + minSegmentLength) {
            return false;
        }
        int position = 0;
        while (series.get(position).getWindowIndex() != windowIndex) {
            position++;
        }
        int after = series.size() - position;
        if (after <= minSegmentLength) {
            return false;
        }
        // The old regime is leaving the horizon; its remnant is not a new shift.
        return !(series.size() >= horizon && position <= minSegmentLength);
    }

    /**
     * Segment a series. Pure: the same input always yields the same output.
     *
     * @param series points in window order
     * @return one change point per segment boundary
     */
    public List<ChangePoint> detect(List<SeriesPoint> series) {
        int n = series.size();
        SummaryStatistics stats = new SummaryStatistics();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = series.get(i).getValue();
            stats.addValue(values[i]);
        }
        double sd = stats.getStandardDeviation();
        if (n < 2 || !(sd > 0)) {
            return List.of();
        }
        double mean = stats.getMean();
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            z[i] = (values[i] - mean) / sd;
        }

        List<Integer> splits = segmenter.segment(z);
        List<ChangePoint> result = new ArrayList<>(splits.size());
        for (int k = 0; k < splits.size(); k++) {
            int split = splits.get(k);
            int from = k == 0 ? 0 : splits.get(k - 1);
            int to = k + 1 < splits.size() ? splits.get(k + 1) : n;
            double before = mean(values, from, split);
            double after = mean(values, split, to);
            SeriesPoint at = series.get(split);
            result.add(new ChangePoint(seriesName, at.getWindowIndex(), at.getTimestamp(), before, after,
                    Math.abs(after - before) / sd, segmenter.getPenalty(),
                    segmenter.getCostModel().getConfigName()));
        }
        return result;
    }

    /**
     * @return the configured statistic of {@code window}, empty if undefined
     */
    public OptionalDouble valueOf(Window window) {
        return switch (statistic) {
            case SAMPLE_COUNT -> OptionalDouble.of(window.getCount());
            case MEAN -> meanOf(window);
            case CATEGORY_RATE -> categoryRateOf(window);
        };
    }

    private OptionalDouble meanOf(Window window) {
        NumericSummary summary = window.getNumericSummaries().get(feature);
        return summary != null && summary.getCount() > 0
                ? OptionalDouble.of(summary.getMean())
                : OptionalDouble.empty();
    }

    private OptionalDouble categoryRateOf(Window window) {
        Map<String, Long> counts = window.categoryCounts(feature);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return total > 0
                ? OptionalDouble.of((double) counts.getOrDefault(category, 0L) / total)
                : OptionalDouble.empty();
    }

    public String getSeriesName() {
        return seriesName;
    }

    /**
     * @return a copy of the current horizon, oldest first
     */
    public List<SeriesPoint> getHistory() {
        return List.copyOf(history);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
