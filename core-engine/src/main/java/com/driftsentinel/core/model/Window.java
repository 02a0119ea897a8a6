package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A sealed time bucket {@code [start, end)} with its samples and frozen
 * aggregates.
 *
 * <p>
 * Windows are created by {@link com.driftsentinel.core.window.WindowAggregator}
 * at sealing time and are immutable afterwards. The {@code index} is the
 * bucket number relative to the aggregator's alignment origin; consecutive
 * buckets have consecutive indexes.
 * </p>
 *
 * @since 1.0.0
 */
public final class Window implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final Instant start;
    private final Instant end;
    private final List<Sample> samples;
    private final Map<String, NumericSummary> numericSummaries;
    private final Map<String, Map<String, Long>> categoryCounts;
    private final boolean forced;

    public Window(long index, Instant start, Instant end, List<Sample> samples,
            Map<String, NumericSummary> numericSummaries,
            Map<String, Map<String, Long>> categoryCounts,
            boolean forced) {
        this.index = index;
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end must be after start: " + start + " / " + end);
        }
        this.samples = List.copyOf(samples);
        this.numericSummaries = Collections.unmodifiableMap(new LinkedHashMap<>(numericSummaries));
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        categoryCounts.forEach((feature, table) ->
                counts.put(feature, Collections.unmodifiableMap(new LinkedHashMap<>(table))));
        this.categoryCounts = Collections.unmodifiableMap(counts);
        this.forced = forced;
    }

    public long getIndex() {
        return index;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public int getCount() {
        return samples.size();
    }

    public Map<String, NumericSummary> getNumericSummaries() {
        return numericSummaries;
    }

    public Map<String, Map<String, Long>> getCategoryCounts() {
        return categoryCounts;
    }

    /**
     * @return {@code true} if the window was sealed by the open-window bound or
     *         a flush instead of by the watermark
     */
    public boolean isForced() {
        return forced;
    }

    /**
     * Frequency table for one categorical feature.
     *
     * @param feature categorical feature name
     * @return category counts, empty if the feature never occurred
     */
    public Map<String, Long> categoryCounts(String feature) {
        return categoryCounts.getOrDefault(feature, Map.of());
    }

    /**
     * Raw values of one numeric feature, in arrival order.
     *
     * @param feature numeric feature name
     * @return a fresh array (possibly empty)
     */
    public double[] numericValues(String feature) {
        return samples.stream()
                .map(s -> s.numericValue(feature))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
    }

    @Override
    public String toString() {
        return "Window{" +
                "index=" + index +
                ", start=" + start +
                ", end=" + end +
                ", count=" + samples.size() +
                ", forced=" + forced +
                '}';
    }
}
