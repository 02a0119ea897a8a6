package com.driftsentinel.core.window;

import com.driftsentinel.core.model.NumericSummary;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for one bucket that has not been sealed yet.
 */
final class OpenWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final Instant start;
    private final Instant end;
    private final List<Sample> samples = new ArrayList<>();
    private final Map<String, SummaryStatistics> stats = new LinkedHashMap<>();
    private final Map<String, Map<String, Long>> counts = new LinkedHashMap<>();

    OpenWindow(long index, Instant start, Instant end) {
        this.index = index;
        this.start = start;
        this.end = end;
    }

    void add(Sample sample) {
        samples.add(sample);
        sample.getNumeric().forEach((feature, value) ->
                stats.computeIfAbsent(feature, f -> new SummaryStatistics()).addValue(value));
        sample.getCategorical().forEach((feature, category) ->
                counts.computeIfAbsent(feature, f -> new LinkedHashMap<>()).merge(category, 1L, Long::sum));
    }

    Window seal(boolean forced) {
        Map<String, NumericSummary> summaries = new LinkedHashMap<>();
        stats.forEach((feature, s) -> summaries.put(feature, NumericSummary.of(s)));
        return new Window(index, start, end, samples, summaries, counts, forced);
    }

    long getIndex() {
        return index;
    }

    Instant getStart() {
        return start;
    }

    int size() {
        return samples.size();
    }
}
