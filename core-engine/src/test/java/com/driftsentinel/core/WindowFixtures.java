package com.driftsentinel.core;

import com.driftsentinel.core.config.WindowSettings;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import com.driftsentinel.core.window.WindowAggregator;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds sealed windows for tests.
 */
public final class WindowFixtures {

    public static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private WindowFixtures() {
    }

    /**
     * @return {@code n} draws from N(mean, sd) with a fixed seed
     */
    public static double[] normal(long seed, double mean, double sd, int n) {
        return new NormalDistribution(new Well19937c(seed), mean, sd).sample(n);
    }

    /**
     * One-minute window {@code index} whose samples carry numeric feature
     * {@code x} with the given values.
     */
    public static Window numericWindow(long index, double[] values) {
        List<Sample> samples = new ArrayList<>();
        Instant start = T0.plusSeconds(60 * index);
        for (int i = 0; i < values.length; i++) {
            samples.add(Sample.builder().timestamp(start.plusMillis(i)).numeric("x", values[i]).build());
        }
        return seal(samples);
    }

    /**
     * One-minute window {@code index} whose samples carry categorical feature
     * {@code level} with the given counts.
     */
    public static Window categoricalWindow(long index, Map<String, Integer> counts) {
        List<Sample> samples = new ArrayList<>();
        Instant start = T0.plusSeconds(60 * index);
        int i = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            for (int k = 0; k < e.getValue(); k++) {
                samples.add(Sample.builder().timestamp(start.plusMillis(i++)).categorical("level", e.getKey())
                        .build());
            }
        }
        return seal(samples);
    }

    /**
     * Seal the given samples, which must all fall into one one-minute bucket.
     */
    public static Window seal(List<Sample> samples) {
        WindowSettings settings = new WindowSettings();
        settings.setBucketSeconds(60);
        WindowAggregator aggregator = new WindowAggregator(settings);
        samples.forEach(aggregator::ingest);
        List<Window> windows = aggregator.flush();
        if (windows.size() != 1) {
            throw new IllegalArgumentException("Samples span " + windows.size() + " windows");
        }
        return windows.get(0);
    }
}
