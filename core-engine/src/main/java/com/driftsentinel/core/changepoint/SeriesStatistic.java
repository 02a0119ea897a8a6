package com.driftsentinel.core.changepoint;

import java.util.Locale;

/**
 * Per-window scalar that feeds change-point detection.
 *
 * @since 1.0.0
 */
public enum SeriesStatistic {

    /** Mean of a numeric feature. */
    MEAN,

    /** Number of samples in the window. */
    SAMPLE_COUNT,

    /** Fraction of samples whose categorical feature equals a given category. */
    CATEGORY_RATE;

    public static SeriesStatistic fromConfig(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (SeriesStatistic s : values()) {
                if (s.name().equals(normalized)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException(
                "statistic must be one of mean, sample_count, category_rate, got: '" + value + "'");
    }
}
