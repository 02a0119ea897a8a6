package com.driftsentinel.core.window;

import java.util.Locale;

/**
 * How bucket boundaries are placed on the time axis.
 *
 * @since 1.0.0
 */
public enum BucketAlignment {

    /**
     * Boundaries are multiples of the bucket size since the UTC epoch, so a
     * one-day bucket starts at UTC midnight. Reproducible across restarts.
     */
    CALENDAR,

    /**
     * Boundaries are offsets from the timestamp of the first accepted sample.
     * Depends on which sample arrives first.
     */
    FIRST_SAMPLE;

    public static BucketAlignment fromConfig(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "calendar" -> CALENDAR;
            case "first_sample" -> FIRST_SAMPLE;
            default -> throw new IllegalArgumentException(
                    "alignment must be 'calendar' or 'first_sample', got: '" + value + "'");
        };
    }
}
