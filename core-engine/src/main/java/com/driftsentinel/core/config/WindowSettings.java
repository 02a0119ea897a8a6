package com.driftsentinel.core.config;

import com.driftsentinel.core.window.BucketAlignment;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Time-bucketing settings for the window aggregator.
 *
 * @since 1.0.0
 */
public class WindowSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Bucket length in seconds. */
    private long bucketSeconds = 60;

    /** {@code calendar} (UTC epoch aligned) or {@code first_sample}. */
    private String alignment = "calendar";

    /** How long a bucket stays open after the watermark passes its end. */
    private long gracePeriodSeconds = 0;

    /** Upper bound on simultaneously open buckets. */
    private int maxOpenWindows = 16;

    /** Minimum samples a window needs before it is compared. */
    private int minSamples = 30;

    void validate(List<String> errors) {
        if (bucketSeconds <= 0) {
            errors.add("window.bucketSeconds must be > 0, got: " + bucketSeconds);
        }
        if (gracePeriodSeconds < 0) {
            errors.add("window.gracePeriodSeconds must be >= 0, got: " + gracePeriodSeconds);
        }
        if (maxOpenWindows < 1) {
            errors.add("window.maxOpenWindows must be >= 1, got: " + maxOpenWindows);
        }
        if (minSamples < 1) {
            errors.add("window.minSamples must be >= 1, got: " + minSamples);
        }
        try {
            BucketAlignment.fromConfig(alignment);
        } catch (IllegalArgumentException e) {
            errors.add("window." + e.getMessage());
        }
    }

    public Duration bucketDuration() {
        return Duration.ofSeconds(bucketSeconds);
    }

    public Duration gracePeriod() {
        return Duration.ofSeconds(gracePeriodSeconds);
    }

    public long getBucketSeconds() {
        return bucketSeconds;
    }

    public void setBucketSeconds(long bucketSeconds) {
        this.bucketSeconds = bucketSeconds;
    }

    public String getAlignment() {
        return alignment;
    }

    public void setAlignment(String alignment) {
        this.alignment = alignment != null ? alignment.toLowerCase(Locale.ROOT) : null;
    }

    public long getGracePeriodSeconds() {
        return gracePeriodSeconds;
    }

    public void setGracePeriodSeconds(long gracePeriodSeconds) {
        this.gracePeriodSeconds = gracePeriodSeconds;
    }

    public int getMaxOpenWindows() {
        return maxOpenWindows;
    }

    public void setMaxOpenWindows(int maxOpenWindows) {
        this.maxOpenWindows = maxOpenWindows;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    @Override
    public String toString() {
        return "WindowSettings{bucketSeconds=" + bucketSeconds + ", alignment='" + alignment
                + "', gracePeriodSeconds=" + gracePeriodSeconds + ", maxOpenWindows=" + maxOpenWindows
                + ", minSamples=" + minSamples + '}';
    }
}
