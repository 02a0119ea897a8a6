package com.driftsentinel.core.comparison;

import java.io.Serializable;
import java.util.Objects;

/**
 * Non-alerting outcome recorded when a comparison was skipped.
 *
 * @since 1.0.0
 */
public final class InsufficientData implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Why a comparison did not produce a metric. */
    public enum Reason {
        /** The window has fewer samples than {@code window.minSamples}. */
        INSUFFICIENT_WINDOW,
        /** No reference exists, or it has too few observations for the feature. */
        INSUFFICIENT_REFERENCE,
        /** The reference validity period has ended. */
        REFERENCE_EXPIRED,
        /** Fewer than two categories remain in the contingency table. */
        DEGENERATE_TABLE,
        /** The statistic threw unexpectedly. */
        FEATURE_FAILURE
    }

    private final String feature;
    private final Reason reason;
    private final long windowIndex;
    private final String detail;

    /**
     * @param feature     feature name, or {@code null} when the outcome covers
     *                    the whole window
     * @param reason      why the comparison was skipped
     * @param windowIndex index of the evaluated window
     * @param detail      human-readable explanation
     */
    public InsufficientData(String feature, Reason reason, long windowIndex, String detail) {
        this.feature = feature;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.windowIndex = windowIndex;
        this.detail = detail;
    }

    public String getFeature() {
        return feature;
    }

    public boolean isWindowWide() {
        return feature == null;
    }

    public Reason getReason() {
        return reason;
    }

    public long getWindowIndex() {
        return windowIndex;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "InsufficientData{" +
                "feature=" + (feature == null ? "*" : feature) +
                ", reason=" + reason +
                ", window=" + windowIndex +
                ", detail='" + detail + '\'' +
                '}';
    }
}
