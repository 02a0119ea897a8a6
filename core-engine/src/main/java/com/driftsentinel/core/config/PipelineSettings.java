package com.driftsentinel.core.config;

import com.driftsentinel.core.engine.BackpressureStrategy;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Queue sizes and backpressure behaviour of the concurrent pipeline.
 *
 * @since 1.0.0
 */
public class PipelineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int windowQueueCapacity = 64;

    private int alertQueueCapacity = 256;

    /** {@code block} (wait, then shed) or {@code shed}. */
    private String backpressure = "block";

    private long offerTimeoutMillis = 1_000;

    /** Seal still-open buckets when the pipeline is closed. */
    private boolean flushOnShutdown = true;

    private long shutdownTimeoutSeconds = 30;

    void validate(List<String> errors) {
        if (windowQueueCapacity < 1) {
            errors.add("pipeline.windowQueueCapacity must be >= 1, got: " + windowQueueCapacity);
        }
        if (alertQueueCapacity < 1) {
            errors.add("pipeline.alertQueueCapacity must be >= 1, got: " + alertQueueCapacity);
        }
        if (offerTimeoutMillis < 0) {
            errors.add("pipeline.offerTimeoutMillis must be >= 0, got: " + offerTimeoutMillis);
        }
        if (shutdownTimeoutSeconds < 1) {
            errors.add("pipeline.shutdownTimeoutSeconds must be >= 1, got: " + shutdownTimeoutSeconds);
        }
        try {
            BackpressureStrategy.fromConfig(backpressure);
        } catch (IllegalArgumentException e) {
            errors.add("pipeline." + e.getMessage());
        }
    }

    public int getWindowQueueCapacity() {
        return windowQueueCapacity;
    }

    public void setWindowQueueCapacity(int windowQueueCapacity) {
        this.windowQueueCapacity = windowQueueCapacity;
    }

    public int getAlertQueueCapacity() {
        return alertQueueCapacity;
    }

    public void setAlertQueueCapacity(int alertQueueCapacity) {
        this.alertQueueCapacity = alertQueueCapacity;
    }

    public String getBackpressure() {
        return backpressure;
    }

    public void setBackpressure(String backpressure) {
        this.backpressure = backpressure != null ? backpressure.toLowerCase(Locale.ROOT) : null;
    }

    public long getOfferTimeoutMillis() {
        return offerTimeoutMillis;
    }

    public void setOfferTimeoutMillis(long offerTimeoutMillis) {
        this.offerTimeoutMillis = offerTimeoutMillis;
    }

    public boolean isFlushOnShutdown() {
        return flushOnShutdown;
    }

    public void setFlushOnShutdown(boolean flushOnShutdown) {
        this.flushOnShutdown = flushOnShutdown;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "PipelineSettings{windowQueueCapacity=" + windowQueueCapacity + ", alertQueueCapacity="
                + alertQueueCapacity + ", backpressure='" + backpressure + "', offerTimeoutMillis="
                + offerTimeoutMillis + ", flushOnShutdown=" + flushOnShutdown + '}';
    }
}
