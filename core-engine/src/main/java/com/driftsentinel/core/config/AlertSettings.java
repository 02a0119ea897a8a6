package com.driftsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Cooldown and dispatch-retry settings for alerts.
 *
 * @since 1.0.0
 */
public class AlertSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Per-key suppression interval for equal-or-lower severity alerts. */
    private long cooldownSeconds = 300;

    /** Total publish attempts per alert, including the first one. */
    private int dispatchMaxAttempts = 3;

    private long dispatchBackoffMillis = 200;

    private double dispatchBackoffMultiplier = 2.0;

    void validate(List<String> errors) {
        if (cooldownSeconds < 0) {
            errors.add("alerts.cooldownSeconds must be >= 0, got: " + cooldownSeconds);
        }
        if (dispatchMaxAttempts < 1) {
            errors.add("alerts.dispatchMaxAttempts must be >= 1, got: " + dispatchMaxAttempts);
        }
        if (dispatchBackoffMillis < 1) {
            errors.add("alerts.dispatchBackoffMillis must be >= 1, got: " + dispatchBackoffMillis);
        }
        if (dispatchBackoffMultiplier < 1.0) {
            errors.add("alerts.dispatchBackoffMultiplier must be >= 1.0, got: " + dispatchBackoffMultiplier);
        }
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public int getDispatchMaxAttempts() {
        return dispatchMaxAttempts;
    }

    public void setDispatchMaxAttempts(int dispatchMaxAttempts) {
        this.dispatchMaxAttempts = dispatchMaxAttempts;
    }

    public long getDispatchBackoffMillis() {
        return dispatchBackoffMillis;
    }

    public void setDispatchBackoffMillis(long dispatchBackoffMillis) {
        this.dispatchBackoffMillis = dispatchBackoffMillis;
    }

    public double getDispatchBackoffMultiplier() {
        return dispatchBackoffMultiplier;
    }

    public void setDispatchBackoffMultiplier(double dispatchBackoffMultiplier) {
        this.dispatchBackoffMultiplier = dispatchBackoffMultiplier;
    }

    @Override
    public String toString() {
        return "AlertSettings{cooldownSeconds=" + cooldownSeconds + ", dispatchMaxAttempts=" + dispatchMaxAttempts
                + ", dispatchBackoffMillis=" + dispatchBackoffMillis + ", dispatchBackoffMultiplier="
                + dispatchBackoffMultiplier + '}';
    }
}
