package com.driftsentinel.core.config;

import com.driftsentinel.core.reference.ReferencePolicy;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Baseline management settings.
 *
 * <p>
 * {@code policy} is one of {@code manual}, {@code rolling_windows} or
 * {@code exponential_decay}. Under every policy the first
 * {@code bootstrapWindows} sealed windows become the initial baseline when no
 * reference has been snapshotted yet.
 * </p>
 *
 * @since 1.0.0
 */
public class ReferenceSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String policy = "manual";

    /** Windows accumulated into the bootstrap baseline; 0 disables bootstrapping. */
    private int bootstrapWindows = 1;

    /** Ring-buffer size for {@code rolling_windows}. */
    private int rollingWindowCount = 10;

    /** Weight retained by the existing baseline per update under {@code exponential_decay}. */
    private double decayFactor = 0.9;

    /** Minimum observations per feature before a reference may be compared against. */
    private int minSamples = 30;

    /** Cap on retained numeric reference samples per feature. */
    private int maxSamples = 10_000;

    /** Reference lifetime in seconds after its newest window; 0 means no expiry. */
    private long validitySeconds = 0;

    void validate(List<String> errors) {
        try {
            ReferencePolicy.fromConfig(policy);
        } catch (IllegalArgumentException e) {
            errors.add("reference." + e.getMessage());
        }
        if (bootstrapWindows < 0) {
            errors.add("reference.bootstrapWindows must be >= 0, got: " + bootstrapWindows);
        }
        if (rollingWindowCount < 1) {
            errors.add("reference.rollingWindowCount must be >= 1, got: " + rollingWindowCount);
        }
        if (!(decayFactor > 0 && decayFactor < 1)) {
            errors.add("reference.decayFactor must be in (0, 1), got: " + decayFactor);
        }
        if (minSamples < 2) {
            errors.add("reference.minSamples must be >= 2, got: " + minSamples);
        }
        if (maxSamples < minSamples) {
            errors.add("reference.maxSamples must be >= minSamples, got: " + maxSamples);
        }
        if (validitySeconds < 0) {
            errors.add("reference.validitySeconds must be >= 0, got: " + validitySeconds);
        }
    }

    public String getPolicy() {
        return policy;
    }

    public void setPolicy(String policy) {
        this.policy = policy != null ? policy.toLowerCase(Locale.ROOT) : null;
    }

    public int getBootstrapWindows() {
        return bootstrapWindows;
    }

    public void setBootstrapWindows(int bootstrapWindows) {
        this.bootstrapWindows = bootstrapWindows;
    }

    public int getRollingWindowCount() {
        return rollingWindowCount;
    }

    public void setRollingWindowCount(int rollingWindowCount) {
        this.rollingWindowCount = rollingWindowCount;
    }

    public double getDecayFactor() {
        return decayFactor;
    }

    public void setDecayFactor(double decayFactor) {
        this.decayFactor = decayFactor;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    public long getValiditySeconds() {
        return validitySeconds;
    }

    public void setValiditySeconds(long validitySeconds) {
        this.validitySeconds = validitySeconds;
    }

    @Override
    public String toString() {
        return "ReferenceSettings{policy='" + policy + "', bootstrapWindows=" + bootstrapWindows
                + ", rollingWindowCount=" + rollingWindowCount + ", decayFactor=" + decayFactor
                + ", minSamples=" + minSamples + ", maxSamples=" + maxSamples
                + ", validitySeconds=" + validitySeconds + '}';
    }
}
