package com.driftsentinel.core.reference;

import java.util.Locale;

/**
 * How the baseline evolves after it has been established.
 *
 * @since 1.0.0
 */
public enum ReferencePolicy {

    /** Baseline changes only through an explicit snapshot. */
    MANUAL,

    /** Baseline is rebuilt from a ring buffer of the last N sealed windows. */
    ROLLING_WINDOWS,

    /** Baseline weights decay geometrically and each sealed window is added. */
    EXPONENTIAL_DECAY;

    public static ReferencePolicy fromConfig(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (ReferencePolicy policy : values()) {
                if (policy.name().equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException(
                "policy must be one of manual, rolling_windows, exponential_decay, got: '" + value + "'");
    }
}
