package com.driftsentinel.core.model;

/**
 * Alert severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    WARNING,
    CRITICAL;

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }
}
