package com.driftsentinel.core.reference;

/**
 * How a {@link ReferenceDistribution} came to be.
 *
 * @since 1.0.0
 */
public enum Provenance {
    BOOTSTRAP,
    MANUAL_SNAPSHOT,
    ROLLING_WINDOWS,
    EXPONENTIAL_DECAY
}
