package com.driftsentinel.core.reference;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned baseline snapshot.
 *
 * @since 1.0.0
 */
public final class ReferenceDistribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long version;
    private final Provenance provenance;
    private final Instant validFrom;
    private final Instant validUntil;
    private final Map<String, FeatureReference> features;

    public ReferenceDistribution(long version, Provenance provenance, Instant validFrom, Instant validUntil,
            Map<String, FeatureReference> features) {
        this.version = version;
        this.provenance = Objects.requireNonNull(provenance, "provenance must not be null");
        this.validFrom = Objects.requireNonNull(validFrom, "validFrom must not be null");
        this.validUntil = validUntil;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public Optional<FeatureReference> feature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    /**
     * @param at event time to check
     * @return {@code true} if a validity end exists and {@code at} is at or
     *         after it
     */
    public boolean isExpiredAt(Instant at) {
        return validUntil != null && !at.isBefore(validUntil);
    }

    public long getVersion() {
        return version;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    /**
     * @return end of validity, empty when the reference never expires
     */
    public Optional<Instant> getValidUntil() {
        return Optional.ofNullable(validUntil);
    }

    public Map<String, FeatureReference> getFeatures() {
        return features;
    }

    @Override
    public String toString() {
        return "ReferenceDistribution{" +
                "version=" + version +
                ", provenance=" + provenance +
                ", validFrom=" + validFrom +
                ", validUntil=" + validUntil +
                ", features=" + features.keySet() +
                '}';
    }
}
