package com.driftsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One validated observation: numeric features, categorical features, an event
 * timestamp and the id of the source that produced it.
 *
 * <p>
 * Instances are immutable. They are created by the ingestor and only ever
 * read afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String sourceId;
    private final Map<String, Double> numeric;
    private final Map<String, String> categorical;

    private Sample(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.sourceId = builder.sourceId;
        this.numeric = Collections.unmodifiableMap(new LinkedHashMap<>(builder.numeric));
        this.categorical = Collections.unmodifiableMap(new LinkedHashMap<>(builder.categorical));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return source identifier, or {@code null} if the record carried none
     */
    public String getSourceId() {
        return sourceId;
    }

    public Map<String, Double> getNumeric() {
        return numeric;
    }

    public Map<String, String> getCategorical() {
        return categorical;
    }

    public OptionalDouble numericValue(String feature) {
        Double value = numeric.get(feature);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public String categoryOf(String feature) {
        return categorical.get(feature);
    }

    /**
     * Fluent builder for {@link Sample}. {@code timestamp} is required.
     */
    public static class Builder {
        private Instant timestamp;
        private String sourceId;
        private final Map<String, Double> numeric = new LinkedHashMap<>();
        private final Map<String, String> categorical = new LinkedHashMap<>();

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder numeric(String feature, double value) {
            numeric.put(Objects.requireNonNull(feature, "feature"), value);
            return this;
        }

        public Builder categorical(String feature, String category) {
            categorical.put(Objects.requireNonNull(feature, "feature"),
                    Objects.requireNonNull(category, "category"));
            return this;
        }

        public Sample build() {
            return new Sample(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return timestamp.equals(that.timestamp)
                && Objects.equals(sourceId, that.sourceId)
                && numeric.equals(that.numeric)
                && categorical.equals(that.categorical);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, sourceId, numeric, categorical);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "timestamp=" + timestamp +
                ", sourceId='" + sourceId + '\'' +
                ", numeric=" + numeric +
                ", categorical=" + categorical +
                '}';
    }
}
