package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Free-form record as delivered by the transport layer.
 *
 * <p>
 * Records arrive as flat JSON objects. Every property is kept in a
 * {@link Map} so the ingestor can look up the timestamp, the source id and the
 * declared features without a rigid schema. Validation and type coercion
 * happen in {@link com.driftsentinel.core.ingest.SampleIngestor}; this class
 * performs none.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A record is built by one
 * thread and handed off to the ingestor.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public RawRecord() {
    }

    /**
     * Create a record holding a copy of the given fields.
     *
     * @param fields initial fields; must not be {@code null}
     */
    public RawRecord(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        fields.forEach(this::setField);
    }

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     * @return this record
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public RawRecord setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
        return this;
    }

    /**
     * @return unmodifiable view of all fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * @param fieldName the JSON key
     * @return the raw value, or empty if absent or JSON {@code null}
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.get(fieldName) != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
