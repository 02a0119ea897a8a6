package com.driftsentinel.core.config;

import java.io.Serializable;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Field names and timestamp format used to read {@code RawRecord}s.
 *
 * @since 1.0.0
 */
public class IngestSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Record field holding the event timestamp. */
    private String timestampField = "timestamp";

    /** Record field holding the source identifier. */
    private String sourceField = "source";

    /** Pattern for textual timestamps that are not ISO-8601, interpreted as UTC. */
    private String timestampPattern = "yyyy-MM-dd HH:mm:ss";

    void validate(List<String> errors) {
        if (timestampField == null || timestampField.isBlank()) {
            errors.add("ingest.timestampField is required");
        }
        if (sourceField == null || sourceField.isBlank()) {
            errors.add("ingest.sourceField is required");
        }
        if (timestampPattern != null && !timestampPattern.isBlank()) {
            try {
                DateTimeFormatter.ofPattern(timestampPattern);
            } catch (IllegalArgumentException e) {
                errors.add("ingest.timestampPattern is invalid: " + e.getMessage());
            }
        }
    }

    public String getTimestampField() {
        return timestampField;
    }

    public void setTimestampField(String timestampField) {
        this.timestampField = timestampField;
    }

    public String getSourceField() {
        return sourceField;
    }

    public void setSourceField(String sourceField) {
        this.sourceField = sourceField;
    }

    public String getTimestampPattern() {
        return timestampPattern;
    }

    public void setTimestampPattern(String timestampPattern) {
        this.timestampPattern = timestampPattern;
    }

    @Override
    public String toString() {
        return "IngestSettings{timestampField='" + timestampField + "', sourceField='" + sourceField
                + "', timestampPattern='" + timestampPattern + "'}";
    }
}
