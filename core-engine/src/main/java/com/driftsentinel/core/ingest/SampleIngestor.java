package com.driftsentinel.core.ingest;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.config.IngestSettings;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a {@link RawRecord} and normalises it into a {@link Sample}.
 *
 * <h3>Timestamps</h3>
 * <p>
 * The timestamp field accepts an {@link Instant}, a {@link Date}, epoch
 * milliseconds (as a number or a numeric string), an ISO-8601 instant, an
 * ISO-8601 local date-time, or the configured pattern. Local forms are read
 * as UTC.
 * </p>
 *
 * <h3>Features</h3>
 * <p>
 * Only declared features are read; undeclared fields are ignored. A missing
 * declared feature is allowed. A declared numeric feature that is present
 * but not a finite number rejects the record.
 * </p>
 *
 * <p>
 * Instances hold no mutable state apart from a cached formatter and may be
 * shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleIngestor implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(SampleIngestor.class);

    private final String timestampField;
    private final String sourceField;
    private final String timestampPattern;
    private transient DateTimeFormatter pattern;
    private final List<String> numericFeatures;
    private final List<String> categoricalFeatures;

    public SampleIngestor(DriftConfig config) {
        this(config.getIngest(), config.getNumericFeatures(), config.getCategoricalFeatures());
    }

    public SampleIngestor(IngestSettings settings, List<String> numericFeatures, List<String> categoricalFeatures) {
        Objects.requireNonNull(settings, "IngestSettings must not be null");
        this.timestampField = settings.getTimestampField();
        this.sourceField = settings.getSourceField();
        String configured = settings.getTimestampPattern();
        this.timestampPattern = configured != null && !configured.isBlank() ? configured : null;
        this.pattern = timestampPattern != null ? DateTimeFormatter.ofPattern(timestampPattern) : null;
        this.numericFeatures = List.copyOf(numericFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    /**
     * @param record the raw record; must not be {@code null}
     * @return the normalised sample
     * @throws ValidationException if the timestamp is missing or unparseable,
     *                             or a numeric feature is not a finite number
     */
    public Sample ingest(RawRecord record) throws ValidationException {
        Objects.requireNonNull(record, "RawRecord must not be null");

        Object rawTimestamp = record.getField(timestampField)
                .orElseThrow(() -> new ValidationException("Missing timestamp field '" + timestampField + "'"));

        Sample.Builder builder = Sample.builder().timestamp(parseTimestamp(rawTimestamp));

        record.getField(sourceField).map(Object::toString).ifPresent(builder::sourceId);

        for (String feature : numericFeatures) {
            Optional<Object> value = record.getField(feature);
            if (value.isPresent()) {
                builder.numeric(feature, toFiniteDouble(feature, value.get()));
            }
        }
        for (String feature : categoricalFeatures) {
            record.getField(feature)
                    .map(Object::toString)
                    .ifPresent(v -> builder.categorical(feature, v));
        }

        Sample sample = builder.build();
        LOG.trace("Ingested sample at {} from {}", sample.getTimestamp(), sample.getSourceId());
        return sample;
    }

    // ---------------------------------------------------------------
    // Parsing helpers
    // ---------------------------------------------------------------

    Instant parseTimestamp(Object raw) throws ValidationException {
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw new ValidationException("Empty timestamp in field '" + timestampField + "'");
        }
        if (isInteger(text)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new ValidationException("Epoch timestamp out of range: " + text, e);
            }
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // not an ISO instant, try the local forms next
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not ISO local, try the configured pattern
        }
        if (timestampPattern == null) {
            throw new ValidationException("Unparseable timestamp '" + text + "'");
        }
        if (pattern == null) {
            // formatters do not serialize
            pattern = DateTimeFormatter.ofPattern(timestampPattern);
        }
        try {
            return LocalDateTime.parse(text, pattern).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new ValidationException("Unparseable timestamp '" + text + "'", e);
        }
    }

    private static double toFiniteDouble(String feature, Object raw) throws ValidationException {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Numeric feature '" + feature + "' is not a number: '" + raw + "'", e);
            }
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("Numeric feature '" + feature + "' is not finite: " + value);
        }
        return value;
    }

    private static boolean isInteger(String text) {
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
