package com.driftsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes the job's output records (alerts, drift metrics, change points) as
 * UTF-8 JSON documents for the Kafka sinks. {@link java.time.Instant}s become
 * ISO-8601 strings.
 *
 * <p>
 * One instance is bound to one record type. A record Jackson cannot write is
 * logged with that type and replaced by an empty payload.
 * </p>
 *
 * @param <T> the record type
 */
public class JsonSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonSerializationSchema.class);

    private final Class<T> type;

    private transient ObjectWriter writer;

    public JsonSerializationSchema(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override
    public void open(InitializationContext context) {
        writer = newWriter();
    }

    @Override
    public byte[] serialize(T element) {
        try {
            return writer().writeValueAsBytes(element);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot write {} as JSON; sending an empty payload", type.getSimpleName(), e);
            return new byte[0];
        }
    }

    private ObjectWriter writer() {
        if (writer == null) {
            writer = newWriter();
        }
        return writer;
    }

    private ObjectWriter newWriter() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .writerFor(type);
    }
}
