package com.driftsentinel.flink;

import com.driftsentinel.core.model.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Reads one Kafka message as a JSON object and wraps its properties in a
 * {@link RawRecord}.
 *
 * <p>
 * Property values keep their JSON types: numbers stay numbers and timestamps
 * stay text until {@link com.driftsentinel.core.ingest.SampleIngestor}
 * parses them. Validation against the configured features happens there, not
 * here.
 * </p>
 *
 * <p>
 * An empty message, invalid JSON, or a JSON value other than an object yields
 * {@code null}, which the Kafka source skips. Skips are counted per subtask.
 * </p>
 */
public class RawRecordDeserializationSchema implements DeserializationSchema<RawRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RawRecordDeserializationSchema.class);

    private transient ObjectReader reader;
    private transient long skipped;

    @Override
    public void open(InitializationContext context) {
        reader = newReader();
    }

    @Override
    public RawRecord deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return skip("empty message");
        }
        try {
            JsonNode tree = reader().readTree(message);
            if (tree == null || !tree.isObject()) {
                return skip("expected a JSON object, got " + (tree == null ? "nothing" : tree.getNodeType()));
            }
            return reader().treeToValue(tree, RawRecord.class);
        } catch (JsonProcessingException e) {
            return skip(e.getOriginalMessage());
        }
    }

    @Override
    public boolean isEndOfStream(RawRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<RawRecord> getProducedType() {
        return TypeInformation.of(RawRecord.class);
    }

    /** Messages skipped by this instance since it was created or restored. */
    public long getSkippedCount() {
        return skipped;
    }

    private RawRecord skip(String reason) {
        skipped++;
        LOG.warn("Skipping unreadable message ({} so far): {}", skipped, reason);
        return null;
    }

    private ObjectReader reader() {
        // deserialize may be called without open() in unit tests
        if (reader == null) {
            reader = newReader();
        }
        return reader;
    }

    private static ObjectReader newReader() {
        return new ObjectMapper().readerFor(RawRecord.class);
    }
}
