package com.driftsentinel.flink;

import com.driftsentinel.core.model.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RawRecordDeserializationSchema}.
 */
class RawRecordDeserializationSchemaTest {

    private final RawRecordDeserializationSchema schema = new RawRecordDeserializationSchema();

    @Test
    @DisplayName("Should keep every JSON property with its type")
    void shouldDeserializeObject() throws IOException {
        RawRecord record = schema.deserialize(bytes(
                "{\"timestamp\":\"2024-03-01 12:00:00\",\"source\":\"model-a\",\"feature1\":1.5,"
                        + "\"feature3\":\"red\",\"count\":7}"));

        assertThat(record).isNotNull();
        assertThat(record.getField("timestamp")).contains("2024-03-01 12:00:00");
        assertThat(record.getField("feature1")).contains(1.5);
        assertThat(record.getField("feature3")).contains("red");
        assertThat(record.getField("count")).contains(7);
    }

    @Test
    @DisplayName("Should drop malformed or non-object messages")
    void shouldDropMalformed() throws IOException {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(bytes("[1, 2, 3]"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.getSkippedCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Stream should never end")
    void shouldBeUnbounded() {
        assertThat(schema.isEndOfStream(new RawRecord())).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(RawRecord.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
