package com.driftsentinel.flink;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonSerializationSchema}.
 */
class JsonSerializationSchemaTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Alerts should serialize with ISO timestamps and the triggering change point")
    void shouldSerializeAlert() throws IOException {
        Instant at = Instant.parse("2024-03-01T12:05:00Z");
        ChangePoint cp = new ChangePoint("feature1.mean", 12, Instant.parse("2024-03-01T11:00:00Z"),
                0.0, 4.0, 2.5, 10.0, "l2");
        Alert alert = Alert.builder()
                .severity(Severity.CRITICAL)
                .feature("feature1.mean")
                .kind(MetricKind.CHANGE_POINT)
                .value(2.5)
                .bound(2.0)
                .timestamp(at)
                .windowIndex(12)
                .details("Change point in 'feature1.mean'")
                .changePoint(cp)
                .build();

        JsonNode json = reader.readTree(new JsonSerializationSchema<>(Alert.class).serialize(alert));

        assertThat(json.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(json.get("kind").asText()).isEqualTo("CHANGE_POINT");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T12:05:00Z");
        assertThat(json.get("changePoint").get("meanAfter").asDouble()).isEqualTo(4.0);
    }
}
