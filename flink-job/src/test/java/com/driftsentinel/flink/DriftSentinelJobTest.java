package com.driftsentinel.flink;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the helpers of {@link DriftSentinelJob}.
 */
class DriftSentinelJobTest {

    @Test
    @DisplayName("Samples without a source id should share the fallback key")
    void shouldKeyBySource() {
        Sample withSource = Sample.builder().timestamp(Instant.EPOCH).sourceId("model-a").build();
        Sample withoutSource = Sample.builder().timestamp(Instant.EPOCH).build();

        assertThat(DriftSentinelJob.sourceKey(withSource)).isEqualTo("model-a");
        assertThat(DriftSentinelJob.sourceKey(withoutSource)).isEqualTo(DriftSentinelJob.UNKNOWN_SOURCE);
    }

    @Test
    @DisplayName("An explicit drift config path should be loaded and validated")
    void shouldLoadDriftConfigFromPath() throws Exception {
        String path = Path.of(getClass().getClassLoader().getResource("job-drift.yml").toURI()).toString();

        DriftConfig config = DriftSentinelJob.loadDriftConfig(JobConfig.builder().driftConfigPath(path).build());

        assertThat(config.getNumericFeatures()).containsExactly("latency");
        assertThat(config.getWindow().getBucketSeconds()).isEqualTo(120);
    }
}
