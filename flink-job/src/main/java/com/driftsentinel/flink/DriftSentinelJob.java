package com.driftsentinel.flink;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.config.DriftConfigLoader;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Sample;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the Drift Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (input topic)
 *     → Deserialize JSON → RawRecord
 *     → SampleParser (validate, drop malformed) → Sample
 *     → Event-time watermarks (window grace period)
 *     → Key by source id
 *     → DriftProcessFunction (one engine per key)
 *     → Alerts → JSON → Kafka (alerts topic)
 *     → Drift metrics / change points → JSON → Kafka (metrics topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Transport settings come from environment variables via {@link JobConfig};
 * drift semantics from the YAML file resolved by {@link DriftConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Checkpoints cover Kafka offsets and the per-key drift engines held in
 * keyed state, so a restored job keeps its references, open buckets and
 * alert cooldowns.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(DriftSentinelJob.class);

        /** Key for samples that carry no source id. */
        static final String UNKNOWN_SOURCE = "__unknown__";

        private DriftSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Drift Sentinel with config: {}", config);

                // 2. Load and validate drift configuration
                DriftConfig driftConfig = loadDriftConfig(config);
                LOG.info("Tracking {} feature(s) with {} threshold(s)", driftConfig.tracked().size(),
                                driftConfig.getThresholds().size());

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, driftConfig);

                // 5. Execute
                env.execute("Drift Sentinel - Distribution Drift Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        DriftConfig driftConfig) {
                // Kafka source
                KafkaSource<RawRecord> kafkaSource = KafkaSource.<RawRecord>builder()
                                .setProperties(config.consumerProperties())
                                .setBootstrapServers(config.getBootstrapServers())
                                .setTopics(config.getInputTopic())
                                .setGroupId(config.getGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new RawRecordDeserializationSchema())
                                .build();

                DataStream<RawRecord> records = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-records-source");

                // Validate, then assign event time from the parsed sample
                Duration grace = driftConfig.getWindow().gracePeriod();
                DataStream<Sample> samples = records
                                .filter(Objects::nonNull) // drop deserialization failures
                                .flatMap(new SampleParser(driftConfig))
                                .name("sample-parser")
                                .assignTimestampsAndWatermarks(
                                                WatermarkStrategy.<Sample>forBoundedOutOfOrderness(grace)
                                                                .withTimestampAssigner((sample, ts) -> sample
                                                                                .getTimestamp().toEpochMilli())
                                                                .withIdleness(Duration.ofMillis(
                                                                                config.getIdleSourceTimeoutMs())));

                // Key by source & detect drift
                SingleOutputStreamOperator<Alert> alerts = samples
                                .keyBy(sample -> sourceKey(sample))
                                .process(new DriftProcessFunction(driftConfig))
                                .name("drift-detection");

                alerts.sinkTo(kafkaSink(config, config.getAlertTopic(), new JsonSerializationSchema<>(Alert.class)))
                                .name("kafka-alerts-sink");
                alerts.getSideOutput(DriftProcessFunction.METRICS)
                                .sinkTo(kafkaSink(config, config.getMetricsTopic(),
                                                new JsonSerializationSchema<>(DriftMetric.class)))
                                .name("kafka-metrics-sink");
                alerts.getSideOutput(DriftProcessFunction.CHANGE_POINTS)
                                .sinkTo(kafkaSink(config, config.getMetricsTopic(),
                                                new JsonSerializationSchema<>(ChangePoint.class)))
                                .name("kafka-change-points-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static String sourceKey(Sample sample) {
                String source = sample.getSourceId();
                return source != null && !source.isBlank() ? source : UNKNOWN_SOURCE;
        }

        private static <T> KafkaSink<T> kafkaSink(JobConfig config, String topic,
                        JsonSerializationSchema<T> serializer) {
                return KafkaSink.<T>builder()
                                .setKafkaProducerConfig(config.producerProperties())
                                .setBootstrapServers(config.getBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(serializer)
                                                                .build())
                                .build();
        }

        static DriftConfig loadDriftConfig(JobConfig config) {
                if (config.hasDriftConfigPath()) {
                        return DriftConfigLoader.fromFile(config.getDriftConfigPath());
                }
                return DriftConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so offsets can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
