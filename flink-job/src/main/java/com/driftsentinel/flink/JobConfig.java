package com.driftsentinel.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Transport settings of the Drift Sentinel Flink job: Kafka endpoints and
 * topics, parallelism, checkpoint cadence and the location of the drift YAML.
 *
 * <p>
 * Each setting has an environment variable (see the {@code ENV_*} constants)
 * and a default suited to a local single-broker setup. Drift semantics
 * (features, windows, thresholds) are not configured here; they live in the
 * file named by {@link #ENV_DRIFT_CONFIG_PATH}.
 * </p>
 *
 * <p>
 * Instances are immutable and serializable so they can be captured by
 * Flink operators.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_BOOTSTRAP_SERVERS = "KAFKA_BOOTSTRAP_SERVERS";
    public static final String ENV_INPUT_TOPIC = "KAFKA_INPUT_TOPIC";
    public static final String ENV_ALERT_TOPIC = "KAFKA_ALERT_TOPIC";
    public static final String ENV_METRICS_TOPIC = "KAFKA_METRICS_TOPIC";
    public static final String ENV_GROUP_ID = "KAFKA_GROUP_ID";
    public static final String ENV_PARALLELISM = "FLINK_PARALLELISM";
    public static final String ENV_CHECKPOINT_INTERVAL_MS = "FLINK_CHECKPOINT_INTERVAL_MS";
    public static final String ENV_IDLE_SOURCE_TIMEOUT_MS = "FLINK_IDLE_SOURCE_TIMEOUT_MS";
    public static final String ENV_DRIFT_CONFIG_PATH = "DRIFT_CONFIG_PATH";

    /** Kafka transactions must outlive the slowest checkpoint. */
    private static final String PRODUCER_TRANSACTION_TIMEOUT_MS = "900000";

    private final String bootstrapServers;
    private final String inputTopic;
    private final String alertTopic;
    private final String metricsTopic;
    private final String groupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long idleSourceTimeoutMs;
    private final String driftConfigPath;

    private JobConfig(Builder builder) {
        this.bootstrapServers = builder.bootstrapServers;
        this.inputTopic = builder.inputTopic;
        this.alertTopic = builder.alertTopic;
        this.metricsTopic = builder.metricsTopic;
        this.groupId = builder.groupId;
        this.parallelism = builder.parallelism;
        this.checkpointIntervalMs = builder.checkpointIntervalMs;
        this.idleSourceTimeoutMs = builder.idleSourceTimeoutMs;
        this.driftConfigPath = builder.driftConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the configuration from the process environment.
     *
     * @throws IllegalStateException    if a numeric variable is not a number
     * @throws IllegalArgumentException if a value fails validation
     */
    public static JobConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /**
     * Resolve the configuration from a variable map. Blank values count as
     * unset.
     *
     * @param variables environment-style variables; must not be {@code null}
     * @return validated configuration
     * @throws IllegalStateException    if a numeric variable is not a number
     * @throws IllegalArgumentException if a value fails validation
     */
    public static JobConfig fromVariables(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        Builder builder = builder();
        lookup(variables, ENV_BOOTSTRAP_SERVERS).ifPresent(builder::bootstrapServers);
        lookup(variables, ENV_INPUT_TOPIC).ifPresent(builder::inputTopic);
        lookup(variables, ENV_ALERT_TOPIC).ifPresent(builder::alertTopic);
        lookup(variables, ENV_METRICS_TOPIC).ifPresent(builder::metricsTopic);
        lookup(variables, ENV_GROUP_ID).ifPresent(builder::groupId);
        lookup(variables, ENV_DRIFT_CONFIG_PATH).ifPresent(builder::driftConfigPath);
        lookup(variables, ENV_PARALLELISM)
                .ifPresent(v -> builder.parallelism((int) number(ENV_PARALLELISM, v)));
        lookup(variables, ENV_CHECKPOINT_INTERVAL_MS)
                .ifPresent(v -> builder.checkpointIntervalMs(number(ENV_CHECKPOINT_INTERVAL_MS, v)));
        lookup(variables, ENV_IDLE_SOURCE_TIMEOUT_MS)
                .ifPresent(v -> builder.idleSourceTimeoutMs(number(ENV_IDLE_SOURCE_TIMEOUT_MS, v)));
        return builder.build();
    }

    /**
     * Properties handed to the Kafka source. The group id and offset reset
     * policy are set here so they also apply to the admin client the source
     * creates.
     */
    public Properties consumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", bootstrapServers);
        props.setProperty("group.id", groupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    public Properties producerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", bootstrapServers);
        props.setProperty("transaction.timeout.ms", PRODUCER_TRANSACTION_TIMEOUT_MS);
        return props;
    }

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public String getInputTopic() {
        return inputTopic;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    /** Topic that receives drift metrics and change points. */
    public String getMetricsTopic() {
        return metricsTopic;
    }

    public String getGroupId() {
        return groupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getIdleSourceTimeoutMs() {
        return idleSourceTimeoutMs;
    }

    /**
     * @return path of the drift YAML file; blank means the classpath default
     */
    public String getDriftConfigPath() {
        return driftConfigPath;
    }

    public boolean hasDriftConfigPath() {
        return !driftConfigPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@link #build()} rejects blank endpoints and topics,
     * parallelism below one and non-positive intervals.
     */
    public static final class Builder {
        private String bootstrapServers = "localhost:9092";
        private String inputTopic = "feature-stream";
        private String alertTopic = "drift-alerts";
        private String metricsTopic = "drift-metrics";
        private String groupId = "drift-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long idleSourceTimeoutMs = 60_000;
        private String driftConfigPath = "";

        private Builder() {
        }

        public Builder bootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
            return this;
        }

        public Builder inputTopic(String inputTopic) {
            this.inputTopic = inputTopic;
            return this;
        }

        public Builder alertTopic(String alertTopic) {
            this.alertTopic = alertTopic;
            return this;
        }

        public Builder metricsTopic(String metricsTopic) {
            this.metricsTopic = metricsTopic;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointIntervalMs(long checkpointIntervalMs) {
            this.checkpointIntervalMs = checkpointIntervalMs;
            return this;
        }

        public Builder idleSourceTimeoutMs(long idleSourceTimeoutMs) {
            this.idleSourceTimeoutMs = idleSourceTimeoutMs;
            return this;
        }

        public Builder driftConfigPath(String driftConfigPath) {
            this.driftConfigPath = driftConfigPath == null ? "" : driftConfigPath;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public JobConfig build() {
            requireText(bootstrapServers, "bootstrapServers");
            requireText(inputTopic, "inputTopic");
            requireText(alertTopic, "alertTopic");
            requireText(metricsTopic, "metricsTopic");
            requireText(groupId, "groupId");
            requirePositive(parallelism, "parallelism");
            requirePositive(checkpointIntervalMs, "checkpointIntervalMs");
            requirePositive(idleSourceTimeoutMs, "idleSourceTimeoutMs");
            return new JobConfig(this);
        }

        private static void requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
        }

        private static void requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Optional<String> lookup(Map<String, String> variables, String name) {
        String value = variables.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static long number(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(name + " is not a number: '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "JobConfig{bootstrapServers='" + bootstrapServers
                + "', topics=[" + inputTopic + " -> " + alertTopic + ", " + metricsTopic
                + "], groupId='" + groupId
                + "', parallelism=" + parallelism
                + ", checkpointIntervalMs=" + checkpointIntervalMs
                + ", idleSourceTimeoutMs=" + idleSourceTimeoutMs
                + ", driftConfigPath='" + driftConfigPath + "'}";
    }
}
