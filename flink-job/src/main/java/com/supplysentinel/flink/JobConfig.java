package com.supplysentinel.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Supply Sentinel Flink job
 * and the offline trainer.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured entirely through Kubernetes Deployment env vars,
 * Docker {@code -e} flags or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final List<String> DEFAULT_FEATURE_FIELDS = List.of(
            "temperature", "humidity", "quantity", "unitCost", "leadTimeDays");

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Ensemble
    // ---------------------------------------------------------------
    private final String ensembleConfigPath;
    private final String ensembleBundlePath;
    private final int batchSize;

    // ---------------------------------------------------------------
    // Telemetry schema
    // ---------------------------------------------------------------
    private final List<String> featureFields;
    private final String keyField;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.ensembleConfigPath = b.ensembleConfigPath;
        this.ensembleBundlePath = b.ensembleBundlePath;
        this.batchSize = b.batchSize;
        this.featureFields = Collections.unmodifiableList(new ArrayList<>(b.featureFields));
        this.keyField = b.keyField;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "telemetry"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "anomalies"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "supply-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .ensembleConfigPath(env("ENSEMBLE_CONFIG_PATH", ""))
                    .ensembleBundlePath(env("ENSEMBLE_BUNDLE_PATH", ""))
                    .batchSize(parseIntEnv("SCORING_BATCH_SIZE", "100"))
                    .featureFields(parseList(env("FEATURE_FIELDS", String.join(",", DEFAULT_FEATURE_FIELDS))))
                    .keyField(env("KEY_FIELD", "productId"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties}.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the ensemble YAML, or blank to use the loader's default
     *         resolution
     */
    public String getEnsembleConfigPath() {
        return ensembleConfigPath;
    }

    /**
     * @return path of the trained ensemble bundle; blank if unset
     */
    public String getEnsembleBundlePath() {
        return ensembleBundlePath;
    }

    /**
     * @return records per scoring micro-batch
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * @return numeric telemetry fields in feature-column order
     */
    public List<String> getFeatureFields() {
        return featureFields;
    }

    public String getKeyField() {
        return keyField;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, batch size
     * &gt;= 2, port in [1, 65535], non-blank topic names, at least one
     * distinct feature field).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "telemetry";
        private String kafkaAlertTopic = "anomalies";
        private String kafkaGroupId = "supply-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String ensembleConfigPath = "";
        private String ensembleBundlePath = "";
        private int batchSize = 100;
        private List<String> featureFields = DEFAULT_FEATURE_FIELDS;
        private String keyField = "productId";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder ensembleConfigPath(String v) {
            this.ensembleConfigPath = v;
            return this;
        }

        public Builder ensembleBundlePath(String v) {
            this.ensembleBundlePath = v;
            return this;
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder featureFields(List<String> v) {
            this.featureFields = v;
            return this;
        }

        public Builder keyField(String v) {
            this.keyField = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(ensembleConfigPath, "ensembleConfigPath required (may be blank)");
            Objects.requireNonNull(ensembleBundlePath, "ensembleBundlePath required (may be blank)");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(keyField, "keyField");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            // min-max normalization needs at least two rows to mean anything
            if (batchSize < 2) {
                throw new IllegalArgumentException("batchSize must be >= 2, got: " + batchSize);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (featureFields == null || featureFields.isEmpty()) {
                throw new IllegalArgumentException("featureFields must name at least one field");
            }
            for (String field : featureFields) {
                requireNonBlank(field, "feature field");
            }
            if (featureFields.stream().distinct().count() != featureFields.size()) {
                throw new IllegalArgumentException("featureFields contains duplicates: " + featureFields);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", ensembleConfigPath='" + ensembleConfigPath + '\'' +
                ", ensembleBundlePath='" + ensembleBundlePath + '\'' +
                ", batchSize=" + batchSize +
                ", featureFields=" + featureFields +
                ", keyField='" + keyField + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
