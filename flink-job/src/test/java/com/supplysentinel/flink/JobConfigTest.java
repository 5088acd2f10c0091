package com.supplysentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("telemetry");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("anomalies");
        assertThat(config.getBatchSize()).isEqualTo(100);
        assertThat(config.getFeatureFields()).isEqualTo(JobConfig.DEFAULT_FEATURE_FIELDS);
        assertThat(config.getKeyField()).isEqualTo("productId");
        assertThat(config.getEnsembleBundlePath()).isEmpty();
    }

    @Test
    @DisplayName("Should derive Kafka client properties")
    void shouldBuildKafkaProperties() {
        JobConfig config = new JobConfig.Builder()
                .kafkaBootstrapServers("kafka:29092")
                .kafkaGroupId("scoring")
                .build();

        Properties consumer = config.kafkaConsumerProperties();
        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
        assertThat(consumer.getProperty("group.id")).isEqualTo("scoring");
        assertThat(config.kafkaProducerProperties().getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
    }

    @Test
    @DisplayName("Should reject a batch too small to normalise")
    void shouldRejectTinyBatch() {
        assertThatThrownBy(() -> new JobConfig.Builder().batchSize(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }

    @Test
    @DisplayName("Should reject out-of-range numbers and blank names")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
    }

    @Test
    @DisplayName("Should reject empty and duplicated feature fields")
    void shouldRejectBadFeatureFields() {
        assertThatThrownBy(() -> new JobConfig.Builder().featureFields(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().featureFields(List.of("a", "a")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicates");
    }

    @Test
    @DisplayName("Should split a comma-separated field list")
    void shouldParseList() {
        assertThat(JobConfig.parseList(" temperature, humidity,,quantity "))
                .containsExactly("temperature", "humidity", "quantity");
    }
}
