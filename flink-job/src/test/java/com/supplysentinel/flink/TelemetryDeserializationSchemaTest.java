package com.supplysentinel.flink;

import com.supplysentinel.core.model.TelemetryEvent;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TelemetryDeserializationSchema}.
 */
class TelemetryDeserializationSchemaTest {

    private static final long KAFKA_TIME = Instant.parse("2024-05-01T10:15:30Z").toEpochMilli();

    private final TelemetryDeserializationSchema schema = new TelemetryDeserializationSchema("productId");

    @Test
    @DisplayName("Should read every JSON property and take the ingestion time from Kafka")
    void shouldDeserializeRecord() {
        List<TelemetryEvent> out = deserialize(record(null,
                "{\"productId\":\"SKU-7\",\"temperature\":5.5,\"quantity\":12}", KAFKA_TIME));

        assertThat(out).hasSize(1);
        TelemetryEvent event = out.get(0);
        assertThat(event.getStringField("productId")).contains("SKU-7");
        assertThat(event.toFeatureVector(List.of("temperature", "quantity")))
                .hasValueSatisfying(row -> assertThat(row).containsExactly(5.5, 12.0));
        assertThat(event.getIngestionTime()).isEqualTo(Instant.ofEpochMilli(KAFKA_TIME));
    }

    @Test
    @DisplayName("Should fall back to the wall clock when the record has no timestamp")
    void shouldStampWallClockWithoutKafkaTimestamp() {
        Instant before = Instant.now();

        List<TelemetryEvent> out = deserialize(record(null, "{\"productId\":\"SKU-7\"}", -1L));

        assertThat(out).singleElement()
                .satisfies(event -> assertThat(event.getIngestionTime()).isAfterOrEqualTo(before));
    }

    @Test
    @DisplayName("Should take the key field from the message key only when the payload lacks it")
    void shouldFillKeyFromMessageKey() {
        List<TelemetryEvent> keyed = deserialize(record("SKU-9", "{\"temperature\":3.0}", KAFKA_TIME));
        List<TelemetryEvent> explicit = deserialize(record("SKU-9", "{\"productId\":\"SKU-1\"}", KAFKA_TIME));

        assertThat(keyed.get(0).getStringField("productId")).contains("SKU-9");
        assertThat(explicit.get(0).getStringField("productId")).contains("SKU-1");
    }

    @Test
    @DisplayName("Should drop malformed and empty messages without emitting")
    void shouldDropMalformedMessages() {
        assertThat(deserialize(record(null, "{not json", KAFKA_TIME))).isEmpty();
        assertThat(deserialize(record(null, "[1,2,3]", KAFKA_TIME))).isEmpty();
        assertThat(deserialize(record(null, "", KAFKA_TIME))).isEmpty();
        assertThat(deserialize(new ConsumerRecord<>("telemetry", 0, 0L, null, null))).isEmpty();
    }

    @Test
    @DisplayName("Should produce telemetry events")
    void shouldDescribeProducedType() {
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(TelemetryEvent.class);
    }

    private List<TelemetryEvent> deserialize(ConsumerRecord<byte[], byte[]> record) {
        ListCollector out = new ListCollector();
        schema.deserialize(record, out);
        return out.events;
    }

    private static ConsumerRecord<byte[], byte[]> record(String key, String value, long timestamp) {
        byte[] keyBytes = key == null ? null : key.getBytes(StandardCharsets.UTF_8);
        byte[] valueBytes = value.getBytes(StandardCharsets.UTF_8);
        return new ConsumerRecord<>("telemetry", 0, 42L, timestamp, TimestampType.CREATE_TIME,
                keyBytes == null ? -1 : keyBytes.length, valueBytes.length,
                keyBytes, valueBytes, new RecordHeaders(), Optional.empty());
    }

    private static final class ListCollector implements Collector<TelemetryEvent> {

        private final List<TelemetryEvent> events = new ArrayList<>();

        @Override
        public void collect(TelemetryEvent record) {
            events.add(record);
        }

        @Override
        public void close() {
        }
    }
}
