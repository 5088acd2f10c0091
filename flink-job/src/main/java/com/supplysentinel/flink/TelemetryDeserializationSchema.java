package com.supplysentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplysentinel.core.model.TelemetryEvent;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Turns Kafka telemetry records into {@link TelemetryEvent}s.
 *
 * <p>
 * The ingestion time is the Kafka record timestamp, or the wall clock when
 * the record carries none. A record whose JSON lacks the key field inherits
 * the Kafka message key, since producers usually key telemetry by product.
 * Malformed and empty messages are logged and dropped without emitting
 * anything.
 * </p>
 */
public class TelemetryDeserializationSchema implements KafkaRecordDeserializationSchema<TelemetryEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryDeserializationSchema.class);

    private final String keyField;

    private transient ObjectMapper mapper;

    /**
     * @param keyField telemetry field that identifies the record's subject
     */
    public TelemetryDeserializationSchema(String keyField) {
        this.keyField = Objects.requireNonNull(keyField, "keyField must not be null");
    }

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<TelemetryEvent> out) {
        byte[] value = record.value();
        if (value == null || value.length == 0) {
            LOG.debug("Dropping empty record at {}-{}@{}", record.topic(), record.partition(), record.offset());
            return;
        }
        TelemetryEvent event;
        try {
            event = objectMapper().readValue(value, TelemetryEvent.class);
        } catch (IOException e) {
            LOG.warn("Dropping malformed telemetry record at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return;
        }
        if (event.getStringField(keyField).isEmpty() && record.key() != null) {
            event.setField(keyField, new String(record.key(), StandardCharsets.UTF_8));
        }
        event.setIngestionTime(record.timestamp() >= 0
                ? Instant.ofEpochMilli(record.timestamp())
                : Instant.now());
        out.collect(event);
    }

    @Override
    public TypeInformation<TelemetryEvent> getProducedType() {
        return TypeInformation.of(TelemetryEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = TelemetryJson.newMapper();
        }
        return mapper;
    }
}
