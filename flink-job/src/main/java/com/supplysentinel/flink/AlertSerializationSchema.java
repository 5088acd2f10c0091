package com.supplysentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplysentinel.core.model.AnomalyAlert;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes {@link AnomalyAlert}s to the alerts topic as JSON.
 *
 * <p>
 * The record key is the alert key, so every alert for one product lands on
 * the same partition in order, and the record timestamp is the alert's
 * timestamp. An alert that cannot be serialized is logged and published
 * with an empty value.
 * </p>
 */
public class AlertSerializationSchema implements KafkaRecordSerializationSchema<AnomalyAlert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertSerializationSchema.class);

    private final String topic;

    private transient ObjectMapper mapper;

    /**
     * @param topic Kafka topic the alerts go to
     */
    public AlertSerializationSchema(String topic) {
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    @Override
    public ProducerRecord<byte[], byte[]> serialize(AnomalyAlert alert, KafkaSinkContext context, Long timestamp) {
        byte[] key = alert.getKey() != null ? alert.getKey().getBytes(StandardCharsets.UTF_8) : null;
        Long alertTime = alert.getTimestamp() != null ? alert.getTimestamp().toEpochMilli() : timestamp;
        return new ProducerRecord<>(topic, null, alertTime, key, toJson(alert));
    }

    byte[] toJson(AnomalyAlert alert) {
        try {
            return objectMapper().writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert for key {}: {}", alert.getKey(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = TelemetryJson.newMapper();
        }
        return mapper;
    }
}
