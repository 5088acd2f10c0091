package com.supplysentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON mapper settings shared by the Kafka schemas and the trainer, so a
 * record reads the same in training and in streaming.
 */
final class TelemetryJson {

    private TelemetryJson() {
        // utility class, not instantiable
    }

    /**
     * @return a new mapper that ignores unknown properties and writes
     *         timestamps as ISO-8601 strings
     */
    static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }
}
