package com.supplysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One supply-chain telemetry record (temperature, humidity, quantity, cost,
 * lead time, ...).
 *
 * <p>
 * Records arrive as free-form JSON. The upstream feature pipeline decides
 * which numeric fields form the feature vector; this class only stores the
 * raw key-value pairs and projects them onto an ordered field list with
 * {@link #toFeatureVector(List)}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A single instance must
 * only be accessed by one thread at a time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Field holding the optional ground-truth label (+1 / -1). */
    public static final String LABEL_FIELD = "label";

    /** Every key-value pair in the original JSON record. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Ingestion timestamp (set by the deserializer). */
    private Instant ingestionTime;

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable map of field names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Retrieve a numeric field value, coercing common JSON number types.
     *
     * @param fieldName the JSON key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a string field value.
     *
     * @param fieldName the JSON key
     * @return optional containing the string value
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Project this record onto an ordered list of numeric features.
     *
     * @param featureFields field names in column order; must not be {@code null}
     * @return the feature row, or empty if any field is missing or not numeric
     */
    public Optional<double[]> toFeatureVector(List<String> featureFields) {
        Objects.requireNonNull(featureFields, "Feature field list must not be null");
        double[] row = new double[featureFields.size()];
        for (int i = 0; i < row.length; i++) {
            Optional<Double> value = getNumericField(featureFields.get(i));
            if (value.isEmpty() || !Double.isFinite(value.get())) {
                return Optional.empty();
            }
            row[i] = value.get();
        }
        return Optional.of(row);
    }

    /**
     * Ground-truth label carried by training records.
     *
     * @return {@code +1} / {@code -1}, or empty if the record is unlabelled
     * @throws IllegalArgumentException if the label is present but not ±1
     */
    public Optional<Integer> label() {
        return getNumericField(LABEL_FIELD)
                .map(v -> Label.fromValue(v.intValue()).value());
    }

    public Instant getIngestionTime() {
        return ingestionTime;
    }

    public void setIngestionTime(Instant ingestionTime) {
        this.ingestionTime = ingestionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryEvent that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TelemetryEvent" + fields;
    }
}
