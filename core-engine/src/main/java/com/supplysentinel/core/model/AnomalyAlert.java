package com.supplysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert emitted when the ensemble flags a telemetry record as anomalous.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic.
 * The {@code decisionScore} follows the ensemble convention: positive means
 * normal, negative means anomalous, range [-1, 1]. It is not comparable to
 * raw per-detector scores.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code key} and {@code timestamp} are required;
 * omitting either throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Severity of an alert. */
    public enum Severity {
        MEDIUM,
        HIGH
    }

    /** Record key (e.g. product id) of the flagged record. */
    private String key;

    private Instant timestamp;

    /** Combined ensemble decision score in [-1, 1]. */
    private double decisionScore;

    /** Pseudo-probability of being normal; a ranking score, not calibrated. */
    private double normalProbability;

    private Severity severity;

    private EnsembleStatus ensembleStatus;

    private int contributingDetectors;

    private int totalDetectors;

    private String details;

    /** Copy of the telemetry record that triggered the alert. */
    private Map<String, Object> originalEvent;

    /** No-arg constructor required by Jackson. */
    public AnomalyAlert() {
    }

    private AnomalyAlert(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.decisionScore = builder.decisionScore;
        this.normalProbability = builder.normalProbability;
        this.severity = builder.severity;
        this.ensembleStatus = builder.ensembleStatus;
        this.contributingDetectors = builder.contributingDetectors;
        this.totalDetectors = builder.totalDetectors;
        this.details = builder.details;
        this.originalEvent = builder.originalEvent != null
                ? new LinkedHashMap<>(builder.originalEvent)
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyAlert} instances.
     */
    public static class Builder {
        private String key;
        private Instant timestamp;
        private double decisionScore;
        private double normalProbability;
        private Severity severity = Severity.MEDIUM;
        private EnsembleStatus ensembleStatus = EnsembleStatus.HEALTHY;
        private int contributingDetectors;
        private int totalDetectors;
        private String details;
        private Map<String, Object> originalEvent;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder decisionScore(double decisionScore) {
            this.decisionScore = decisionScore;
            return this;
        }

        public Builder normalProbability(double normalProbability) {
            this.normalProbability = normalProbability;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder ensembleStatus(EnsembleStatus ensembleStatus) {
            this.ensembleStatus = ensembleStatus;
            return this;
        }

        public Builder contributingDetectors(int contributingDetectors) {
            this.contributingDetectors = contributingDetectors;
            return this;
        }

        public Builder totalDetectors(int totalDetectors) {
            this.totalDetectors = totalDetectors;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder originalEvent(Map<String, Object> originalEvent) {
            this.originalEvent = originalEvent;
            return this;
        }

        /**
         * @return a new {@link AnomalyAlert}
         * @throws NullPointerException if {@code key} or {@code timestamp} is
         *                              {@code null}
         */
        public AnomalyAlert build() {
            return new AnomalyAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getDecisionScore() {
        return decisionScore;
    }

    public void setDecisionScore(double decisionScore) {
        this.decisionScore = decisionScore;
    }

    public double getNormalProbability() {
        return normalProbability;
    }

    public void setNormalProbability(double normalProbability) {
        this.normalProbability = normalProbability;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public EnsembleStatus getEnsembleStatus() {
        return ensembleStatus;
    }

    public void setEnsembleStatus(EnsembleStatus ensembleStatus) {
        this.ensembleStatus = ensembleStatus;
    }

    public int getContributingDetectors() {
        return contributingDetectors;
    }

    public void setContributingDetectors(int contributingDetectors) {
        this.contributingDetectors = contributingDetectors;
    }

    public int getTotalDetectors() {
        return totalDetectors;
    }

    public void setTotalDetectors(int totalDetectors) {
        this.totalDetectors = totalDetectors;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    /**
     * @return unmodifiable view of the original record, or {@code null}
     */
    public Map<String, Object> getOriginalEvent() {
        return originalEvent != null
                ? Collections.unmodifiableMap(originalEvent)
                : null;
    }

    public void setOriginalEvent(Map<String, Object> originalEvent) {
        this.originalEvent = originalEvent != null
                ? new LinkedHashMap<>(originalEvent)
                : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAlert alert))
            return false;
        return Objects.equals(key, alert.key)
                && Objects.equals(timestamp, alert.timestamp)
                && Double.compare(decisionScore, alert.decisionScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, timestamp, decisionScore);
    }

    @Override
    public String toString() {
        return "AnomalyAlert{" +
                "key='" + key + '\'' +
                ", timestamp=" + timestamp +
                ", decisionScore=" + decisionScore +
                ", severity=" + severity +
                ", ensembleStatus=" + ensembleStatus +
                ", contributing=" + contributingDetectors + "/" + totalDetectors +
                '}';
    }
}
