package com.supplysentinel.flink;

import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import com.supplysentinel.core.ensemble.EnsemblePrediction;
import com.supplysentinel.core.model.AnomalyAlert;
import com.supplysentinel.core.model.EnsemblePolicy;
import com.supplysentinel.core.model.EnsembleStatus;
import com.supplysentinel.core.model.Label;
import com.supplysentinel.core.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores one micro-batch of telemetry with a fitted ensemble and turns the
 * anomalous rows into alerts.
 *
 * <p>
 * Records missing a feature field, or carrying a non-finite value, are
 * skipped. The scorer has no Flink dependency so it can be exercised
 * directly.
 * </p>
 *
 * <h3>Severity</h3>
 * <ul>
 * <li>Weighted policy: {@link AnomalyAlert.Severity#HIGH} when the decision
 * score is at most {@value #HIGH_SEVERITY_DECISION_SCORE}.</li>
 * <li>Quorum policy: {@code HIGH} when every contributing voter flagged the
 * record.</li>
 * </ul>
 * Every other alert is {@code MEDIUM}.
 *
 * @since 1.0.0
 */
public class BatchScorer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchScorer.class);

    static final double HIGH_SEVERITY_DECISION_SCORE = -0.5;

    private final AnomalyEnsemble ensemble;
    private final List<String> featureFields;
    private final String keyField;

    public BatchScorer(AnomalyEnsemble ensemble, List<String> featureFields, String keyField) {
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble must not be null");
        this.featureFields = List.copyOf(featureFields);
        this.keyField = Objects.requireNonNull(keyField, "keyField must not be null");
    }

    /**
     * Score a batch.
     *
     * @param events the batch, in arrival order
     * @return alerts and counters of the batch
     */
    public Result score(Iterable<TelemetryEvent> events) {
        List<TelemetryEvent> scorable = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        int skipped = 0;
        for (TelemetryEvent event : events) {
            Optional<double[]> row = event.toFeatureVector(featureFields);
            if (row.isPresent()) {
                scorable.add(event);
                rows.add(row.get());
            } else {
                skipped++;
                LOG.debug("Skipping record without a complete feature vector: {}", event);
            }
        }
        if (rows.isEmpty()) {
            return new Result(List.of(), 0, skipped, null);
        }

        EnsemblePrediction prediction = ensemble.evaluate(rows.toArray(new double[0][]));
        if (prediction.status() == EnsembleStatus.UNAVAILABLE) {
            LOG.warn("No alerts for a batch of {} record(s): {}", rows.size(), prediction.describeStatus());
            return new Result(List.of(), 0, skipped + rows.size(), EnsembleStatus.UNAVAILABLE);
        }

        int[] labels = prediction.labels();
        double[] scores = prediction.scores();
        double[] decisionScores = prediction.decisionScores();
        List<AnomalyAlert> alerts = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (!Label.isAnomalous(labels[i])) {
                continue;
            }
            TelemetryEvent event = scorable.get(i);
            AnomalyAlert.Severity severity = severity(prediction.policy(), scores[i], decisionScores[i]);
            alerts.add(AnomalyAlert.builder()
                    .key(event.getStringField(keyField).orElse("__unknown__"))
                    .timestamp(event.getIngestionTime() != null ? event.getIngestionTime() : Instant.now())
                    .decisionScore(decisionScores[i])
                    .normalProbability(scores[i])
                    .severity(severity)
                    .ensembleStatus(prediction.status())
                    .contributingDetectors(prediction.contributingDetectors().size())
                    .totalDetectors(prediction.activeDetectors())
                    .details(String.format("%s ensemble flagged record (decision score %.4f, %s)",
                            prediction.policy().name().toLowerCase(Locale.ROOT), decisionScores[i],
                            prediction.describeStatus()))
                    .originalEvent(event.getFields())
                    .build());
        }
        return new Result(alerts, rows.size(), skipped, prediction.status());
    }

    static AnomalyAlert.Severity severity(EnsemblePolicy policy, double score, double decisionScore) {
        boolean high = policy == EnsemblePolicy.QUORUM
                ? score == 0.0
                : decisionScore <= HIGH_SEVERITY_DECISION_SCORE;
        return high ? AnomalyAlert.Severity.HIGH : AnomalyAlert.Severity.MEDIUM;
    }

    /** Outcome of one batch. */
    public static final class Result {
        private final List<AnomalyAlert> alerts;
        private final int scored;
        private final int skipped;
        private final EnsembleStatus status;

        Result(List<AnomalyAlert> alerts, int scored, int skipped, EnsembleStatus status) {
            this.alerts = Collections.unmodifiableList(alerts);
            this.scored = scored;
            this.skipped = skipped;
            this.status = status;
        }

        public List<AnomalyAlert> getAlerts() {
            return alerts;
        }

        public int getScored() {
            return scored;
        }

        public int getSkipped() {
            return skipped;
        }

        /**
         * @return ensemble status of the batch, or {@code null} if nothing was
         *         scorable
         */
        public EnsembleStatus getStatus() {
            return status;
        }
    }
}
