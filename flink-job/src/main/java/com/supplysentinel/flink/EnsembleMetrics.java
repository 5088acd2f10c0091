package com.supplysentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Supply Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus);
 * the reporter itself is configured at cluster level.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code records_scored_total}: records that went through the ensemble</li>
 * <li>{@code records_skipped_total}: records without a usable feature vector,
 * or in a batch no detector could score</li>
 * <li>{@code anomalies_detected_total}: alerts emitted</li>
 * <li>{@code degraded_batches_total}: batches some detector dropped out of</li>
 * <li>{@code unavailable_batches_total}: batches no detector could score</li>
 * <li>{@code batch_latency_ms}: histogram of per-batch scoring latency</li>
 * </ul>
 */
public class EnsembleMetrics {

    private final Counter recordsScored;
    private final Counter recordsSkipped;
    private final Counter anomaliesDetected;
    private final Counter degradedBatches;
    private final Counter unavailableBatches;
    private final Histogram batchLatency;

    public EnsembleMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("supply_sentinel");

        this.recordsScored = group.counter("records_scored_total");
        this.recordsSkipped = group.counter("records_skipped_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.degradedBatches = group.counter("degraded_batches_total");
        this.unavailableBatches = group.counter("unavailable_batches_total");
        // sliding window of the last 350 batches
        this.batchLatency = group.histogram("batch_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    /**
     * Record the outcome of one scored batch.
     */
    public void record(BatchScorer.Result result, long latencyMs) {
        recordsScored.inc(result.getScored());
        recordsSkipped.inc(result.getSkipped());
        anomaliesDetected.inc(result.getAlerts().size());
        if (result.getStatus() != null) {
            switch (result.getStatus()) {
                case DEGRADED -> degradedBatches.inc();
                case UNAVAILABLE -> unavailableBatches.inc();
                default -> {
                }
            }
        }
        batchLatency.update(latencyMs);
    }
}
