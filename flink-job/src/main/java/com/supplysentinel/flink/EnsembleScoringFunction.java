package com.supplysentinel.flink;

import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import com.supplysentinel.core.model.AnomalyAlert;
import com.supplysentinel.core.model.TelemetryEvent;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.windowing.ProcessAllWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.GlobalWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flink window function that scores each count window of telemetry as one
 * batch with a trained ensemble.
 *
 * <p>
 * Detector scores are normalized per batch, so the ensemble needs whole
 * batches rather than single records; the job feeds it fixed-size count
 * windows. The ensemble is rebuilt from its YAML configuration and bundle in
 * {@link #open(Configuration)}; only the paths travel with the function.
 * </p>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated after every batch.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleScoringFunction
        extends ProcessAllWindowFunction<TelemetryEvent, AnomalyAlert, GlobalWindow> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EnsembleScoringFunction.class);

    private final String ensembleConfigPath;
    private final String ensembleBundlePath;
    private final List<String> featureFields;
    private final String keyField;

    private transient AnomalyEnsemble ensemble;
    private transient BatchScorer scorer;
    private transient EnsembleMetrics metrics;

    /**
     * @param config job configuration; must name a bundle path
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public EnsembleScoringFunction(JobConfig config) {
        Objects.requireNonNull(config, "JobConfig must not be null");
        this.ensembleConfigPath = config.getEnsembleConfigPath();
        this.ensembleBundlePath = config.getEnsembleBundlePath();
        this.featureFields = new ArrayList<>(config.getFeatureFields());
        this.keyField = config.getKeyField();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ensemble = EnsembleBootstrap.loadFitted(ensembleConfigPath, ensembleBundlePath);
        scorer = new BatchScorer(ensemble, featureFields, keyField);
        metrics = new EnsembleMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("EnsembleScoringFunction opened with detectors {}", ensemble.activeDetectors());
    }

    @Override
    public void close() {
        LOG.info("EnsembleScoringFunction closing");
        if (ensemble != null) {
            ensemble.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void process(Context context, Iterable<TelemetryEvent> events, Collector<AnomalyAlert> out) {
        long startNanos = System.nanoTime();

        BatchScorer.Result result = scorer.score(events);
        for (AnomalyAlert alert : result.getAlerts()) {
            out.collect(alert);
            LOG.info("Alert fired: key={} severity={} decisionScore={}",
                    alert.getKey(), alert.getSeverity(), alert.getDecisionScore());
        }

        metrics.record(result, (System.nanoTime() - startNanos) / 1_000_000);
    }
}
