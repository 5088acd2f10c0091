package com.supplysentinel.core.calibration;

import com.supplysentinel.core.detection.BaseDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Re-derives combiner weights from each detector's performance on a labelled
 * validation split.
 *
 * <p>
 * Every detector labels the split; its performance is
 * {@code 0.5 * F1 + 0.3 * precision + 0.2 * recall} with anomalous as the
 * positive class, and its new weight is its share of the summed performance.
 * The weights returned are non-negative and sum to 1.
 * </p>
 *
 * <h3>Fallbacks</h3>
 * <ul>
 * <li>A split with only one class, or a summed performance of zero, yields
 * uniform weights.</li>
 * <li>A detector whose {@code predict} throws scores zero and is logged.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RecalibrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecalibrationEngine.class);

    static final double F1_SHARE = 0.5;
    static final double PRECISION_SHARE = 0.3;
    static final double RECALL_SHARE = 0.2;

    /**
     * Combined performance statistic of one detector.
     *
     * @param metrics the detector's confusion counts on the validation split
     * @return {@code 0.5*F1 + 0.3*precision + 0.2*recall}
     */
    public static double performance(ClassificationMetrics metrics) {
        return F1_SHARE * metrics.f1()
                + PRECISION_SHARE * metrics.precision()
                + RECALL_SHARE * metrics.recall();
    }

    /**
     * Compute new weights for the given detectors.
     *
     * @param validation       validation rows
     * @param validationLabels ground truth, {@code +1} / {@code -1}
     * @param detectors        fitted detectors keyed by id; must not be empty
     * @return unmodifiable map of id to weight, in the iteration order of
     *         {@code detectors}
     */
    public Map<String, Double> recalibrate(double[][] validation, int[] validationLabels,
            Map<String, BaseDetector> detectors) {
        Objects.requireNonNull(validation, "validation data must not be null");
        Objects.requireNonNull(validationLabels, "validation labels must not be null");
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot recalibrate an empty detector set");
        }
        if (validation.length != validationLabels.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d validation rows for %d labels", validation.length, validationLabels.length));
        }

        if (!ClassificationMetrics.hasBothClasses(validationLabels)) {
            LOG.info("Validation split lacks one class; using uniform weights");
            return uniform(detectors);
        }

        Map<String, Double> performance = new LinkedHashMap<>();
        double total = 0;
        for (Map.Entry<String, BaseDetector> entry : detectors.entrySet()) {
            double perf;
            try {
                int[] predicted = entry.getValue().predict(validation);
                ClassificationMetrics metrics = ClassificationMetrics.of(validationLabels, predicted);
                perf = performance(metrics);
                LOG.debug("Detector [{}] validation {}", entry.getKey(), metrics);
            } catch (RuntimeException e) {
                LOG.warn("Detector [{}] failed on the validation split; scoring it 0: {}",
                        entry.getKey(), e.getMessage(), e);
                perf = 0.0;
            }
            performance.put(entry.getKey(), perf);
            total += perf;
        }

        if (total <= 0) {
            LOG.info("Every detector scored 0 on the validation split; using uniform weights");
            return uniform(detectors);
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : performance.entrySet()) {
            weights.put(entry.getKey(), entry.getValue() / total);
        }
        LOG.info("Recalibrated detector weights: {}", weights);
        return Collections.unmodifiableMap(weights);
    }

    private static Map<String, Double> uniform(Map<String, BaseDetector> detectors) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double share = 1.0 / detectors.size();
        for (String id : detectors.keySet()) {
            weights.put(id, share);
        }
        return Collections.unmodifiableMap(weights);
    }
}
