package com.supplysentinel.core.detection;

import com.supplysentinel.core.model.DetectorSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates {@link BaseDetector} instances from
 * {@link DetectorSpec} configurations.
 *
 * <p>
 * This is the single point of extension when adding new detector families:
 * register the new type string here and create the corresponding adapter.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create an unfitted detector for the given roster entry.
     *
     * @param spec the detector configuration; must not be {@code null}
     * @return an appropriate {@link BaseDetector} instance
     * @throws NullPointerException     if {@code spec} or its type is {@code null}
     * @throws IllegalArgumentException if the detector type is unknown
     */
    public static BaseDetector create(DetectorSpec spec) {
        Objects.requireNonNull(spec, "DetectorSpec must not be null");
        Objects.requireNonNull(spec.getType(), "Detector type must not be null");

        return switch (spec.getType()) {
            case DetectorSpec.ISOLATION_FOREST -> new IsolationForestDetector(
                    spec.getContamination(), spec.getNumTrees(), spec.getSampleSize(), spec.getRandomSeed());
            case DetectorSpec.MAHALANOBIS -> new MahalanobisDensityDetector(
                    spec.getContamination(), spec.getRegularization());
            case DetectorSpec.ROBUST_ZSCORE -> new RobustZscoreDetector(spec.getContamination());
            case DetectorSpec.PCA_RECONSTRUCTION -> new PcaReconstructionDetector(
                    spec.getContamination(), spec.getVarianceRetained());
            case DetectorSpec.DBSCAN -> new DbscanDetector(spec.getEps(), spec.getMinSamples());
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + spec.getType() + "'. Supported types: "
                            + String.join(", ", DetectorSpec.ISOLATION_FOREST, DetectorSpec.MAHALANOBIS,
                                    DetectorSpec.ROBUST_ZSCORE, DetectorSpec.PCA_RECONSTRUCTION,
                                    DetectorSpec.DBSCAN));
        };
    }

    /**
     * Create detectors for every roster entry, keyed by detector id in roster
     * order.
     *
     * @param specs roster configuration; must not be {@code null}
     * @return unmodifiable ordered map of id to detector
     * @throws NullPointerException     if {@code specs} is {@code null}
     * @throws IllegalArgumentException if two entries share an id
     */
    public static Map<String, BaseDetector> createAll(List<DetectorSpec> specs) {
        Objects.requireNonNull(specs, "Detector roster must not be null");
        LOG.info("Creating {} detector(s) from configuration", specs.size());
        Map<String, BaseDetector> detectors = new LinkedHashMap<>();
        for (DetectorSpec spec : specs) {
            if (detectors.putIfAbsent(spec.getId(), create(spec)) != null) {
                throw new IllegalArgumentException("Duplicate detector id: '" + spec.getId() + "'");
            }
        }
        return Collections.unmodifiableMap(detectors);
    }
}
