package com.supplysentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Capability contract for every base anomaly detector in the ensemble.
 *
 * <p>
 * The ensemble depends only on this interface, never on a concrete detector
 * class. Labels use the {@code +1} (normal) / {@code -1} (anomalous)
 * convention and decision scores are oriented so that a <em>higher</em> value
 * means <em>more normal</em>.
 * </p>
 *
 * <p>
 * Implementations hold their fitted state in plain fields so that the
 * ensemble bundle can persist them as JSON; the {@code family} property
 * identifies the concrete type on reload.
 * </p>
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "family")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForestDetector.class, name = "isolation-forest"),
        @JsonSubTypes.Type(value = MahalanobisDensityDetector.class, name = "mahalanobis"),
        @JsonSubTypes.Type(value = RobustZscoreDetector.class, name = "robust-zscore"),
        @JsonSubTypes.Type(value = PcaReconstructionDetector.class, name = "pca-reconstruction"),
        @JsonSubTypes.Type(value = DbscanDetector.class, name = "dbscan")
})
public interface BaseDetector {

    /**
     * Fit the detector on a feature matrix, replacing any previous state.
     *
     * @param data rows = observations, columns = features
     * @throws IllegalArgumentException if the matrix is empty, ragged or too
     *                                  small for this detector
     */
    void fit(double[][] data);

    /**
     * Label each row.
     *
     * @param data feature matrix with the fit-time column count
     * @return {@code +1} for normal, {@code -1} for anomalous, one per row
     * @throws IllegalStateException if the detector has not been fitted
     */
    int[] predict(double[][] data);

    /**
     * Raw decision score of each row; higher means more normal.
     *
     * @param data feature matrix with the fit-time column count
     * @return one score per row, on this detector's own scale
     * @throws IllegalStateException if the detector has not been fitted
     */
    double[] decisionFunction(double[][] data);

    /**
     * @return {@code true} once {@link #fit(double[][])} has completed
     */
    boolean isFitted();

    /**
     * @return the detector family name, matching the configuration type
     */
    String family();

    /**
     * Whether {@link #decisionFunction(double[][])} yields a graded score.
     * Clustering detectors only emit a binary outlier flag.
     *
     * @return {@code false} if the decision score is only ±1
     */
    default boolean providesContinuousScore() {
        return true;
    }
}
