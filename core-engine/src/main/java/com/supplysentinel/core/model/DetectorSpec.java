package com.supplysentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes one member of the detector roster, loaded from configuration.
 *
 * <p>
 * Supported detector types:
 * </p>
 * <ul>
 * <li>{@code isolation-forest}: random isolation trees</li>
 * <li>{@code mahalanobis}: Gaussian density (Mahalanobis distance)</li>
 * <li>{@code robust-zscore}: per-feature median/MAD boundary</li>
 * <li>{@code pca-reconstruction}: principal-subspace reconstruction error</li>
 * <li>{@code dbscan}: density clustering, binary outlier flag only</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared detector type are present and
 * valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ISOLATION_FOREST = "isolation-forest";
    public static final String MAHALANOBIS = "mahalanobis";
    public static final String ROBUST_ZSCORE = "robust-zscore";
    public static final String PCA_RECONSTRUCTION = "pca-reconstruction";
    public static final String DBSCAN = "dbscan";

    /** Stable detector identifier; survives save/load. */
    private String id;

    /** Detector family, one of the type constants. */
    private String type;

    /** Initial weight in weighted mode. */
    private double weight = 1.0;

    /** Whether the detector votes in quorum mode. */
    private boolean voting = true;

    /** Expected share of anomalies, used to place the label cutoff. */
    private double contamination = 0.01;

    /** Seed for stochastic detectors. */
    private long randomSeed = 42L;

    // --- Isolation forest ---
    private int numTrees = 100;
    private int sampleSize = 256;

    // --- Mahalanobis ---
    /** Ridge added to the covariance diagonal before inversion. */
    private double regularization = 1e-6;

    // --- PCA reconstruction ---
    /** Share of variance the retained components must explain. */
    private double varianceRetained = 0.95;

    // --- DBSCAN ---
    private double eps = 0.5;
    private int minSamples = 5;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared detector type are
     * present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Detector 'id' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Detector '" + id + "' requires 'type'");
        }
        if (weight < 0 || Double.isNaN(weight)) {
            errors.add("Detector '" + id + "' requires 'weight' >= 0");
        }

        if (type != null) {
            switch (type) {
                case ISOLATION_FOREST -> {
                    requireContamination(errors);
                    if (numTrees < 1) {
                        errors.add("Isolation forest '" + id + "' requires 'numTrees' >= 1");
                    }
                    if (sampleSize < 2) {
                        errors.add("Isolation forest '" + id + "' requires 'sampleSize' >= 2");
                    }
                }
                case MAHALANOBIS -> {
                    requireContamination(errors);
                    if (regularization < 0) {
                        errors.add("Mahalanobis detector '" + id + "' requires 'regularization' >= 0");
                    }
                }
                case ROBUST_ZSCORE -> requireContamination(errors);
                case PCA_RECONSTRUCTION -> {
                    requireContamination(errors);
                    if (varianceRetained <= 0 || varianceRetained > 1) {
                        errors.add("PCA detector '" + id + "' requires 'varianceRetained' in (0, 1]");
                    }
                }
                case DBSCAN -> {
                    if (eps <= 0) {
                        errors.add("DBSCAN detector '" + id + "' requires 'eps' > 0");
                    }
                    if (minSamples < 1) {
                        errors.add("DBSCAN detector '" + id + "' requires 'minSamples' >= 1");
                    }
                }
                default -> errors.add("Unknown detector type: '" + type + "'. Supported: "
                        + String.join(", ", ISOLATION_FOREST, MAHALANOBIS, ROBUST_ZSCORE,
                                PCA_RECONSTRUCTION, DBSCAN));
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorSpec: " + String.join("; ", errors));
        }
    }

    private void requireContamination(List<String> errors) {
        if (contamination <= 0 || contamination >= 0.5) {
            errors.add("Detector '" + id + "' requires 'contamination' in (0, 0.5)");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type detector type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public boolean isVoting() {
        return voting;
    }

    public void setVoting(boolean voting) {
        this.voting = voting;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getNumTrees() {
        return numTrees;
    }

    public void setNumTrees(int numTrees) {
        this.numTrees = numTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public double getRegularization() {
        return regularization;
    }

    public void setRegularization(double regularization) {
        this.regularization = regularization;
    }

    public double getVarianceRetained() {
        return varianceRetained;
    }

    public void setVarianceRetained(double varianceRetained) {
        this.varianceRetained = varianceRetained;
    }

    public double getEps() {
        return eps;
    }

    public void setEps(double eps) {
        this.eps = eps;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorSpec that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "DetectorSpec{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", weight=" + weight +
                ", voting=" + voting +
                ", contamination=" + contamination +
                '}';
    }
}
