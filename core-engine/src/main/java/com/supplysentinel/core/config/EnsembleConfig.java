package com.supplysentinel.core.config;

import com.supplysentinel.core.calibration.ThresholdObjective;
import com.supplysentinel.core.model.DetectorSpec;
import com.supplysentinel.core.model.EnsemblePolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the ensemble YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * policy: weighted
 * threshold: 0.5
 * thresholdObjective: f1
 * detectors:
 *   - id: iforest
 *     type: isolation-forest
 *     weight: 0.3
 *   - id: density
 *     type: mahalanobis
 *     weight: 0.2
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the ensemble options and
 * every detector entry.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String policy = "weighted";

    /** Initial decision threshold on the combined [0, 1] scale. */
    private double threshold = 0.5;

    /** Quorum for quorum mode; {@code null} means majority of the voters. */
    private Integer quorum;

    /** Search the quorum on the validation split when labels are given. */
    private boolean optimizeQuorum = true;

    private double validationFraction = 0.2;
    private long randomSeed = 42L;

    /** Worker threads for detector calls; 0 means one per available core. */
    private int parallelism;

    private long detectorTimeoutSeconds = 300L;

    private String thresholdObjective = "f1";
    private int thresholdSteps = 20;
    private double falsePositiveCost = 1.0;
    private double falseNegativeCost = 5.0;

    private List<DetectorSpec> detectors = new ArrayList<>();

    /**
     * Validate the ensemble options and every detector entry.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            EnsemblePolicy.fromName(policy);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            ThresholdObjective.fromName(thresholdObjective);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!(threshold >= 0 && threshold <= 1)) {
            errors.add("'threshold' must lie in [0, 1], got: " + threshold);
        }
        if (!(validationFraction > 0 && validationFraction < 1)) {
            errors.add("'validationFraction' must lie in (0, 1), got: " + validationFraction);
        }
        if (parallelism < 0) {
            errors.add("'parallelism' must be >= 0, got: " + parallelism);
        }
        if (detectorTimeoutSeconds <= 0) {
            errors.add("'detectorTimeoutSeconds' must be > 0, got: " + detectorTimeoutSeconds);
        }
        if (thresholdSteps < 2) {
            errors.add("'thresholdSteps' must be >= 2, got: " + thresholdSteps);
        }
        if (falsePositiveCost < 0 || falseNegativeCost < 0) {
            errors.add("Error costs must be >= 0");
        }

        if (detectors.isEmpty()) {
            errors.add("At least one detector is required");
        }
        Set<String> ids = new HashSet<>();
        int voters = 0;
        for (int i = 0; i < detectors.size(); i++) {
            DetectorSpec spec = Objects.requireNonNull(detectors.get(i),
                    "Detector at index " + i + " is null");
            try {
                spec.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (spec.getId() != null && !ids.add(spec.getId())) {
                errors.add("Duplicate detector id: '" + spec.getId() + "'");
            }
            if (spec.isVoting()) {
                voters++;
            }
        }
        if ("quorum".equalsIgnoreCase(policy)) {
            if (voters == 0) {
                errors.add("Quorum policy needs at least one voting detector");
            } else if (quorum != null && (quorum < 1 || quorum > voters)) {
                errors.add("'quorum' must lie in [1, " + voters + "], got: " + quorum);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Ensemble configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getPolicy() {
        return policy;
    }

    public void setPolicy(String policy) {
        this.policy = policy;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Integer getQuorum() {
        return quorum;
    }

    public void setQuorum(Integer quorum) {
        this.quorum = quorum;
    }

    public boolean isOptimizeQuorum() {
        return optimizeQuorum;
    }

    public void setOptimizeQuorum(boolean optimizeQuorum) {
        this.optimizeQuorum = optimizeQuorum;
    }

    public double getValidationFraction() {
        return validationFraction;
    }

    public void setValidationFraction(double validationFraction) {
        this.validationFraction = validationFraction;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public long getDetectorTimeoutSeconds() {
        return detectorTimeoutSeconds;
    }

    public void setDetectorTimeoutSeconds(long detectorTimeoutSeconds) {
        this.detectorTimeoutSeconds = detectorTimeoutSeconds;
    }

    public String getThresholdObjective() {
        return thresholdObjective;
    }

    public void setThresholdObjective(String thresholdObjective) {
        this.thresholdObjective = thresholdObjective;
    }

    public int getThresholdSteps() {
        return thresholdSteps;
    }

    public void setThresholdSteps(int thresholdSteps) {
        this.thresholdSteps = thresholdSteps;
    }

    public double getFalsePositiveCost() {
        return falsePositiveCost;
    }

    public void setFalsePositiveCost(double falsePositiveCost) {
        this.falsePositiveCost = falsePositiveCost;
    }

    public double getFalseNegativeCost() {
        return falseNegativeCost;
    }

    public void setFalseNegativeCost(double falseNegativeCost) {
        this.falseNegativeCost = falseNegativeCost;
    }

    /**
     * Return the detector roster. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable roster in configuration order
     */
    public List<DetectorSpec> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detector roster (used by SnakeYAML during deserialization).
     *
     * @param detectors the roster
     */
    public void setDetectors(List<DetectorSpec> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EnsembleConfig{" +
                "policy='" + policy + '\'' +
                ", threshold=" + threshold +
                ", quorum=" + quorum +
                ", thresholdObjective='" + thresholdObjective + '\'' +
                ", detectors=" + detectors +
                '}';
    }
}
