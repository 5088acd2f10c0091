package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.detection.BaseDetector;

import java.util.Objects;

/**
 * One member of an ensemble roster: a detector under a stable id, with its
 * weighted-mode weight, its quorum-mode voting eligibility and its status in
 * the current fit cycle.
 *
 * <p>
 * Handles are created once with the roster and owned by an
 * {@link EnsembleState}. Only the ensemble mutates them.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorHandle {

    private final String id;
    private final boolean voting;
    private final double initialWeight;

    private BaseDetector detector;
    private double weight;
    private boolean active = true;
    private int fitCount;

    DetectorHandle(String id, BaseDetector detector, double weight, boolean voting) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Detector id must not be blank");
        }
        if (weight < 0 || !Double.isFinite(weight)) {
            throw new IllegalArgumentException("Detector [" + id + "] weight must be finite and >= 0, got: " + weight);
        }
        this.id = id;
        this.detector = Objects.requireNonNull(detector, "Detector [" + id + "] must not be null");
        this.initialWeight = weight;
        this.weight = weight;
        this.voting = voting;
    }

    public String getId() {
        return id;
    }

    public BaseDetector getDetector() {
        return detector;
    }

    public String getFamily() {
        return detector.family();
    }

    /**
     * @return stored weight before re-normalization over the active
     *         detectors; meaningful in weighted mode only
     */
    public double getWeight() {
        return weight;
    }

    public double getInitialWeight() {
        return initialWeight;
    }

    public boolean isVoting() {
        return voting;
    }

    /**
     * @return {@code false} if the detector failed in the latest fit cycle
     */
    public boolean isActive() {
        return active;
    }

    /**
     * @return number of successful fits since the roster was built
     */
    public int getFitCount() {
        return fitCount;
    }

    // ---------------------------------------------------------------
    // Mutation (ensemble only)
    // ---------------------------------------------------------------

    void setWeight(double weight) {
        this.weight = weight;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    void markFitted() {
        fitCount++;
    }

    void replaceDetector(BaseDetector restored, int restoredFitCount) {
        this.detector = Objects.requireNonNull(restored, "restored detector must not be null");
        this.fitCount = restoredFitCount;
    }

    void reset() {
        this.weight = initialWeight;
        this.active = true;
    }

    @Override
    public String toString() {
        return "DetectorHandle{" +
                "id='" + id + '\'' +
                ", family='" + detector.family() + '\'' +
                ", weight=" + weight +
                ", voting=" + voting +
                ", active=" + active +
                ", fitCount=" + fitCount +
                '}';
    }
}
