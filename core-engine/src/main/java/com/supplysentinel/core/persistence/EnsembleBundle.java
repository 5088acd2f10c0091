package com.supplysentinel.core.persistence;

import com.supplysentinel.core.detection.BaseDetector;
import com.supplysentinel.core.model.EnsemblePolicy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serialized form of a whole ensemble state: roster, fitted detector
 * internals, weights or quorum, threshold and fitted flag.
 *
 * <p>
 * A bundle is written and read as one unit; there is no way to persist
 * detectors without their weights or the reverse. Detector internals are
 * stored polymorphically under their {@code family} name.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleBundle {

    /** Bumped whenever the layout changes incompatibly. */
    public static final int FORMAT_VERSION = 1;

    private int formatVersion = FORMAT_VERSION;
    private Instant savedAt;
    private EnsemblePolicy policy;
    private double threshold;
    private int quorum;
    private boolean fitted;
    private int columnCount;
    private List<DetectorEntry> detectors = new ArrayList<>();

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    public Instant getSavedAt() {
        return savedAt;
    }

    public void setSavedAt(Instant savedAt) {
        this.savedAt = savedAt;
    }

    public EnsemblePolicy getPolicy() {
        return policy;
    }

    public void setPolicy(EnsemblePolicy policy) {
        this.policy = policy;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getQuorum() {
        return quorum;
    }

    public void setQuorum(int quorum) {
        this.quorum = quorum;
    }

    public boolean isFitted() {
        return fitted;
    }

    public void setFitted(boolean fitted) {
        this.fitted = fitted;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(int columnCount) {
        this.columnCount = columnCount;
    }

    public List<DetectorEntry> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<DetectorEntry> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EnsembleBundle{" +
                "formatVersion=" + formatVersion +
                ", policy=" + policy +
                ", threshold=" + threshold +
                ", quorum=" + quorum +
                ", fitted=" + fitted +
                ", detectors=" + detectors.size() +
                '}';
    }

    /**
     * One roster member inside a bundle.
     */
    public static class DetectorEntry {

        private String id;
        private double weight;
        private boolean voting;
        private boolean active;
        private int fitCount;
        private BaseDetector detector;

        public DetectorEntry() {
        }

        public DetectorEntry(String id, double weight, boolean voting, boolean active, int fitCount,
                BaseDetector detector) {
            this.id = id;
            this.weight = weight;
            this.voting = voting;
            this.active = active;
            this.fitCount = fitCount;
            this.detector = detector;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
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

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public int getFitCount() {
            return fitCount;
        }

        public void setFitCount(int fitCount) {
            this.fitCount = fitCount;
        }

        public BaseDetector getDetector() {
            return detector;
        }

        public void setDetector(BaseDetector detector) {
            this.detector = detector;
        }

        @Override
        public String toString() {
            return "DetectorEntry{id='" + id + "', family='"
                    + (detector != null ? detector.family() : null) + "'}";
        }
    }
}
