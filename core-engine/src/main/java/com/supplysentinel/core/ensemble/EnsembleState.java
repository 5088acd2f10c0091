package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.detection.BaseDetector;
import com.supplysentinel.core.model.EnsemblePolicy;
import com.supplysentinel.core.persistence.EnsembleBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The single mutable aggregate of an ensemble: detector handles, combination
 * policy, decision threshold, quorum, lifecycle and the column count seen at
 * fit time.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>Effective weights ({@link #getWeights()}) are non-negative, sum to 1
 * over the active handles and are 0 for inactive ones.</li>
 * <li>The quorum lies between 1 and the number of voting handles.</li>
 * <li>The lifecycle is {@link EnsembleLifecycle#FITTED} only if every active
 * handle has been fitted.</li>
 * <li>The threshold is on the combiner's [0, 1] scale.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe on its own; {@link AnomalyEnsemble} guards it with a
 * read/write lock. Saved and restored only as a whole through
 * {@link #toBundle()} and {@link #restore(EnsembleBundle)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleState {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleState.class);

    private final Map<String, DetectorHandle> handles;
    private final EnsemblePolicy policy;
    private final double defaultThreshold;
    private final int defaultQuorum;

    private double threshold;
    private int quorum;
    private volatile EnsembleLifecycle lifecycle = EnsembleLifecycle.UNFITTED;
    private int columnCount = -1;

    EnsembleState(List<DetectorHandle> roster, EnsemblePolicy policy, double threshold, Integer quorum) {
        if (roster.isEmpty()) {
            throw new IllegalArgumentException("An ensemble needs at least one detector");
        }
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new IllegalArgumentException("threshold must lie in [0, 1], got: " + threshold);
        }
        Map<String, DetectorHandle> byId = new LinkedHashMap<>();
        for (DetectorHandle handle : roster) {
            if (byId.putIfAbsent(handle.getId(), handle) != null) {
                throw new IllegalArgumentException("Duplicate detector id: '" + handle.getId() + "'");
            }
        }
        this.handles = Collections.unmodifiableMap(byId);
        this.policy = policy;
        this.defaultThreshold = threshold;
        this.threshold = threshold;

        int voters = votingCount();
        if (policy == EnsemblePolicy.QUORUM && voters == 0) {
            throw new IllegalArgumentException("Quorum policy needs at least one voting detector");
        }
        int resolved = quorum != null ? quorum : QuorumCombiner.defaultQuorum(Math.max(1, voters));
        if (policy == EnsemblePolicy.QUORUM) {
            requireQuorum(resolved, voters);
        }
        this.defaultQuorum = resolved;
        this.quorum = resolved;
    }

    // ---------------------------------------------------------------
    // Read access
    // ---------------------------------------------------------------

    /**
     * @return handles in roster order
     */
    public List<DetectorHandle> getHandles() {
        return List.copyOf(handles.values());
    }

    public DetectorHandle getHandle(String id) {
        return handles.get(id);
    }

    public Set<String> getDetectorIds() {
        return handles.keySet();
    }

    /**
     * Effective combiner weights: the stored weights of the active handles
     * scaled to sum to 1 (uniform if they are all zero), 0 for inactive
     * handles.
     *
     * @return weight per detector id, in roster order
     */
    public Map<String, Double> getWeights() {
        List<DetectorHandle> active = activeHandles();
        double total = 0;
        for (DetectorHandle handle : active) {
            total += handle.getWeight();
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (DetectorHandle handle : handles.values()) {
            double weight;
            if (!handle.isActive()) {
                weight = 0.0;
            } else if (total > 0) {
                weight = handle.getWeight() / total;
            } else {
                weight = 1.0 / active.size();
            }
            weights.put(handle.getId(), weight);
        }
        return Collections.unmodifiableMap(weights);
    }

    public EnsemblePolicy getPolicy() {
        return policy;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getQuorum() {
        return quorum;
    }

    public EnsembleLifecycle getLifecycle() {
        return lifecycle;
    }

    /**
     * @return column count seen at fit time, or {@code -1} before any fit
     */
    public int getColumnCount() {
        return columnCount;
    }

    public boolean isFitted() {
        return lifecycle == EnsembleLifecycle.FITTED;
    }

    List<DetectorHandle> activeHandles() {
        List<DetectorHandle> active = new ArrayList<>();
        for (DetectorHandle handle : handles.values()) {
            if (handle.isActive()) {
                active.add(handle);
            }
        }
        return active;
    }

    int votingCount() {
        int voters = 0;
        for (DetectorHandle handle : handles.values()) {
            if (handle.isVoting()) {
                voters++;
            }
        }
        return voters;
    }

    // ---------------------------------------------------------------
    // Mutation (ensemble only)
    // ---------------------------------------------------------------

    void setLifecycle(EnsembleLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    void setColumnCount(int columnCount) {
        this.columnCount = columnCount;
    }

    void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    void setQuorum(int quorum) {
        requireQuorum(quorum, votingCount());
        this.quorum = quorum;
    }

    /**
     * Install recalibrated weights; handles absent from {@code weights} get
     * weight 0.
     */
    void applyWeights(Map<String, Double> weights) {
        for (DetectorHandle handle : handles.values()) {
            handle.setWeight(weights.getOrDefault(handle.getId(), 0.0));
        }
    }

    /**
     * Back to the configured weights, threshold and quorum, unfitted.
     */
    void reset() {
        for (DetectorHandle handle : handles.values()) {
            handle.reset();
        }
        threshold = defaultThreshold;
        quorum = defaultQuorum;
        columnCount = -1;
        lifecycle = EnsembleLifecycle.UNFITTED;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    EnsembleBundle toBundle() {
        EnsembleBundle bundle = new EnsembleBundle();
        bundle.setSavedAt(Instant.now());
        bundle.setPolicy(policy);
        bundle.setThreshold(threshold);
        bundle.setQuorum(quorum);
        bundle.setFitted(isFitted());
        bundle.setColumnCount(columnCount);
        List<EnsembleBundle.DetectorEntry> entries = new ArrayList<>();
        for (DetectorHandle handle : handles.values()) {
            entries.add(new EnsembleBundle.DetectorEntry(handle.getId(), handle.getWeight(),
                    handle.isVoting(), handle.isActive(), handle.getFitCount(), handle.getDetector()));
        }
        bundle.setDetectors(entries);
        return bundle;
    }

    /**
     * Replace this state with a bundle's, after checking that the bundle
     * describes exactly this roster.
     *
     * @throws IllegalArgumentException on a roster, family or policy
     *                                  mismatch, or an inconsistent bundle;
     *                                  nothing is changed in that case
     */
    void restore(EnsembleBundle bundle) {
        Set<String> bundled = new LinkedHashSet<>();
        for (EnsembleBundle.DetectorEntry entry : bundle.getDetectors()) {
            if (!bundled.add(entry.getId())) {
                throw new IllegalArgumentException("Bundle lists detector '" + entry.getId() + "' twice");
            }
        }
        Set<String> missing = new LinkedHashSet<>(handles.keySet());
        missing.removeAll(bundled);
        Set<String> extra = new LinkedHashSet<>(bundled);
        extra.removeAll(handles.keySet());
        if (!missing.isEmpty() || !extra.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "Bundle roster does not match the configured roster: missing %s, extra %s", missing, extra));
        }
        if (bundle.getPolicy() != policy) {
            throw new IllegalArgumentException(String.format(
                    "Bundle policy %s does not match the configured policy %s", bundle.getPolicy(), policy));
        }

        List<String> errors = new ArrayList<>();
        boolean anyActive = false;
        for (EnsembleBundle.DetectorEntry entry : bundle.getDetectors()) {
            DetectorHandle handle = handles.get(entry.getId());
            BaseDetector detector = entry.getDetector();
            if (detector == null) {
                errors.add("Detector '" + entry.getId() + "' has no state");
                continue;
            }
            if (!detector.family().equals(handle.getFamily())) {
                errors.add(String.format("Detector '%s' is a %s in the bundle but configured as %s",
                        entry.getId(), detector.family(), handle.getFamily()));
            }
            if (entry.isVoting() != handle.isVoting()) {
                errors.add("Detector '" + entry.getId() + "' voting eligibility differs from the configuration");
            }
            if (entry.getWeight() < 0 || !Double.isFinite(entry.getWeight())) {
                errors.add("Detector '" + entry.getId() + "' has an invalid weight: " + entry.getWeight());
            }
            if (bundle.isFitted() && entry.isActive() && !detector.isFitted()) {
                errors.add("Active detector '" + entry.getId() + "' is not fitted");
            }
            anyActive |= entry.isActive();
        }
        if (bundle.isFitted() && !anyActive) {
            errors.add("Fitted bundle has no active detector");
        }
        if (!(bundle.getThreshold() >= 0 && bundle.getThreshold() <= 1)) {
            errors.add("Threshold outside [0, 1]: " + bundle.getThreshold());
        }
        if (policy == EnsemblePolicy.QUORUM
                && (bundle.getQuorum() < 1 || bundle.getQuorum() > votingCount())) {
            errors.add("Quorum " + bundle.getQuorum() + " outside [1, " + votingCount() + "]");
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid ensemble bundle:\n  - " + String.join("\n  - ", errors));
        }

        for (EnsembleBundle.DetectorEntry entry : bundle.getDetectors()) {
            DetectorHandle handle = handles.get(entry.getId());
            handle.replaceDetector(entry.getDetector(), entry.getFitCount());
            handle.setActive(entry.isActive());
            handle.setWeight(entry.getWeight());
        }
        threshold = bundle.getThreshold();
        quorum = bundle.getQuorum();
        columnCount = bundle.getColumnCount();
        lifecycle = bundle.isFitted() ? EnsembleLifecycle.FITTED : EnsembleLifecycle.UNFITTED;
        LOG.info("Restored ensemble state: policy={}, threshold={}, quorum={}, weights={}",
                policy, threshold, quorum, getWeights());
    }

    private static void requireQuorum(int quorum, int voters) {
        if (quorum < 1 || quorum > voters) {
            throw new IllegalArgumentException(String.format(
                    "quorum must lie in [1, %d], got: %d", voters, quorum));
        }
    }

    @Override
    public String toString() {
        return "EnsembleState{" +
                "policy=" + policy +
                ", lifecycle=" + lifecycle +
                ", threshold=" + threshold +
                ", quorum=" + quorum +
                ", handles=" + handles.values() +
                '}';
    }
}
