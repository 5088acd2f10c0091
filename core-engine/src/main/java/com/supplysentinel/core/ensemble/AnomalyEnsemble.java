package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.calibration.RecalibrationEngine;
import com.supplysentinel.core.calibration.ThresholdObjective;
import com.supplysentinel.core.calibration.ThresholdOptimizer;
import com.supplysentinel.core.calibration.ThresholdResult;
import com.supplysentinel.core.config.EnsembleConfig;
import com.supplysentinel.core.detection.BaseDetector;
import com.supplysentinel.core.detection.DetectorFactory;
import com.supplysentinel.core.detection.Matrices;
import com.supplysentinel.core.model.DetectorSpec;
import com.supplysentinel.core.model.EnsemblePolicy;
import com.supplysentinel.core.model.EnsembleStatus;
import com.supplysentinel.core.model.Label;
import com.supplysentinel.core.persistence.EnsembleBundleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Facade over a fixed roster of base detectors, combined into one calibrated
 * decision.
 *
 * <h3>Fitting</h3>
 * <p>
 * {@link #fit(double[][], int[])} holds out a stratified validation split,
 * fits every detector concurrently on the rest, recalibrates the weights and
 * searches the threshold (weighted policy) or the quorum (quorum policy) on
 * the held-out rows, then refits every detector on all rows. Without labels
 * only the final fit runs and the weights, threshold and quorum keep their
 * current values. Detectors that fail to fit are inactive until the next
 * fit; the fit itself only fails if none succeeds.
 * </p>
 *
 * <h3>Scoring</h3>
 * <p>
 * Each active detector scores the batch concurrently. A detector that fails
 * on a batch is left out of that batch only, and the result reports the
 * ensemble as {@link EnsembleStatus#DEGRADED}.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Scoring calls share a read lock; {@code fit}, {@code save}, {@code load}
 * and {@code reset} take the write lock.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEnsemble implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEnsemble.class);

    private final EnsembleState state;
    private final ThresholdOptimizer thresholdOptimizer;
    private final RecalibrationEngine recalibrationEngine = new RecalibrationEngine();
    private final WeightedCombiner weightedCombiner = new WeightedCombiner();
    private final QuorumCombiner quorumCombiner = new QuorumCombiner();
    private final StratifiedSplitter splitter;
    private final boolean optimizeQuorum;
    private final DetectorRunner runner;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private AnomalyEnsemble(Builder builder) {
        this.state = new EnsembleState(builder.roster, builder.policy, builder.threshold, builder.quorum);
        this.thresholdOptimizer = builder.thresholdOptimizer;
        this.splitter = new StratifiedSplitter(builder.validationFraction, builder.randomSeed);
        this.optimizeQuorum = builder.optimizeQuorum;
        this.runner = new DetectorRunner(Math.min(builder.parallelism, builder.roster.size()),
                builder.detectorTimeout);
        LOG.info("Created {} ensemble with detectors {}", state.getPolicy(), state.getDetectorIds());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build an ensemble from a validated configuration.
     *
     * @param config the configuration; validated again here
     * @return a new, unfitted ensemble
     * @throws IllegalStateException if the configuration is invalid
     */
    public static AnomalyEnsemble fromConfig(EnsembleConfig config) {
        Objects.requireNonNull(config, "EnsembleConfig must not be null");
        config.validate();

        Builder builder = builder()
                .policy(EnsemblePolicy.fromName(config.getPolicy()))
                .threshold(config.getThreshold())
                .optimizeQuorum(config.isOptimizeQuorum())
                .validationFraction(config.getValidationFraction())
                .randomSeed(config.getRandomSeed())
                .detectorTimeout(Duration.ofSeconds(config.getDetectorTimeoutSeconds()))
                .thresholdOptimizer(new ThresholdOptimizer(
                        ThresholdObjective.fromName(config.getThresholdObjective()),
                        config.getThresholdSteps(),
                        config.getFalsePositiveCost(),
                        config.getFalseNegativeCost()));
        if (config.getQuorum() != null) {
            builder.quorum(config.getQuorum());
        }
        if (config.getParallelism() > 0) {
            builder.parallelism(config.getParallelism());
        }

        Map<String, BaseDetector> detectors = DetectorFactory.createAll(config.getDetectors());
        for (DetectorSpec spec : config.getDetectors()) {
            builder.detector(spec.getId(), detectors.get(spec.getId()), spec.getWeight(), spec.isVoting());
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Fitting
    // ---------------------------------------------------------------

    /**
     * Fit without labels: every detector is fitted on all rows and the
     * calibration is left as it is.
     *
     * @param data training matrix
     */
    public void fit(double[][] data) {
        fit(data, null);
    }

    /**
     * Fit the ensemble, replacing all detector state.
     *
     * @param data   training matrix, finite, rows = observations
     * @param labels {@code +1} / {@code -1} per row, or {@code null}
     * @throws IllegalArgumentException if the data or labels are malformed
     * @throws EnsembleFitException     if no detector could be fitted; the
     *                                  ensemble is then unfitted
     */
    public void fit(double[][] data, int[] labels) {
        int columns = Matrices.requireMatrix(data, "Training data");
        Matrices.requireFinite(data, "Training data");
        if (labels != null) {
            if (labels.length != data.length) {
                throw new IllegalArgumentException(String.format(
                        "Got %d label(s) for %d training row(s)", labels.length, data.length));
            }
            for (int label : labels) {
                Label.fromValue(label);
            }
        }

        lock.writeLock().lock();
        try {
            state.setLifecycle(EnsembleLifecycle.FITTING);
            try {
                doFit(data, labels, columns);
            } catch (RuntimeException e) {
                state.setLifecycle(EnsembleLifecycle.UNFITTED);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void doFit(double[][] data, int[] labels, int columns) {
        long start = System.nanoTime();
        LOG.info("Fitting {} ensemble on {} row(s) x {} column(s), {}",
                state.getPolicy(), data.length, columns, labels != null ? "supervised" : "unsupervised");

        Set<String> calibrationFailures = new HashSet<>();
        if (labels != null) {
            StratifiedSplitter.Split split = splitter.split(labels);
            if (split.validation.length == 0) {
                LOG.warn("Too few labelled rows to hold out a validation split; skipping calibration");
            } else {
                int[] validationLabels = new int[split.validation.length];
                for (int i = 0; i < validationLabels.length; i++) {
                    validationLabels[i] = labels[split.validation[i]];
                }
                calibrationFailures = calibrate(Matrices.rows(data, split.train),
                        Matrices.rows(data, split.validation), validationLabels);
            }
        }

        List<DetectorHandle> handles = state.getHandles();
        Map<String, DetectorRunner.Outcome<Void>> outcomes = fitAll(data, handles);
        List<Throwable> failures = new ArrayList<>();
        int active = 0;
        for (DetectorHandle handle : handles) {
            DetectorRunner.Outcome<Void> outcome = outcomes.get(handle.getId());
            if (outcome.succeeded()) {
                handle.markFitted();
            } else {
                failures.add(outcome.failure);
            }
            // a detector that failed in either phase sits out this fit cycle
            boolean usable = outcome.succeeded() && !calibrationFailures.contains(handle.getId());
            handle.setActive(usable);
            if (usable) {
                active++;
            } else if (outcome.succeeded()) {
                LOG.warn("Detector [{}] failed on the training split; inactive until the next fit", handle.getId());
            }
        }
        if (active == 0) {
            if (failures.isEmpty()) {
                throw new EnsembleFitException("No detector fitted in both the calibration and the full fit");
            }
            throw fitFailure(failures);
        }

        state.setColumnCount(columns);
        state.setLifecycle(EnsembleLifecycle.FITTED);
        LOG.info("Ensemble fitted in {} ms: {} of {} detector(s) active, weights={}, threshold={}, quorum={}",
                (System.nanoTime() - start) / 1_000_000, active, handles.size(),
                state.getWeights(), state.getThreshold(), state.getQuorum());
    }

    /**
     * Fit on the training split, then derive weights and threshold, or the
     * quorum, from the validation split.
     *
     * @return ids of the detectors that failed to fit on the training split
     */
    private Set<String> calibrate(double[][] train, double[][] validation, int[] validationLabels) {
        List<DetectorHandle> handles = state.getHandles();
        Map<String, DetectorRunner.Outcome<Void>> outcomes = fitAll(train, handles);
        Map<String, BaseDetector> fitted = new LinkedHashMap<>();
        Set<String> failed = new HashSet<>();
        for (DetectorHandle handle : handles) {
            boolean ok = outcomes.get(handle.getId()).succeeded();
            handle.setActive(ok);
            if (ok) {
                fitted.put(handle.getId(), handle.getDetector());
            } else {
                failed.add(handle.getId());
            }
        }
        if (fitted.isEmpty()) {
            LOG.warn("No detector could be fitted on the training split; skipping calibration");
            return failed;
        }

        if (state.getPolicy() == EnsemblePolicy.WEIGHTED) {
            state.applyWeights(recalibrationEngine.recalibrate(validation, validationLabels, fitted));
            ThresholdResult result = thresholdOptimizer.optimize(validation, validationLabels, this::combinedScores);
            state.setThreshold(result.threshold());
        } else if (optimizeQuorum) {
            Map<String, int[]> votes = collectVotes(validation);
            if (votes.isEmpty()) {
                LOG.warn("No voter labelled the validation split; keeping quorum {}", state.getQuorum());
                return failed;
            }
            int[] anomalousVotes = quorumCombiner.anomalousVotes(votes, validation.length);
            state.setQuorum(thresholdOptimizer.optimizeQuorum(
                    anomalousVotes, votes.size(), validationLabels, Math.min(state.getQuorum(), votes.size())));
        }
        return failed;
    }

    private Map<String, DetectorRunner.Outcome<Void>> fitAll(double[][] data, List<DetectorHandle> handles) {
        Map<String, Callable<Void>> tasks = new LinkedHashMap<>();
        for (DetectorHandle handle : handles) {
            BaseDetector detector = handle.getDetector();
            tasks.put(handle.getId(), () -> {
                detector.fit(data);
                return null;
            });
        }
        return runner.runAll(tasks, "fit");
    }

    private static EnsembleFitException fitFailure(List<Throwable> failures) {
        EnsembleFitException e = new EnsembleFitException(
                "All " + failures.size() + " detector(s) failed to fit", failures.get(0));
        for (Throwable other : failures.subList(1, failures.size())) {
            e.addSuppressed(other);
        }
        return e;
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    /**
     * Score a batch and report which detectors contributed.
     *
     * @param data matrix with the fit-time column count
     * @return the prediction; its status is {@link EnsembleStatus#UNAVAILABLE}
     *         if no detector contributed
     * @throws NotFittedException      before a successful fit
     * @throws SchemaMismatchException on a column count mismatch
     */
    public EnsemblePrediction evaluate(double[][] data) {
        int columns = Matrices.requireMatrix(data, "Input data");
        lock.readLock().lock();
        try {
            if (!state.isFitted()) {
                throw new NotFittedException("Ensemble is " + state.getLifecycle() + "; call fit() or load() first");
            }
            if (columns != state.getColumnCount()) {
                throw new SchemaMismatchException(state.getColumnCount(), columns);
            }
            EnsemblePrediction prediction = state.getPolicy() == EnsemblePolicy.WEIGHTED
                    ? scoreWeighted(data)
                    : scoreQuorum(data);
            if (prediction.status() != EnsembleStatus.HEALTHY) {
                LOG.warn("Batch of {} row(s): {}", data.length, prediction.describeStatus());
            }
            return prediction;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return {@code +1} normal / {@code -1} anomalous per row
     * @throws EnsembleUnavailableException if no detector contributed
     */
    public int[] predict(double[][] data) {
        return evaluate(data).labels();
    }

    /**
     * @return {@code 2 * score - 1} per row; positive = normal. Not
     *         comparable to raw detector scores.
     * @throws EnsembleUnavailableException if no detector contributed
     */
    public double[] decisionFunction(double[][] data) {
        return evaluate(data).decisionScores();
    }

    /**
     * @return per row {@code [P(anomalous), P(normal)]}, uncalibrated
     * @throws EnsembleUnavailableException if no detector contributed
     */
    public double[][] predictProba(double[][] data) {
        return evaluate(data).probabilities();
    }

    private EnsemblePrediction scoreWeighted(double[][] data) {
        List<DetectorHandle> active = state.activeHandles();
        Map<String, Callable<double[]>> tasks = new LinkedHashMap<>();
        for (DetectorHandle handle : active) {
            BaseDetector detector = handle.getDetector();
            tasks.put(handle.getId(), () -> requireLength(detector.decisionFunction(data), data.length));
        }
        Map<String, double[]> raw = successes(runner.runAll(tasks, "scoring"));
        if (raw.isEmpty()) {
            return EnsemblePrediction.unavailable(EnsemblePolicy.WEIGHTED, active.size());
        }
        NormalizedScoreVector normalized = NormalizedScoreVector.fromRaw(raw, data.length);
        double[] combined = weightedCombiner.combine(normalized, state.getWeights());
        int[] labels = weightedCombiner.predict(combined, state.getThreshold());
        return new EnsemblePrediction(EnsemblePolicy.WEIGHTED, labels, combined,
                new ArrayList<>(raw.keySet()), active.size());
    }

    private EnsemblePrediction scoreQuorum(double[][] data) {
        int voters = 0;
        for (DetectorHandle handle : state.activeHandles()) {
            if (handle.isVoting()) {
                voters++;
            }
        }
        Map<String, int[]> votes = collectVotes(data);
        if (votes.isEmpty()) {
            return EnsemblePrediction.unavailable(EnsemblePolicy.QUORUM, voters);
        }
        int[] labels = quorumCombiner.combine(votes, data.length, state.getQuorum());
        double[] normalShare = quorumCombiner.normalFraction(votes, data.length);
        return new EnsemblePrediction(EnsemblePolicy.QUORUM, labels, normalShare,
                new ArrayList<>(votes.keySet()), voters);
    }

    private Map<String, int[]> collectVotes(double[][] data) {
        Map<String, Callable<int[]>> tasks = new LinkedHashMap<>();
        for (DetectorHandle handle : state.activeHandles()) {
            if (handle.isVoting()) {
                BaseDetector detector = handle.getDetector();
                tasks.put(handle.getId(), () -> requireLength(detector.predict(data), data.length));
            }
        }
        return successes(runner.runAll(tasks, "voting"));
    }

    /** Combined scores with the current weights, {@code NaN} if unavailable. */
    private double[] combinedScores(double[][] data) {
        EnsemblePrediction prediction = scoreWeighted(data);
        if (prediction.status() == EnsembleStatus.UNAVAILABLE) {
            double[] missing = new double[data.length];
            Arrays.fill(missing, Double.NaN);
            return missing;
        }
        return prediction.scores();
    }

    private static <T> Map<String, T> successes(Map<String, DetectorRunner.Outcome<T>> outcomes) {
        Map<String, T> values = new LinkedHashMap<>();
        for (Map.Entry<String, DetectorRunner.Outcome<T>> entry : outcomes.entrySet()) {
            if (entry.getValue().succeeded()) {
                values.put(entry.getKey(), entry.getValue().value);
            }
        }
        return values;
    }

    private static double[] requireLength(double[] scores, int rows) {
        if (scores == null || scores.length != rows) {
            throw new IllegalStateException("Detector returned "
                    + (scores == null ? "no" : String.valueOf(scores.length)) + " score(s) for " + rows + " row(s)");
        }
        return scores;
    }

    private static int[] requireLength(int[] labels, int rows) {
        if (labels == null || labels.length != rows) {
            throw new IllegalStateException("Detector returned "
                    + (labels == null ? "no" : String.valueOf(labels.length)) + " label(s) for " + rows + " row(s)");
        }
        return labels;
    }

    // ---------------------------------------------------------------
    // Persistence and lifecycle
    // ---------------------------------------------------------------

    /**
     * Save the whole ensemble state as one bundle.
     *
     * @param path target file
     * @throws NotFittedException    before a successful fit
     * @throws IllegalStateException if the file cannot be written
     */
    public void save(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        lock.writeLock().lock();
        try {
            if (!state.isFitted()) {
                throw new NotFittedException("Cannot save an ensemble that is " + state.getLifecycle());
            }
            EnsembleBundleStore.write(path, state.toBundle());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the whole ensemble state with a saved bundle.
     *
     * @param path bundle file
     * @throws IllegalArgumentException if the bundle's roster, policy or
     *                                  detector families differ from this
     *                                  ensemble's; the state is then left
     *                                  unchanged
     */
    public void load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        lock.writeLock().lock();
        try {
            state.restore(EnsembleBundleStore.read(path));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Back to the configured weights, threshold and quorum, unfitted.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            state.reset();
            LOG.info("Ensemble reset");
        } finally {
            lock.writeLock().unlock();
        }
    }

    public EnsembleLifecycle lifecycle() {
        return state.getLifecycle();
    }

    public EnsemblePolicy policy() {
        return state.getPolicy();
    }

    public Set<String> detectorIds() {
        return state.getDetectorIds();
    }

    /**
     * @return effective weights, summing to 1 over the active detectors
     */
    public Map<String, Double> weights() {
        lock.readLock().lock();
        try {
            return state.getWeights();
        } finally {
            lock.readLock().unlock();
        }
    }

    public double threshold() {
        lock.readLock().lock();
        try {
            return state.getThreshold();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int quorum() {
        lock.readLock().lock();
        try {
            return state.getQuorum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return ids of the detectors that are active in the current fit cycle
     */
    public List<String> activeDetectors() {
        lock.readLock().lock();
        try {
            List<String> ids = new ArrayList<>();
            for (DetectorHandle handle : state.activeHandles()) {
                ids.add(handle.getId());
            }
            return Collections.unmodifiableList(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param id detector id
     * @return family of the detector registered under {@code id}
     * @throws IllegalArgumentException if no such detector exists
     */
    public String family(String id) {
        DetectorHandle handle = state.getHandle(id);
        if (handle == null) {
            throw new IllegalArgumentException("Unknown detector id: '" + id + "'");
        }
        lock.readLock().lock();
        try {
            return handle.getFamily();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Stops the detector worker pool. */
    @Override
    public void close() {
        runner.close();
    }

    @Override
    public String toString() {
        return "AnomalyEnsemble{" + state + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link AnomalyEnsemble}. At least one detector is required;
     * everything else has a default.
     */
    public static final class Builder {

        private final List<DetectorHandle> roster = new ArrayList<>();
        private final Map<BaseDetector, String> seen = new IdentityHashMap<>();
        private EnsemblePolicy policy = EnsemblePolicy.WEIGHTED;
        private double threshold = ThresholdOptimizer.DEFAULT_THRESHOLD;
        private Integer quorum;
        private boolean optimizeQuorum = true;
        private double validationFraction = 0.2;
        private long randomSeed = 42L;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private Duration detectorTimeout = Duration.ofMinutes(5);
        private ThresholdOptimizer thresholdOptimizer = new ThresholdOptimizer();

        private Builder() {
        }

        /** Add a voting detector with weight 1. */
        public Builder detector(String id, BaseDetector detector) {
            return detector(id, detector, 1.0, true);
        }

        /**
         * Add a detector to the roster.
         *
         * @param id       stable id, used in bundles and logs
         * @param detector an unfitted detector instance, not shared with
         *                 another roster entry
         * @param weight   initial weight, &gt;= 0
         * @param voting   whether it votes in quorum mode
         * @return this builder
         */
        public Builder detector(String id, BaseDetector detector, double weight, boolean voting) {
            Objects.requireNonNull(detector, "detector must not be null");
            String previous = seen.putIfAbsent(detector, id);
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                        "Detectors '%s' and '%s' are the same instance", previous, id));
            }
            roster.add(new DetectorHandle(id, detector, weight, voting));
            return this;
        }

        public Builder policy(EnsemblePolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder quorum(int quorum) {
            this.quorum = quorum;
            return this;
        }

        public Builder optimizeQuorum(boolean optimizeQuorum) {
            this.optimizeQuorum = optimizeQuorum;
            return this;
        }

        public Builder validationFraction(double validationFraction) {
            this.validationFraction = validationFraction;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder detectorTimeout(Duration detectorTimeout) {
            this.detectorTimeout = Objects.requireNonNull(detectorTimeout, "detectorTimeout must not be null");
            return this;
        }

        public Builder thresholdOptimizer(ThresholdOptimizer thresholdOptimizer) {
            this.thresholdOptimizer = Objects.requireNonNull(thresholdOptimizer,
                    "thresholdOptimizer must not be null");
            return this;
        }

        /**
         * @return a new, unfitted ensemble
         * @throws IllegalArgumentException if the roster is empty, or an
         *                                  option is out of range
         */
        public AnomalyEnsemble build() {
            return new AnomalyEnsemble(this);
        }
    }
}
