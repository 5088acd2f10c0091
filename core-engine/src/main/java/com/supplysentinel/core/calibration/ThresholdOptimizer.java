package com.supplysentinel.core.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Grid search for the operating point of the ensemble.
 *
 * <h3>Threshold search</h3>
 * <p>
 * The score function is evaluated once over the validation split. Candidate
 * thresholds are {@code steps} evenly spaced points between the lowest and
 * highest observed score; a row is predicted anomalous iff its score is
 * strictly below the candidate. The candidate with the best configured
 * {@link ThresholdObjective} wins, ties going to the lower threshold since
 * missed anomalies are the more expensive error.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * A validation split without both classes, without finite scores, or on
 * which no candidate reaches a positive F1 yields the default threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdOptimizer.class);

    public static final double DEFAULT_THRESHOLD = 0.5;
    public static final int DEFAULT_STEPS = 20;
    public static final double DEFAULT_FALSE_POSITIVE_COST = 1.0;
    public static final double DEFAULT_FALSE_NEGATIVE_COST = 5.0;

    private final ThresholdObjective objective;
    private final int steps;
    private final double falsePositiveCost;
    private final double falseNegativeCost;

    /**
     * Optimizer maximizing F1 over {@value #DEFAULT_STEPS} candidates.
     */
    public ThresholdOptimizer() {
        this(ThresholdObjective.F1, DEFAULT_STEPS, DEFAULT_FALSE_POSITIVE_COST, DEFAULT_FALSE_NEGATIVE_COST);
    }

    /**
     * @param objective         the single objective to optimize
     * @param steps             number of candidate thresholds, &gt;= 2
     * @param falsePositiveCost cost of a false positive, &gt;= 0
     * @param falseNegativeCost cost of a false negative, &gt;= 0
     */
    public ThresholdOptimizer(ThresholdObjective objective, int steps,
            double falsePositiveCost, double falseNegativeCost) {
        this.objective = Objects.requireNonNull(objective, "objective must not be null");
        if (steps < 2) {
            throw new IllegalArgumentException("steps must be >= 2, got: " + steps);
        }
        if (falsePositiveCost < 0 || falseNegativeCost < 0) {
            throw new IllegalArgumentException("Error costs must be >= 0");
        }
        this.steps = steps;
        this.falsePositiveCost = falsePositiveCost;
        this.falseNegativeCost = falseNegativeCost;
    }

    /**
     * Search the threshold on a validation split.
     *
     * @param validation       validation rows
     * @param validationLabels ground truth, {@code +1} / {@code -1}
     * @param scoreFunction    combiner score function; higher = more normal
     * @return the chosen threshold
     */
    public ThresholdResult optimize(double[][] validation, int[] validationLabels,
            Function<double[][], double[]> scoreFunction) {
        Objects.requireNonNull(scoreFunction, "scoreFunction must not be null");
        if (!ClassificationMetrics.hasBothClasses(validationLabels)) {
            LOG.info("Validation split lacks one class; keeping default threshold {}", DEFAULT_THRESHOLD);
            return fallback();
        }
        return optimize(scoreFunction.apply(validation), validationLabels);
    }

    /**
     * Search the threshold on precomputed validation scores. Rows with a
     * non-finite score are ignored.
     *
     * @param scores           combined scores, one per row
     * @param validationLabels ground truth of the same length
     * @return the chosen threshold
     */
    public ThresholdResult optimize(double[] scores, int[] validationLabels) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(validationLabels, "validationLabels must not be null");
        if (scores.length != validationLabels.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d scores for %d labels", scores.length, validationLabels.length));
        }

        int[] finite = finiteRows(scores);
        double[] usable = new double[finite.length];
        int[] labels = new int[finite.length];
        for (int i = 0; i < finite.length; i++) {
            usable[i] = scores[finite[i]];
            labels[i] = validationLabels[finite[i]];
        }
        if (!ClassificationMetrics.hasBothClasses(labels)) {
            LOG.info("Validation split lacks one class; keeping default threshold {}", DEFAULT_THRESHOLD);
            return fallback();
        }

        double min = Arrays.stream(usable).min().orElseThrow();
        double max = Arrays.stream(usable).max().orElseThrow();
        if (min == max) {
            LOG.info("Validation scores are constant; keeping default threshold {}", DEFAULT_THRESHOLD);
            return fallback();
        }

        double bestThreshold = Double.NaN;
        double bestGoodness = Double.NEGATIVE_INFINITY;
        ClassificationMetrics bestMetrics = null;
        int[] predicted = new int[usable.length];
        for (int k = 0; k < steps; k++) {
            double candidate = k == steps - 1 ? max : min + k * (max - min) / (steps - 1);
            for (int i = 0; i < usable.length; i++) {
                predicted[i] = usable[i] < candidate ? -1 : 1;
            }
            ClassificationMetrics metrics = ClassificationMetrics.of(labels, predicted);
            double goodness = objective.goodness(metrics, falsePositiveCost, falseNegativeCost);
            if (goodness > bestGoodness) {
                bestGoodness = goodness;
                bestThreshold = candidate;
                bestMetrics = metrics;
            }
        }

        if (objective == ThresholdObjective.F1 && bestGoodness <= 0) {
            LOG.info("No threshold reaches a positive F1; keeping default threshold {}", DEFAULT_THRESHOLD);
            return fallback();
        }

        double reported = objective == ThresholdObjective.F1
                ? bestMetrics.f1()
                : bestMetrics.cost(falsePositiveCost, falseNegativeCost);
        LOG.info("Optimized threshold: {} ({}={}, {})",
                String.format("%.4f", bestThreshold), objective, String.format("%.4f", reported), bestMetrics);
        return new ThresholdResult(bestThreshold, reported, false);
    }

    /**
     * Search the quorum of a vote-counting ensemble: a row is predicted
     * anomalous iff its anomalous-vote count reaches the candidate quorum.
     * Ties go to the lower quorum.
     *
     * @param anomalousVotes   anomalous votes per validation row
     * @param voters           number of voting detectors, &gt;= 1
     * @param validationLabels ground truth of the same length
     * @param defaultQuorum    returned when the search cannot run
     * @return the chosen quorum in [1, voters]
     */
    public int optimizeQuorum(int[] anomalousVotes, int voters, int[] validationLabels, int defaultQuorum) {
        Objects.requireNonNull(anomalousVotes, "anomalousVotes must not be null");
        if (voters < 1) {
            throw new IllegalArgumentException("voters must be >= 1, got: " + voters);
        }
        if (anomalousVotes.length != validationLabels.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d vote counts for %d labels", anomalousVotes.length, validationLabels.length));
        }
        if (!ClassificationMetrics.hasBothClasses(validationLabels)) {
            LOG.info("Validation split lacks one class; keeping quorum {}", defaultQuorum);
            return defaultQuorum;
        }

        int bestQuorum = defaultQuorum;
        double bestGoodness = Double.NEGATIVE_INFINITY;
        int[] predicted = new int[anomalousVotes.length];
        for (int quorum = 1; quorum <= voters; quorum++) {
            for (int i = 0; i < anomalousVotes.length; i++) {
                predicted[i] = anomalousVotes[i] >= quorum ? -1 : 1;
            }
            double goodness = objective.goodness(
                    ClassificationMetrics.of(validationLabels, predicted), falsePositiveCost, falseNegativeCost);
            if (goodness > bestGoodness) {
                bestGoodness = goodness;
                bestQuorum = quorum;
            }
        }
        if (objective == ThresholdObjective.F1 && bestGoodness <= 0) {
            LOG.info("No quorum reaches a positive F1; keeping quorum {}", defaultQuorum);
            return defaultQuorum;
        }
        LOG.info("Optimized quorum: {} of {} voter(s)", bestQuorum, voters);
        return bestQuorum;
    }

    public ThresholdObjective getObjective() {
        return objective;
    }

    private static ThresholdResult fallback() {
        return new ThresholdResult(DEFAULT_THRESHOLD, Double.NaN, true);
    }

    private static int[] finiteRows(double[] scores) {
        return IntStream.range(0, scores.length)
                .filter(i -> Double.isFinite(scores[i]))
                .toArray();
    }
}
