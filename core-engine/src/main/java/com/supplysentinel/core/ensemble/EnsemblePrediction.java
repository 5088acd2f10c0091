package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.model.EnsemblePolicy;
import com.supplysentinel.core.model.EnsembleStatus;

import java.util.List;

/**
 * Result of scoring one batch, with the health of the evaluation.
 *
 * <p>
 * {@link #scores()} is the combined normality score in [0, 1]: the weighted
 * average of normalized detector scores, or the share of voters that found
 * the row normal. A row that no detector could score has a {@code NaN} score
 * and is labelled anomalous.
 * </p>
 *
 * <p>
 * When no detector contributed ({@link EnsembleStatus#UNAVAILABLE}) the
 * result accessors throw {@link EnsembleUnavailableException}; the status
 * accessors always work.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsemblePrediction {

    private final EnsemblePolicy policy;
    private final int[] labels;
    private final double[] scores;
    private final List<String> contributing;
    private final int activeDetectors;
    private final EnsembleStatus status;

    EnsemblePrediction(EnsemblePolicy policy, int[] labels, double[] scores,
            List<String> contributing, int activeDetectors) {
        this.policy = policy;
        this.labels = labels;
        this.scores = scores;
        this.contributing = List.copyOf(contributing);
        this.activeDetectors = activeDetectors;
        if (this.contributing.isEmpty()) {
            this.status = EnsembleStatus.UNAVAILABLE;
        } else if (this.contributing.size() < activeDetectors) {
            this.status = EnsembleStatus.DEGRADED;
        } else {
            this.status = EnsembleStatus.HEALTHY;
        }
    }

    static EnsemblePrediction unavailable(EnsemblePolicy policy, int activeDetectors) {
        return new EnsemblePrediction(policy, null, null, List.of(), activeDetectors);
    }

    public EnsembleStatus status() {
        return status;
    }

    public EnsemblePolicy policy() {
        return policy;
    }

    /**
     * @return ids of the detectors that contributed to this batch
     */
    public List<String> contributingDetectors() {
        return contributing;
    }

    /**
     * @return detectors expected to contribute (active, and voting in
     *         quorum mode)
     */
    public int activeDetectors() {
        return activeDetectors;
    }

    /**
     * @return e.g. {@code "2 of 3 detectors contributed"}
     */
    public String describeStatus() {
        return switch (status) {
            case HEALTHY -> "all " + activeDetectors + " detector(s) contributed";
            case DEGRADED -> "ensemble degraded (" + contributing.size() + " of " + activeDetectors
                    + " detectors contributed)";
            case UNAVAILABLE -> "ensemble unavailable (0 of " + activeDetectors + " detectors contributed)";
        };
    }

    /**
     * @return {@code +1} normal / {@code -1} anomalous per row
     */
    public int[] labels() {
        requireAvailable();
        return labels.clone();
    }

    /**
     * @return combined normality score per row, in [0, 1] or {@code NaN}
     */
    public double[] scores() {
        requireAvailable();
        return scores.clone();
    }

    /**
     * @return {@code 2 * score - 1} per row: positive = normal
     */
    public double[] decisionScores() {
        requireAvailable();
        double[] signed = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            signed[i] = 2 * scores[i] - 1;
        }
        return signed;
    }

    /**
     * Uncalibrated pseudo-probabilities, usable for ranking only.
     *
     * @return per row {@code [P(anomalous), P(normal)]}
     */
    public double[][] probabilities() {
        requireAvailable();
        double[][] proba = new double[scores.length][2];
        for (int i = 0; i < scores.length; i++) {
            proba[i][0] = 1.0 - scores[i];
            proba[i][1] = scores[i];
        }
        return proba;
    }

    public int rows() {
        requireAvailable();
        return labels.length;
    }

    private void requireAvailable() {
        if (status == EnsembleStatus.UNAVAILABLE) {
            throw new EnsembleUnavailableException(describeStatus());
        }
    }

    @Override
    public String toString() {
        return "EnsemblePrediction{policy=" + policy + ", status=" + status
                + ", contributing=" + contributing + '}';
    }
}
