package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.model.Label;

import java.util.Map;
import java.util.Objects;

/**
 * Agreement-counting combination of detector labels.
 *
 * <p>
 * A row is anomalous iff at least {@code quorum} detectors voted it
 * anomalous. Score magnitudes are ignored, which lets detectors that only
 * emit a binary outlier flag take part on equal terms. With quorum 1 the
 * vote is a logical OR, with quorum equal to the voter count a logical AND.
 * </p>
 *
 * <p>
 * When detectors drop out of a batch the quorum is capped at the number of
 * detectors that did vote.
 * </p>
 *
 * @since 1.0.0
 */
public class QuorumCombiner {

    /**
     * Default quorum for {@code voters} detectors: unanimity for one or two
     * voters, strict majority from three voters on.
     *
     * @param voters number of voting detectors, &gt;= 1
     * @return the default quorum
     */
    public static int defaultQuorum(int voters) {
        if (voters < 1) {
            throw new IllegalArgumentException("voters must be >= 1, got: " + voters);
        }
        return voters <= 2 ? voters : voters / 2 + 1;
    }

    /**
     * Count anomalous votes per row.
     *
     * @param votes labels keyed by detector id, all of length {@code rows}
     * @param rows  batch size
     * @return anomalous-vote count per row
     */
    public int[] anomalousVotes(Map<String, int[]> votes, int rows) {
        Objects.requireNonNull(votes, "votes must not be null");
        int[] counts = new int[rows];
        for (Map.Entry<String, int[]> entry : votes.entrySet()) {
            int[] labels = entry.getValue();
            if (labels.length != rows) {
                throw new IllegalArgumentException(String.format(
                        "Detector [%s] returned %d label(s) for %d row(s)", entry.getKey(), labels.length, rows));
            }
            for (int i = 0; i < rows; i++) {
                if (Label.isAnomalous(labels[i])) {
                    counts[i]++;
                }
            }
        }
        return counts;
    }

    /**
     * Combine a batch of votes.
     *
     * @param votes  labels of the detectors that voted, keyed by id
     * @param rows   batch size
     * @param quorum configured quorum, &gt;= 1
     * @return {@code -1} where the anomalous votes reach the quorum,
     *         {@code +1} otherwise
     */
    public int[] combine(Map<String, int[]> votes, int rows, int quorum) {
        if (quorum < 1) {
            throw new IllegalArgumentException("quorum must be >= 1, got: " + quorum);
        }
        if (votes.isEmpty()) {
            throw new IllegalArgumentException("Cannot combine an empty vote");
        }
        int effective = Math.min(quorum, votes.size());
        int[] counts = anomalousVotes(votes, rows);
        int[] labels = new int[rows];
        for (int i = 0; i < rows; i++) {
            labels[i] = counts[i] >= effective ? Label.ANOMALOUS.value() : Label.NORMAL.value();
        }
        return labels;
    }

    /**
     * Share of voters that found each row normal; the quorum ensemble's
     * continuous score.
     *
     * @param votes labels keyed by detector id
     * @param rows  batch size
     * @return normal-vote fraction per row, in [0, 1]
     */
    public double[] normalFraction(Map<String, int[]> votes, int rows) {
        int[] counts = anomalousVotes(votes, rows);
        double[] fraction = new double[rows];
        int voters = votes.size();
        for (int i = 0; i < rows; i++) {
            fraction[i] = voters == 0 ? Double.NaN : (double) (voters - counts[i]) / voters;
        }
        return fraction;
    }
}
