package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.model.Label;

import java.util.Map;
import java.util.Objects;

/**
 * Weighted-average combination of normalized detector scores.
 *
 * <p>
 * For each row, the weights of the detectors that scored that row are
 * re-normalized to sum to 1 before averaging, so a detector missing from a
 * batch (or from a single row) biases the result neither toward normal nor
 * toward anomalous. When the weights of the present detectors sum to zero
 * they are averaged uniformly. A row no detector scored combines to
 * {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public class WeightedCombiner {

    /**
     * Combine a batch.
     *
     * @param normalized normalized scores of the contributing detectors
     * @param weights    weight per detector id; ids absent from this map
     *                   weigh 0
     * @return combined normality score per row, in [0, 1]
     */
    public double[] combine(NormalizedScoreVector normalized, Map<String, Double> weights) {
        Objects.requireNonNull(normalized, "normalized scores must not be null");
        Objects.requireNonNull(weights, "weights must not be null");

        double[] combined = new double[normalized.rows()];
        for (int row = 0; row < combined.length; row++) {
            double weightSum = 0;
            int present = 0;
            for (String id : normalized.detectorIds()) {
                if (!Double.isNaN(normalized.score(id, row))) {
                    weightSum += weights.getOrDefault(id, 0.0);
                    present++;
                }
            }
            if (present == 0) {
                combined[row] = Double.NaN;
                continue;
            }

            double score = 0;
            for (String id : normalized.detectorIds()) {
                double value = normalized.score(id, row);
                if (Double.isNaN(value)) {
                    continue;
                }
                double share = weightSum > 0
                        ? weights.getOrDefault(id, 0.0) / weightSum
                        : 1.0 / present;
                score += share * value;
            }
            combined[row] = Math.min(1.0, Math.max(0.0, score));
        }
        return combined;
    }

    /**
     * Threshold combined scores.
     *
     * @param combined  combined scores
     * @param threshold decision threshold on the combined scale
     * @return {@code +1} where the score exceeds the threshold, {@code -1}
     *         otherwise (including rows without a score)
     */
    public int[] predict(double[] combined, double threshold) {
        int[] labels = new int[combined.length];
        for (int i = 0; i < combined.length; i++) {
            labels[i] = combined[i] > threshold ? Label.NORMAL.value() : Label.ANOMALOUS.value();
        }
        return labels;
    }

    /**
     * Rescale combined scores to the signed detector convention.
     *
     * @param combined combined scores in [0, 1]
     * @return {@code 2 * score - 1}: positive = normal, negative = anomalous
     */
    public double[] decisionFunction(double[] combined) {
        double[] signed = new double[combined.length];
        for (int i = 0; i < combined.length; i++) {
            signed[i] = 2 * combined[i] - 1;
        }
        return signed;
    }
}
