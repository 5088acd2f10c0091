package com.supplysentinel.core.ensemble;

import java.util.Objects;

/**
 * Per-batch min-max scaling of one detector's raw decision scores onto the
 * common [0, 1] normality scale, 1.0 being the most normal row of the batch.
 *
 * <p>
 * Each detector is normalized on its own minimum and maximum; scores of
 * different detectors are never mixed. A batch whose finite scores span no
 * more than {@value #EPSILON} (a single row, or a detector returning a
 * constant) maps to the midpoint 0.5. Non-finite scores stay {@code NaN} and
 * are ignored when finding the range.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoreNormalizer {

    /** Smallest score range treated as non-degenerate. */
    public static final double EPSILON = 1e-10;

    /** Value of every row of a degenerate batch. */
    public static final double MIDPOINT = 0.5;

    private ScoreNormalizer() {
        // utility class, not instantiable
    }

    /**
     * Normalize one detector's scores for one batch. The input is not
     * modified.
     *
     * @param rawScores raw decision scores, higher = more normal
     * @return scores in [0, 1], or {@code NaN} where the input was not finite
     */
    public static double[] normalize(double[] rawScores) {
        Objects.requireNonNull(rawScores, "rawScores must not be null");
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double score : rawScores) {
            if (Double.isFinite(score)) {
                min = Math.min(min, score);
                max = Math.max(max, score);
            }
        }

        boolean degenerate = !(max - min > EPSILON);
        double range = max - min;
        double[] normalized = new double[rawScores.length];
        for (int i = 0; i < rawScores.length; i++) {
            double score = rawScores[i];
            if (!Double.isFinite(score)) {
                normalized[i] = Double.NaN;
            } else if (degenerate) {
                normalized[i] = MIDPOINT;
            } else {
                normalized[i] = (score - min) / range;
            }
        }
        return normalized;
    }
}
