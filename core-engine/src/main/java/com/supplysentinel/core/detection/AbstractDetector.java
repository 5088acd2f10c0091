package com.supplysentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Template for detectors whose label is derived from their own decision
 * score.
 *
 * <p>
 * After {@link #doFit(double[][])} has built the model, the training rows are
 * scored and the {@code contamination} quantile of those scores becomes the
 * label cutoff: rows scoring strictly below it are labelled anomalous.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * Fitted state lives in non-final fields, serialized by field access.
 * Subclasses need a no-arg constructor for Jackson.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public abstract class AbstractDetector implements BaseDetector {

    /** Expected share of anomalies in the training data. */
    protected double contamination;

    /** Decision score below which a row is labelled anomalous. */
    protected double labelCutoff;

    /** Column count seen at fit time. */
    protected int columnCount;

    protected boolean fitted;

    protected AbstractDetector() {
    }

    protected AbstractDetector(double contamination) {
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must lie in (0, 0.5), got: " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public final void fit(double[][] data) {
        int columns = Matrices.requireMatrix(data, "Training data");
        Matrices.requireFinite(data, "Training data");
        if (data.length < minimumRows()) {
            throw new IllegalArgumentException(String.format(
                    "%s detector needs at least %d rows to fit, got %d",
                    family(), minimumRows(), data.length));
        }
        fitted = false;
        columnCount = columns;
        doFit(data);
        labelCutoff = cutoffFor(score(data));
        fitted = true;
    }

    @Override
    public int[] predict(double[][] data) {
        double[] scores = decisionFunction(data);
        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = scores[i] < labelCutoff ? -1 : 1;
        }
        return labels;
    }

    @Override
    public double[] decisionFunction(double[][] data) {
        requireFitted();
        int columns = Matrices.requireMatrix(data, "Input data");
        if (columns != columnCount) {
            throw new IllegalArgumentException(String.format(
                    "%s detector was fitted on %d columns, got %d",
                    family(), columnCount, columns));
        }
        return score(data);
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    // ---------------------------------------------------------------
    // Extension points
    // ---------------------------------------------------------------

    /**
     * Build the model from validated, finite training data.
     *
     * @param data training matrix
     */
    protected abstract void doFit(double[][] data);

    /**
     * Score rows against the model built by {@link #doFit(double[][])}.
     *
     * @param data validated matrix
     * @return one decision score per row, higher = more normal
     */
    protected abstract double[] score(double[][] data);

    /**
     * @return minimum training rows this detector can fit on
     */
    protected int minimumRows() {
        return 2;
    }

    /**
     * @param trainingScores decision scores of the training rows
     * @return the label cutoff
     */
    protected double cutoffFor(double[] trainingScores) {
        return Matrices.quantile(trainingScores, contamination);
    }

    protected void requireFitted() {
        if (!fitted) {
            throw new IllegalStateException(family() + " detector has not been fitted yet");
        }
    }
}
