package com.supplysentinel.core.calibration;

import com.supplysentinel.core.model.Label;

import java.util.Objects;

/**
 * Confusion counts and derived scores for a binary labelling, with
 * <strong>anomalous</strong> as the positive class.
 *
 * <p>
 * Ratios with a zero denominator are reported as {@code 0.0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationMetrics {

    private final int truePositives;
    private final int falsePositives;
    private final int falseNegatives;
    private final int trueNegatives;

    private ClassificationMetrics(int tp, int fp, int fn, int tn) {
        this.truePositives = tp;
        this.falsePositives = fp;
        this.falseNegatives = fn;
        this.trueNegatives = tn;
    }

    /**
     * Compare predicted labels with ground truth.
     *
     * @param actual    ground truth, {@code +1} / {@code -1}
     * @param predicted predictions of the same length
     * @return the confusion counts
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static ClassificationMetrics of(int[] actual, int[] predicted) {
        Objects.requireNonNull(actual, "actual labels must not be null");
        Objects.requireNonNull(predicted, "predicted labels must not be null");
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(String.format(
                    "Label arrays differ in length: %d actual vs %d predicted",
                    actual.length, predicted.length));
        }
        int tp = 0;
        int fp = 0;
        int fn = 0;
        int tn = 0;
        for (int i = 0; i < actual.length; i++) {
            boolean isAnomaly = Label.isAnomalous(actual[i]);
            boolean flagged = Label.isAnomalous(predicted[i]);
            if (isAnomaly && flagged) {
                tp++;
            } else if (flagged) {
                fp++;
            } else if (isAnomaly) {
                fn++;
            } else {
                tn++;
            }
        }
        return new ClassificationMetrics(tp, fp, fn, tn);
    }

    /**
     * @param labels {@code +1} / {@code -1} labels
     * @return {@code true} if at least one normal and one anomalous label occur
     */
    public static boolean hasBothClasses(int[] labels) {
        boolean normal = false;
        boolean anomalous = false;
        for (int label : labels) {
            if (Label.isAnomalous(label)) {
                anomalous = true;
            } else {
                normal = true;
            }
            if (normal && anomalous) {
                return true;
            }
        }
        return false;
    }

    public double precision() {
        int flagged = truePositives + falsePositives;
        return flagged == 0 ? 0.0 : (double) truePositives / flagged;
    }

    public double recall() {
        int anomalies = truePositives + falseNegatives;
        return anomalies == 0 ? 0.0 : (double) truePositives / anomalies;
    }

    public double f1() {
        double p = precision();
        double r = recall();
        return p + r == 0 ? 0.0 : 2 * p * r / (p + r);
    }

    /**
     * Business cost of the errors.
     *
     * @param falsePositiveCost cost of flagging a normal record
     * @param falseNegativeCost cost of missing an anomaly
     * @return {@code fp * fpCost + fn * fnCost}
     */
    public double cost(double falsePositiveCost, double falseNegativeCost) {
        return falsePositives * falsePositiveCost + falseNegatives * falseNegativeCost;
    }

    public int truePositives() {
        return truePositives;
    }

    public int falsePositives() {
        return falsePositives;
    }

    public int falseNegatives() {
        return falseNegatives;
    }

    public int trueNegatives() {
        return trueNegatives;
    }

    @Override
    public String toString() {
        return String.format("ClassificationMetrics{tp=%d, fp=%d, fn=%d, tn=%d, precision=%.4f, recall=%.4f, f1=%.4f}",
                truePositives, falsePositives, falseNegatives, trueNegatives, precision(), recall(), f1());
    }
}
