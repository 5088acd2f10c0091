package com.supplysentinel.core.calibration;

import java.util.Locale;

/**
 * The single objective the threshold search optimizes.
 *
 * @since 1.0.0
 */
public enum ThresholdObjective {

    /** Maximize F1 on the anomalous class. */
    F1,

    /** Minimize {@code fp * fpCost + fn * fnCost}. */
    BUSINESS_COST;

    /**
     * Goodness of a candidate; higher is better for both objectives.
     *
     * @param metrics           confusion counts of the candidate
     * @param falsePositiveCost cost of one false positive
     * @param falseNegativeCost cost of one false negative
     * @return F1, or the negated business cost
     */
    double goodness(ClassificationMetrics metrics, double falsePositiveCost, double falseNegativeCost) {
        return switch (this) {
            case F1 -> metrics.f1();
            case BUSINESS_COST -> -metrics.cost(falsePositiveCost, falseNegativeCost);
        };
    }

    /**
     * Parse an objective name such as {@code f1} or {@code business-cost}.
     *
     * @param name objective name
     * @return the objective
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ThresholdObjective fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Threshold objective must not be blank");
        }
        String normalised = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown threshold objective: '" + name
                    + "'. Supported: f1, business-cost", e);
        }
    }
}
