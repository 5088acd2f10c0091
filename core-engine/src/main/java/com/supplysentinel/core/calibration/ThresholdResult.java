package com.supplysentinel.core.calibration;

/**
 * Outcome of a threshold search.
 *
 * @since 1.0.0
 */
public final class ThresholdResult {

    private final double threshold;
    private final double objectiveValue;
    private final boolean fallback;

    ThresholdResult(double threshold, double objectiveValue, boolean fallback) {
        this.threshold = threshold;
        this.objectiveValue = objectiveValue;
        this.fallback = fallback;
    }

    /**
     * @return the chosen threshold, on the scale of the scores searched
     */
    public double threshold() {
        return threshold;
    }

    /**
     * @return F1 or business cost at the chosen threshold; {@code NaN} on
     *         fallback
     */
    public double objectiveValue() {
        return objectiveValue;
    }

    /**
     * @return {@code true} if the search could not run and the default
     *         threshold was returned
     */
    public boolean isFallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return "ThresholdResult{threshold=" + threshold
                + ", objectiveValue=" + objectiveValue
                + ", fallback=" + fallback + '}';
    }
}
