package com.supplysentinel.core.detection;

import com.supplysentinel.core.model.DetectorSpec;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Boundary detector on robust z-scores.
 *
 * <p>
 * Each feature is centred on its training median and scaled by its median
 * absolute deviation (times 1.4826, the normal-consistency constant). The
 * decision score of a row is the negated largest absolute robust z-score
 * over its features. Features with zero MAD fall back to the standard
 * deviation, then to a unit scale.
 * </p>
 *
 * @since 1.0.0
 */
public class RobustZscoreDetector extends AbstractDetector {

    static final double MAD_CONSISTENCY = 1.4826;

    private double[] medians;
    private double[] scales;

    RobustZscoreDetector() {
    }

    /**
     * @param contamination expected share of anomalies in (0, 0.5)
     */
    public RobustZscoreDetector(double contamination) {
        super(contamination);
    }

    @Override
    public String family() {
        return DetectorSpec.ROBUST_ZSCORE;
    }

    @Override
    protected int minimumRows() {
        return 1;
    }

    @Override
    protected void doFit(double[][] data) {
        int columns = data[0].length;
        double[] centre = new double[columns];
        double[] spread = new double[columns];
        Median median = new Median();
        double[] column = new double[data.length];
        double[] deviations = new double[data.length];

        for (int j = 0; j < columns; j++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
                stats.addValue(data[i][j]);
            }
            centre[j] = median.evaluate(column);
            for (int i = 0; i < data.length; i++) {
                deviations[i] = Math.abs(column[i] - centre[j]);
            }
            double mad = MAD_CONSISTENCY * median.evaluate(deviations);
            if (mad > 0) {
                spread[j] = mad;
            } else {
                double sd = stats.getStandardDeviation();
                spread[j] = sd > 0 ? sd : 1.0;
            }
        }
        medians = centre;
        scales = spread;
    }

    @Override
    protected double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double worst = 0;
            for (int j = 0; j < medians.length; j++) {
                worst = Math.max(worst, Math.abs(data[i][j] - medians[j]) / scales[j]);
            }
            scores[i] = -worst;
        }
        return scores;
    }
}
