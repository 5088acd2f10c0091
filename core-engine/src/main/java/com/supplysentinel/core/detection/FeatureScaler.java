package com.supplysentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Per-column standardization (zero mean, unit variance) learnt from
 * training data. Columns with zero variance keep a unit scale.
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
final class FeatureScaler {

    private double[] means;
    private double[] scales;

    FeatureScaler() {
    }

    static FeatureScaler fit(double[][] data) {
        int columns = data[0].length;
        FeatureScaler scaler = new FeatureScaler();
        scaler.means = new double[columns];
        scaler.scales = new double[columns];
        for (int j = 0; j < columns; j++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : data) {
                stats.addValue(row[j]);
            }
            scaler.means[j] = stats.getMean();
            // population deviation, as the usual standard scaler
            double sd = Math.sqrt(stats.getPopulationVariance());
            scaler.scales[j] = sd > 0 ? sd : 1.0;
        }
        return scaler;
    }

    double[] transform(double[] row) {
        double[] scaled = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            scaled[j] = (row[j] - means[j]) / scales[j];
        }
        return scaled;
    }

    double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }
}
