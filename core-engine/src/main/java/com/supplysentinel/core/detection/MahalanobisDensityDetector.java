package com.supplysentinel.core.detection;

import com.supplysentinel.core.model.DetectorSpec;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * Gaussian density detector.
 *
 * <p>
 * Fits the mean vector and covariance of the training data; the decision
 * score of a row is its negated Mahalanobis distance from the mean, so rows
 * in low-density regions score low. The covariance is ridge-regularised and
 * inverted through an SVD pseudo-inverse, which keeps constant or collinear
 * features from making the model singular.
 * </p>
 *
 * @since 1.0.0
 */
public class MahalanobisDensityDetector extends AbstractDetector {

    private double regularization;
    private double[] mean;
    private double[][] inverseCovariance;

    MahalanobisDensityDetector() {
    }

    /**
     * @param contamination  expected share of anomalies in (0, 0.5)
     * @param regularization ridge added to the covariance diagonal, &gt;= 0
     */
    public MahalanobisDensityDetector(double contamination, double regularization) {
        super(contamination);
        if (regularization < 0) {
            throw new IllegalArgumentException("regularization must be >= 0, got: " + regularization);
        }
        this.regularization = regularization;
    }

    @Override
    public String family() {
        return DetectorSpec.MAHALANOBIS;
    }

    @Override
    protected void doFit(double[][] data) {
        int columns = data[0].length;
        double[] centre = new double[columns];
        for (double[] row : data) {
            for (int j = 0; j < columns; j++) {
                centre[j] += row[j];
            }
        }
        for (int j = 0; j < columns; j++) {
            centre[j] /= data.length;
        }

        RealMatrix covariance = new Covariance(data, false).getCovarianceMatrix();
        for (int j = 0; j < columns; j++) {
            covariance.addToEntry(j, j, regularization);
        }
        RealMatrix inverse = new SingularValueDecomposition(covariance).getSolver().getInverse();

        mean = centre;
        inverseCovariance = inverse.getData();
    }

    @Override
    protected double[] score(double[][] data) {
        RealMatrix precision = MatrixUtils.createRealMatrix(inverseCovariance);
        double[] scores = new double[data.length];
        double[] delta = new double[mean.length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < delta.length; j++) {
                delta[j] = data[i][j] - mean[j];
            }
            double[] projected = precision.operate(delta);
            double squared = 0;
            for (int j = 0; j < delta.length; j++) {
                squared += delta[j] * projected[j];
            }
            scores[i] = -Math.sqrt(Math.max(squared, 0));
        }
        return scores;
    }
}
