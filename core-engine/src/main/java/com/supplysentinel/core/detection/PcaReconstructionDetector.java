package com.supplysentinel.core.detection;

import com.supplysentinel.core.model.DetectorSpec;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Reconstruction-error detector on the principal subspace.
 *
 * <p>
 * Features are standardized, then projected onto the leading principal
 * components that together explain {@code varianceRetained} of the training
 * variance. The decision score is the negated mean squared reconstruction
 * error, so rows the subspace cannot reproduce score low. At least one
 * component is always left out, otherwise every row would reconstruct
 * perfectly.
 * </p>
 *
 * @since 1.0.0
 */
public class PcaReconstructionDetector extends AbstractDetector {

    private double varianceRetained;
    private FeatureScaler scaler;

    /** Retained components, one unit-length row per component. */
    private double[][] components;

    PcaReconstructionDetector() {
    }

    /**
     * @param contamination    expected share of anomalies in (0, 0.5)
     * @param varianceRetained explained-variance target in (0, 1]
     */
    public PcaReconstructionDetector(double contamination, double varianceRetained) {
        super(contamination);
        if (varianceRetained <= 0 || varianceRetained > 1) {
            throw new IllegalArgumentException(
                    "varianceRetained must be in (0, 1], got: " + varianceRetained);
        }
        this.varianceRetained = varianceRetained;
    }

    @Override
    public String family() {
        return DetectorSpec.PCA_RECONSTRUCTION;
    }

    /**
     * @return number of principal components kept by the last fit
     */
    public int componentCount() {
        requireFitted();
        return components.length;
    }

    @Override
    protected void doFit(double[][] data) {
        FeatureScaler fittedScaler = FeatureScaler.fit(data);
        double[][] scaled = fittedScaler.transform(data);
        int columns = scaled[0].length;

        RealMatrix covariance = new Covariance(scaled, false).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();

        Integer[] order = new Integer[eigenvalues.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

        double total = 0;
        for (double value : eigenvalues) {
            total += Math.max(value, 0);
        }

        int keep = 0;
        double explained = 0;
        int maxKeep = columns - 1;
        while (keep < maxKeep && (total <= 0 || explained / total < varianceRetained)) {
            explained += Math.max(eigenvalues[order[keep]], 0);
            keep++;
        }

        double[][] retained = new double[keep][];
        for (int k = 0; k < keep; k++) {
            retained[k] = eigen.getEigenvector(order[k]).unitVector().toArray();
        }
        scaler = fittedScaler;
        components = retained;
    }

    @Override
    protected double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double[] z = scaler.transform(data[i]);
            double[] reconstruction = new double[z.length];
            for (double[] component : components) {
                double projection = 0;
                for (int j = 0; j < z.length; j++) {
                    projection += z[j] * component[j];
                }
                for (int j = 0; j < z.length; j++) {
                    reconstruction[j] += projection * component[j];
                }
            }
            double error = 0;
            for (int j = 0; j < z.length; j++) {
                double d = z[j] - reconstruction[j];
                error += d * d;
            }
            scores[i] = -(error / z.length);
        }
        return scores;
    }
}
