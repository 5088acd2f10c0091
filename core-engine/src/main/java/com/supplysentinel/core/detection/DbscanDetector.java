package com.supplysentinel.core.detection;

import com.supplysentinel.core.model.DetectorSpec;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Clustering detector based on DBSCAN.
 *
 * <p>
 * Training rows are standardized and clustered; the core points of every
 * cluster are kept. A new row is normal iff it lies within {@code eps} of a
 * core point, i.e. it would join an existing cluster. The detector produces
 * only a binary outlier flag: its decision score is {@code +1} or {@code -1}.
 * </p>
 *
 * @since 1.0.0
 */
public class DbscanDetector extends AbstractDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DbscanDetector.class);

    private double eps;
    private int minSamples;
    private FeatureScaler scaler;
    private double[][] corePoints;

    DbscanDetector() {
    }

    /**
     * @param eps        neighbourhood radius in standardized units, &gt; 0
     * @param minSamples neighbours (excluding the point) a core point needs
     */
    public DbscanDetector(double eps, int minSamples) {
        if (eps <= 0) {
            throw new IllegalArgumentException("eps must be > 0, got: " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    @Override
    public String family() {
        return DetectorSpec.DBSCAN;
    }

    @Override
    public boolean providesContinuousScore() {
        return false;
    }

    @Override
    protected int minimumRows() {
        return 1;
    }

    @Override
    protected void doFit(double[][] data) {
        FeatureScaler fittedScaler = FeatureScaler.fit(data);
        double[][] scaled = fittedScaler.transform(data);

        List<DoublePoint> points = new ArrayList<>(scaled.length);
        for (double[] row : scaled) {
            points.add(new DoublePoint(row));
        }
        List<Cluster<DoublePoint>> clusters = new DBSCANClusterer<DoublePoint>(eps, minSamples).cluster(points);

        List<double[]> cores = new ArrayList<>();
        int clustered = 0;
        for (Cluster<DoublePoint> cluster : clusters) {
            for (DoublePoint member : cluster.getPoints()) {
                clustered++;
                if (isCore(member.getPoint(), scaled)) {
                    cores.add(member.getPoint());
                }
            }
        }
        if (cores.isEmpty()) {
            LOG.warn("DBSCAN found no clusters in {} rows (eps={}, minSamples={}); every row will be flagged",
                    data.length, eps, minSamples);
        } else {
            LOG.debug("DBSCAN found {} cluster(s), {} noise row(s), {} core point(s)",
                    clusters.size(), data.length - clustered, cores.size());
        }
        scaler = fittedScaler;
        corePoints = cores.toArray(new double[0][]);
    }

    @Override
    protected double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = nearCore(scaler.transform(data[i])) ? 1.0 : -1.0;
        }
        return scores;
    }

    @Override
    protected double cutoffFor(double[] trainingScores) {
        return 0.0;
    }

    private boolean isCore(double[] point, double[][] all) {
        // the point itself is within eps, so a core point needs minSamples + 1 hits
        int withinEps = 0;
        for (double[] other : all) {
            if (Matrices.distance(point, other) <= eps && ++withinEps > minSamples) {
                return true;
            }
        }
        return false;
    }

    private boolean nearCore(double[] row) {
        for (double[] core : corePoints) {
            if (Matrices.distance(row, core) <= eps) {
                return true;
            }
        }
        return false;
    }
}
