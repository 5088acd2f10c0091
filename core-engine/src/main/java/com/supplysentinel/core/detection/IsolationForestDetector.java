package com.supplysentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.supplysentinel.core.model.DetectorSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest: anomalies are isolated by fewer random axis-aligned
 * splits than normal points.
 *
 * <p>
 * The anomaly score of a row is {@code s = 2^(-E[h(x)] / c(n))}, where
 * {@code h(x)} is the path length in one tree and {@code c(n)} the average
 * path length of an unsuccessful binary-search-tree lookup over {@code n}
 * samples. The decision score is {@code -s}, so higher means more normal.
 * </p>
 *
 * <p>
 * Tree construction is seeded; fitting twice on the same data yields the same
 * forest.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector extends AbstractDetector {

    private int numTrees;
    private int sampleSize;
    private long randomSeed;

    /** Sample size actually used per tree (bounded by the training rows). */
    private int effectiveSampleSize;

    private List<Node> trees = new ArrayList<>();

    IsolationForestDetector() {
    }

    /**
     * @param contamination expected share of anomalies in (0, 0.5)
     * @param numTrees      number of isolation trees, &gt;= 1
     * @param sampleSize    sub-sample size per tree, &gt;= 2
     * @param randomSeed    seed for sub-sampling and splits
     */
    public IsolationForestDetector(double contamination, int numTrees, int sampleSize, long randomSeed) {
        super(contamination);
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2, got: " + sampleSize);
        }
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
    }

    @Override
    public String family() {
        return DetectorSpec.ISOLATION_FOREST;
    }

    @Override
    protected void doFit(double[][] data) {
        effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(effectiveSampleSize) / Math.log(2));
        Random random = new Random(randomSeed);

        List<Node> forest = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            double[][] sample = subsample(data, effectiveSampleSize, random);
            forest.add(build(sample, 0, maxDepth, random));
        }
        trees = forest;
    }

    @Override
    protected double[] score(double[][] data) {
        double c = averagePathLength(effectiveSampleSize);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double meanPath = 0;
            for (Node tree : trees) {
                meanPath += tree.pathLength(data[i], 0);
            }
            meanPath /= trees.size();
            double anomalyScore = c > 0 ? Math.pow(2.0, -meanPath / c) : 0.5;
            scores[i] = -anomalyScore;
        }
        return scores;
    }

    // ---------------------------------------------------------------
    // Tree construction
    // ---------------------------------------------------------------

    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        // partial Fisher-Yates
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static Node build(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;
        if (depth >= maxDepth || n <= 1) {
            return Node.leaf(n);
        }

        int feature = random.nextInt(data[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : data) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        if (min >= max) {
            return Node.leaf(n);
        }

        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : data) {
            if (row[feature] < split) {
                leftCount++;
            }
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : data) {
            if (row[feature] < split) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }
        return Node.split(feature, split,
                build(left, depth + 1, maxDepth, random),
                build(right, depth + 1, maxDepth, random));
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + 0.5772156649015329;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    /** One node of an isolation tree; leaves carry their sample count. */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            isGetterVisibility = JsonAutoDetect.Visibility.NONE)
    static final class Node {
        private int feature = -1;
        private double split;
        private int size;
        private Node left;
        private Node right;

        Node() {
        }

        static Node leaf(int size) {
            Node node = new Node();
            node.size = size;
            return node;
        }

        static Node split(int feature, double split, Node left, Node right) {
            Node node = new Node();
            node.feature = feature;
            node.split = split;
            node.left = left;
            node.right = right;
            return node;
        }

        double pathLength(double[] row, int depth) {
            if (feature < 0) {
                return depth + averagePathLength(size);
            }
            return row[feature] < split
                    ? left.pathLength(row, depth + 1)
                    : right.pathLength(row, depth + 1);
        }
    }
}
