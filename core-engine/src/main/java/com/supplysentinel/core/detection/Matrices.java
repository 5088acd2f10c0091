package com.supplysentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Shape checks and small numeric helpers shared by detectors and the
 * ensemble.
 *
 * @since 1.0.0
 */
public final class Matrices {

    private Matrices() {
        // utility class, not instantiable
    }

    /**
     * Verify that {@code data} is a non-empty rectangular matrix.
     *
     * @param data the matrix
     * @param what description used in error messages
     * @return the column count
     * @throws IllegalArgumentException if the matrix is empty or ragged
     */
    public static int requireMatrix(double[][] data, String what) {
        Objects.requireNonNull(data, what + " must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException(what + " must contain at least one row");
        }
        Objects.requireNonNull(data[0], what + " row 0 is null");
        int columns = data[0].length;
        if (columns == 0) {
            throw new IllegalArgumentException(what + " must contain at least one column");
        }
        for (int i = 1; i < data.length; i++) {
            Objects.requireNonNull(data[i], what + " row " + i + " is null");
            if (data[i].length != columns) {
                throw new IllegalArgumentException(String.format(
                        "%s row %d has %d columns, expected %d", what, i, data[i].length, columns));
            }
        }
        return columns;
    }

    /**
     * Verify that every cell of {@code data} is finite.
     *
     * @param data the matrix
     * @param what description used in error messages
     * @throws IllegalArgumentException on the first NaN or infinite cell
     */
    public static void requireFinite(double[][] data, String what) {
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[i].length; j++) {
                if (!Double.isFinite(data[i][j])) {
                    throw new IllegalArgumentException(String.format(
                            "%s contains a non-finite value at [%d][%d]", what, i, j));
                }
            }
        }
    }

    /**
     * Select rows by index without copying the rows themselves.
     *
     * @param data    source matrix
     * @param indices row indices
     * @return a new outer array referencing the selected rows
     */
    public static double[][] rows(double[][] data, int[] indices) {
        double[][] selected = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = data[indices[i]];
        }
        return selected;
    }

    /**
     * Lower quantile of {@code values}.
     *
     * @param values   sample, not modified
     * @param fraction quantile in (0, 1]
     * @return the estimated quantile
     */
    public static double quantile(double[] values, double fraction) {
        if (values.length == 1) {
            return values[0];
        }
        return new Percentile().evaluate(values, fraction * 100.0);
    }

    /**
     * @param a first vector
     * @param b second vector of the same length
     * @return Euclidean distance between {@code a} and {@code b}
     */
    public static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
