package com.supplysentinel.core.ensemble;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized scores of one batch, keyed by detector id.
 *
 * <p>
 * Only detectors that produced scores for the batch appear. Every array has
 * one entry per row, in [0, 1] or {@code NaN} for a row the detector could
 * not score. Built fresh for each prediction call and never persisted.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizedScoreVector {

    private final Map<String, double[]> scores;
    private final int rows;

    private NormalizedScoreVector(Map<String, double[]> scores, int rows) {
        this.scores = scores;
        this.rows = rows;
    }

    /**
     * Normalize raw decision scores of several detectors, each against its own
     * batch range.
     *
     * @param rawScores raw scores keyed by detector id, all the same length
     * @param rows      batch size
     * @return the normalized vector
     * @throws IllegalArgumentException if an array length differs from
     *                                  {@code rows}
     */
    public static NormalizedScoreVector fromRaw(Map<String, double[]> rawScores, int rows) {
        Objects.requireNonNull(rawScores, "rawScores must not be null");
        Map<String, double[]> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : rawScores.entrySet()) {
            requireLength(entry.getKey(), entry.getValue(), rows);
            normalized.put(entry.getKey(), ScoreNormalizer.normalize(entry.getValue()));
        }
        return new NormalizedScoreVector(Collections.unmodifiableMap(normalized), rows);
    }

    /**
     * Wrap already-normalized scores.
     *
     * @param normalizedScores scores in [0, 1] or {@code NaN}, keyed by id
     * @param rows             batch size
     * @return the vector
     * @throws IllegalArgumentException if a length differs from {@code rows}
     *                                  or a finite score lies outside [0, 1]
     */
    public static NormalizedScoreVector of(Map<String, double[]> normalizedScores, int rows) {
        Objects.requireNonNull(normalizedScores, "normalizedScores must not be null");
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : normalizedScores.entrySet()) {
            requireLength(entry.getKey(), entry.getValue(), rows);
            for (double score : entry.getValue()) {
                if (score < 0 || score > 1) {
                    throw new IllegalArgumentException("Detector [" + entry.getKey()
                            + "] has a normalized score outside [0, 1]: " + score);
                }
            }
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        return new NormalizedScoreVector(Collections.unmodifiableMap(copy), rows);
    }

    /**
     * @return ids of the detectors that scored this batch
     */
    public Set<String> detectorIds() {
        return scores.keySet();
    }

    /**
     * @param detectorId detector id
     * @return normalized score of row {@code row}, or {@code NaN} if the
     *         detector did not score it
     */
    public double score(String detectorId, int row) {
        double[] values = scores.get(detectorId);
        return values == null ? Double.NaN : values[row];
    }

    public int rows() {
        return rows;
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    private static void requireLength(String id, double[] values, int rows) {
        Objects.requireNonNull(values, "Scores of detector [" + id + "] must not be null");
        if (values.length != rows) {
            throw new IllegalArgumentException(String.format(
                    "Detector [%s] returned %d score(s) for %d row(s)", id, values.length, rows));
        }
    }

    @Override
    public String toString() {
        return "NormalizedScoreVector{detectors=" + scores.keySet() + ", rows=" + rows + '}';
    }
}
