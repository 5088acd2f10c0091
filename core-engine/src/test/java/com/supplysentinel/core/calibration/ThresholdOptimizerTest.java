package com.supplysentinel.core.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdOptimizer}.
 */
class ThresholdOptimizerTest {

    @Test
    @DisplayName("Should reach F1 = 1 on perfectly separated scores")
    void shouldSeparatePerfectly() {
        double[] scores = { 0.0, 0.05, 0.9, 0.95, 1.0 };
        int[] labels = { -1, -1, 1, 1, 1 };

        ThresholdResult result = new ThresholdOptimizer().optimize(scores, labels);

        assertThat(result.isFallback()).isFalse();
        assertThat(result.objectiveValue()).isEqualTo(1.0);
        assertThat(result.threshold()).isGreaterThan(0.05).isLessThanOrEqualTo(0.9);
    }

    @Test
    @DisplayName("Should keep the lowest of equally good thresholds")
    void shouldPreferLowerThresholdOnTies() {
        // every candidate in (0, 1] separates the two rows
        double[] scores = { 0.0, 1.0 };
        int[] labels = { -1, 1 };

        ThresholdResult result = new ThresholdOptimizer().optimize(scores, labels);

        assertThat(result.threshold()).isCloseTo(1.0 / 19, within(1e-12));
    }

    @Test
    @DisplayName("Should evaluate the score function exactly once")
    void shouldEvaluateScoreFunctionOnce() {
        AtomicInteger calls = new AtomicInteger();
        double[][] validation = { { 0 }, { 1 }, { 2 }, { 3 } };

        new ThresholdOptimizer().optimize(validation, new int[] { -1, -1, 1, 1 }, rows -> {
            calls.incrementAndGet();
            return new double[] { 0.1, 0.2, 0.8, 0.9 };
        });

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Should fall back to 0.5 when the split lacks a class")
    void shouldFallBackOnSingleClass() {
        ThresholdResult result = new ThresholdOptimizer().optimize(new double[] { 0.1, 0.9 }, new int[] { 1, 1 });

        assertThat(result.isFallback()).isTrue();
        assertThat(result.threshold()).isEqualTo(ThresholdOptimizer.DEFAULT_THRESHOLD);
    }

    @Test
    @DisplayName("Should fall back to 0.5 on constant or non-finite scores")
    void shouldFallBackOnDegenerateScores() {
        ThresholdOptimizer optimizer = new ThresholdOptimizer();

        assertThat(optimizer.optimize(new double[] { 0.4, 0.4 }, new int[] { -1, 1 }).isFallback()).isTrue();
        assertThat(optimizer.optimize(new double[] { Double.NaN, 0.3 }, new int[] { -1, 1 }).isFallback()).isTrue();
    }

    @Test
    @DisplayName("Should fall back when no threshold flags an anomaly correctly")
    void shouldFallBackWhenF1IsZero() {
        // anomalies score higher than every normal row
        ThresholdResult result = new ThresholdOptimizer().optimize(
                new double[] { 1.0, 1.0, 0.0, 0.1 }, new int[] { -1, -1, 1, 1 });

        assertThat(result.isFallback()).isTrue();
    }

    @Test
    @DisplayName("Should trade false positives for fewer false negatives under business cost")
    void shouldMinimizeBusinessCost() {
        double[] scores = { 0.0, 0.5, 0.6, 1.0 };
        int[] labels = { -1, -1, 1, 1 };
        ThresholdOptimizer optimizer = new ThresholdOptimizer(ThresholdObjective.BUSINESS_COST, 3, 1.0, 5.0);

        ThresholdResult result = optimizer.optimize(scores, labels);

        // candidates 0.0, 0.5, 1.0: costs 10, 5 and 1
        assertThat(result.threshold()).isEqualTo(1.0);
        assertThat(result.objectiveValue()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should choose the quorum that best separates the validation split")
    void shouldOptimizeQuorum() {
        int[] anomalousVotes = { 3, 2, 1, 0, 1 };
        int[] labels = { -1, -1, 1, 1, 1 };

        int quorum = new ThresholdOptimizer().optimizeQuorum(anomalousVotes, 3, labels, 3);

        assertThat(quorum).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep the default quorum when the split lacks a class")
    void shouldKeepDefaultQuorum() {
        int quorum = new ThresholdOptimizer().optimizeQuorum(new int[] { 0, 1 }, 3, new int[] { 1, 1 }, 2);

        assertThat(quorum).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject fewer than two steps and negative costs")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new ThresholdOptimizer(ThresholdObjective.F1, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThresholdOptimizer(ThresholdObjective.F1, 20, -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should resolve objective names leniently")
    void shouldParseObjectiveNames() {
        assertThat(ThresholdObjective.fromName("f1")).isEqualTo(ThresholdObjective.F1);
        assertThat(ThresholdObjective.fromName("business-cost")).isEqualTo(ThresholdObjective.BUSINESS_COST);
        assertThatThrownBy(() -> ThresholdObjective.fromName("accuracy"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
