package com.supplysentinel.core.detection;

import com.supplysentinel.core.TelemetryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestDetector}.
 */
class IsolationForestDetectorTest {

    private static final double[][] PROBES = { { 0, 0, 0 }, { 8, -8, 8 } };

    @Test
    @DisplayName("Should isolate a distant row faster than a central one")
    void shouldScoreOutlierLower() {
        IsolationForestDetector detector = new IsolationForestDetector(0.1, 100, 256, 42L);
        detector.fit(TelemetryFixtures.normalRows(300, 3, 21L));

        double[] scores = detector.decisionFunction(PROBES);

        assertThat(scores[1]).isLessThan(scores[0]);
        assertThat(detector.predict(PROBES)).containsExactly(1, -1);
    }

    @Test
    @DisplayName("Should keep anomaly scores within [-1, 0]")
    void shouldBoundScores() {
        IsolationForestDetector detector = new IsolationForestDetector(0.1, 50, 64, 42L);
        detector.fit(TelemetryFixtures.normalRows(100, 2, 4L));

        double[] scores = detector.decisionFunction(TelemetryFixtures.normalRows(20, 2, 5L));

        assertThat(Arrays.stream(scores).allMatch(s -> s >= -1.0 && s <= 0.0)).isTrue();
    }

    @Test
    @DisplayName("Should build the same forest for the same seed")
    void shouldBeDeterministic() {
        double[][] data = TelemetryFixtures.normalRows(150, 3, 8L);
        IsolationForestDetector first = new IsolationForestDetector(0.1, 30, 64, 7L);
        IsolationForestDetector second = new IsolationForestDetector(0.1, 30, 64, 7L);

        first.fit(data);
        second.fit(data);

        assertThat(first.decisionFunction(PROBES)).containsExactly(second.decisionFunction(PROBES));
    }

    @Test
    @DisplayName("Should cap the per-tree sample at the number of training rows")
    void shouldFitOnSmallData() {
        IsolationForestDetector detector = new IsolationForestDetector(0.1, 10, 256, 1L);

        detector.fit(TelemetryFixtures.normalRows(5, 3, 1L));

        assertThat(detector.isFitted()).isTrue();
        assertThat(detector.decisionFunction(PROBES)).hasSize(2);
    }

    @Test
    @DisplayName("Should reject invalid hyper-parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new IsolationForestDetector(0.1, 0, 256, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForestDetector(0.1, 10, 1, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForestDetector(0.6, 10, 16, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
