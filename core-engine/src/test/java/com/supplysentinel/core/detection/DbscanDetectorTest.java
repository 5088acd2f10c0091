package com.supplysentinel.core.detection;

import com.supplysentinel.core.TelemetryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DbscanDetector}.
 */
class DbscanDetectorTest {

    @Test
    @DisplayName("Should flag a row far from every cluster")
    void shouldFlagNoiseRow() {
        DbscanDetector detector = new DbscanDetector(0.5, 5);
        detector.fit(TelemetryFixtures.normalRows(200, 2, 17L));

        assertThat(detector.predict(new double[][] { { 0, 0 }, { 9, 9 } })).containsExactly(1, -1);
    }

    @Test
    @DisplayName("Should only emit a binary decision score")
    void shouldEmitBinaryScore() {
        DbscanDetector detector = new DbscanDetector(0.5, 5);
        detector.fit(TelemetryFixtures.normalRows(200, 2, 17L));

        double[] scores = detector.decisionFunction(TelemetryFixtures.normalRows(30, 2, 18L));

        assertThat(detector.providesContinuousScore()).isFalse();
        assertThat(scores).contains(1.0);
        assertThat(Arrays.stream(scores).allMatch(s -> s == 1.0 || s == -1.0)).isTrue();
    }

    @Test
    @DisplayName("Should flag every row when no cluster is found")
    void shouldFlagEverythingWithoutClusters() {
        DbscanDetector detector = new DbscanDetector(0.01, 5);
        detector.fit(new double[][] { { 0, 0 }, { 5, 5 }, { 10, 0 } });

        assertThat(detector.predict(new double[][] { { 0, 0 } })).containsExactly(-1);
    }

    @Test
    @DisplayName("Should reject a non-positive eps or minSamples")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new DbscanDetector(0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DbscanDetector(0.5, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
