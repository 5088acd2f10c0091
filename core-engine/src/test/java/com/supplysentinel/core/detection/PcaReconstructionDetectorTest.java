package com.supplysentinel.core.detection;

import com.supplysentinel.core.TelemetryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PcaReconstructionDetector}.
 */
class PcaReconstructionDetectorTest {

    private double[][] correlated;

    @BeforeEach
    void setUp() {
        // two strongly correlated features: one principal direction
        correlated = TelemetryFixtures.normalRows(300, 2, 13L);
        for (double[] row : correlated) {
            row[1] = row[0] + 0.1 * row[1];
        }
    }

    @Test
    @DisplayName("Should keep only the components needed for the variance target")
    void shouldRetainLeadingComponent() {
        PcaReconstructionDetector detector = new PcaReconstructionDetector(0.1, 0.9);

        detector.fit(correlated);

        assertThat(detector.componentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should flag a row off the principal subspace")
    void shouldFlagOffSubspaceRow() {
        PcaReconstructionDetector detector = new PcaReconstructionDetector(0.1, 0.9);
        detector.fit(correlated);

        double[][] probes = { { 1.0, 1.0 }, { 2.0, -2.0 } };
        double[] scores = detector.decisionFunction(probes);

        assertThat(scores[0]).isGreaterThan(scores[1]);
        assertThat(detector.predict(probes)).containsExactly(1, -1);
    }

    @Test
    @DisplayName("Should always leave at least one component out")
    void shouldLeaveOneComponentOut() {
        PcaReconstructionDetector detector = new PcaReconstructionDetector(0.1, 1.0);

        detector.fit(TelemetryFixtures.normalRows(100, 4, 3L));

        assertThat(detector.componentCount()).isEqualTo(3);
    }
}
