package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.TelemetryFixtures;
import com.supplysentinel.core.config.EnsembleConfig;
import com.supplysentinel.core.config.EnsembleConfigLoader;
import com.supplysentinel.core.detection.IsolationForestDetector;
import com.supplysentinel.core.detection.MahalanobisDensityDetector;
import com.supplysentinel.core.detection.RobustZscoreDetector;
import com.supplysentinel.core.model.EnsemblePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Save/load tests for {@link AnomalyEnsemble}.
 */
class EnsemblePersistenceTest {

    @TempDir
    Path tempDir;

    private final double[][] data = TelemetryFixtures.withAnomalies(90, 10, 3, 7L);
    private final int[] labels = TelemetryFixtures.labels(90, 10);
    private final double[][] batch = TelemetryFixtures.withAnomalies(20, 5, 3, 99L);

    @Test
    @DisplayName("Should reproduce predictions bit for bit after save and load")
    void shouldRoundTripEveryDetectorFamily() {
        EnsembleConfig config = EnsembleConfigLoader.fromClasspath("ensemble.yml");
        Path bundle = tempDir.resolve("bundles/ensemble.json");

        try (AnomalyEnsemble original = AnomalyEnsemble.fromConfig(config);
                AnomalyEnsemble restored = AnomalyEnsemble.fromConfig(config)) {
            original.fit(data, labels);
            original.save(bundle);
            restored.load(bundle);

            assertThat(restored.lifecycle()).isEqualTo(EnsembleLifecycle.FITTED);
            assertThat(restored.weights()).isEqualTo(original.weights());
            assertThat(restored.threshold()).isEqualTo(original.threshold());
            assertThat(restored.decisionFunction(batch)).containsExactly(original.decisionFunction(batch));
            assertThat(restored.predict(batch)).containsExactly(original.predict(batch));
        }
    }

    @Test
    @DisplayName("Should restore the quorum of a quorum ensemble")
    void shouldRoundTripQuorumEnsemble() {
        Path bundle = tempDir.resolve("quorum.json");

        try (AnomalyEnsemble original = quorumEnsemble(); AnomalyEnsemble restored = quorumEnsemble()) {
            original.fit(data);
            original.save(bundle);
            restored.load(bundle);

            assertThat(restored.quorum()).isEqualTo(original.quorum());
            assertThat(restored.predict(batch)).containsExactly(original.predict(batch));
        }
    }

    @Test
    @DisplayName("Should refuse to save before fit")
    void shouldNotSaveUnfitted() {
        try (AnomalyEnsemble ensemble = pair("zscore", "density")) {
            assertThatThrownBy(() -> ensemble.save(tempDir.resolve("x.json")))
                    .isInstanceOf(NotFittedException.class);
        }
        assertThat(tempDir.resolve("x.json")).doesNotExist();
    }

    @Test
    @DisplayName("Should reject a bundle whose detector ids differ from the roster")
    void shouldRejectRosterMismatch() {
        Path bundle = tempDir.resolve("pair.json");
        try (AnomalyEnsemble original = pair("zscore", "density");
                AnomalyEnsemble other = pair("zscore", "forest")) {
            original.fit(data);
            original.save(bundle);

            assertThatThrownBy(() -> other.load(bundle))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing [forest]")
                    .hasMessageContaining("extra [density]");
            assertThat(other.lifecycle()).isEqualTo(EnsembleLifecycle.UNFITTED);
        }
    }

    @Test
    @DisplayName("Should reject a bundle whose detector family differs from the configuration")
    void shouldRejectFamilyMismatch() {
        Path bundle = tempDir.resolve("pair.json");
        try (AnomalyEnsemble original = pair("zscore", "density");
                AnomalyEnsemble other = AnomalyEnsemble.builder()
                        .detector("zscore", new RobustZscoreDetector(0.1))
                        .detector("density", new RobustZscoreDetector(0.1))
                        .build()) {
            original.fit(data);
            original.save(bundle);

            assertThatThrownBy(() -> other.load(bundle))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is a mahalanobis in the bundle but configured as robust-zscore");
        }
    }

    @Test
    @DisplayName("Should reject a bundle saved under another policy")
    void shouldRejectPolicyMismatch() {
        Path bundle = tempDir.resolve("quorum.json");
        try (AnomalyEnsemble original = quorumEnsemble();
                AnomalyEnsemble weighted = AnomalyEnsemble.builder()
                        .detector("zscore", new RobustZscoreDetector(0.1))
                        .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                        .detector("forest", new IsolationForestDetector(0.1, 20, 64, 1L))
                        .build()) {
            original.fit(data);
            original.save(bundle);

            assertThatThrownBy(() -> weighted.load(bundle))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("policy");
        }
    }

    @Test
    @DisplayName("Should report a missing or malformed bundle file")
    void shouldRejectUnreadableBundle() throws Exception {
        Path garbage = tempDir.resolve("garbage.json");
        Files.writeString(garbage, "{ not json");

        try (AnomalyEnsemble ensemble = pair("zscore", "density")) {
            assertThatThrownBy(() -> ensemble.load(tempDir.resolve("missing.json")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not found");
            assertThatThrownBy(() -> ensemble.load(garbage))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Malformed");
        }
    }

    private static AnomalyEnsemble pair(String first, String second) {
        return AnomalyEnsemble.builder()
                .detector(first, new RobustZscoreDetector(0.1))
                .detector(second, second.equals("forest")
                        ? new IsolationForestDetector(0.1, 20, 64, 1L)
                        : new MahalanobisDensityDetector(0.1, 1e-6))
                .build();
    }

    private static AnomalyEnsemble quorumEnsemble() {
        return AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                .detector("forest", new IsolationForestDetector(0.1, 20, 64, 1L))
                .policy(EnsemblePolicy.QUORUM)
                .build();
    }
}
