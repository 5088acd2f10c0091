package com.supplysentinel.core.ensemble;

import com.supplysentinel.core.TelemetryFixtures;
import com.supplysentinel.core.detection.IsolationForestDetector;
import com.supplysentinel.core.detection.MahalanobisDensityDetector;
import com.supplysentinel.core.detection.RobustZscoreDetector;
import com.supplysentinel.core.model.EnsemblePolicy;
import com.supplysentinel.core.model.EnsembleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyEnsemble}.
 */
class AnomalyEnsembleTest {

    private static final int NORMAL = 90;
    private static final int ANOMALOUS = 10;

    private final List<AnomalyEnsemble> created = new ArrayList<>();
    private double[][] data;
    private int[] labels;

    @BeforeEach
    void setUp() {
        data = TelemetryFixtures.withAnomalies(NORMAL, ANOMALOUS, 3, 42L);
        labels = TelemetryFixtures.labels(NORMAL, ANOMALOUS);
    }

    @AfterEach
    void tearDown() {
        created.forEach(AnomalyEnsemble::close);
    }

    // ------------------------------------------------------------------
    // Weighted policy
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should fit around a failing detector and renormalize the remaining weights")
    void shouldContainDetectorFitFailure() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                .detector("broken", new StubDetector(StubDetector.Mode.FAIL_FIT))
                .parallelism(2)
                .build());

        ensemble.fit(data, labels);

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.FITTED);
        assertThat(ensemble.activeDetectors()).containsExactly("zscore", "density");
        Map<String, Double> weights = ensemble.weights();
        assertThat(weights.get("broken")).isZero();
        assertThat(weights.get("zscore") + weights.get("density")).isCloseTo(1.0, within(1e-9));
        assertThat(ensemble.predict(data)).hasSize(data.length);
    }

    @Test
    @DisplayName("Should rank spiked rows below normal rows")
    void shouldRankAnomaliesLowest() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());
        ensemble.fit(data, labels);

        double[] decision = ensemble.decisionFunction(data);

        double normalMean = IntStream.range(0, NORMAL).mapToDouble(i -> decision[i]).average().orElseThrow();
        double anomalyMean = IntStream.range(NORMAL, data.length).mapToDouble(i -> decision[i]).average()
                .orElseThrow();
        int lowest = IntStream.range(0, decision.length)
                .reduce((a, b) -> decision[a] <= decision[b] ? a : b).orElseThrow();
        assertThat(anomalyMean).isLessThan(normalMean);
        assertThat(lowest).isGreaterThanOrEqualTo(NORMAL);
        assertThat(ensemble.threshold()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should keep the configured weights and threshold when fitted without labels")
    void shouldKeepCalibrationWithoutLabels() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1), 3.0, true)
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6), 1.0, true)
                .threshold(0.35)
                .build());

        ensemble.fit(data);

        assertThat(ensemble.weights().get("zscore")).isCloseTo(0.75, within(1e-12));
        assertThat(ensemble.weights().get("density")).isCloseTo(0.25, within(1e-12));
        assertThat(ensemble.threshold()).isEqualTo(0.35);
    }

    @Test
    @DisplayName("Should use uniform weights and the default threshold when labels hold one class")
    void shouldFallBackOnSingleClassLabels() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());
        int[] allNormal = new int[data.length];
        Arrays.fill(allNormal, 1);

        ensemble.fit(data, allNormal);

        assertThat(ensemble.weights().values()).allSatisfy(w -> assertThat(w).isCloseTo(0.5, within(1e-12)));
        assertThat(ensemble.threshold()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should return identical results for repeated predictions and refits")
    void shouldBeDeterministic() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());
        ensemble.fit(data, labels);
        double[] first = ensemble.decisionFunction(data);

        assertThat(ensemble.decisionFunction(data)).containsExactly(first);

        ensemble.fit(data, labels);
        assertThat(ensemble.decisionFunction(data)).containsExactly(first);
    }

    @Test
    @DisplayName("Should return [P(anomalous), P(normal)] pairs that sum to 1")
    void shouldReturnProbabilityPairs() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());
        ensemble.fit(data, labels);

        double[][] proba = ensemble.predictProba(data);
        double[] decision = ensemble.decisionFunction(data);

        assertThat(proba).hasSize(data.length);
        for (int i = 0; i < proba.length; i++) {
            assertThat(proba[i][0] + proba[i][1]).isCloseTo(1.0, within(1e-12));
            assertThat(2 * proba[i][1] - 1).isCloseTo(decision[i], within(1e-12));
        }
    }

    @Test
    @DisplayName("Should not modify the input matrix")
    void shouldNotMutateInput() {
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        AnomalyEnsemble ensemble = track(weightedEnsemble());

        ensemble.fit(data, labels);
        ensemble.predict(data);

        assertThat(data).isDeepEqualTo(copy);
    }

    // ------------------------------------------------------------------
    // Quorum policy
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should flag rows that a majority of detectors flags")
    void shouldVoteWithMajorityQuorum() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                .detector("forest", new IsolationForestDetector(0.1, 100, 256, 42L))
                .policy(EnsemblePolicy.QUORUM)
                .build());

        ensemble.fit(data);

        assertThat(ensemble.quorum()).isEqualTo(2);
        assertThat(ensemble.predict(data)).containsExactly(labels);
        double[] decision = ensemble.decisionFunction(data);
        for (int i = NORMAL; i < data.length; i++) {
            assertThat(decision[i]).isLessThanOrEqualTo(-1.0 / 3 + 1e-12);
        }
    }

    @Test
    @DisplayName("Should search the quorum on the validation split when labels are given")
    void shouldOptimizeQuorum() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                .detector("forest", new IsolationForestDetector(0.1, 50, 64, 42L))
                .policy(EnsemblePolicy.QUORUM)
                .build());

        ensemble.fit(data, labels);

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.FITTED);
        assertThat(ensemble.quorum()).isBetween(1, 3);
    }

    @Test
    @DisplayName("Should reject a quorum policy without voters and a quorum above the voter count")
    void shouldValidateQuorumSettings() {
        assertThatThrownBy(() -> AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1), 1.0, false)
                .policy(EnsemblePolicy.QUORUM)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("voting detector");
        assertThatThrownBy(() -> AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .policy(EnsemblePolicy.QUORUM)
                .quorum(2)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quorum");
    }

    // ------------------------------------------------------------------
    // Failure modes
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should refuse to predict before fit")
    void shouldRequireFit() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.UNFITTED);
        assertThatThrownBy(() -> ensemble.predict(data)).isInstanceOf(NotFittedException.class);
    }

    @Test
    @DisplayName("Should reject a batch whose column count differs from fit time")
    void shouldRejectSchemaMismatch() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());
        ensemble.fit(data);

        assertThatThrownBy(() -> ensemble.predict(new double[][] { { 1.0, 2.0 } }))
                .isInstanceOfSatisfying(SchemaMismatchException.class, e -> {
                    assertThat(e.getExpectedColumns()).isEqualTo(3);
                    assertThat(e.getActualColumns()).isEqualTo(2);
                });
    }

    @Test
    @DisplayName("Should fail the fit and stay unfitted when every detector fails")
    void shouldFailWhenAllDetectorsFail() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("a", new StubDetector(StubDetector.Mode.FAIL_FIT))
                .detector("b", new StubDetector(StubDetector.Mode.FAIL_FIT))
                .build());

        assertThatThrownBy(() -> ensemble.fit(data))
                .isInstanceOf(EnsembleFitException.class)
                .hasMessageContaining("All 2 detector(s) failed")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.UNFITTED);
        assertThatThrownBy(() -> ensemble.predict(data)).isInstanceOf(NotFittedException.class);
    }

    @Test
    @DisplayName("Should report a degraded batch when a detector fails to score")
    void shouldDegradeOnScoringFailure() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("flaky", new StubDetector(StubDetector.Mode.FAIL_SCORING))
                .build());
        ensemble.fit(data);

        EnsemblePrediction prediction = ensemble.evaluate(data);

        assertThat(prediction.status()).isEqualTo(EnsembleStatus.DEGRADED);
        assertThat(prediction.contributingDetectors()).containsExactly("zscore");
        assertThat(prediction.describeStatus()).contains("1 of 2");
        assertThat(prediction.labels()).hasSize(data.length);
    }

    @Test
    @DisplayName("Should report the ensemble unavailable when no detector scores a batch")
    void shouldBeUnavailableWhenNoDetectorScores() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("flaky", new StubDetector(StubDetector.Mode.FAIL_SCORING))
                .build());
        ensemble.fit(data);

        EnsemblePrediction prediction = ensemble.evaluate(data);

        assertThat(prediction.status()).isEqualTo(EnsembleStatus.UNAVAILABLE);
        assertThatThrownBy(prediction::labels).isInstanceOf(EnsembleUnavailableException.class);
        assertThatThrownBy(() -> ensemble.predict(data)).isInstanceOf(EnsembleUnavailableException.class);
    }

    @Test
    @DisplayName("Should deactivate a detector that exceeds the fit timeout")
    void shouldTimeOutSlowDetector() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("slow", new StubDetector(StubDetector.Mode.HANG_FIT))
                .parallelism(2)
                .detectorTimeout(Duration.ofMillis(300))
                .build());

        ensemble.fit(data);

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.FITTED);
        assertThat(ensemble.activeDetectors()).containsExactly("zscore");
        assertThat(ensemble.weights()).containsEntry("slow", 0.0);
    }

    @Test
    @DisplayName("Should not refit a detector whose timed-out fit is still running")
    void shouldNotRaceAbandonedFit() throws Exception {
        StubDetector slow = new StubDetector(StubDetector.Mode.STUBBORN_FIRST_FIT);
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("slow", slow)
                .parallelism(2)
                .detectorTimeout(Duration.ofMillis(300))
                .build());

        ensemble.fit(data, labels);

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.FITTED);
        assertThat(ensemble.activeDetectors()).containsExactly("zscore");
        assertThat(ensemble.weights()).containsEntry("slow", 0.0);

        // let the abandoned training-split fit run out
        Thread.sleep(StubDetector.STUBBORN_FIT_MILLIS + 400);

        assertThat(slow.fitCalls()).isEqualTo(1);
        assertThat(ensemble.activeDetectors()).containsExactly("zscore");

        ensemble.fit(data);

        assertThat(ensemble.activeDetectors()).containsExactly("zscore", "slow");
        assertThat(slow.fittedRows()).isEqualTo(data.length);
    }

    @Test
    @DisplayName("Should keep a detector that failed on the training split out of the whole fit cycle")
    void shouldExcludeCalibrationFailureForCycle() {
        StubDetector flaky = new StubDetector(StubDetector.Mode.FAIL_FIRST_FIT);
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("flaky", flaky)
                .parallelism(2)
                .build());

        ensemble.fit(data, labels);

        assertThat(flaky.fitCalls()).isEqualTo(2);
        assertThat(ensemble.activeDetectors()).containsExactly("zscore");
        assertThat(ensemble.weights()).containsEntry("flaky", 0.0).containsEntry("zscore", 1.0);
        EnsemblePrediction prediction = ensemble.evaluate(data);
        assertThat(prediction.status()).isEqualTo(EnsembleStatus.HEALTHY);
        assertThat(prediction.contributingDetectors()).containsExactly("zscore");
        assertThat(prediction.activeDetectors()).isEqualTo(1);

        ensemble.fit(data);

        assertThat(ensemble.activeDetectors()).containsExactly("zscore", "flaky");
    }

    @Test
    @DisplayName("Should reject malformed training data and labels")
    void shouldValidateTrainingInput() {
        AnomalyEnsemble ensemble = track(weightedEnsemble());

        assertThatThrownBy(() -> ensemble.fit(new double[][] { { 1.0, Double.NaN } }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ensemble.fit(data, new int[] { 1 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("label");
        int[] badLabels = labels.clone();
        badLabels[0] = 0;
        assertThatThrownBy(() -> ensemble.fit(data, badLabels)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.UNFITTED);
    }

    @Test
    @DisplayName("Should reject the same detector instance under two ids")
    void shouldRejectSharedDetectorInstance() {
        RobustZscoreDetector shared = new RobustZscoreDetector(0.1);

        assertThatThrownBy(() -> AnomalyEnsemble.builder().detector("a", shared).detector("b", shared))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same instance");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should return to the configured calibration on reset")
    void shouldResetToDefaults() {
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1), 3.0, true)
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6), 1.0, true)
                .detector("broken", new StubDetector(StubDetector.Mode.FAIL_FIT), 1.0, true)
                .build());
        ensemble.fit(data, labels);

        ensemble.reset();

        assertThat(ensemble.lifecycle()).isEqualTo(EnsembleLifecycle.UNFITTED);
        assertThat(ensemble.threshold()).isEqualTo(0.5);
        assertThat(ensemble.weights().get("zscore")).isCloseTo(0.6, within(1e-12));
        assertThat(ensemble.activeDetectors()).containsExactly("zscore", "density", "broken");
        assertThatThrownBy(() -> ensemble.predict(data)).isInstanceOf(NotFittedException.class);
    }

    @Test
    @DisplayName("Should refit every detector on each fit")
    void shouldRefitDetectors() {
        StubDetector stub = new StubDetector(StubDetector.Mode.FIRST_COLUMN);
        AnomalyEnsemble ensemble = track(AnomalyEnsemble.builder().detector("stub", stub).build());

        ensemble.fit(data, labels);
        ensemble.fit(data);

        // supervised fit: training split + full data; unsupervised: full data
        assertThat(stub.fitCalls()).isEqualTo(3);
    }

    private AnomalyEnsemble weightedEnsemble() {
        return AnomalyEnsemble.builder()
                .detector("zscore", new RobustZscoreDetector(0.1))
                .detector("density", new MahalanobisDensityDetector(0.1, 1e-6))
                .parallelism(2)
                .build();
    }

    private AnomalyEnsemble track(AnomalyEnsemble ensemble) {
        created.add(ensemble);
        return ensemble;
    }
}
