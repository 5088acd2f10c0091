package com.supplysentinel.core.ensemble;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorRunner}.
 */
class DetectorRunnerTest {

    private DetectorRunner runner;

    @BeforeEach
    void setUp() {
        runner = new DetectorRunner(2, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    @DisplayName("Should collect a value per task in submission order")
    void shouldCollectValues() {
        Map<String, Callable<String>> tasks = new LinkedHashMap<>();
        tasks.put("second", () -> "b");
        tasks.put("first", () -> "a");

        Map<String, DetectorRunner.Outcome<String>> outcomes = runner.runAll(tasks, "test");

        assertThat(outcomes).containsOnlyKeys("second", "first");
        assertThat(outcomes.keySet()).containsExactly("second", "first");
        assertThat(outcomes.get("first").value).isEqualTo("a");
        assertThat(outcomes.get("second").succeeded()).isTrue();
    }

    @Test
    @DisplayName("Should isolate a failing task from the others")
    void shouldContainFailures() {
        Map<String, Callable<String>> tasks = new LinkedHashMap<>();
        tasks.put("ok", () -> "fine");
        tasks.put("broken", () -> {
            throw new IllegalArgumentException("bad input");
        });

        Map<String, DetectorRunner.Outcome<String>> outcomes = runner.runAll(tasks, "test");

        assertThat(outcomes.get("ok").succeeded()).isTrue();
        assertThat(outcomes.get("broken").succeeded()).isFalse();
        assertThat(outcomes.get("broken").failure)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad input");
    }

    @Test
    @DisplayName("Should report a task exceeding the timeout as a timeout failure")
    void shouldTimeOutSlowTasks() {
        Map<String, Callable<String>> tasks = new LinkedHashMap<>();
        tasks.put("slow", () -> {
            Thread.sleep(10_000);
            return "late";
        });
        tasks.put("fast", () -> "early");

        long start = System.nanoTime();
        Map<String, DetectorRunner.Outcome<String>> outcomes = runner.runAll(tasks, "test");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(outcomes.get("slow").failure).isInstanceOf(TimeoutException.class);
        assertThat(outcomes.get("fast").value).isEqualTo("early");
        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    @DisplayName("Should fail a detector at once while its timed-out call is still running")
    void shouldNotReenterAbandonedCall() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Map<String, Callable<String>> tasks = new LinkedHashMap<>();
        tasks.put("stubborn", () -> {
            calls.incrementAndGet();
            spinIgnoringInterrupts(800);
            return "late";
        });

        assertThat(runner.runAll(tasks, "test").get("stubborn").failure).isInstanceOf(TimeoutException.class);
        assertThat(runner.isRunning("stubborn")).isTrue();

        Map<String, DetectorRunner.Outcome<String>> again = runner.runAll(tasks, "test");

        assertThat(again.get("stubborn").failure)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still running");
        assertThat(calls).hasValue(1);

        awaitIdle("stubborn");
        Map<String, Callable<String>> later = Map.of("stubborn", () -> "now");
        assertThat(runner.runAll(later, "test").get("stubborn").value).isEqualTo("now");
    }

    @Test
    @DisplayName("Should release a detector whose call was cancelled before it started")
    void shouldReleaseQueuedCall() throws Exception {
        try (DetectorRunner single = new DetectorRunner(1, Duration.ofMillis(200))) {
            Map<String, Callable<String>> tasks = new LinkedHashMap<>();
            tasks.put("stubborn", () -> {
                spinIgnoringInterrupts(600);
                return "late";
            });
            tasks.put("queued", () -> "never");

            Map<String, DetectorRunner.Outcome<String>> outcomes = single.runAll(tasks, "test");

            assertThat(outcomes.get("queued").failure).isInstanceOf(TimeoutException.class);
            assertThat(single.isRunning("queued")).isFalse();
            assertThat(single.isRunning("stubborn")).isTrue();
        }
    }

    private void awaitIdle(String id) throws InterruptedException {
        long deadline = System.nanoTime() + 5_000_000_000L;
        while (runner.isRunning(id) && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(runner.isRunning(id)).isFalse();
    }

    private static void spinIgnoringInterrupts(long millis) {
        long end = System.nanoTime() + millis * 1_000_000;
        while (System.nanoTime() < end) {
            Thread.onSpinWait();
        }
    }

    @Test
    @DisplayName("Should reject a non-positive parallelism or timeout")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new DetectorRunner(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectorRunner(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
