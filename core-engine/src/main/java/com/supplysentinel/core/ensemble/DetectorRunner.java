package com.supplysentinel.core.ensemble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one call per detector on a bounded worker pool and collects a
 * success or a failure per detector id.
 *
 * <p>
 * A round is bounded by the configured timeout; calls still running when it
 * expires are cancelled and reported as failed with a
 * {@link TimeoutException}. A detector that ignores interruption may keep its
 * worker busy after that; until that call returns, every further call for
 * the same detector id fails at once instead of racing it on the same
 * instance.
 * </p>
 */
final class DetectorRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRunner.class);

    private final ExecutorService executor;
    private final Duration timeout;

    /** Ids with a call submitted or executing, including abandoned ones. */
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    DetectorRunner(int parallelism, Duration timeout) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("detector timeout must be positive, got: " + timeout);
        }
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(parallelism, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "detector-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    /**
     * Run every task concurrently and wait for all of them, or for the
     * timeout.
     *
     * @param tasks one task per detector id
     * @param phase what the tasks do, for log messages
     * @return one outcome per id, in the order of {@code tasks}
     */
    <T> Map<String, Outcome<T>> runAll(Map<String, Callable<T>> tasks, String phase) {
        Map<String, Outcome<T>> outcomes = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>();
        List<AtomicBoolean> claims = new ArrayList<>();
        List<Callable<T>> calls = new ArrayList<>();
        for (Map.Entry<String, Callable<T>> task : tasks.entrySet()) {
            String id = task.getKey();
            if (!running.add(id)) {
                outcomes.put(id, Outcome.failure(new IllegalStateException(
                        "Detector is still running an earlier call that exceeded its timeout")));
            } else {
                AtomicBoolean claim = new AtomicBoolean();
                outcomes.put(id, null);
                ids.add(id);
                claims.add(claim);
                calls.add(tracked(id, claim, task.getValue()));
            }
        }

        List<Future<T>> futures = List.of();
        if (!calls.isEmpty()) {
            try {
                futures = executor.invokeAll(calls, timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                for (int i = 0; i < ids.size(); i++) {
                    release(ids.get(i), claims.get(i));
                }
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for detector " + phase, e);
            }
        }

        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            Outcome<T> outcome;
            try {
                outcome = Outcome.success(futures.get(i).get());
            } catch (CancellationException e) {
                release(id, claims.get(i));
                outcome = Outcome.failure(new TimeoutException(
                        "Detector " + phase + " exceeded " + timeout.toMillis() + " ms"));
            } catch (ExecutionException e) {
                outcome = Outcome.failure(e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting detector " + phase, e);
            }
            outcomes.put(id, outcome);
        }
        for (Map.Entry<String, Outcome<T>> entry : outcomes.entrySet()) {
            Throwable failure = entry.getValue().failure;
            if (failure != null) {
                LOG.warn("Detector [{}] failed during {}: {}", entry.getKey(), phase, failure.toString(), failure);
            }
        }
        return outcomes;
    }

    /**
     * @return {@code true} while a call for {@code id} is still executing
     */
    boolean isRunning(String id) {
        return running.contains(id);
    }

    /** Drop {@code id} if its call never started; a started call drops it itself. */
    private void release(String id, AtomicBoolean claim) {
        if (claim.compareAndSet(false, true)) {
            running.remove(id);
        }
    }

    /**
     * Wrap a call so that {@code id} leaves {@link #running} when the call
     * returns. The id is added before submission; whoever wins
     * {@code claim} first, the call or the canceller, removes it.
     */
    private <T> Callable<T> tracked(String id, AtomicBoolean claim, Callable<T> call) {
        return () -> {
            if (!claim.compareAndSet(false, true)) {
                return null;
            }
            try {
                return call.call();
            } finally {
                running.remove(id);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /** Result of one detector call. */
    static final class Outcome<T> {
        final T value;
        final Throwable failure;

        private Outcome(T value, Throwable failure) {
            this.value = value;
            this.failure = failure;
        }

        static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failure(Throwable failure) {
            return new Outcome<>(null, failure);
        }

        boolean succeeded() {
            return failure == null;
        }
    }
}
