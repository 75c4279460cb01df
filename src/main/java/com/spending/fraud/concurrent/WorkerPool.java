package com.spending.fraud.concurrent;

import com.spending.fraud.exception.ComputeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent units of work on a bounded pool of platform threads and joins them at a
 * barrier. The caller's MDC is copied into every worker thread.
 *
 * <p>Each call creates its own pool and shuts it down before returning. Running units are
 * never interrupted. A unit's exception is captured in its {@link UnitResult} and never
 * affects its siblings.</p>
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final int maxWorkers;

    public WorkerPool(String name, int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be > 0");
        }
        this.name = name;
        this.maxWorkers = maxWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Runs every unit and returns one result per unit, in submission order.
     */
    public <T, R> List<UnitResult<R>> run(List<T> units, UnitWorker<T, R> worker) {
        return run(units, worker, CancellationToken.none());
    }

    /**
     * Runs every unit and returns one result per unit, in submission order. Units that have
     * not started when {@code cancellation} is raised are reported as cancelled.
     *
     * @throws ComputeException if the calling thread is interrupted while waiting; units already
     *                          running are left to finish, the rest never start
     */
    public <T, R> List<UnitResult<R>> run(List<T> units, UnitWorker<T, R> worker, CancellationToken cancellation) {
        if (units.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(maxWorkers, units.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory());
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        log.debug("pool.start name={} units={} threads={}", name, units.size(), threads);

        try {
            List<Future<UnitResult<R>>> futures = new ArrayList<>(units.size());
            for (int i = 0; i < units.size(); i++) {
                int index = i;
                T unit = units.get(i);
                futures.add(executor.submit(() -> runUnit(index, unit, worker, cancellation, parentMdc)));
            }

            List<UnitResult<R>> results = new ArrayList<>(units.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(await(i, futures.get(i)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel();
                    // running units drain and commit; queued ones never start
                    futures.forEach(future -> future.cancel(false));
                    throw new ComputeException("Interrupted while waiting for pool '" + name + "'", e);
                }
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private <T, R> UnitResult<R> runUnit(int index, T unit, UnitWorker<T, R> worker,
                                         CancellationToken cancellation, Map<String, String> parentMdc) {
        if (cancellation.isCancelled()) {
            return UnitResult.cancelled(index);
        }
        if (parentMdc != null) {
            MDC.setContextMap(parentMdc);
        }
        long start = System.nanoTime();
        try {
            R value = worker.process(unit);
            return UnitResult.succeeded(index, value, Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception e) {
            log.debug("pool.unit.failed name={} index={} error={}", name, index, e.toString());
            return UnitResult.failed(index, e, Duration.ofNanos(System.nanoTime() - start));
        } finally {
            MDC.clear();
        }
    }

    private <R> UnitResult<R> await(int index, Future<UnitResult<R>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // Errors thrown by the worker end up here
            return UnitResult.failed(index, e.getCause(), Duration.ZERO);
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
