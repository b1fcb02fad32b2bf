package org.transitmatters.stopevents.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded pool of worker threads that maps a function over a collection of independent inputs.
 */
public class WorkerPool implements AutoCloseable {
    private final AtomicInteger threadCounter = new AtomicInteger();

    private final ExecutorService executor;
    private final Queue<Future<?>> submitted = new ConcurrentLinkedQueue<>();

    /**
     *
     * @param workers Maximum number of concurrently running tasks
     */
    public WorkerPool(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be positive, was " + workers);
        }
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            final Thread t = new Thread(runnable, "stopevents-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs the function for every input and returns the results in input order.
     * If any task fails, the remaining tasks are cancelled and the failure is rethrown.
     *
     * @throws CancellationException if the pool was cancelled while the tasks were running
     */
    public <T, R> List<R> map(Collection<T> inputs, Function<T, R> function) throws InterruptedException, ExecutionException {
        List<Future<R>> futures = new ArrayList<>(inputs.size());
        try {
            for (T input : inputs) {
                Future<R> future = executor.submit(() -> function.apply(input));
                submitted.add(future);
                futures.add(future);
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            submitted.removeAll(futures);
            throw new CancellationException("Worker pool was cancelled");
        }

        List<R> results = new ArrayList<>(futures.size());
        try {
            for (Future<R> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException | ExecutionException | CancellationException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        } finally {
            submitted.removeAll(futures);
        }
        return results;
    }

    /**
     * Aborts queued work. Tasks already running are interrupted.
     */
    public void cancel() {
        executor.shutdownNow();
        submitted.forEach(future -> future.cancel(true));
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
