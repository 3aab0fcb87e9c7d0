package com.conveyal.sweep.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs a batch of independent, mostly I/O-bound tasks with a cap on how many run at once, and collects every outcome.
 * The caller blocks until the whole batch is finished. Outcomes are returned in the order of the input items, no
 * matter in which order the tasks complete. A task that throws does not affect its siblings: its exception is just
 * recorded as that item's outcome.
 *
 * The thread pool is shared by all batches (i.e. by all concurrent sweeps). Each call to runAll gets its own
 * semaphore, so the parallelism cap applies per batch, and the pool size caps the total across batches.
 * runAll must not be called from a thread of the same pool, which could deadlock once all threads wait on batches.
 */
public class BoundedExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(BoundedExecutor.class);

    /** The result of running the worker on one item: a value or the throwable it failed with. */
    public static class Outcome<R> {
        public final R value;
        public final Throwable failure;

        private Outcome (R value, Throwable failure) {
            this.value = value;
            this.failure = failure;
        }

        public boolean succeeded () {
            return failure == null;
        }
    }

    private final ExecutorService executor;

    public BoundedExecutor (ExecutorService executor) {
        this.executor = executor;
    }

    /** Create an executor backed by its own pool of daemon threads, which will not keep the JVM alive. */
    public static BoundedExecutor withThreads (int nThreads, String threadNamePrefix) {
        checkArgument(nThreads >= 1, "Need at least one thread.");
        ExecutorService pool = Executors.newFixedThreadPool(nThreads, new ThreadFactoryBuilder()
                .setNameFormat(threadNamePrefix + "-%d")
                .setDaemon(true)
                .build());
        return new BoundedExecutor(pool);
    }

    /**
     * Apply the worker to every item, with at most maxParallel invocations active at any instant.
     * Each item is processed exactly once.
     */
    public <T, R> List<Outcome<R>> runAll (List<T> items, Function<? super T, ? extends R> worker, int maxParallel) {
        checkArgument(maxParallel >= 1, "Parallelism must be at least one.");
        Semaphore permits = new Semaphore(maxParallel);
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            // Acquire before submitting so that no more than maxParallel tasks are even queued at once.
            permits.acquireUninterruptibly();
            try {
                futures.add(executor.submit(() -> {
                    try {
                        return worker.apply(item);
                    } finally {
                        permits.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                permits.release();
                throw e;
            }
        }
        List<Outcome<R>> outcomes = new ArrayList<>(futures.size());
        for (Future<R> future : futures) {
            outcomes.add(await(future));
        }
        return outcomes;
    }

    private static <R> Outcome<R> await (Future<R> future) {
        try {
            return new Outcome<>(future.get(), null);
        } catch (ExecutionException e) {
            LOG.warn("Task in bounded batch failed: {}", ExceptionUtils.shortCauseString(e.getCause()));
            return new Outcome<>(null, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Outcome<>(null, e);
        }
    }

    public void shutdown () {
        executor.shutdown();
    }

}
