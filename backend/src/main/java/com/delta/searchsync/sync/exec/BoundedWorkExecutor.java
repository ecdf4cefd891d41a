package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool with a bounded queue. A full queue rejects submissions instead of blocking the caller.
 */
public class BoundedWorkExecutor implements WorkExecutor {
    private final ThreadPoolExecutor pool;

    public BoundedWorkExecutor(int concurrency, int queueCapacity) {
        int threads = Math.max(1, concurrency);
        this.pool = new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
            new WorkerThreadFactory(),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Override
    public WorkHandle submit(Callable<BatchResult> task) {
        CompletableFuture<BatchResult> future = CompletableFuture.supplyAsync(
            () -> {
                try {
                    return task.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            },
            pool
        );
        return new WorkHandle(future);
    }

    public int queuedCount() {
        return pool.getQueue().size();
    }

    public void shutdown() {
        pool.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return pool.awaitTermination(timeout, unit);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "sync-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
