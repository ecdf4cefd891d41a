package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans batches out to a {@link WorkExecutor} and sums their results.
 *
 * <p>Not thread-safe: a single driver thread submits units and drains them. Use one instance per operation.
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final WorkExecutor executor;
    private final SyncHooks hooks;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final List<WorkHandle> pending = new ArrayList<>();

    public BatchScheduler(WorkExecutor executor, SyncHooks hooks, BackoffPolicy backoff, Sleeper sleeper) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.hooks = hooks == null ? SyncHooks.none() : hooks;
        this.backoff = backoff == null ? BackoffPolicy.unbounded() : backoff;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public BatchScheduler(WorkExecutor executor, SyncHooks hooks) {
        this(executor, hooks, BackoffPolicy.unbounded(), Sleeper.SYSTEM);
    }

    public <I> WorkHandle submit(I input, WorkUnit<I> work) {
        Objects.requireNonNull(work, "work");
        int rejected = 0;
        while (true) {
            WorkHandle handle;
            try {
                handle = executor.submit(() -> work.process(input));
            } catch (RejectedExecutionException e) {
                rejected++;
                if (backoff.isExhausted(rejected)) {
                    throw new SchedulerSaturatedException(
                        "Executor rejected work unit " + rejected + " times; giving up",
                        e
                    );
                }
                if (rejected == 1 || rejected % 50 == 0) {
                    log.debug("Executor saturated, retrying submission in {}ms (attempt {})",
                        backoff.interval().toMillis(), rejected);
                }
                pause();
                continue;
            }
            WorkHandle tracked = handle.onComplete(hooks.onProgress(), hooks.onFailure());
            pending.add(tracked);
            return tracked;
        }
    }

    public BatchResult waitAll() {
        List<WorkHandle> handles = List.copyOf(pending);
        pending.clear();

        BatchResult total = BatchResult.ZERO;
        Throwable firstFailure = null;
        int failedUnits = 0;
        for (WorkHandle handle : handles) {
            try {
                total = total.plus(handle.await());
            } catch (CompletionException | CancellationException e) {
                Throwable cause = WorkHandle.unwrap(e);
                failedUnits++;
                if (firstFailure == null) {
                    firstFailure = cause;
                } else if (firstFailure != cause) {
                    firstFailure.addSuppressed(cause);
                }
            }
        }
        if (firstFailure != null) {
            throw new BatchFailedException(failedUnits, handles.size(), firstFailure);
        }
        return total;
    }

    public void reset() {
        pending.clear();
    }

    public int pendingCount() {
        return pending.size();
    }

    private void pause() {
        try {
            sleeper.sleep(backoff.interval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerSaturatedException("Interrupted while waiting for executor capacity", e);
        }
    }
}
