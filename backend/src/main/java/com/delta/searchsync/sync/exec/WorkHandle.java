package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

public final class WorkHandle {
    private static final Logger log = LoggerFactory.getLogger(WorkHandle.class);

    private final CompletableFuture<BatchResult> future;

    public WorkHandle(CompletableFuture<BatchResult> future) {
        this.future = future;
    }

    /**
     * Blocks until the unit is terminal.
     *
     * @throws CompletionException wrapping the unit's own failure
     */
    public BatchResult await() {
        return future.join();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Returns a handle that completes with the same outcome once the matching callback has run.
     * Callback failures are logged and do not change the outcome.
     */
    public WorkHandle onComplete(Consumer<BatchResult> onSuccess, Consumer<Throwable> onFailure) {
        return new WorkHandle(future.whenComplete((result, error) -> {
            try {
                if (error == null) {
                    onSuccess.accept(result);
                } else {
                    onFailure.accept(unwrap(error));
                }
            } catch (Throwable hookError) {
                log.warn("Work unit completion hook failed", hookError);
            }
        }));
    }

    public static WorkHandle completed(BatchResult result) {
        return new WorkHandle(CompletableFuture.completedFuture(result));
    }

    public static WorkHandle failed(Throwable error) {
        return new WorkHandle(CompletableFuture.failedFuture(error));
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
