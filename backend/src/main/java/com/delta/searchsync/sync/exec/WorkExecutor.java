package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;

import java.util.concurrent.Callable;

public interface WorkExecutor {

    /**
     * Starts the task asynchronously.
     *
     * @throws java.util.concurrent.RejectedExecutionException when the executor cannot take more work right now;
     *     the task has not been started and may be submitted again
     */
    WorkHandle submit(Callable<BatchResult> task);
}
