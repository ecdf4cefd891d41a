package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;

import java.util.function.Consumer;

/**
 * Per-unit notifications, fixed when a {@link BatchScheduler} is built. Both callbacks run on worker threads.
 */
public record SyncHooks(Consumer<BatchResult> onProgress, Consumer<Throwable> onFailure) {
    private static final SyncHooks NONE = new SyncHooks(null, null);

    public SyncHooks {
        onProgress = onProgress == null ? result -> { } : onProgress;
        onFailure = onFailure == null ? error -> { } : onFailure;
    }

    public static SyncHooks none() {
        return NONE;
    }

    public static SyncHooks withProgress(Consumer<BatchResult> onProgress) {
        return new SyncHooks(onProgress, null);
    }
}
