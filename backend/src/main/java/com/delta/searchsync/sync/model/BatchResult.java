package com.delta.searchsync.sync.model;

public record BatchResult(long processed, long failed) {
    public static final BatchResult ZERO = new BatchResult(0, 0);

    public BatchResult plus(BatchResult other) {
        return new BatchResult(processed + other.processed, failed + other.failed);
    }
}
