package com.delta.searchsync.sync.model;

public record BulkResponseSummary(int items, int failed, long tookMs) {
    public int succeeded() {
        return Math.max(0, items - failed);
    }
}
