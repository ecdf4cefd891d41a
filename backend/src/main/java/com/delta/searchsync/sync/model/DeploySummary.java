package com.delta.searchsync.sync.model;

import java.time.Instant;
import java.util.List;

public record DeploySummary(
    Instant startedAt,
    Instant finishedAt,
    List<IndexDeployResult> indices
) {
    public BatchResult totalImported() {
        return indices.stream().map(IndexDeployResult::imported).reduce(BatchResult.ZERO, BatchResult::plus);
    }

    public BatchResult totalCleanedUp() {
        return indices.stream().map(IndexDeployResult::cleanedUp).reduce(BatchResult.ZERO, BatchResult::plus);
    }
}
