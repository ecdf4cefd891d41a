package com.delta.searchsync.sync.model;

import java.time.Duration;

public record IndexDeployResult(
    String index,
    long estimatedRows,
    BatchResult imported,
    BatchResult cleanedUp,
    Duration elapsed
) {
}
