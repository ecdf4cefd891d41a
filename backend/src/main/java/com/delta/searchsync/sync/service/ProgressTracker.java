package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.exec.SyncHooks;
import com.delta.searchsync.sync.model.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe running totals for one operation, fed from worker threads through {@link #hooks()}.
 */
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String label;
    private final long expectedRows;
    private final LongAdder units = new LongAdder();
    private final LongAdder processed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder failedUnits = new LongAdder();

    public ProgressTracker(String label, long expectedRows) {
        this.label = label;
        this.expectedRows = Math.max(0L, expectedRows);
    }

    public SyncHooks hooks() {
        return new SyncHooks(this::recordProgress, this::recordFailure);
    }

    void recordProgress(BatchResult result) {
        units.increment();
        processed.add(result.processed());
        failed.add(result.failed());
        long done = processed.sum() + failed.sum();
        if (expectedRows > 0) {
            log.info("{}: {} units done, {}/{} rows (~{}%)", label, units.sum(), done, expectedRows,
                Math.min(100L, done * 100L / expectedRows));
        } else {
            log.info("{}: {} units done, {} rows", label, units.sum(), done);
        }
    }

    void recordFailure(Throwable error) {
        failedUnits.increment();
        log.warn("{}: work unit failed", label, error);
    }

    public long completedUnits() {
        return units.sum();
    }

    public long failedUnits() {
        return failedUnits.sum();
    }

    public BatchResult totals() {
        return new BatchResult(processed.sum(), failed.sum());
    }
}
