package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;

/**
 * One batch of work. Runs on a worker thread and reports how many records it processed and how many failed.
 */
@FunctionalInterface
public interface WorkUnit<I> {
    BatchResult process(I input) throws Exception;
}
