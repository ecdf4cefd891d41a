package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.exec.WorkUnit;

import java.util.List;
import java.util.function.Consumer;

/**
 * Source side of an index import: the rows to push and how one batch of them is written.
 */
public interface ImportSource<B> {

    String indexName();

    /**
     * Feeds the consumer batches of at most {@code batchSize} rows, on the calling thread.
     */
    void streamBatches(int batchSize, Consumer<List<B>> consumer);

    /**
     * Unit that writes one batch to the index and reports {@code (written, failed)}.
     */
    WorkUnit<List<B>> buildWriteUnit();
}
