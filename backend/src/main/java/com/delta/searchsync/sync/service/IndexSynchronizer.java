package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.exec.BatchFailedException;
import com.delta.searchsync.sync.exec.BatchScheduler;
import com.delta.searchsync.sync.index.BulkRequestBuilder;
import com.delta.searchsync.sync.index.SearchIndexClient;
import com.delta.searchsync.sync.model.BatchResult;
import com.delta.searchsync.sync.model.IndexHit;
import com.delta.searchsync.sync.persistence.SourceJdbcRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Keeps one index in line with its source table. Instances are single-use per driver thread,
 * see {@link IndexSynchronizerFactory}.
 */
public class IndexSynchronizer<B> {
    private static final Logger log = LoggerFactory.getLogger(IndexSynchronizer.class);

    private final ImportSource<B> source;
    private final String table;
    private final String refreshInterval;
    private final int batchSize;
    private final SearchIndexClient indexClient;
    private final SourceJdbcRepository repository;
    private final BulkRequestBuilder bulkRequestBuilder;
    private final BatchScheduler scheduler;

    public IndexSynchronizer(
        ImportSource<B> source,
        String table,
        String refreshInterval,
        int batchSize,
        SearchIndexClient indexClient,
        SourceJdbcRepository repository,
        BulkRequestBuilder bulkRequestBuilder,
        BatchScheduler scheduler
    ) {
        this.source = source;
        this.table = table;
        this.refreshInterval = refreshInterval;
        this.batchSize = Math.max(1, batchSize);
        this.indexClient = indexClient;
        this.repository = repository;
        this.bulkRequestBuilder = bulkRequestBuilder;
        this.scheduler = scheduler;
    }

    public String indexName() {
        return source.indexName();
    }

    public long estimate() {
        return repository.estimateRowCount(table);
    }

    public void optimizeForImport() {
        log.info("Disabling refresh on index {} for bulk import (was {})", indexName(), currentRefreshInterval());
        indexClient.disableRefresh(indexName());
    }

    public void optimizeForSearch() {
        log.info("Restoring refresh_interval={} on index {}", refreshInterval, indexName());
        indexClient.restoreRefresh(indexName(), refreshInterval);
    }

    public String currentRefreshInterval() {
        JsonNode settings = indexClient.settings(indexName());
        if (settings == null) {
            return "unknown";
        }
        return settings.path("index").path("refresh_interval").asText("default");
    }

    public BatchResult importAll() {
        scheduler.reset();
        log.info("Import into {} started (batchSize={})", indexName(), batchSize);
        try {
            source.streamBatches(batchSize, batch -> {
                if (!batch.isEmpty()) {
                    scheduler.submit(batch, source.buildWriteUnit());
                }
            });
        } catch (RuntimeException e) {
            drainPendingAfter(e);
            throw e;
        }
        BatchResult result = scheduler.waitAll();
        log.info("Import into {} finished: written={}, failed={}", indexName(), result.processed(), result.failed());
        return result;
    }

    public BatchResult importWithOptimizedSettings() {
        optimizeForImport();
        RuntimeException importFailure = null;
        try {
            return importAll();
        } catch (RuntimeException e) {
            importFailure = e;
            throw e;
        } finally {
            try {
                optimizeForSearch();
            } catch (RuntimeException restoreFailure) {
                if (importFailure == null) {
                    throw restoreFailure;
                }
                importFailure.addSuppressed(restoreFailure);
            }
        }
    }

    public BatchResult cleanUp() {
        scheduler.reset();
        log.info("Clean-up of {} started against table {}", indexName(), table);
        try {
            indexClient.scrollBatches(indexName(), batchSize, this::submitDeletesFor);
        } catch (RuntimeException e) {
            drainPendingAfter(e);
            throw e;
        }
        BatchResult result = scheduler.waitAll();
        log.info("Clean-up of {} finished: deleted={}", indexName(), result.failed());
        return result;
    }

    // Units already submitted must finish before the caller sees the failure.
    private void drainPendingAfter(RuntimeException driverFailure) {
        try {
            scheduler.waitAll();
        } catch (BatchFailedException unitFailures) {
            driverFailure.addSuppressed(unitFailures);
        }
    }

    private void submitDeletesFor(List<IndexHit> hits) {
        List<String> ids = hits.stream().map(IndexHit::id).toList();
        Set<String> existing = repository.findExistingIds(table, ids);
        List<String> missing = ids.stream().filter(id -> !existing.contains(id)).toList();
        if (missing.isEmpty()) {
            return;
        }
        scheduler.submit(missing, deletedIds -> {
            indexClient.bulk(bulkRequestBuilder.deleteActions(indexName(), deletedIds));
            return new BatchResult(0, deletedIds.size());
        });
    }
}
