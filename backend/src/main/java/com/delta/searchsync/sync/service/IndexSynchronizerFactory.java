package com.delta.searchsync.sync.service;

import com.delta.searchsync.config.SearchSyncProperties;
import com.delta.searchsync.sync.exec.BatchSchedulerFactory;
import com.delta.searchsync.sync.exec.SyncHooks;
import com.delta.searchsync.sync.index.BulkRequestBuilder;
import com.delta.searchsync.sync.index.SearchIndexClient;
import com.delta.searchsync.sync.persistence.SourceJdbcRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class IndexSynchronizerFactory {
    private final Map<String, ImportSource<?>> sources = new LinkedHashMap<>();
    private final SearchSyncProperties properties;
    private final SearchIndexClient indexClient;
    private final SourceJdbcRepository repository;
    private final BulkRequestBuilder bulkRequestBuilder;
    private final BatchSchedulerFactory schedulerFactory;

    public IndexSynchronizerFactory(
        List<ImportSource<?>> importSources,
        SearchSyncProperties properties,
        SearchIndexClient indexClient,
        SourceJdbcRepository repository,
        BulkRequestBuilder bulkRequestBuilder,
        BatchSchedulerFactory schedulerFactory
    ) {
        for (ImportSource<?> source : importSources) {
            ImportSource<?> previous = sources.putIfAbsent(source.indexName(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate import source for index " + source.indexName());
            }
        }
        this.properties = properties;
        this.indexClient = indexClient;
        this.repository = repository;
        this.bulkRequestBuilder = bulkRequestBuilder;
        this.schedulerFactory = schedulerFactory;
    }

    public List<String> indexNames() {
        return List.copyOf(sources.keySet());
    }

    public IndexSynchronizer<?> create(String indexName, SyncHooks hooks) {
        ImportSource<?> source = sources.get(indexName);
        if (source == null) {
            throw new UnknownIndexException(indexName);
        }
        return build(source, hooks);
    }

    private <B> IndexSynchronizer<B> build(ImportSource<B> source, SyncHooks hooks) {
        SearchSyncProperties.IndexDefinition definition = properties.definitionFor(source.indexName());
        return new IndexSynchronizer<>(
            source,
            definition.getTable(),
            definition.getRefreshInterval(),
            properties.getBatchSize(),
            indexClient,
            repository,
            bulkRequestBuilder,
            schedulerFactory.create(hooks)
        );
    }
}
