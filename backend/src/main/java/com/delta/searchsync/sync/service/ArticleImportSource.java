package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.exec.WorkUnit;
import com.delta.searchsync.sync.index.BulkRequestBuilder;
import com.delta.searchsync.sync.index.SearchIndexClient;
import com.delta.searchsync.sync.model.Article;
import com.delta.searchsync.sync.model.BatchResult;
import com.delta.searchsync.sync.model.BulkResponseSummary;
import com.delta.searchsync.sync.model.IndexedDocument;
import com.delta.searchsync.sync.persistence.SourceJdbcRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Component
public class ArticleImportSource implements ImportSource<Article> {
    public static final String INDEX_NAME = "articles";

    private final SourceJdbcRepository repository;
    private final SearchIndexClient indexClient;
    private final BulkRequestBuilder bulkRequestBuilder;

    public ArticleImportSource(
        SourceJdbcRepository repository,
        SearchIndexClient indexClient,
        BulkRequestBuilder bulkRequestBuilder
    ) {
        this.repository = repository;
        this.indexClient = indexClient;
        this.bulkRequestBuilder = bulkRequestBuilder;
    }

    @Override
    public String indexName() {
        return INDEX_NAME;
    }

    @Override
    public void streamBatches(int batchSize, Consumer<List<Article>> consumer) {
        int safeBatchSize = Math.max(1, batchSize);
        long lastId = 0L;
        while (true) {
            List<Article> batch = repository.findArticlesAfter(lastId, safeBatchSize);
            if (batch.isEmpty()) {
                return;
            }
            lastId = batch.get(batch.size() - 1).id();
            consumer.accept(batch);
            if (batch.size() < safeBatchSize) {
                return;
            }
        }
    }

    @Override
    public WorkUnit<List<Article>> buildWriteUnit() {
        return batch -> {
            List<IndexedDocument> documents = batch.stream().map(ArticleImportSource::toDocument).toList();
            BulkResponseSummary response = indexClient.bulk(bulkRequestBuilder.indexActions(INDEX_NAME, documents));
            return new BatchResult(response.succeeded(), response.failed());
        };
    }

    static IndexedDocument toDocument(Article article) {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("title", article.title());
        source.put("body", article.body());
        source.put("author", article.author());
        source.put("published_at", article.publishedAt() == null ? null : article.publishedAt().toString());
        source.put("updated_at", article.updatedAt() == null ? null : article.updatedAt().toString());
        return new IndexedDocument(Long.toString(article.id()), source);
    }
}
