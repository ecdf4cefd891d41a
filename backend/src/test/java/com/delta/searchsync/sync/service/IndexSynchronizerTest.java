package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.exec.BatchFailedException;
import com.delta.searchsync.sync.exec.BatchScheduler;
import com.delta.searchsync.sync.exec.BoundedWorkExecutor;
import com.delta.searchsync.sync.exec.SyncHooks;
import com.delta.searchsync.sync.exec.WorkUnit;
import com.delta.searchsync.sync.index.BulkRequestBuilder;
import com.delta.searchsync.sync.index.SearchIndexClient;
import com.delta.searchsync.sync.index.SearchIndexException;
import com.delta.searchsync.sync.model.BatchResult;
import com.delta.searchsync.sync.model.BulkResponseSummary;
import com.delta.searchsync.sync.model.IndexHit;
import com.delta.searchsync.sync.persistence.SourceJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexSynchronizerTest {

    @Mock
    private SearchIndexClient indexClient;
    @Mock
    private SourceJdbcRepository repository;

    private final BulkRequestBuilder bulkRequestBuilder = new BulkRequestBuilder(new ObjectMapper());
    private BoundedWorkExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new BoundedWorkExecutor(2, 4);
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void cleanUpDeletesOnlyIdsMissingFromTheStore() {
        scrollReturns(List.of(hits("1", "2", "3", "4")));
        when(repository.findExistingIds("articles", List.of("1", "2", "3", "4"))).thenReturn(Set.of("2", "4"));
        when(indexClient.bulk(anyString())).thenReturn(new BulkResponseSummary(2, 0, 1));

        BatchResult result = synchronizer(new FixedBatchSource(List.of())).cleanUp();

        assertThat(result).isEqualTo(new BatchResult(0, 2));
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(indexClient).bulk(body.capture());
        assertThat(deletedIds(body.getValue())).containsExactly("1", "3");
    }

    @Test
    void cleanUpOverTenDocumentsSendsOneDeleteForTheThreeMissing() {
        List<IndexHit> page = IntStream.rangeClosed(1, 10).mapToObj(i -> new IndexHit(Integer.toString(i))).toList();
        scrollReturns(List.of(page));
        when(repository.findExistingIds(eq("articles"), any()))
            .thenReturn(Set.of("1", "2", "4", "5", "7", "8", "10"));
        when(indexClient.bulk(anyString())).thenReturn(new BulkResponseSummary(3, 0, 1));

        BatchResult result = synchronizer(new FixedBatchSource(List.of())).cleanUp();

        assertThat(result).isEqualTo(new BatchResult(0, 3));
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(indexClient, times(1)).bulk(body.capture());
        assertThat(deletedIds(body.getValue())).containsExactly("3", "6", "9");
    }

    @Test
    void cleanUpSkipsBatchesWithNothingToDelete() {
        scrollReturns(List.of(hits("1", "2"), hits("3")));
        when(repository.findExistingIds(eq("articles"), any())).thenAnswer(invocation -> Set.copyOf(invocation.getArgument(1)));

        BatchResult result = synchronizer(new FixedBatchSource(List.of())).cleanUp();

        assertThat(result).isEqualTo(BatchResult.ZERO);
        verify(indexClient, never()).bulk(anyString());
    }

    @Test
    void cleanUpSumsDeletesAcrossBatches() {
        scrollReturns(List.of(hits("1", "2"), hits("3", "4"), hits("5")));
        when(repository.findExistingIds(eq("articles"), any())).thenReturn(Set.of("2", "5"));
        when(indexClient.bulk(anyString())).thenReturn(new BulkResponseSummary(1, 0, 1));

        BatchResult result = synchronizer(new FixedBatchSource(List.of())).cleanUp();

        assertThat(result).isEqualTo(new BatchResult(0, 3));
        verify(indexClient, times(2)).bulk(anyString());
    }

    @Test
    void failedDeleteFailsTheCleanUp() {
        scrollReturns(List.of(hits("1")));
        when(repository.findExistingIds(eq("articles"), any())).thenReturn(Set.of());
        when(indexClient.bulk(anyString())).thenThrow(new SearchIndexException("POST /_bulk returned 500", 500));

        assertThatThrownBy(() -> synchronizer(new FixedBatchSource(List.of())).cleanUp())
            .isInstanceOf(BatchFailedException.class)
            .hasCauseInstanceOf(SearchIndexException.class);
    }

    @Test
    void scrollErrorsPropagateUnchanged() {
        doThrow(new SearchIndexException("index_not_found_exception", 404))
            .when(indexClient).scrollBatches(eq("articles"), anyInt(), any());

        assertThatThrownBy(() -> synchronizer(new FixedBatchSource(List.of())).cleanUp())
            .isInstanceOf(SearchIndexException.class)
            .hasMessage("index_not_found_exception");
    }

    @Test
    void importSubmitsOneUnitPerBatchAndSumsWrites() {
        FixedBatchSource source = new FixedBatchSource(List.of(List.of(1, 2, 3, 4, 5), List.of(6, 7, 8)));

        BatchResult result = synchronizer(source).importAll();

        assertThat(result).isEqualTo(new BatchResult(8, 0));
    }

    @Test
    void importWithOptimizedSettingsBracketsTheImport() {
        FixedBatchSource source = new FixedBatchSource(List.of(List.of(1, 2)));

        BatchResult result = synchronizer(source).importWithOptimizedSettings();

        assertThat(result).isEqualTo(new BatchResult(2, 0));
        InOrder order = inOrder(indexClient);
        order.verify(indexClient).disableRefresh("articles");
        order.verify(indexClient).restoreRefresh("articles", "1s");
    }

    @Test
    void restoreFailureIsNotSwallowed() {
        doThrow(new SearchIndexException("PUT /articles/_settings returned 500", 500))
            .when(indexClient).restoreRefresh("articles", "1s");

        assertThatThrownBy(() -> synchronizer(new FixedBatchSource(List.of(List.of(1)))).importWithOptimizedSettings())
            .isInstanceOf(SearchIndexException.class)
            .hasMessageContaining("_settings");
    }

    @Test
    void importFailureKeepsRestoreFailureAsSuppressed() {
        doThrow(new SearchIndexException("PUT /articles/_settings returned 500", 500))
            .when(indexClient).restoreRefresh("articles", "1s");
        FixedBatchSource source = new FixedBatchSource(List.of(List.of(1)), batch -> {
            throw new IllegalStateException("bulk rejected");
        });

        assertThatThrownBy(() -> synchronizer(source).importWithOptimizedSettings())
            .isInstanceOfSatisfying(BatchFailedException.class, e -> {
                assertThat(e.getCause()).hasMessage("bulk rejected");
                assertThat(e.getSuppressed()).singleElement().isInstanceOf(SearchIndexException.class);
            });
        verify(indexClient).restoreRefresh("articles", "1s");
    }

    @Test
    void sourceFailureWaitsForSubmittedWritesBeforeRestoringRefresh() {
        AtomicBoolean writeFinished = new AtomicBoolean(false);
        AtomicBoolean writeFinishedBeforeRestore = new AtomicBoolean(false);
        doAnswer(invocation -> {
            writeFinishedBeforeRestore.set(writeFinished.get());
            return null;
        }).when(indexClient).restoreRefresh("articles", "1s");
        ImportSource<Integer> source = new ImportSource<>() {
            @Override
            public String indexName() {
                return "articles";
            }

            @Override
            public void streamBatches(int batchSize, Consumer<List<Integer>> consumer) {
                consumer.accept(List.of(1, 2, 3));
                throw new IllegalStateException("db read failed on page 2");
            }

            @Override
            public WorkUnit<List<Integer>> buildWriteUnit() {
                return batch -> {
                    Thread.sleep(200);
                    writeFinished.set(true);
                    return new BatchResult(batch.size(), 0);
                };
            }
        };

        assertThatThrownBy(() -> synchronizer(source).importWithOptimizedSettings())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("db read failed on page 2");
        assertThat(writeFinishedBeforeRestore).isTrue();
    }

    @Test
    void scrollFailureStillReportsDeletesThatFailedInFlight() {
        doAnswer(invocation -> {
            Consumer<List<IndexHit>> consumer = invocation.getArgument(2);
            consumer.accept(hits("1"));
            throw new SearchIndexException("POST /_search/scroll returned 500", 500);
        }).when(indexClient).scrollBatches(eq("articles"), anyInt(), any());
        when(repository.findExistingIds(eq("articles"), any())).thenReturn(Set.of());
        when(indexClient.bulk(anyString())).thenThrow(new SearchIndexException("POST /_bulk returned 503", 503));

        assertThatThrownBy(() -> synchronizer(new FixedBatchSource(List.of())).cleanUp())
            .isInstanceOfSatisfying(SearchIndexException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(500);
                assertThat(e.getSuppressed()).singleElement()
                    .isInstanceOfSatisfying(BatchFailedException.class, failed ->
                        assertThat(failed.getCause()).hasMessage("POST /_bulk returned 503"));
            });
        verify(indexClient).bulk(anyString());
    }

    @Test
    void estimateReadsTheConfiguredTable() {
        when(repository.estimateRowCount("articles")).thenReturn(1234L);

        assertThat(synchronizer(new FixedBatchSource(List.of())).estimate()).isEqualTo(1234L);
    }

    private IndexSynchronizer<Integer> synchronizer(ImportSource<Integer> source) {
        return new IndexSynchronizer<>(
            source,
            "articles",
            "1s",
            100,
            indexClient,
            repository,
            bulkRequestBuilder,
            new BatchScheduler(executor, SyncHooks.none())
        );
    }

    @SuppressWarnings("unchecked")
    private void scrollReturns(List<List<IndexHit>> pages) {
        doAnswer(invocation -> {
            Consumer<List<IndexHit>> consumer = invocation.getArgument(2);
            pages.forEach(consumer);
            return null;
        }).when(indexClient).scrollBatches(eq("articles"), anyInt(), any(Consumer.class));
    }

    private static List<IndexHit> hits(String... ids) {
        return java.util.Arrays.stream(ids).map(IndexHit::new).toList();
    }

    private static List<String> deletedIds(String bulkBody) {
        return java.util.Arrays.stream(bulkBody.split("\n"))
            .map(line -> line.replaceAll(".*\"_id\":\"([^\"]+)\".*", "$1"))
            .collect(Collectors.toList());
    }

    private static final class FixedBatchSource implements ImportSource<Integer> {
        private final List<List<Integer>> batches;
        private final WorkUnit<List<Integer>> writeUnit;

        FixedBatchSource(List<List<Integer>> batches) {
            this(batches, batch -> new BatchResult(batch.size(), 0));
        }

        FixedBatchSource(List<List<Integer>> batches, WorkUnit<List<Integer>> writeUnit) {
            this.batches = batches;
            this.writeUnit = writeUnit;
        }

        @Override
        public String indexName() {
            return "articles";
        }

        @Override
        public void streamBatches(int batchSize, Consumer<List<Integer>> consumer) {
            batches.forEach(consumer);
        }

        @Override
        public WorkUnit<List<Integer>> buildWriteUnit() {
            return writeUnit;
        }
    }
}
