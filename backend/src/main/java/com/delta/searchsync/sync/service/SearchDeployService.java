package com.delta.searchsync.sync.service;

import com.delta.searchsync.sync.model.BatchResult;
import com.delta.searchsync.sync.model.DeployRequest;
import com.delta.searchsync.sync.model.DeploySummary;
import com.delta.searchsync.sync.model.IndexDeployResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

@Service
public class SearchDeployService {
    private static final Logger log = LoggerFactory.getLogger(SearchDeployService.class);

    private final IndexSynchronizerFactory synchronizerFactory;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SearchDeployService(IndexSynchronizerFactory synchronizerFactory) {
        this.synchronizerFactory = synchronizerFactory;
    }

    public DeploySummary deploy(DeployRequest request) {
        List<String> indices = request.normalizedIndices().isEmpty()
            ? synchronizerFactory.indexNames()
            : request.normalizedIndices();
        return exclusively("deploy", () -> {
            Instant startedAt = Instant.now();
            List<IndexDeployResult> results = new ArrayList<>();
            for (String index : indices) {
                results.add(deployIndex(index, request.isOnlyImport()));
            }
            return new DeploySummary(startedAt, Instant.now(), results);
        });
    }

    public BatchResult importIndex(String index) {
        return exclusively("import " + index, () -> {
            ProgressTracker tracker = new ProgressTracker("import " + index, 0L);
            return synchronizerFactory.create(index, tracker.hooks()).importWithOptimizedSettings();
        });
    }

    public BatchResult cleanUpIndex(String index) {
        return exclusively("clean-up " + index, () -> {
            ProgressTracker tracker = new ProgressTracker("clean-up " + index, 0L);
            return synchronizerFactory.create(index, tracker.hooks()).cleanUp();
        });
    }

    public long estimate(String index) {
        return synchronizerFactory.create(index, null).estimate();
    }

    public boolean isRunning() {
        return running.get();
    }

    private <T> T exclusively(String operation, Supplier<T> work) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveSyncRunException("Cannot start " + operation + ": a search sync run is already active");
        }
        try {
            return work.get();
        } finally {
            running.set(false);
        }
    }

    private IndexDeployResult deployIndex(String index, boolean onlyImport) {
        Instant indexStart = Instant.now();
        long estimate = synchronizerFactory.create(index, null).estimate();
        log.info("Deploying index {} (~{} rows)", index, estimate);

        ProgressTracker importProgress = new ProgressTracker("import " + index, estimate);
        BatchResult imported = synchronizerFactory.create(index, importProgress.hooks()).importWithOptimizedSettings();

        BatchResult cleanedUp = BatchResult.ZERO;
        if (!onlyImport) {
            ProgressTracker cleanUpProgress = new ProgressTracker("clean-up " + index, 0L);
            cleanedUp = synchronizerFactory.create(index, cleanUpProgress.hooks()).cleanUp();
        }

        Duration elapsed = Duration.between(indexStart, Instant.now());
        log.info(
            "Index {} deployed in {}ms: indexed={}, indexFailures={}, deleted={}",
            index,
            elapsed.toMillis(),
            imported.processed(),
            imported.failed(),
            cleanedUp.failed()
        );
        return new IndexDeployResult(index, estimate, imported, cleanedUp, elapsed);
    }
}
