package com.delta.searchsync.sync.exec;

import com.delta.searchsync.config.SearchSyncProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class BatchSchedulerFactory {
    private final WorkExecutor executor;
    private final SearchSyncProperties properties;

    public BatchSchedulerFactory(
        @Qualifier("syncWorkExecutor") WorkExecutor executor,
        SearchSyncProperties properties
    ) {
        this.executor = executor;
        this.properties = properties;
    }

    public BatchScheduler create(SyncHooks hooks) {
        SearchSyncProperties.Backoff backoff = properties.getBackoff();
        return new BatchScheduler(
            executor,
            hooks,
            new BackoffPolicy(backoff.getInterval(), backoff.getMaxAttempts()),
            Sleeper.SYSTEM
        );
    }
}
