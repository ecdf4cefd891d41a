package com.delta.searchsync.sync.exec;

import com.delta.searchsync.sync.model.BatchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoundedWorkExecutorTest {
    private final BoundedWorkExecutor executor = new BoundedWorkExecutor(1, 1);

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void rejectsSynchronouslyWhenWorkersAndQueueAreFull() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        WorkHandle running = executor.submit(() -> {
            started.countDown();
            release.await();
            return new BatchResult(1, 0);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        WorkHandle queued = executor.submit(() -> new BatchResult(2, 0));

        assertThrows(RejectedExecutionException.class, () -> executor.submit(() -> new BatchResult(3, 0)));
        assertThat(executor.queuedCount()).isEqualTo(1);

        release.countDown();
        assertThat(running.await()).isEqualTo(new BatchResult(1, 0));
        assertThat(queued.await()).isEqualTo(new BatchResult(2, 0));
    }

    @Test
    void runsUnitsOnNamedWorkerThreads() {
        AtomicReference<String> threadName = new AtomicReference<>();

        WorkHandle handle = executor.submit(() -> {
            threadName.set(Thread.currentThread().getName());
            return BatchResult.ZERO;
        });

        assertThat(handle.await()).isEqualTo(BatchResult.ZERO);
        assertThat(handle.isDone()).isTrue();
        assertThat(threadName.get()).startsWith("sync-worker-");
    }
}
