package com.delta.searchsync.sync.exec;

import java.time.Duration;

/**
 * Fixed-interval retry for rejected submissions. {@code maxAttempts == 0} retries forever.
 */
public record BackoffPolicy(Duration interval, int maxAttempts) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    public BackoffPolicy {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("backoff interval must be zero or positive");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be zero (unbounded) or positive");
        }
    }

    public static BackoffPolicy unbounded() {
        return new BackoffPolicy(DEFAULT_INTERVAL, 0);
    }

    public static BackoffPolicy unbounded(Duration interval) {
        return new BackoffPolicy(interval, 0);
    }

    public boolean isExhausted(int rejectedAttempts) {
        return maxAttempts > 0 && rejectedAttempts >= maxAttempts;
    }
}
