package com.dashquery.executor;

import com.dashquery.config.RetryConfig;
import com.dashquery.query.QueryErrorKind;

/**
 * Decides whether a failed query attempt is retried and how long to wait first.
 * Only transient failures are retried; delays grow exponentially up to a cap.
 */
public class RetryPolicy {

    private final RetryConfig config;

    public RetryPolicy(RetryConfig config) {
        this.config = config;
    }

    /**
     * @param kind     Failure of the attempt that just finished
     * @param attempts Attempts made so far, including that one
     */
    public boolean shouldRetry(QueryErrorKind kind, int attempts) {
        return kind.isRetryable() && attempts <= config.maxRetries();
    }

    /**
     * Delay before the retry following the given attempt number (1-based).
     */
    public long backoffMillis(int attempts) {
        double delay = config.initialBackoffMs() * Math.pow(config.backoffMultiplier(), Math.max(0, attempts - 1));
        return (long) Math.min(delay, config.maxBackoffMs());
    }

    public int maxRetries() {
        return config.maxRetries();
    }
}
