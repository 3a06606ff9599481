package com.dashquery.config;

import com.dashquery.exception.ConfigurationException;

import java.time.Duration;

/**
 * Settings for the query execution coordinator.
 *
 * @param concurrencyLimit Maximum queries in flight at once
 * @param queryTimeoutMs   Per-query timeout
 * @param retry            Retry settings for transient failures
 */
public record ExecutionConfig(int concurrencyLimit, long queryTimeoutMs, RetryConfig retry) {

    public ExecutionConfig {
        if (concurrencyLimit < 1) {
            throw new ConfigurationException("concurrency-limit must be >= 1, got " + concurrencyLimit);
        }
        if (queryTimeoutMs < 1) {
            throw new ConfigurationException("query-timeout-ms must be >= 1, got " + queryTimeoutMs);
        }
        if (retry == null) {
            retry = RetryConfig.defaults();
        }
    }

    public Duration queryTimeout() {
        return Duration.ofMillis(queryTimeoutMs);
    }

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(4, 30_000, RetryConfig.defaults());
    }
}
