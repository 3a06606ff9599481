package com.dashquery.config;

import com.dashquery.exception.ConfigurationException;

/**
 * Retry settings for transient engine failures.
 *
 * @param maxRetries        Retries after the first attempt (0 disables retrying)
 * @param initialBackoffMs  Delay before the first retry
 * @param backoffMultiplier Factor applied to the delay after each retry
 * @param maxBackoffMs      Upper bound on a single delay
 */
public record RetryConfig(int maxRetries, long initialBackoffMs, double backoffMultiplier, long maxBackoffMs) {

    public RetryConfig {
        if (maxRetries < 0) {
            throw new ConfigurationException("max-retries must be >= 0, got " + maxRetries);
        }
        if (initialBackoffMs < 0 || maxBackoffMs < 0) {
            throw new ConfigurationException("Backoff delays must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new ConfigurationException("backoff-multiplier must be >= 1.0, got " + backoffMultiplier);
        }
    }

    public static RetryConfig defaults() {
        return new RetryConfig(2, 200, 2.0, 5000);
    }

    public static RetryConfig none() {
        return new RetryConfig(0, 0, 1.0, 0);
    }
}
