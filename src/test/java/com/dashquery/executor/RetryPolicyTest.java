package com.dashquery.executor;

import com.dashquery.config.RetryConfig;
import com.dashquery.exception.ConfigurationException;
import com.dashquery.query.QueryErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryPolicy.
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(new RetryConfig(2, 100, 2.0, 300));

    @Test
    @DisplayName("Transient failures are retried up to the bound")
    void retriesTransient() {
        assertTrue(policy.shouldRetry(QueryErrorKind.TRANSIENT, 1));
        assertTrue(policy.shouldRetry(QueryErrorKind.TRANSIENT, 2));
        assertFalse(policy.shouldRetry(QueryErrorKind.TRANSIENT, 3));
    }

    @ParameterizedTest
    @EnumSource(value = QueryErrorKind.class, names = {"TIMEOUT", "SYNTAX", "PERMISSION", "CANCELLED"})
    @DisplayName("Non-transient failures are never retried")
    void doesNotRetryOthers(QueryErrorKind kind) {
        assertFalse(policy.shouldRetry(kind, 1));
    }

    @ParameterizedTest
    @CsvSource({
            "1, 100",
            "2, 200",
            "3, 300",
            "10, 300"
    })
    @DisplayName("Backoff grows exponentially up to the cap")
    void backoff(int attempts, long expected) {
        assertEquals(expected, policy.backoffMillis(attempts));
    }

    @Test
    @DisplayName("Disabled retry never retries")
    void noneNeverRetries() {
        assertFalse(new RetryPolicy(RetryConfig.none()).shouldRetry(QueryErrorKind.TRANSIENT, 1));
    }

    @Test
    @DisplayName("Invalid retry settings are rejected")
    void rejectsInvalidConfig() {
        assertThrows(ConfigurationException.class, () -> new RetryConfig(-1, 0, 1.0, 0));
        assertThrows(ConfigurationException.class, () -> new RetryConfig(1, 10, 0.5, 10));
    }
}
