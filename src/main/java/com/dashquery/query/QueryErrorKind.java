package com.dashquery.query;

/**
 * Reasons a panel query did not produce a result.
 */
public enum QueryErrorKind {
    /**
     * The query exceeded its timeout.
     */
    TIMEOUT(false),

    /**
     * Connection-level failure that may succeed on retry.
     */
    TRANSIENT(true),

    /**
     * The engine rejected the query text (syntax, unknown table or column).
     */
    SYNTAX(false),

    /**
     * The engine denied access.
     */
    PERMISSION(false),

    /**
     * The analysis run was cancelled before the query started.
     */
    CANCELLED(false);

    private final boolean retryable;

    QueryErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
