package com.dashquery.engine;

import com.dashquery.query.QueryErrorKind;

/**
 * Failure reported by a SqlEngineClient for a single query.
 */
public class SqlEngineException extends Exception {

    private final QueryErrorKind kind;

    public SqlEngineException(QueryErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SqlEngineException(QueryErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public QueryErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
