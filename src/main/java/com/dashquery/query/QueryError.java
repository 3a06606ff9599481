package com.dashquery.query;

import java.util.Objects;

/**
 * Failure of one panel query.
 *
 * @param panelId  Panel identifier
 * @param kind     Failure category
 * @param message  Engine or coordinator message
 * @param attempts Number of calls made to the engine for this query
 */
public record QueryError(String panelId, QueryErrorKind kind, String message, int attempts) {

    public QueryError {
        Objects.requireNonNull(panelId, "panelId");
        Objects.requireNonNull(kind, "kind");
    }

    public static QueryError cancelled(String panelId) {
        return new QueryError(panelId, QueryErrorKind.CANCELLED, "Analysis run cancelled before query started", 0);
    }
}
