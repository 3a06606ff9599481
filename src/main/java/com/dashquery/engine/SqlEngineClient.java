package com.dashquery.engine;

import com.dashquery.exception.EngineUnreachableException;
import com.dashquery.query.RowSet;

import java.time.Duration;

/**
 * Connection to the external SQL engine that panel queries run against.
 * Implementations must be safe for concurrent calls.
 */
public interface SqlEngineClient {

    /**
     * Run one query.
     *
     * @param sql     Query text
     * @param timeout Time the engine may spend on the query
     * @return Columns and rows
     * @throws SqlEngineException if the query fails; the exception carries its failure category
     */
    RowSet runQuery(String sql, Duration timeout) throws SqlEngineException;

    /**
     * Check that the engine can be reached before a run dispatches queries.
     *
     * @throws EngineUnreachableException if no query could possibly succeed
     */
    default void checkAvailable() {
    }
}
