package com.dashquery.engine;

import com.dashquery.config.ExecutionConfig;
import com.dashquery.config.RetryConfig;
import com.dashquery.exception.EngineUnreachableException;
import com.dashquery.executor.QueryExecutionCoordinator;
import com.dashquery.query.ColumnType;
import com.dashquery.query.QueryError;
import com.dashquery.query.QueryErrorKind;
import com.dashquery.query.QueryResult;
import com.dashquery.query.ResolvedQuery;
import com.dashquery.query.Result;
import com.dashquery.query.RowSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Types;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcSqlEngineClient against an in-memory DuckDB.
 */
class JdbcSqlEngineClientTest {

    private static final String DUCKDB_URL = "jdbc:duckdb:";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final JdbcSqlEngineClient client = new JdbcSqlEngineClient(DUCKDB_URL);

    @Test
    @DisplayName("Query returns typed columns and rows")
    void runsQuery() throws SqlEngineException {
        RowSet rows = client.runQuery(
                "SELECT * FROM (VALUES (1, 'eu'), (2, 'us'), (NULL, 'apac')) AS t(requests, region) ORDER BY region",
                TIMEOUT);

        assertEquals(2, rows.columns().size());
        assertEquals("requests", rows.columns().get(0).name());
        assertEquals(ColumnType.NUMERIC, rows.columns().get(0).type());
        assertEquals("region", rows.columns().get(1).name());
        assertEquals(ColumnType.STRING, rows.columns().get(1).type());

        assertEquals(3, rows.rows().size());
        assertEquals(Arrays.asList(null, "apac"), rows.rows().get(0));
        assertEquals("eu", rows.rows().get(1).get(1));
        assertEquals(1, ((Number) rows.rows().get(1).get(0)).intValue());
    }

    @Test
    @DisplayName("Empty result keeps its columns")
    void emptyResult() throws SqlEngineException {
        RowSet rows = client.runQuery("SELECT 1 AS x WHERE 1 = 0", TIMEOUT);

        assertEquals(1, rows.columns().size());
        assertTrue(rows.rows().isEmpty());
    }

    @Test
    @DisplayName("Syntax error is classified as a non-retryable syntax failure")
    void syntaxError() {
        SqlEngineException e = assertThrows(SqlEngineException.class,
                () -> client.runQuery("SELEC 1 FRM nowhere", TIMEOUT));

        assertEquals(QueryErrorKind.SYNTAX, e.getKind());
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Missing table is a syntax failure whatever its name")
    void missingTableIsSyntax() {
        SqlEngineException e = assertThrows(SqlEngineException.class,
                () -> client.runQuery("SELECT * FROM connection_log", TIMEOUT));

        assertEquals(QueryErrorKind.SYNTAX, e.getKind());
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Coordinator runs a query on a missing table once")
    void missingTableNotRetried() {
        QueryExecutionCoordinator coordinator = new QueryExecutionCoordinator(client,
                new ExecutionConfig(1, 10_000, new RetryConfig(2, 10, 2.0, 50)));
        try {
            Result<QueryResult, QueryError> result =
                    coordinator.execute(List.of(new ResolvedQuery("p1", "SELECT * FROM connection_log"))).get(0);

            assertEquals(QueryErrorKind.SYNTAX, result.getError().kind());
            assertEquals(1, result.getError().attempts());
            assertEquals(1, coordinator.getStats().engineCalls());
            assertEquals(0, coordinator.getStats().retried());
        } finally {
            coordinator.shutdown();
        }
    }

    @Test
    @DisplayName("Missing JDBC URL makes the engine unreachable")
    void blankUrlUnreachable() {
        assertThrows(EngineUnreachableException.class, () -> new JdbcSqlEngineClient(" ").checkAvailable());
        assertThrows(EngineUnreachableException.class, () -> new JdbcSqlEngineClient(null).checkAvailable());
    }

    @Test
    @DisplayName("JDBC types map to coarse column types")
    void mapsJdbcTypes() {
        assertEquals(ColumnType.NUMERIC, JdbcSqlEngineClient.toColumnType(Types.BIGINT));
        assertEquals(ColumnType.NUMERIC, JdbcSqlEngineClient.toColumnType(Types.DECIMAL));
        assertEquals(ColumnType.STRING, JdbcSqlEngineClient.toColumnType(Types.VARCHAR));
        assertEquals(ColumnType.BOOLEAN, JdbcSqlEngineClient.toColumnType(Types.BOOLEAN));
        assertEquals(ColumnType.TEMPORAL, JdbcSqlEngineClient.toColumnType(Types.TIMESTAMP));
        assertEquals(ColumnType.OTHER, JdbcSqlEngineClient.toColumnType(Types.ARRAY));
    }
}
