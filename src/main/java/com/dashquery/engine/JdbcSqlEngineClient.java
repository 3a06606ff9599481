package com.dashquery.engine;

import com.dashquery.exception.EngineUnreachableException;
import com.dashquery.query.ColumnSpec;
import com.dashquery.query.ColumnType;
import com.dashquery.query.QueryErrorKind;
import com.dashquery.query.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * SqlEngineClient over a JDBC driver. Opens one connection per query.
 */
public class JdbcSqlEngineClient implements SqlEngineClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcSqlEngineClient.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;
    private static final int MAX_LOGGED_SQL = 200;

    private final String jdbcUrl;
    private final Properties connectionProperties;

    public JdbcSqlEngineClient(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    public JdbcSqlEngineClient(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.connectionProperties = new Properties();
        if (username != null && !username.isEmpty()) {
            connectionProperties.setProperty("user", username);
        }
        if (password != null && !password.isEmpty()) {
            connectionProperties.setProperty("password", password);
        }
    }

    @Override
    public RowSet runQuery(String sql, Duration timeout) throws SqlEngineException {
        log.debug("Running query: {}", abbreviate(sql));

        try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
            applyTimeout(statement, timeout);
            try (ResultSet resultSet = statement.executeQuery(sql)) {
                return readRows(resultSet);
            }
        } catch (SQLException e) {
            throw new SqlEngineException(SqlErrorClassifier.classify(e), e.getMessage(), e);
        }
    }

    private Connection openConnection() throws SqlEngineException {
        try {
            return DriverManager.getConnection(jdbcUrl, connectionProperties);
        } catch (SQLException e) {
            QueryErrorKind kind = SqlErrorClassifier.classify(e);
            throw new SqlEngineException(kind == QueryErrorKind.PERMISSION ? kind : QueryErrorKind.TRANSIENT,
                    "Cannot connect to engine: " + e.getMessage(), e);
        }
    }

    @Override
    public void checkAvailable() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new EngineUnreachableException("No JDBC URL configured for the SQL engine");
        }
        try (Connection connection = DriverManager.getConnection(jdbcUrl, connectionProperties)) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new EngineUnreachableException("SQL engine connection is not valid: " + jdbcUrl);
            }
        } catch (SQLException e) {
            throw new EngineUnreachableException("SQL engine unreachable: " + e.getMessage(), e);
        }
    }

    private void applyTimeout(Statement statement, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        int seconds = (int) Math.max(1, Math.min(Integer.MAX_VALUE, (timeout.toMillis() + 999) / 1000));
        try {
            statement.setQueryTimeout(seconds);
        } catch (SQLException e) {
            // Some drivers reject statement timeouts; the coordinator still enforces its deadline
            log.debug("Driver rejected query timeout of {}s: {}", seconds, e.getMessage());
        }
    }

    private RowSet readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<ColumnSpec> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new ColumnSpec(metaData.getColumnLabel(i),
                    toColumnType(metaData.getColumnType(i)),
                    metaData.getColumnTypeName(i)));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(resultSet.getObject(i));
            }
            rows.add(row);
        }
        log.debug("Fetched {} rows with {} columns", rows.size(), columnCount);
        return new RowSet(columns, rows);
    }

    static ColumnType toColumnType(int sqlType) {
        return switch (sqlType) {
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT,
                    Types.FLOAT, Types.REAL, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> ColumnType.NUMERIC;
            case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR,
                    Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB -> ColumnType.STRING;
            case Types.BOOLEAN, Types.BIT -> ColumnType.BOOLEAN;
            case Types.DATE, Types.TIME, Types.TIMESTAMP, Types.TIME_WITH_TIMEZONE,
                    Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.TEMPORAL;
            default -> ColumnType.OTHER;
        };
    }

    private static String abbreviate(String sql) {
        if (sql == null || sql.length() <= MAX_LOGGED_SQL) {
            return sql;
        }
        return sql.substring(0, MAX_LOGGED_SQL) + "...";
    }
}
