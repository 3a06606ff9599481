package com.dashquery.query;

import java.util.List;
import java.util.Objects;

/**
 * Successful result of one panel query.
 *
 * @param panelId Panel identifier
 * @param columns Columns in result order
 * @param rows    Rows; each row holds one value per column, nulls allowed
 */
public record QueryResult(String panelId, List<ColumnSpec> columns, List<List<Object>> rows) {

    public QueryResult {
        Objects.requireNonNull(panelId, "panelId");
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult of(String panelId, RowSet rowSet) {
        return new QueryResult(panelId, rowSet.columns(), rowSet.rows());
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
