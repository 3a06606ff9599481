package com.dashquery.query;

import java.util.List;

/**
 * Tabular data returned by the SQL engine.
 *
 * @param columns Columns in result order
 * @param rows    Rows; each row holds one value per column, nulls allowed
 */
public record RowSet(List<ColumnSpec> columns, List<List<Object>> rows) {

    public RowSet {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static RowSet empty(List<ColumnSpec> columns) {
        return new RowSet(columns, List.of());
    }
}
