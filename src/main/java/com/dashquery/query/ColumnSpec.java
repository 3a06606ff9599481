package com.dashquery.query;

import java.util.Objects;

/**
 * Name and type of a result column.
 *
 * @param name    Column label
 * @param type    Coarse type
 * @param sqlType Engine-reported type name, may be null
 */
public record ColumnSpec(String name, ColumnType type, String sqlType) {

    public ColumnSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ColumnSpec of(String name, ColumnType type) {
        return new ColumnSpec(name, type, null);
    }
}
