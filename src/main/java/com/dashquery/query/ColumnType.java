package com.dashquery.query;

/**
 * Coarse column type used for summarization.
 */
public enum ColumnType {
    NUMERIC,
    STRING,
    BOOLEAN,
    TEMPORAL,
    OTHER;

    public boolean isNumeric() {
        return this == NUMERIC;
    }
}
