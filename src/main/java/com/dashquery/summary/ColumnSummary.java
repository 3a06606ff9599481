package com.dashquery.summary;

import com.dashquery.query.ColumnType;

/**
 * Descriptive statistics of one result column.
 *
 * @param name                  Column name
 * @param type                  Column type
 * @param count                 Number of rows
 * @param nullCount             Number of null values
 * @param min                   Minimum of a numeric column, null otherwise or when all values are null
 * @param max                   Maximum of a numeric column, null otherwise or when all values are null
 * @param mean                  Mean of a numeric column, null otherwise or when all values are null
 * @param distinctCountEstimate Distinct non-null values seen in the sample
 * @param distinctCountCapped   Whether the sample limit was reached, making the estimate a lower bound
 */
public record ColumnSummary(
        String name,
        ColumnType type,
        long count,
        long nullCount,
        Double min,
        Double max,
        Double mean,
        long distinctCountEstimate,
        boolean distinctCountCapped
) {
    public boolean isNumeric() {
        return mean != null;
    }
}
