package com.dashquery.query;

import java.util.Objects;

/**
 * An executable query for one panel.
 *
 * @param panelId Panel identifier
 * @param sql     Fully interpolated SQL
 */
public record ResolvedQuery(String panelId, String sql) {

    public ResolvedQuery {
        Objects.requireNonNull(panelId, "panelId");
        Objects.requireNonNull(sql, "sql");
    }
}
