package com.dashquery.dashboard;

/**
 * One query target of a panel.
 *
 * @param refId      Target reference id (A, B, ...), may be null
 * @param rawSql     SQL text of the target, or null if the target carries no SQL
 * @param datasource Target-level datasource reference, may be null
 * @param hidden     Whether the target is disabled in the dashboard
 */
public record PanelTarget(String refId, String rawSql, String datasource, boolean hidden) {

    public boolean hasSql() {
        return rawSql != null && !rawSql.isBlank();
    }
}
