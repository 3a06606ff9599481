package com.dashquery.analysis;

import com.dashquery.interpolation.Diagnostic;
import com.dashquery.query.QueryError;
import com.dashquery.query.QueryResult;
import com.dashquery.query.Result;
import com.dashquery.summary.ColumnSummary;

import java.util.List;

/**
 * Outcome for one panel query.
 *
 * @param panelId       Panel identifier
 * @param title         Panel title
 * @param datasource    Resolved datasource reference, may be null
 * @param resolvedQuery SQL sent to the engine
 * @param result        Query result or error
 * @param summaries     Column summaries; empty when the query failed
 * @param diagnostics   Interpolation diagnostics for this panel
 */
public record PanelAnalysis(
        String panelId,
        String title,
        String datasource,
        String resolvedQuery,
        Result<QueryResult, QueryError> result,
        List<ColumnSummary> summaries,
        List<Diagnostic> diagnostics
) {
    public PanelAnalysis {
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return result.isOk();
    }
}
