package com.dashquery.analysis;

import com.dashquery.interpolation.Diagnostic;
import com.dashquery.query.QueryError;
import com.dashquery.query.QueryResult;
import com.dashquery.summary.ColumnSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Renders an {@link AnalysisReport} as JSON for the reporting layer.
 * Raw rows are left out; each panel carries its row count and column summaries.
 */
public class AnalysisReportWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toJson(AnalysisReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("dashboardUid", report.dashboardUid());
        root.put("title", report.title());
        if (report.timeRange() != null) {
            ObjectNode time = root.putObject("timeRange");
            time.put("from", report.timeRange().fromMillis());
            time.put("to", report.timeRange().toMillis());
        }
        root.put("succeeded", report.succeededCount());
        root.put("failed", report.failedCount());
        writeDiagnostics(root.putArray("diagnostics"), report.diagnostics());

        ArrayNode panels = root.putArray("panels");
        for (PanelAnalysis panel : report.panels()) {
            ObjectNode node = panels.addObject();
            node.put("panelId", panel.panelId());
            node.put("title", panel.title());
            node.put("datasource", panel.datasource());
            node.put("query", panel.resolvedQuery());
            panel.result().fold(
                    result -> writeResult(node, result, panel.summaries()),
                    error -> writeError(node, error));
            writeDiagnostics(node.putArray("diagnostics"), panel.diagnostics());
        }
        return root;
    }

    public String write(AnalysisReport report) {
        try {
            return objectMapper.writeValueAsString(toJson(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis report", e);
        }
    }

    private static ObjectNode writeResult(ObjectNode node, QueryResult result, List<ColumnSummary> summaries) {
        node.put("status", "ok");
        node.put("rowCount", result.rowCount());
        ArrayNode columns = node.putArray("columns");
        for (ColumnSummary summary : summaries) {
            ObjectNode column = columns.addObject();
            column.put("name", summary.name());
            column.put("type", summary.type().name());
            column.put("count", summary.count());
            column.put("nullCount", summary.nullCount());
            column.put("distinctCountEstimate", summary.distinctCountEstimate());
            column.put("distinctCountCapped", summary.distinctCountCapped());
            if (summary.isNumeric()) {
                column.put("min", summary.min());
                column.put("max", summary.max());
                column.put("mean", summary.mean());
            }
        }
        return node;
    }

    private static ObjectNode writeError(ObjectNode node, QueryError error) {
        node.put("status", "error");
        ObjectNode err = node.putObject("error");
        err.put("kind", error.kind().name());
        err.put("message", error.message());
        err.put("attempts", error.attempts());
        return node;
    }

    private static void writeDiagnostics(ArrayNode array, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode node = array.addObject();
            node.put("kind", diagnostic.kind().name());
            if (diagnostic.token() != null) {
                node.put("token", diagnostic.token());
                node.put("position", diagnostic.position());
            }
            node.put("message", diagnostic.message());
        }
    }
}
