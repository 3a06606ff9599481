package com.dashquery;

import com.dashquery.analysis.AnalysisReport;
import com.dashquery.analysis.AnalysisReportWriter;
import com.dashquery.analysis.AnalysisRequest;
import com.dashquery.analysis.DashboardAnalyzer;
import com.dashquery.analysis.PanelAnalysis;
import com.dashquery.config.ExecutionConfig;
import com.dashquery.config.RetryConfig;
import com.dashquery.dashboard.Dashboard;
import com.dashquery.dashboard.DashboardFixtures;
import com.dashquery.dashboard.DashboardUrl;
import com.dashquery.dashboard.QueryExtractor;
import com.dashquery.engine.JdbcSqlEngineClient;
import com.dashquery.executor.QueryExecutionCoordinator;
import com.dashquery.interpolation.InterpolationEngine;
import com.dashquery.query.QueryErrorKind;
import com.dashquery.query.QueryResult;
import com.dashquery.summary.ColumnSummary;
import com.dashquery.summary.ResultSummarizer;
import com.dashquery.time.ResolvedTimeRange;
import com.dashquery.time.TimeRangeResolver;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end analysis of a dashboard against an in-memory DuckDB.
 * Tests cover:
 * - All-values expansion feeding an IN predicate
 * - Textbox values substituted into the query
 * - Syntax failures isolated to their panel
 * - Time macros rendered as literals the engine accepts
 */
class DashQueryApplicationTest {

    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_000L);

    private QueryExecutionCoordinator coordinator;
    private DashboardAnalyzer analyzer;
    private Dashboard dashboard;

    @BeforeEach
    void setUp() {
        coordinator = new QueryExecutionCoordinator(new JdbcSqlEngineClient("jdbc:duckdb:"),
                new ExecutionConfig(2, 30_000, RetryConfig.none()));
        analyzer = new DashboardAnalyzer(new QueryExtractor(), new InterpolationEngine(), new TimeRangeResolver(),
                coordinator, new ResultSummarizer(), Clock.fixed(NOW, ZoneOffset.UTC));
        dashboard = DashboardFixtures.load("/dashboards/duckdb-smoke.json");
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private static PanelAnalysis panel(AnalysisReport report, String panelId) {
        return report.panels().stream()
                .filter(p -> p.panelId().equals(panelId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no panel " + panelId));
    }

    // =====================================================================
    // Full dashboard
    // =====================================================================

    @Test
    @DisplayName("Dashboard runs end to end with one failing panel")
    void analyzesDashboard() {
        AnalysisReport report = analyzer.analyze(AnalysisRequest.of(dashboard));

        assertEquals(4, report.panels().size());
        assertEquals(3, report.succeededCount());
        assertEquals(1, report.failedCount());
    }

    @Test
    @DisplayName("All regions selected expands to every option")
    void allRegions() {
        PanelAnalysis requests = panel(analyzer.analyze(AnalysisRequest.of(dashboard)), "1");

        assertTrue(requests.isSuccess(), () -> requests.result().toString());
        QueryResult result = requests.result().getValue();
        assertEquals(3, result.rowCount());
        assertEquals("apac", result.rows().get(0).get(0));

        ColumnSummary n = requests.summaries().get(1);
        assertEquals("n", n.name());
        assertTrue(n.isNumeric());
        assertEquals(1.0, n.min(), 1e-9);
        assertEquals(2.0, n.max(), 1e-9);
    }

    @Test
    @DisplayName("Textbox value limits the result")
    void textboxLimit() {
        PanelAnalysis limited = panel(analyzer.analyze(AnalysisRequest.of(dashboard)), "2");

        assertTrue(limited.isSuccess(), () -> limited.result().toString());
        assertEquals(2, limited.result().getValue().rowCount());
    }

    @Test
    @DisplayName("Broken SQL fails its panel without retries")
    void brokenPanel() {
        PanelAnalysis broken = panel(analyzer.analyze(AnalysisRequest.of(dashboard)), "3");

        assertFalse(broken.isSuccess());
        assertEquals(QueryErrorKind.SYNTAX, broken.result().getError().kind());
        assertEquals(1, broken.result().getError().attempts());
    }

    @Test
    @DisplayName("Time macros become literals of the resolved window")
    void timeWindow() {
        PanelAnalysis window = panel(analyzer.analyze(AnalysisRequest.of(dashboard)), "4");

        assertTrue(window.isSuccess(), () -> window.result().toString());
        List<Object> row = window.result().getValue().rows().get(0);
        assertEquals(unquote(ResolvedTimeRange.literal(NOW.toEpochMilli() - 3_600_000L)), row.get(0));
        assertEquals(unquote(ResolvedTimeRange.literal(NOW.toEpochMilli())), row.get(1));
    }

    // =====================================================================
    // Link bindings
    // =====================================================================

    @Test
    @DisplayName("Region chosen in the link narrows the result")
    void linkBindings() {
        DashboardUrl url = DashboardUrl.parse("http://localhost:3000/d/duckdb-smoke/smoke?var-region=eu&var-limit=5");

        AnalysisReport report = analyzer.analyze(AnalysisRequest.of(dashboard, url));

        QueryResult requests = panel(report, "1").result().getValue();
        assertEquals(1, requests.rowCount());
        assertEquals("eu", requests.rows().get(0).get(0));
        assertEquals(2, ((Number) requests.rows().get(0).get(1)).intValue());
        assertEquals(5, panel(report, "2").result().getValue().rowCount());
    }

    @Test
    @DisplayName("Report JSON carries summaries but no raw rows")
    void reportJson() {
        JsonNode json = new AnalysisReportWriter().toJson(analyzer.analyze(AnalysisRequest.of(dashboard)));

        JsonNode requests = json.get("panels").get(0);
        assertEquals("ok", requests.get("status").asText());
        assertEquals(3, requests.get("rowCount").asInt());
        assertFalse(requests.has("rows"));
        assertEquals(3, requests.get("columns").get(1).get("count").asInt());
    }

    private static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1);
    }
}
