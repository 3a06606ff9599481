package com.dashquery.dashboard;

import com.dashquery.query.QueryTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryExtractor.
 */
class QueryExtractorTest {

    private QueryExtractor extractor;
    private DashboardParser parser;

    @BeforeEach
    void setUp() {
        extractor = new QueryExtractor();
        parser = new DashboardParser();
    }

    private static List<String> ids(List<QueryTemplate> templates) {
        return templates.stream().map(QueryTemplate::panelId).toList();
    }

    @Test
    @DisplayName("SQL targets are extracted from nested and collapsed rows in panel order")
    void extractsFromTree() {
        List<QueryTemplate> templates = extractor.extract(DashboardFixtures.serviceOverview());

        assertEquals(List.of("1", "4-A", "4-B", "6", "8"), ids(templates));
    }

    @Test
    @DisplayName("Templates carry title, datasource and referenced variables")
    void templateDetails() {
        List<QueryTemplate> templates = extractor.extract(DashboardFixtures.serviceOverview());

        QueryTemplate total = templates.get(0);
        assertEquals("Total requests", total.title());
        assertEquals("$ds", total.datasourceRef());
        assertEquals(Set.of("region"), total.referencedVariables());

        QueryTemplate worst = templates.get(2);
        assertEquals("warehouse", worst.datasourceRef());
        assertEquals(Set.of("min_latency"), worst.referencedVariables());

        assertNull(templates.get(3).datasourceRef());
    }

    @Test
    @DisplayName("Panels without SQL and hidden targets are skipped")
    void skipsNonSqlAndHidden() {
        List<QueryTemplate> templates = extractor.extract(DashboardFixtures.serviceOverview());

        assertTrue(templates.stream().noneMatch(t -> t.rawText().equals("SELECT 1")));
        assertTrue(templates.stream().noneMatch(t -> t.panelId().startsWith("9")));
        assertTrue(templates.stream().noneMatch(t -> t.panelId().startsWith("2")));
    }

    @Test
    @DisplayName("Dashboard without panels yields no templates")
    void emptyDashboard() {
        assertTrue(extractor.extract(parser.parse("{\"title\": \"empty\"}")).isEmpty());
    }

    @Test
    @DisplayName("Missing and duplicate panel ids are made unique")
    void uniqueIds() {
        Dashboard dashboard = parser.parse("""
                {"panels": [
                  {"type": "table", "targets": [{"rawSql": "SELECT a"}]},
                  {"id": 1, "type": "table", "targets": [{"rawSql": "SELECT b"}]},
                  {"id": 1, "type": "table", "targets": [{"rawSql": "SELECT c"}]}
                ]}
                """);

        assertEquals(List.of("panel-1", "1", "1#2"), ids(extractor.extract(dashboard)));
    }

    @Test
    @DisplayName("Target datasource overrides panel datasource")
    void targetDatasourceWins() {
        Dashboard dashboard = parser.parse("""
                {"panels": [{"id": 1, "datasource": "panel-ds",
                  "targets": [{"rawSql": "SELECT 1", "datasource": {"uid": "target-ds"}}]}]}
                """);

        assertEquals("target-ds", extractor.extract(dashboard).get(0).datasourceRef());
    }

    @Test
    @DisplayName("Alternative SQL fields are recognized")
    void alternativeSqlFields() {
        Dashboard dashboard = parser.parse("""
                {"panels": [
                  {"id": 1, "targets": [{"sql": "SELECT 1"}]},
                  {"id": 2, "targets": [{"query": "SELECT 2"}]},
                  {"id": 3, "targets": [{"query": {"builder": true}}]}
                ]}
                """);

        assertEquals(List.of("1", "2"), ids(extractor.extract(dashboard)));
    }
}
