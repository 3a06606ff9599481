package com.dashquery.dashboard;

import com.dashquery.exception.DashboardParseException;
import com.dashquery.variable.Variable;
import com.dashquery.variable.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DashboardParser.
 */
class DashboardParserTest {

    private DashboardParser parser;

    @BeforeEach
    void setUp() {
        parser = new DashboardParser();
    }

    // =====================================================================
    // Envelope and metadata
    // =====================================================================

    @Test
    @DisplayName("API envelope is unwrapped and metadata read")
    void parsesEnvelope() {
        Dashboard dashboard = DashboardFixtures.serviceOverview();

        assertEquals("svc-overview", dashboard.uid());
        assertEquals("Service Overview", dashboard.title());
        assertEquals("now-6h", dashboard.timeFrom());
        assertEquals("now", dashboard.timeTo());
        assertEquals(6, dashboard.panels().size());
    }

    @Test
    @DisplayName("Bare dashboard without time range gets default range")
    void parsesBareDashboard() {
        Dashboard dashboard = parser.parse("{\"uid\":\"x\",\"title\":\"Bare\"}");

        assertEquals("x", dashboard.uid());
        assertEquals(Dashboard.DEFAULT_FROM, dashboard.timeFrom());
        assertEquals(Dashboard.DEFAULT_TO, dashboard.timeTo());
        assertTrue(dashboard.panels().isEmpty());
        assertTrue(dashboard.variables().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not json", "[1,2]", "\"text\"", "{\"dashboard\": 3}", "{\"panels\": [}"})
    @DisplayName("Malformed or non-object JSON fails with DashboardParseException")
    void rejectsMalformed(String json) {
        assertThrows(DashboardParseException.class, () -> parser.parse(json));
    }

    // =====================================================================
    // Variables
    // =====================================================================

    @Test
    @DisplayName("Supported variables are parsed in declaration order, unsupported types skipped")
    void parsesVariables() {
        List<Variable> variables = DashboardFixtures.serviceOverview().variables();

        assertEquals(List.of("region", "service", "min_latency", "ds"),
                variables.stream().map(Variable::name).toList());
    }

    @Test
    @DisplayName("Custom variable derives candidates from its query")
    void customVariableCandidates() {
        Variable region = DashboardFixtures.serviceOverview().variables().get(0);

        assertEquals(VariableType.CUSTOM, region.type());
        assertTrue(region.allowAll());
        assertTrue(region.multiValue());
        assertTrue(region.isAllSelected());
        assertEquals(List.of("eu", "us", "apac"), region.options());
    }

    @Test
    @DisplayName("Array current value and options are read")
    void queryVariable() {
        Variable service = DashboardFixtures.serviceOverview().variables().get(1);

        assertEquals(VariableType.QUERY, service.type());
        assertEquals(List.of("api", "web"), service.currentValues());
        assertEquals(List.of("api", "web", "worker"), service.options());
    }

    @Test
    @DisplayName("Textbox without current value uses its query as value")
    void textboxDefault() {
        Variable minLatency = DashboardFixtures.serviceOverview().variables().get(2);

        assertEquals(List.of("100"), minLatency.currentValues());
    }

    @Test
    @DisplayName("Scalar current value is read as a single value")
    void scalarCurrentValue() {
        Variable ds = DashboardFixtures.serviceOverview().variables().get(3);

        assertEquals(VariableType.DATASOURCE, ds.type());
        assertEquals(List.of("warehouse"), ds.currentValues());
    }

    @Test
    @DisplayName("All option is excluded from candidates")
    void allOptionExcluded() {
        Dashboard dashboard = parser.parse("""
                {"templating": {"list": [{
                  "name": "host", "type": "query", "includeAll": true, "allValue": "*",
                  "current": {"value": "$__all"},
                  "options": [{"value": "$__all"}, {"value": "*"}, {"value": "a"}, {"value": "b"}]
                }]}}
                """);

        Variable host = dashboard.variables().get(0);
        assertEquals(List.of("a", "b"), host.options());
        assertTrue(host.isAllSelected());
    }

    @Test
    @DisplayName("Variable with no value and no options is skipped")
    void variableWithoutValueSkipped() {
        Dashboard dashboard = parser.parse("""
                {"templating": {"list": [{"name": "empty", "type": "query"}, {"type": "custom"}]}}
                """);

        assertTrue(dashboard.variables().isEmpty());
    }

    @Test
    @DisplayName("Custom query handles escaped commas and text : value pairs")
    void customQuerySplitting() {
        assertEquals(List.of("a,b", "c", "v"), DashboardParser.parseCustomQuery("a\\,b, c ,, label : v"));
    }

    // =====================================================================
    // Panels
    // =====================================================================

    @Test
    @DisplayName("Panel tree is parsed with rows, targets and datasources")
    void parsesPanelTree() {
        List<Panel> panels = DashboardFixtures.serviceOverview().panels();

        Panel stat = panels.get(0);
        assertEquals("1", stat.id());
        assertEquals("$ds", stat.datasource());
        assertEquals(1, stat.targets().size());
        assertFalse(stat.isRow());

        Panel timeseries = panels.get(3);
        assertEquals("warehouse", timeseries.datasource());
        assertEquals(3, timeseries.targets().size());
        assertTrue(timeseries.targets().get(2).hidden());

        Panel errors = panels.get(4);
        assertTrue(errors.isRow());
        assertTrue(errors.collapsed());
        assertEquals(2, errors.children().size());
        assertEquals(1, errors.children().get(1).children().size());

        Panel prometheus = panels.get(5);
        assertFalse(prometheus.targets().get(0).hasSql());
    }

    @Test
    @DisplayName("Legacy rows layout becomes row panels")
    void parsesLegacyRows() {
        Dashboard dashboard = parser.parse("""
                {"title": "Old", "rows": [
                  {"title": "First", "collapse": true, "panels": [
                    {"id": 11, "type": "table", "targets": [{"refId": "A", "rawSql": "SELECT 1"}]}
                  ]}
                ]}
                """);

        Panel row = dashboard.panels().get(0);
        assertTrue(row.isRow());
        assertTrue(row.collapsed());
        assertEquals("First", row.title());
        assertEquals("SELECT 1", row.children().get(0).targets().get(0).rawSql());
    }
}
