package com.dashquery.dashboard;

import com.dashquery.exception.DashboardParseException;
import com.dashquery.variable.Variable;
import com.dashquery.variable.VariableType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses dashboard JSON into the {@link Dashboard} model.
 * <p>
 * Accepts either the API envelope {@code {"dashboard": {...}, "meta": {...}}} or a bare
 * dashboard object, and both the nested {@code panels} layout and the legacy {@code rows} layout.
 */
public class DashboardParser {

    private static final Logger log = LoggerFactory.getLogger(DashboardParser.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /** Target fields that may carry SQL, in lookup order. */
    static final List<String> SQL_FIELDS = List.of("rawSql", "sql", "query");

    private static final int MAX_DEPTH = 16;

    /**
     * Parse dashboard JSON text.
     *
     * @throws DashboardParseException if the text is not JSON or not a dashboard object
     */
    public Dashboard parse(String json) {
        if (json == null || json.isBlank()) {
            throw new DashboardParseException("Dashboard JSON is empty");
        }
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DashboardParseException("Invalid dashboard JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse dashboard JSON from a stream.
     */
    public Dashboard parse(InputStream inputStream) {
        try {
            return parse(objectMapper.readTree(inputStream));
        } catch (IOException e) {
            throw new DashboardParseException("Cannot read dashboard JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parse an already decoded JSON tree.
     */
    public Dashboard parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DashboardParseException("Dashboard JSON must be an object");
        }
        JsonNode node = root.has("dashboard") ? root.get("dashboard") : root;
        if (!node.isObject()) {
            throw new DashboardParseException("'dashboard' must be an object");
        }

        JsonNode time = node.path("time");
        List<Variable> variables = parseVariables(node.path("templating").path("list"));

        List<Panel> panels = new ArrayList<>();
        if (node.has("panels")) {
            panels.addAll(parsePanels(node.get("panels"), 0));
        }
        if (node.has("rows")) {
            panels.addAll(parseLegacyRows(node.get("rows")));
        }

        Dashboard dashboard = new Dashboard(
                text(node, "uid"),
                text(node, "title"),
                text(time, "from"),
                text(time, "to"),
                variables,
                panels
        );
        log.debug("Parsed dashboard '{}' ({}): {} variables, {} top-level panels",
                dashboard.title(), dashboard.uid(), variables.size(), panels.size());
        return dashboard;
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    private List<Variable> parseVariables(JsonNode list) {
        List<Variable> variables = new ArrayList<>();
        if (!list.isArray()) {
            return variables;
        }
        for (JsonNode entry : list) {
            parseVariable(entry).ifPresent(variables::add);
        }
        return variables;
    }

    private Optional<Variable> parseVariable(JsonNode node) {
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            log.warn("Skipping template variable without a name");
            return Optional.empty();
        }
        Optional<VariableType> type = VariableType.fromName(text(node, "type"));
        if (type.isEmpty()) {
            log.debug("Skipping variable '{}' of unsupported type '{}'", name, text(node, "type"));
            return Optional.empty();
        }

        boolean allowAll = node.path("includeAll").asBoolean(false);
        String allValue = text(node, "allValue");
        boolean multi = node.path("multi").asBoolean(false);
        String query = text(node, "query");

        List<String> options = parseOptions(node.path("options"), allValue);
        if (options.isEmpty() && type.get() == VariableType.CUSTOM && query != null) {
            options = parseCustomQuery(query);
        }

        List<String> current = textValues(node.path("current").path("value"));
        if (current.isEmpty()) {
            current = selectedOptions(node.path("options"));
        }
        if (current.isEmpty() && (type.get() == VariableType.CONSTANT || type.get() == VariableType.TEXTBOX)
                && query != null) {
            current = List.of(query);
        }
        if (current.isEmpty() && !options.isEmpty()) {
            current = List.of(options.get(0));
        }
        if (current.isEmpty()) {
            log.warn("Variable '{}' has no current value, skipping", name);
            return Optional.empty();
        }

        return Optional.of(new Variable(name, type.get(), current, allowAll, allValue, multi, options));
    }

    private List<String> parseOptions(JsonNode options, String allValue) {
        List<String> values = new ArrayList<>();
        if (!options.isArray()) {
            return values;
        }
        for (JsonNode option : options) {
            for (String value : textValues(option.path("value"))) {
                if (value.equals(Variable.DEFAULT_ALL_TOKEN) || value.equals(allValue)) {
                    continue;
                }
                values.add(value);
            }
        }
        return values;
    }

    private List<String> selectedOptions(JsonNode options) {
        List<String> values = new ArrayList<>();
        if (!options.isArray()) {
            return values;
        }
        for (JsonNode option : options) {
            if (option.path("selected").asBoolean(false)) {
                values.addAll(textValues(option.path("value")));
            }
        }
        return values;
    }

    /**
     * Split a custom variable query into values. Items are comma-separated, a backslash
     * escapes a comma, and {@code text : value} items keep the value.
     */
    static List<String> parseCustomQuery(String query) {
        List<String> values = new ArrayList<>();
        StringBuilder item = new StringBuilder();
        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '\\' && i + 1 < query.length() && query.charAt(i + 1) == ',') {
                item.append(',');
                i++;
            } else if (c == ',') {
                addCustomItem(item.toString(), values);
                item.setLength(0);
            } else {
                item.append(c);
            }
        }
        addCustomItem(item.toString(), values);
        return values;
    }

    private static void addCustomItem(String item, List<String> values) {
        String trimmed = item.trim();
        int separator = trimmed.indexOf(" : ");
        if (separator >= 0) {
            trimmed = trimmed.substring(separator + 3).trim();
        }
        if (!trimmed.isEmpty()) {
            values.add(trimmed);
        }
    }

    // ---------------------------------------------------------------------
    // Panels
    // ---------------------------------------------------------------------

    private List<Panel> parsePanels(JsonNode panels, int depth) {
        List<Panel> result = new ArrayList<>();
        if (!panels.isArray()) {
            return result;
        }
        if (depth > MAX_DEPTH) {
            log.warn("Max panel nesting depth ({}) exceeded, ignoring deeper panels", MAX_DEPTH);
            return result;
        }
        for (JsonNode node : panels) {
            if (node.isObject()) {
                result.add(parsePanel(node, depth));
            }
        }
        return result;
    }

    private Panel parsePanel(JsonNode node, int depth) {
        return new Panel(
                text(node, "id"),
                text(node, "title"),
                text(node, "type"),
                node.path("collapsed").asBoolean(false),
                datasource(node.get("datasource")),
                parseTargets(node.path("targets")),
                parsePanels(node.path("panels"), depth + 1)
        );
    }

    private List<Panel> parseLegacyRows(JsonNode rows) {
        List<Panel> result = new ArrayList<>();
        if (!rows.isArray()) {
            return result;
        }
        for (JsonNode row : rows) {
            result.add(new Panel(
                    null,
                    text(row, "title"),
                    Panel.ROW_TYPE,
                    row.path("collapse").asBoolean(false),
                    null,
                    List.of(),
                    parsePanels(row.path("panels"), 1)
            ));
        }
        return result;
    }

    private List<PanelTarget> parseTargets(JsonNode targets) {
        List<PanelTarget> result = new ArrayList<>();
        if (!targets.isArray()) {
            return result;
        }
        for (JsonNode target : targets) {
            result.add(new PanelTarget(
                    text(target, "refId"),
                    sql(target),
                    datasource(target.get("datasource")),
                    target.path("hide").asBoolean(false)
            ));
        }
        return result;
    }

    private static String sql(JsonNode target) {
        for (String field : SQL_FIELDS) {
            JsonNode value = target.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * A datasource is either a name string or an object with uid/type.
     */
    private static String datasource(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        String uid = text(node, "uid");
        return uid != null ? uid : text(node, "type");
    }

    // Helper methods

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) {
                    values.add(item.asText());
                }
            }
        } else if (node.isValueNode()) {
            values.add(node.asText());
        }
        return values;
    }
}
