package com.dashquery.analysis;

import com.dashquery.dashboard.Dashboard;
import com.dashquery.dashboard.DashboardUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one analysis run.
 *
 * @param dashboard  Parsed dashboard
 * @param from       Time range start overriding the dashboard default, or null
 * @param to         Time range end overriding the dashboard default, or null
 * @param overrides  Variable selections overriding the dashboard's current values
 * @param candidates Enumerated candidate values per variable, used for "all values" expansion
 */
public record AnalysisRequest(
        Dashboard dashboard,
        String from,
        String to,
        Map<String, List<String>> overrides,
        Map<String, List<String>> candidates
) {
    public AnalysisRequest {
        Objects.requireNonNull(dashboard, "dashboard");
        overrides = copy(overrides);
        candidates = copy(candidates);
    }

    /**
     * Analyze a dashboard with its own defaults.
     */
    public static AnalysisRequest of(Dashboard dashboard) {
        return new AnalysisRequest(dashboard, null, null, Map.of(), Map.of());
    }

    /**
     * Analyze a dashboard with the time range and variables carried by a link.
     */
    public static AnalysisRequest of(Dashboard dashboard, DashboardUrl url) {
        return new AnalysisRequest(dashboard, url.from(), url.to(), url.variables(), Map.of());
    }

    public String effectiveFrom() {
        return from != null && !from.isBlank() ? from : dashboard.timeFrom();
    }

    public String effectiveTo() {
        return to != null && !to.isBlank() ? to : dashboard.timeTo();
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
