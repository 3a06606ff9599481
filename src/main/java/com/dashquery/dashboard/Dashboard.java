package com.dashquery.dashboard;

import com.dashquery.variable.Variable;

import java.util.List;

/**
 * Parsed dashboard definition.
 *
 * @param uid       Dashboard uid, may be null
 * @param title     Dashboard title
 * @param timeFrom  Default time range start as declared (e.g. "now-6h")
 * @param timeTo    Default time range end as declared (e.g. "now")
 * @param variables Template variables in declaration order
 * @param panels    Top-level panels
 */
public record Dashboard(
        String uid,
        String title,
        String timeFrom,
        String timeTo,
        List<Variable> variables,
        List<Panel> panels
) {
    public static final String DEFAULT_FROM = "now-6h";
    public static final String DEFAULT_TO = "now";

    public Dashboard {
        timeFrom = timeFrom == null || timeFrom.isBlank() ? DEFAULT_FROM : timeFrom;
        timeTo = timeTo == null || timeTo.isBlank() ? DEFAULT_TO : timeTo;
        variables = variables == null ? List.of() : List.copyOf(variables);
        panels = panels == null ? List.of() : List.copyOf(panels);
    }
}
