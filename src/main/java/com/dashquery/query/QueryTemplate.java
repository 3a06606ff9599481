package com.dashquery.query;

import java.util.Objects;
import java.util.Set;

/**
 * A raw query template taken from a dashboard panel.
 *
 * @param panelId             Panel identifier (suffixed with the target refId when a panel has several)
 * @param title               Panel title, may be null
 * @param rawText             Query text with unresolved tokens
 * @param datasourceRef       Datasource uid or name, possibly itself a variable reference
 * @param referencedVariables Variables referenced by the template
 */
public record QueryTemplate(
        String panelId,
        String title,
        String rawText,
        String datasourceRef,
        Set<String> referencedVariables
) {
    public QueryTemplate {
        Objects.requireNonNull(panelId, "panelId");
        Objects.requireNonNull(rawText, "rawText");
        referencedVariables = referencedVariables == null ? Set.of() : Set.copyOf(referencedVariables);
    }
}
