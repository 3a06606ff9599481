package com.dashquery.dashboard;

import com.dashquery.interpolation.TemplateTokenizer;
import com.dashquery.query.QueryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a dashboard's panel tree and yields one {@link QueryTemplate} per SQL-bearing target.
 * <p>
 * Rows are expanded recursively whether collapsed or not. Panels without SQL targets are
 * skipped, as are hidden targets. Panel ids in the output are unique.
 */
public class QueryExtractor {

    private static final Logger log = LoggerFactory.getLogger(QueryExtractor.class);

    private static final int MAX_DEPTH = 16;

    /**
     * Extract query templates in panel declaration order.
     */
    public List<QueryTemplate> extract(Dashboard dashboard) {
        Collector collector = new Collector();
        for (Panel panel : dashboard.panels()) {
            panel.accept(collector);
        }
        log.debug("Extracted {} query templates from dashboard '{}', skipped {} panels without SQL",
                collector.templates.size(), dashboard.title(), collector.skipped);
        return collector.templates;
    }

    private static final class Collector implements PanelVisitor {

        private final List<QueryTemplate> templates = new ArrayList<>();
        private final Set<String> usedIds = new HashSet<>();
        private int depth;
        private int anonymous;
        private int skipped;

        @Override
        public void visitRow(Panel row) {
            if (depth >= MAX_DEPTH) {
                log.warn("Max row nesting depth ({}) exceeded at row '{}'", MAX_DEPTH, row.title());
                return;
            }
            // A row may itself carry targets
            visitPanel(row);
            depth++;
            try {
                for (Panel child : row.children()) {
                    child.accept(this);
                }
            } finally {
                depth--;
            }
        }

        @Override
        public void visitPanel(Panel panel) {
            List<PanelTarget> sqlTargets = panel.targets().stream()
                    .filter(PanelTarget::hasSql)
                    .filter(target -> !target.hidden())
                    .toList();
            if (sqlTargets.isEmpty()) {
                if (!panel.isRow()) {
                    skipped++;
                    log.trace("Panel '{}' has no SQL target", panel.title());
                }
                return;
            }

            String baseId = panel.id() != null ? panel.id() : "panel-" + (++anonymous);
            for (int i = 0; i < sqlTargets.size(); i++) {
                PanelTarget target = sqlTargets.get(i);
                String id = baseId;
                if (sqlTargets.size() > 1) {
                    id = baseId + "-" + (target.refId() != null ? target.refId() : String.valueOf(i + 1));
                }
                String datasource = target.datasource() != null ? target.datasource() : panel.datasource();
                templates.add(new QueryTemplate(uniqueId(id), panel.title(), target.rawSql(), datasource,
                        TemplateTokenizer.referencedVariables(target.rawSql())));
            }
        }

        private String uniqueId(String id) {
            String candidate = id;
            int suffix = 2;
            while (!usedIds.add(candidate)) {
                candidate = id + "#" + suffix++;
            }
            if (!candidate.equals(id)) {
                log.debug("Duplicate panel id '{}' renamed to '{}'", id, candidate);
            }
            return candidate;
        }
    }
}
