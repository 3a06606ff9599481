package com.dashquery.dashboard;

import java.util.List;

/**
 * A dashboard panel. Rows are panels of type "row" that hold child panels.
 *
 * @param id         Panel id as declared, may be null
 * @param title      Panel title
 * @param type       Panel type (timeseries, table, row, ...)
 * @param collapsed  Whether a row is collapsed; its children are still present
 * @param datasource Panel-level datasource reference, may be null
 * @param targets    Query targets
 * @param children   Nested panels of a row
 */
public record Panel(
        String id,
        String title,
        String type,
        boolean collapsed,
        String datasource,
        List<PanelTarget> targets,
        List<Panel> children
) {
    public static final String ROW_TYPE = "row";

    public Panel {
        targets = targets == null ? List.of() : List.copyOf(targets);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isRow() {
        return ROW_TYPE.equals(type) || !children.isEmpty();
    }

    public void accept(PanelVisitor visitor) {
        if (isRow()) {
            visitor.visitRow(this);
        } else {
            visitor.visitPanel(this);
        }
    }
}
