package com.dashquery.dashboard;

/**
 * Visitor over the panel tree.
 */
public interface PanelVisitor {

    /**
     * Visit a row. Implementations decide whether to descend into its children.
     */
    void visitRow(Panel row);

    /**
     * Visit a leaf panel.
     */
    void visitPanel(Panel panel);
}
