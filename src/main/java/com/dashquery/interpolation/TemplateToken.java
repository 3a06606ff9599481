package com.dashquery.interpolation;

/**
 * A token in a query template.
 *
 * @param kind     Token kind
 * @param text     Original source text of the token
 * @param name     Variable or macro name (null for text)
 * @param format   Explicit format suffix (null if absent)
 * @param argument Macro argument, e.g. the column of $__timeFilter(column)
 * @param position Offset of the token in the template
 * @param syntax   Source syntax of a variable token
 * @param inClause Whether the token directly follows an SQL IN keyword
 */
public record TemplateToken(
        TokenKind kind,
        String text,
        String name,
        String format,
        String argument,
        int position,
        TokenSyntax syntax,
        boolean inClause
) {
    static TemplateToken text(String text, int position) {
        return new TemplateToken(TokenKind.TEXT, text, null, null, null, position, TokenSyntax.NONE, false);
    }

    public boolean isText() {
        return kind == TokenKind.TEXT;
    }

    @Override
    public String toString() {
        if (kind == TokenKind.TEXT) {
            return "TEXT(" + text + ")";
        }
        return kind + "(" + text + ")";
    }
}
