package com.dashquery.interpolation;

import java.util.Map;

/**
 * Macro names and delimiters recognized in query templates.
 */
public final class TemplateSyntaxConfig {

    private TemplateSyntaxConfig() {
    }

    public static final String TIME_FILTER = "__timeFilter";

    /**
     * Macros that take no argument, by name.
     */
    public static final Map<String, TokenKind> MACROS = Map.of(
            "__timeFrom", TokenKind.TIME_FROM,
            "__timeTo", TokenKind.TIME_TO,
            "__from", TokenKind.EPOCH_FROM,
            "__to", TokenKind.EPOCH_TO
    );

    /**
     * Delimiter symbols.
     */
    public static final class Delimiters {
        public static final char DOLLAR = '$';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char FORMAT_SEPARATOR = ':';
        public static final char UNDERSCORE = '_';
        public static final char DOT = '.';

        private Delimiters() {
        }
    }

    /**
     * SQL keyword that switches multi-value variables to quoted lists.
     */
    public static final String IN_KEYWORD = "IN";
}
