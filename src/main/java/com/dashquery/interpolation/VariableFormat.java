package com.dashquery.interpolation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Formats controlling how a variable's values are joined and quoted on substitution.
 */
public enum VariableFormat {
    /**
     * Comma-joined, unquoted.
     */
    CSV {
        @Override
        public String format(List<String> values) {
            return String.join(",", values);
        }
    },

    /**
     * Pipe-joined, unquoted.
     */
    PIPE {
        @Override
        public String format(List<String> values) {
            return String.join("|", values);
        }
    },

    /**
     * Regex alternation with metacharacters escaped; several values are grouped as (a|b).
     */
    REGEX {
        @Override
        public String format(List<String> values) {
            String joined = values.stream()
                    .map(VariableFormat::escapeRegex)
                    .collect(Collectors.joining("|"));
            return values.size() > 1 ? "(" + joined + ")" : joined;
        }
    },

    /**
     * Each value single-quoted, comma-joined.
     */
    SINGLEQUOTE {
        @Override
        public String format(List<String> values) {
            return quoteEach(values, '\'');
        }
    },

    /**
     * Each value double-quoted, comma-joined.
     */
    DOUBLEQUOTE {
        @Override
        public String format(List<String> values) {
            return quoteEach(values, '"');
        }
    },

    /**
     * SQL string literals: each value single-quoted, comma-joined.
     */
    SQLSTRING {
        @Override
        public String format(List<String> values) {
            return quoteEach(values, '\'');
        }
    },

    /**
     * Comma-joined with no quoting or escaping at all.
     */
    RAW {
        @Override
        public String format(List<String> values) {
            return String.join(",", values);
        }
    };

    private static final String REGEX_METACHARACTERS = "\\^$.|?*+()[]{}/-";

    /**
     * Render values in this format.
     *
     * @param values Values in selection order
     * @return Substitution text
     */
    public abstract String format(List<String> values);

    /**
     * Whether the format joins values as alternatives of a regular expression.
     */
    public boolean isRegexAlternation() {
        return this == PIPE || this == REGEX;
    }

    /**
     * Look up a format by its name in a ${name:format} token.
     */
    public static Optional<VariableFormat> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(VariableFormat.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Wrap each value in the quote character, doubling any embedded quote.
     */
    static String quoteEach(List<String> values, char quote) {
        String q = String.valueOf(quote);
        String doubled = q + q;
        return values.stream()
                .map(v -> q + v.replace(q, doubled) + q)
                .collect(Collectors.joining(","));
    }

    static String escapeRegex(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
