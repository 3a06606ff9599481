package com.dashquery.interpolation;

/**
 * Kinds of non-fatal problems recorded while resolving a template.
 */
public enum DiagnosticKind {
    /**
     * A token names a variable that was never declared; left verbatim.
     */
    UNRESOLVED_TOKEN,

    /**
     * A ${name:format} token uses a format that is not supported; left verbatim.
     */
    UNKNOWN_FORMAT,

    /**
     * The time range could not be resolved; time macros left verbatim.
     */
    INVALID_TIME_SPEC,

    /**
     * An "all values" selection had no known candidates and was substituted with a fallback.
     */
    ALL_VALUES_FALLBACK
}
