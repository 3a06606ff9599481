package com.dashquery.interpolation;

/**
 * Kinds of tokens in a query template.
 */
public enum TokenKind {
    // Literal query text, copied through unchanged
    TEXT,

    // User-declared template variable: $name, ${name}, ${name:format}, [[name]]
    VARIABLE,

    // Time macros
    TIME_FROM,
    TIME_TO,
    TIME_FILTER,

    // Epoch-millisecond bounds: $__from, $__to
    EPOCH_FROM,
    EPOCH_TO
}
