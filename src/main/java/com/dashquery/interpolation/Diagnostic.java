package com.dashquery.interpolation;

/**
 * A non-fatal problem found while resolving a template.
 *
 * @param kind     What went wrong
 * @param token    Source text of the offending token
 * @param position Offset of the token in the template, or -1 if not tied to a token
 * @param message  Human-readable detail
 */
public record Diagnostic(DiagnosticKind kind, String token, int position, String message) {

    public static Diagnostic of(DiagnosticKind kind, TemplateToken token, String message) {
        return new Diagnostic(kind, token.text(), token.position(), message);
    }

    public static Diagnostic general(DiagnosticKind kind, String message) {
        return new Diagnostic(kind, null, -1, message);
    }
}
