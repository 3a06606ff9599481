package com.dashquery.interpolation;

import java.util.List;

/**
 * Output of interpolating one template.
 *
 * @param text        Resolved query text
 * @param diagnostics Problems found, in template order
 */
public record InterpolationResult(String text, List<Diagnostic> diagnostics) {

    public InterpolationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }
}
