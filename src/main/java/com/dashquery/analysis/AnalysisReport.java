package com.dashquery.analysis;

import com.dashquery.interpolation.Diagnostic;
import com.dashquery.time.ResolvedTimeRange;

import java.util.List;

/**
 * Outcome of one analysis run: every panel's result, successful or not.
 *
 * @param dashboardUid Dashboard uid
 * @param title        Dashboard title
 * @param timeRange    Resolved time range, or null if it could not be resolved
 * @param panels       Panel outcomes in panel order
 * @param diagnostics  Run-level diagnostics
 */
public record AnalysisReport(
        String dashboardUid,
        String title,
        ResolvedTimeRange timeRange,
        List<PanelAnalysis> panels,
        List<Diagnostic> diagnostics
) {
    public AnalysisReport {
        panels = panels == null ? List.of() : List.copyOf(panels);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public long succeededCount() {
        return panels.stream().filter(PanelAnalysis::isSuccess).count();
    }

    public long failedCount() {
        return panels.size() - succeededCount();
    }
}
