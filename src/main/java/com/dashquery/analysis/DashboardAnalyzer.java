package com.dashquery.analysis;

import com.dashquery.dashboard.Dashboard;
import com.dashquery.dashboard.QueryExtractor;
import com.dashquery.exception.InvalidTimeSpecException;
import com.dashquery.exception.UnknownVariableException;
import com.dashquery.executor.CancellationToken;
import com.dashquery.executor.QueryExecutionCoordinator;
import com.dashquery.interpolation.Diagnostic;
import com.dashquery.interpolation.DiagnosticKind;
import com.dashquery.interpolation.InterpolationEngine;
import com.dashquery.interpolation.InterpolationResult;
import com.dashquery.query.QueryError;
import com.dashquery.query.QueryResult;
import com.dashquery.query.QueryTemplate;
import com.dashquery.query.ResolvedQuery;
import com.dashquery.query.Result;
import com.dashquery.summary.ColumnSummary;
import com.dashquery.summary.ResultSummarizer;
import com.dashquery.time.ResolvedTimeRange;
import com.dashquery.time.TimeRange;
import com.dashquery.time.TimeRangeResolver;
import com.dashquery.variable.DefaultVariableRegistry;
import com.dashquery.variable.VariableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the full analysis of a dashboard: extract queries, interpolate them against the run's
 * variables and time range, execute them and summarize what came back.
 * <p>
 * Each run owns a fresh variable registry and resolves the time range once, so every panel
 * sees the same bindings and the same "now". Only an unreachable engine aborts a run; every
 * other failure is reported per panel or as a run diagnostic.
 */
public class DashboardAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DashboardAnalyzer.class);

    private final QueryExtractor extractor;
    private final InterpolationEngine interpolationEngine;
    private final TimeRangeResolver timeRangeResolver;
    private final QueryExecutionCoordinator coordinator;
    private final ResultSummarizer summarizer;
    private final Clock clock;

    public DashboardAnalyzer(QueryExecutionCoordinator coordinator, ResultSummarizer summarizer) {
        this(new QueryExtractor(), new InterpolationEngine(), new TimeRangeResolver(),
                coordinator, summarizer, Clock.systemUTC());
    }

    public DashboardAnalyzer(QueryExtractor extractor,
                             InterpolationEngine interpolationEngine,
                             TimeRangeResolver timeRangeResolver,
                             QueryExecutionCoordinator coordinator,
                             ResultSummarizer summarizer,
                             Clock clock) {
        this.extractor = extractor;
        this.interpolationEngine = interpolationEngine;
        this.timeRangeResolver = timeRangeResolver;
        this.coordinator = coordinator;
        this.summarizer = summarizer;
        this.clock = clock;
    }

    public AnalysisReport analyze(AnalysisRequest request) {
        return analyze(request, CancellationToken.create());
    }

    /**
     * Analyze a dashboard.
     *
     * @param request      Dashboard and view-time bindings
     * @param cancellation Stops queries that have not started yet
     * @return Report with one entry per extracted query
     * @throws com.dashquery.exception.EngineUnreachableException if the SQL engine cannot be reached
     */
    public AnalysisReport analyze(AnalysisRequest request, CancellationToken cancellation) {
        Dashboard dashboard = request.dashboard();
        Instant now = clock.instant();
        List<Diagnostic> runDiagnostics = new ArrayList<>();

        log.info("Analyzing dashboard '{}' ({})", dashboard.title(), dashboard.uid());

        VariableRegistry registry = buildRegistry(request, runDiagnostics);
        ResolvedTimeRange timeRange = resolveTimeRange(request, now, runDiagnostics);

        List<QueryTemplate> templates = extractor.extract(dashboard);
        List<ResolvedQuery> queries = new ArrayList<>(templates.size());
        List<InterpolationResult> interpolations = new ArrayList<>(templates.size());
        List<String> datasources = new ArrayList<>(templates.size());

        for (QueryTemplate template : templates) {
            InterpolationResult sql = interpolationEngine.interpolate(template.rawText(), registry, timeRange);
            interpolations.add(sql);
            queries.add(new ResolvedQuery(template.panelId(), sql.text()));
            datasources.add(template.datasourceRef() == null ? null
                    : interpolationEngine.interpolate(template.datasourceRef(), registry, timeRange).text());
        }

        List<Result<QueryResult, QueryError>> results = coordinator.execute(
                queries, coordinator.getConfig().concurrencyLimit(), cancellation);

        List<PanelAnalysis> panels = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            QueryTemplate template = templates.get(i);
            Result<QueryResult, QueryError> result = results.get(i);
            List<ColumnSummary> summaries = result.isOk() ? summarizer.summarize(result.getValue()) : List.of();
            panels.add(new PanelAnalysis(template.panelId(), template.title(), datasources.get(i),
                    queries.get(i).sql(), result, summaries, interpolations.get(i).diagnostics()));
        }

        AnalysisReport report = new AnalysisReport(dashboard.uid(), dashboard.title(), timeRange, panels,
                runDiagnostics);
        log.info("Analysis of '{}' finished: {} panels, {} succeeded, {} failed",
                dashboard.title(), panels.size(), report.succeededCount(), report.failedCount());
        return report;
    }

    private VariableRegistry buildRegistry(AnalysisRequest request, List<Diagnostic> runDiagnostics) {
        VariableRegistry registry = new DefaultVariableRegistry();
        registry.registerAll(request.dashboard().variables());

        for (Map.Entry<String, List<String>> entry : request.overrides().entrySet()) {
            if (entry.getValue().isEmpty()) {
                runDiagnostics.add(Diagnostic.general(DiagnosticKind.UNRESOLVED_TOKEN,
                        "override for '" + entry.getKey() + "' has no value, ignored"));
                continue;
            }
            registry.override(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, List<String>> entry : request.candidates().entrySet()) {
            try {
                registry.registerCandidates(entry.getKey(), entry.getValue());
            } catch (UnknownVariableException e) {
                runDiagnostics.add(Diagnostic.general(DiagnosticKind.UNRESOLVED_TOKEN,
                        "candidates given for undeclared variable '" + e.getVariableName() + "', ignored"));
            }
        }

        registry.seal();
        return registry;
    }

    private ResolvedTimeRange resolveTimeRange(AnalysisRequest request, Instant now,
                                               List<Diagnostic> runDiagnostics) {
        try {
            TimeRange range = TimeRange.parse(request.effectiveFrom(), request.effectiveTo());
            return timeRangeResolver.resolveRange(range, now);
        } catch (InvalidTimeSpecException e) {
            log.warn("Time range {}..{} cannot be resolved: {}",
                    request.effectiveFrom(), request.effectiveTo(), e.getMessage());
            runDiagnostics.add(Diagnostic.general(DiagnosticKind.INVALID_TIME_SPEC, e.getMessage()));
            return null;
        }
    }
}
