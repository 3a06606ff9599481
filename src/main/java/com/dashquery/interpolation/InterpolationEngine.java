package com.dashquery.interpolation;

import com.dashquery.exception.InvalidTimeSpecException;
import com.dashquery.variable.Variable;
import com.dashquery.variable.VariableRegistry;
import com.dashquery.time.ResolvedTimeRange;
import com.dashquery.time.TimeRange;
import com.dashquery.time.TimeRangeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variable and time-macro tokens in query templates.
 * <p>
 * Each template is tokenized once and every token is substituted exactly once, so text
 * produced by a substitution is never scanned again. Tokens that cannot be resolved stay
 * verbatim and are reported as diagnostics.
 */
public class InterpolationEngine {

    private static final Logger log = LoggerFactory.getLogger(InterpolationEngine.class);

    /**
     * Matches the end of "expr IN (" or "expr NOT IN (" so an empty all-values list can be
     * replaced by a constant predicate.
     */
    private static final Pattern IN_PREDICATE_TAIL = Pattern.compile(
            "([\\w.\"`\\[\\]]+)\\s+(NOT\\s+)?IN\\s*\\(\\s*$", Pattern.CASE_INSENSITIVE);

    private static final String ALWAYS_TRUE = "1=1";
    private static final String ALWAYS_FALSE = "1=0";
    private static final String MATCH_ANYTHING = ".*";

    private final TimeRangeResolver timeRangeResolver;

    public InterpolationEngine() {
        this(new TimeRangeResolver());
    }

    public InterpolationEngine(TimeRangeResolver timeRangeResolver) {
        this.timeRangeResolver = timeRangeResolver;
    }

    /**
     * Interpolate a template against a declared time range evaluated at {@code now}.
     * A time range that fails to resolve leaves time macros verbatim with a diagnostic.
     *
     * @param template  Raw query template
     * @param registry  Variable bindings
     * @param timeRange Declared time range, may be null
     * @param now       Evaluation instant
     * @return Resolved text and diagnostics
     */
    public InterpolationResult interpolate(String template, VariableRegistry registry,
                                           TimeRange timeRange, Instant now) {
        ResolvedTimeRange resolved = null;
        String timeError = null;
        if (timeRange == null) {
            timeError = "no time range";
        } else {
            try {
                resolved = timeRangeResolver.resolveRange(timeRange, now);
            } catch (InvalidTimeSpecException e) {
                timeError = e.getMessage();
            }
        }
        return interpolate(template, registry, resolved, timeError);
    }

    /**
     * Interpolate a template against an already resolved time range.
     *
     * @param template Raw query template
     * @param registry Variable bindings
     * @param range    Resolved time range, may be null
     * @return Resolved text and diagnostics
     */
    public InterpolationResult interpolate(String template, VariableRegistry registry, ResolvedTimeRange range) {
        return interpolate(template, registry, range, range == null ? "no time range" : null);
    }

    private InterpolationResult interpolate(String template, VariableRegistry registry,
                                            ResolvedTimeRange range, String timeError) {
        if (template == null || template.isEmpty()) {
            return new InterpolationResult(template == null ? "" : template, List.of());
        }

        List<TemplateToken> tokens = new TemplateTokenizer(template).tokenize();
        StringBuilder out = new StringBuilder(template.length() + 32);
        List<Diagnostic> diagnostics = new ArrayList<>();
        boolean dropClosingParen = false;

        for (int i = 0; i < tokens.size(); i++) {
            TemplateToken token = tokens.get(i);

            switch (token.kind()) {
                case TEXT -> {
                    String text = token.text();
                    if (dropClosingParen) {
                        text = stripLeadingClosingParen(text);
                        dropClosingParen = false;
                    }
                    out.append(text);
                }
                case VARIABLE -> dropClosingParen =
                        appendVariable(token, nextToken(tokens, i), registry, out, diagnostics);
                case TIME_FROM, TIME_TO, TIME_FILTER, EPOCH_FROM, EPOCH_TO ->
                        appendTimeMacro(token, range, timeError, out, diagnostics);
            }
        }

        for (Diagnostic diagnostic : diagnostics) {
            log.warn("Template diagnostic {}: {} at {} ({})",
                    diagnostic.kind(), diagnostic.token(), diagnostic.position(), diagnostic.message());
        }
        return new InterpolationResult(out.toString(), diagnostics);
    }

    /**
     * Append the substitution for a variable token.
     *
     * @return true if the following closing parenthesis must be dropped
     */
    private boolean appendVariable(TemplateToken token, TemplateToken next, VariableRegistry registry,
                                   StringBuilder out, List<Diagnostic> diagnostics) {
        Optional<Variable> declared = registry.lookup(token.name());
        if (declared.isEmpty()) {
            out.append(token.text());
            diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_TOKEN, token,
                    "variable '" + token.name() + "' is not declared"));
            return false;
        }
        Variable variable = declared.get();

        VariableFormat explicitFormat = null;
        if (token.format() != null) {
            Optional<VariableFormat> format = VariableFormat.fromName(token.format());
            if (format.isEmpty()) {
                out.append(token.text());
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNKNOWN_FORMAT, token,
                        "format '" + token.format() + "' is not supported"));
                return false;
            }
            explicitFormat = format.get();
        }

        List<String> values = registry.resolve(variable.name());
        if (values.isEmpty()) {
            return appendAllValuesFallback(token, next, explicitFormat, out, diagnostics);
        }

        VariableFormat format = explicitFormat;
        if (format == null) {
            format = token.inClause() && variable.isMultiValued() ? VariableFormat.SQLSTRING : VariableFormat.CSV;
        }
        String rendered = format.format(values);
        log.debug("Substituted {} -> {}", token.text(), rendered);
        out.append(rendered);
        return false;
    }

    /**
     * Substitute an "all values" selection whose candidates were never enumerated.
     * IN predicates become constant predicates, regex formats match anything, and any
     * other position keeps the token.
     */
    private boolean appendAllValuesFallback(TemplateToken token, TemplateToken next, VariableFormat format,
                                            StringBuilder out, List<Diagnostic> diagnostics) {
        if (format != null && format.isRegexAlternation()) {
            out.append(MATCH_ANYTHING);
            diagnostics.add(Diagnostic.of(DiagnosticKind.ALL_VALUES_FALLBACK, token,
                    "no candidate values known, substituted match-anything pattern"));
            return false;
        }

        if (token.inClause() && next != null && next.isText() && next.text().stripLeading().startsWith(")")) {
            Matcher matcher = IN_PREDICATE_TAIL.matcher(out);
            if (matcher.find()) {
                boolean negated = matcher.group(2) != null;
                out.setLength(matcher.start());
                out.append(negated ? ALWAYS_FALSE : ALWAYS_TRUE);
                diagnostics.add(Diagnostic.of(DiagnosticKind.ALL_VALUES_FALLBACK, token,
                        "no candidate values known, replaced IN predicate on "
                                + matcher.group(1) + " with " + (negated ? ALWAYS_FALSE : ALWAYS_TRUE)));
                return true;
            }
        }

        out.append(token.text());
        diagnostics.add(Diagnostic.of(DiagnosticKind.ALL_VALUES_FALLBACK, token,
                "no candidate values known, token left unresolved"));
        return false;
    }

    private void appendTimeMacro(TemplateToken token, ResolvedTimeRange range, String timeError,
                                 StringBuilder out, List<Diagnostic> diagnostics) {
        if (range == null) {
            out.append(token.text());
            diagnostics.add(Diagnostic.of(DiagnosticKind.INVALID_TIME_SPEC, token, timeError));
            return;
        }
        switch (token.kind()) {
            case TIME_FROM -> out.append(range.fromLiteral());
            case TIME_TO -> out.append(range.toLiteral());
            case EPOCH_FROM -> out.append(range.fromMillis());
            case EPOCH_TO -> out.append(range.toMillis());
            case TIME_FILTER -> {
                String column = token.argument();
                if (column == null || column.isEmpty()) {
                    out.append(token.text());
                    diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_TOKEN, token,
                            "time filter has no column"));
                    return;
                }
                out.append(column).append(" >= ").append(range.fromLiteral())
                        .append(" AND ").append(column).append(" <= ").append(range.toLiteral());
            }
            default -> throw new IllegalStateException("Not a time macro: " + token);
        }
    }

    private static TemplateToken nextToken(List<TemplateToken> tokens, int index) {
        return index + 1 < tokens.size() ? tokens.get(index + 1) : null;
    }

    private static String stripLeadingClosingParen(String text) {
        String stripped = text.stripLeading();
        if (stripped.startsWith(")")) {
            return stripped.substring(1);
        }
        return text;
    }
}
