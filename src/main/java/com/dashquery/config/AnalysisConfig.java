package com.dashquery.config;

/**
 * Root configuration for dashboard analysis.
 *
 * @param name      Configuration name, used in logs
 * @param execution Query execution settings
 * @param summary   Summarization settings
 * @param engine    SQL engine connection settings
 */
public record AnalysisConfig(
        String name,
        ExecutionConfig execution,
        SummaryConfig summary,
        EngineConfig engine
) {
    /**
     * Configuration with every default applied.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig("default", ExecutionConfig.defaults(), SummaryConfig.defaults(), EngineConfig.none());
    }
}
