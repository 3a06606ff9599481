package com.dashquery.adapter.spring;

import com.dashquery.analysis.AnalysisReportWriter;
import com.dashquery.analysis.DashboardAnalyzer;
import com.dashquery.config.AnalysisConfig;
import com.dashquery.config.ConfigLoader;
import com.dashquery.config.EngineConfig;
import com.dashquery.dashboard.DashboardParser;
import com.dashquery.engine.JdbcSqlEngineClient;
import com.dashquery.engine.SqlEngineClient;
import com.dashquery.executor.QueryExecutionCoordinator;
import com.dashquery.summary.ResultSummarizer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for dashboard analysis.
 */
@Configuration
@ConditionalOnProperty(prefix = "dashquery", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DashQueryProperties.class)
public class DashQueryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DashQueryAutoConfiguration.class);

    private QueryExecutionCoordinator coordinator;

    @Bean
    @ConditionalOnMissingBean
    public AnalysisConfig analysisConfig(DashQueryProperties properties) {
        log.info("Loading analysis configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlEngineClient sqlEngineClient(AnalysisConfig config) {
        EngineConfig engine = config.engine();
        log.info("Creating JDBC engine client: {}", engine);
        return new JdbcSqlEngineClient(engine.jdbcUrl(), engine.username(), engine.password());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutionCoordinator queryExecutionCoordinator(SqlEngineClient client, AnalysisConfig config) {
        this.coordinator = new QueryExecutionCoordinator(client, config.execution());
        return this.coordinator;
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultSummarizer resultSummarizer(AnalysisConfig config) {
        return new ResultSummarizer(config.summary());
    }

    @Bean
    @ConditionalOnMissingBean
    public DashboardAnalyzer dashboardAnalyzer(QueryExecutionCoordinator coordinator, ResultSummarizer summarizer) {
        return new DashboardAnalyzer(coordinator, summarizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DashboardParser dashboardParser() {
        return new DashboardParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisReportWriter analysisReportWriter() {
        return new AnalysisReportWriter();
    }

    @PreDestroy
    public void shutdown() {
        if (coordinator != null && !coordinator.isShutdown()) {
            log.info("Shutting down QueryExecutionCoordinator");
            coordinator.shutdown();
        }
    }
}
