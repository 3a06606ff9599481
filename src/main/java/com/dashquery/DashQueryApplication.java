package com.dashquery;

import com.dashquery.analysis.AnalysisReport;
import com.dashquery.analysis.AnalysisReportWriter;
import com.dashquery.analysis.AnalysisRequest;
import com.dashquery.analysis.DashboardAnalyzer;
import com.dashquery.dashboard.Dashboard;
import com.dashquery.dashboard.DashboardParser;
import com.dashquery.dashboard.DashboardUrl;
import com.dashquery.exception.DashQueryException;
import com.dashquery.spring.EnableDashQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Analyzes a dashboard JSON file and logs the report.
 * <p>
 * Usage: {@code DashQueryApplication <dashboard.json> [dashboard-url]}. The optional URL
 * supplies the time range and {@code var-} bindings.
 */
@SpringBootApplication
@EnableDashQuery
public class DashQueryApplication {

    private static final Logger log = LoggerFactory.getLogger(DashQueryApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DashQueryApplication.class, args);
    }

    @Bean
    public CommandLineRunner analyze(DashboardParser parser, DashboardAnalyzer analyzer, AnalysisReportWriter writer) {
        return args -> {
            if (args.length == 0) {
                log.info("Usage: DashQueryApplication <dashboard.json> [dashboard-url]");
                return;
            }

            Dashboard dashboard;
            try (InputStream in = Files.newInputStream(Path.of(args[0]))) {
                dashboard = parser.parse(in);
            } catch (IOException e) {
                log.error("Cannot read dashboard file {}: {}", args[0], e.getMessage());
                return;
            }

            AnalysisRequest request = args.length > 1
                    ? AnalysisRequest.of(dashboard, DashboardUrl.parse(args[1]))
                    : AnalysisRequest.of(dashboard);

            try {
                AnalysisReport report = analyzer.analyze(request);
                log.info("Analysis report:\n{}", writer.write(report));
            } catch (DashQueryException e) {
                log.error("Analysis of '{}' failed: {}", dashboard.title(), e.getMessage());
            }
        };
    }
}
