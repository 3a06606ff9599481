package com.dashquery.config;

import com.dashquery.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads analysis configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static AnalysisConfig load(String path) {
        log.info("Loading analysis configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static AnalysisConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings may sit at the root or under a 'dashquery' key
        Map<String, Object> config = root.containsKey("dashquery")
                ? getMap(root, "dashquery")
                : root;

        String name = getString(config, "name", "default");
        ExecutionConfig execution = parseExecution(getMap(config, "execution"));
        SummaryConfig summary = parseSummary(getMap(config, "summary"));
        EngineConfig engine = parseEngine(getMap(config, "engine"));

        AnalysisConfig analysisConfig = new AnalysisConfig(name, execution, summary, engine);

        log.info("Loaded analysis configuration '{}': concurrency={}, timeout={}ms, retries={}, engine={}",
                name, execution.concurrencyLimit(), execution.queryTimeoutMs(),
                execution.retry().maxRetries(), engine.isConfigured() ? engine.jdbcUrl() : "none");

        return analysisConfig;
    }

    private static ExecutionConfig parseExecution(Map<String, Object> map) {
        if (map == null) {
            return ExecutionConfig.defaults();
        }
        ExecutionConfig defaults = ExecutionConfig.defaults();
        int concurrencyLimit = getInt(map, "concurrency-limit", defaults.concurrencyLimit());
        long queryTimeoutMs = getLong(map, "query-timeout-ms", defaults.queryTimeoutMs());
        RetryConfig retry = parseRetry(getMap(map, "retry"));

        log.debug("Parsed execution config: concurrency={}, timeout={}ms", concurrencyLimit, queryTimeoutMs);
        return new ExecutionConfig(concurrencyLimit, queryTimeoutMs, retry);
    }

    private static RetryConfig parseRetry(Map<String, Object> map) {
        RetryConfig defaults = RetryConfig.defaults();
        if (map == null) {
            return defaults;
        }
        return new RetryConfig(
                getInt(map, "max-retries", defaults.maxRetries()),
                getLong(map, "initial-backoff-ms", defaults.initialBackoffMs()),
                getDouble(map, "backoff-multiplier", defaults.backoffMultiplier()),
                getLong(map, "max-backoff-ms", defaults.maxBackoffMs())
        );
    }

    private static SummaryConfig parseSummary(Map<String, Object> map) {
        if (map == null) {
            return SummaryConfig.defaults();
        }
        return new SummaryConfig(getInt(map, "cardinality-sample-size",
                SummaryConfig.defaults().cardinalitySampleSize()));
    }

    private static EngineConfig parseEngine(Map<String, Object> map) {
        if (map == null) {
            return EngineConfig.none();
        }
        return new EngineConfig(
                getString(map, "jdbc-url", null),
                getString(map, "username", null),
                getString(map, "password", null)
        );
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + value + "'", e);
        }
    }
}
