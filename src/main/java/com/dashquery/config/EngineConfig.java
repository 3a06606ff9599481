package com.dashquery.config;

/**
 * Connection settings for the JDBC engine client.
 *
 * @param jdbcUrl  JDBC URL, blank if no engine is configured
 * @param username User name, may be null
 * @param password Password, may be null
 */
public record EngineConfig(String jdbcUrl, String username, String password) {

    public boolean isConfigured() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    public static EngineConfig none() {
        return new EngineConfig(null, null, null);
    }

    @Override
    public String toString() {
        return "EngineConfig[jdbcUrl=" + jdbcUrl + ", username=" + username + "]";
    }
}
