package com.dashquery.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for dashboard analysis.
 */
@ConfigurationProperties(prefix = "dashquery")
public class DashQueryProperties {

    /**
     * Whether dashboard analysis beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the analysis configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:dashquery.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
