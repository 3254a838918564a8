package com.batchpool.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for batch-pool.
 */
@ConfigurationProperties(prefix = "batch-pool")
public class BatchPoolProperties {

    /**
     * Whether batch-pool beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the batch-pool configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:batch-pool.yaml";

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
