package com.rift.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for RIFT.
 */
@ConfigurationProperties(prefix = "rift")
public class RiftProperties {

    /**
     * Whether RIFT is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the governance configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:rift-gov.yaml";

    /**
     * Source text processed by the demo runner.
     */
    private String demoInput = "x + 2 * y";

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

    public String getDemoInput() {
        return demoInput;
    }

    public void setDemoInput(String demoInput) {
        this.demoInput = demoInput;
    }
}
