package com.policy.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the policy engine.
 */
@ConfigurationProperties(prefix = "policy")
public class PolicyProperties {

    /**
     * Whether the policy engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the policy document (YAML or JSON).
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:policies.yaml";

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
