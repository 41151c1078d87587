package com.policy.adapter.spring;

import com.policy.config.PolicyConfig;
import com.policy.config.PolicyLoader;
import com.policy.operation.OperationRegistry;
import com.policy.policy.DefaultPolicyEngine;
import com.policy.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the policy engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "policy", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PolicyProperties.class)
public class PolicyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolicyAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PolicyConfig policyConfig(PolicyProperties properties) {
        log.info("Loading policy configuration from: {}", properties.getConfigPath());
        return PolicyLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationRegistry operationRegistry() {
        return OperationRegistry.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEngine policyEngine(PolicyConfig config, OperationRegistry operationRegistry) {
        log.info("Creating PolicyEngine: {} v{}", config.name(), config.version());
        return new DefaultPolicyEngine(config.policySet(), config.budget(), operationRegistry);
    }
}
