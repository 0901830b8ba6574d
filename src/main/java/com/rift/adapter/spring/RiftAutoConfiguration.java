package com.rift.adapter.spring;

import com.rift.config.ConfigLoader;
import com.rift.config.DefaultGovernance;
import com.rift.config.Governance;
import com.rift.config.RiftConfig;
import com.rift.pipeline.RiftPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for RIFT.
 */
@Configuration
@ConditionalOnProperty(prefix = "rift", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RiftProperties.class)
public class RiftAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RiftAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RiftConfig riftConfig(RiftProperties properties) {
        log.info("Loading RIFT governance from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Governance governance(RiftConfig config) {
        return new DefaultGovernance(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public RiftPipeline riftPipeline(Governance governance) {
        log.info("Creating RiftPipeline");
        return new RiftPipeline(governance);
    }
}
