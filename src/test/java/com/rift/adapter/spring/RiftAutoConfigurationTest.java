package com.rift.adapter.spring;

import com.rift.config.Governance;
import com.rift.config.RiftConfig;
import com.rift.pipeline.PipelineResult;
import com.rift.pipeline.RiftPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RiftAutoConfiguration.
 */
class RiftAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RiftAutoConfiguration.class));

    @Test
    @DisplayName("Creates governance and pipeline from the bundled configuration")
    void createsBeans() {
        contextRunner.run(context -> {
            RiftConfig config = context.getBean(RiftConfig.class);
            assertEquals("rift-default", config.name());
            assertNotNull(context.getBean(Governance.class));

            PipelineResult result = context.getBean(RiftPipeline.class).run("x + 2 * y");
            assertTrue(result.isSuccess());
        });
    }

    @Test
    @DisplayName("Config path property selects the governance file")
    void customConfigPath() {
        contextRunner
                .withPropertyValues("rift.config-path=classpath:rift-gov-test.yaml")
                .run(context -> assertEquals("rift-test", context.getBean(RiftConfig.class).name()));
    }

    @Test
    @DisplayName("Disabled property skips all beans")
    void disabled() {
        contextRunner
                .withPropertyValues("rift.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(RiftPipeline.class).isEmpty()));
    }
}
