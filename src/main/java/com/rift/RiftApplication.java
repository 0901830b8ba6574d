package com.rift;

import com.rift.adapter.spring.RiftProperties;
import com.rift.pipeline.PipelineError;
import com.rift.pipeline.PipelineResult;
import com.rift.pipeline.RenderedOutput;
import com.rift.pipeline.RiftPipeline;
import com.rift.render.OutputFormat;
import com.rift.spring.EnableRift;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.Map;

/**
 * Example Spring Boot application running the RIFT pipeline once.
 * Input comes from the first command-line argument, or rift.demo-input.
 */
@SpringBootApplication
@EnableRift
public class RiftApplication {

    private static final Logger log = LoggerFactory.getLogger(RiftApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RiftApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(RiftPipeline pipeline, RiftProperties properties) {
        return args -> {
            String source = args.length > 0 ? String.join(" ", args) : properties.getDemoInput();
            log.info("=== RIFT Demo: \"{}\" ===", source);

            PipelineResult result = pipeline.run(source);
            if (result.isSuccess()) {
                RenderedOutput output = result.getOutput().orElseThrow();
                log.info("Tokens: {}, AST nodes: {} -> {}, passes: {}", output.tokenCount(),
                        output.nodeCount(), output.optimizedNodeCount(), output.appliedPasses());
                log.info("{}:\n{}", output.format(), output.text());
                for (Map.Entry<OutputFormat, String> extra : output.additionalOutputs().entrySet()) {
                    log.info("{}:\n{}", extra.getKey(), extra.getValue());
                }
            } else {
                PipelineError error = result.getError().orElseThrow();
                log.error("Pipeline failed [{}] in stage {}: {}", error.kind(), error.stageName(), error.message());
            }
        };
    }
}
