package com.rift.pipeline;

import com.rift.config.Governance;
import com.rift.config.Stage;
import com.rift.coordinator.AstCoordinator;
import com.rift.coordinator.CoordinationResult;
import com.rift.coordinator.OptimizationPassRegistry;
import com.rift.exception.ConfigurationException;
import com.rift.exception.RiftException;
import com.rift.lexer.TokenStream;
import com.rift.lexer.Tokenizer;
import com.rift.parser.AstNode;
import com.rift.parser.OperatorTiers;
import com.rift.parser.Parser;
import com.rift.render.OutputFormat;
import com.rift.render.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs source text through tokenizer, parser, coordinator and renderer, in that order.
 * Each stage only sees the previous stage's output. The first failure stops the run
 * and is returned as a {@link PipelineError}.
 */
public class RiftPipeline {

    private static final Logger log = LoggerFactory.getLogger(RiftPipeline.class);

    private final Tokenizer tokenizer;
    private final Parser parser;
    private final AstCoordinator coordinator;
    private final Renderer renderer;

    /**
     * Build all stages from governance.
     *
     * @throws ConfigurationException if a stage's required configuration is missing
     */
    public RiftPipeline(Governance governance) {
        this(governance, OptimizationPassRegistry.defaults());
    }

    public RiftPipeline(Governance governance, OptimizationPassRegistry passRegistry) {
        this.tokenizer = new Tokenizer(governance.getPatternRules(Stage.TOKENIZER));
        this.parser = new Parser(OperatorTiers.fromPrecedenceTable(governance.getPrecedenceTable(Stage.PARSER)));
        this.coordinator = new AstCoordinator(passRegistry, governance.getOptimizationFlags(Stage.COORDINATOR));
        this.renderer = new Renderer(governance.getOutputSettings(Stage.RENDERER));
        log.info("RIFT pipeline ready");
    }

    public RiftPipeline(Tokenizer tokenizer, Parser parser, AstCoordinator coordinator, Renderer renderer) {
        this.tokenizer = tokenizer;
        this.parser = parser;
        this.coordinator = coordinator;
        this.renderer = renderer;
    }

    /**
     * Build a pipeline from governance and run it once. Configuration errors raised
     * while building the stages are returned as CONFIG_MISSING failures.
     */
    public static PipelineResult runPipeline(String source, Governance governance) {
        RiftPipeline pipeline;
        try {
            pipeline = new RiftPipeline(governance);
        } catch (ConfigurationException e) {
            log.warn("Pipeline construction failed: {}", e.getMessage());
            return DefaultPipelineResult.failure(PipelineError.from(e, null));
        }
        return pipeline.run(source);
    }

    public PipelineResult run(String source) {
        log.debug("Processing input: \"{}\"", source);
        Stage stage = Stage.TOKENIZER;
        try {
            TokenStream tokens = tokenizer.tokenize(source);
            int tokenCount = tokens.size();

            stage = Stage.PARSER;
            AstNode ast = parser.parse(tokens);

            stage = Stage.COORDINATOR;
            CoordinationResult coordinated = coordinator.coordinate(ast);

            stage = Stage.RENDERER;
            String text = renderer.render(coordinated.ast());
            Map<OutputFormat, String> additional = renderer.renderAdditional(coordinated.ast());

            RenderedOutput output = new RenderedOutput(text, renderer.getSettings().primaryFormat(), additional,
                    tokenCount, coordinated.nodeCount(), coordinated.optimizedNodeCount(),
                    coordinated.appliedPasses());
            log.debug("Pipeline complete: {} tokens, {} -> {} nodes",
                    tokenCount, output.nodeCount(), output.optimizedNodeCount());
            return DefaultPipelineResult.success(output);
        } catch (RiftException e) {
            log.warn("Pipeline failed at stage {}: {}", stage, e.getMessage());
            return DefaultPipelineResult.failure(PipelineError.from(e, stage.name()));
        }
    }
}
