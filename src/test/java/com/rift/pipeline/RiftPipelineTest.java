package com.rift.pipeline;

import com.rift.config.ConfigLoader;
import com.rift.config.DefaultGovernance;
import com.rift.config.Governance;
import com.rift.config.RiftConfig;
import com.rift.config.Stage;
import com.rift.config.StageConfig;
import com.rift.exception.ConfigurationException;
import com.rift.parser.Parser;
import com.rift.render.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for RiftPipeline.
 */
class RiftPipelineTest {

    private Governance governance;
    private RiftPipeline pipeline;

    @BeforeEach
    void setUp() {
        governance = new DefaultGovernance(RiftConfig.defaults());
        pipeline = new RiftPipeline(governance);
    }

    private RenderedOutput success(PipelineResult result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        assertTrue(result.getError().isEmpty());
        return result.getOutput().orElseThrow();
    }

    private PipelineError failure(PipelineResult result) {
        assertFalse(result.isSuccess(), () -> "expected failure but got " + result);
        assertTrue(result.getOutput().isEmpty());
        return result.getError().orElseThrow();
    }

    @Test
    @DisplayName("Renders 'x + 2 * y' in canonical form")
    void rendersCanonical() {
        RenderedOutput output = success(pipeline.run("x + 2 * y"));

        String expected = """
                (BinOp +
                  (Identifier x)
                  (BinOp *
                    (Number 2)
                    (Identifier y)
                  )
                )
                """;
        assertEquals(expected, output.text());
        assertEquals(OutputFormat.LISP_STYLE_AST, output.format());
        assertEquals(5, output.tokenCount());
        assertEquals(5, output.nodeCount());
        assertEquals(5, output.optimizedNodeCount());
        assertEquals(List.of("constant_folding", "dead_code_elimination"), output.appliedPasses());
    }

    @Test
    @DisplayName("Default governance also produces C, DOT and JSON outputs")
    void additionalOutputs() {
        RenderedOutput output = success(pipeline.run("a - b - c"));

        assertEquals("((a - b) - c)", output.additionalOutputs().get(OutputFormat.C_CODE));
        assertTrue(output.additionalOutputs().get(OutputFormat.DOT_GRAPH).startsWith("digraph AST {"));
        assertTrue(output.additionalOutputs().containsKey(OutputFormat.JSON));
    }

    @Test
    @DisplayName("Constant subexpressions are folded before rendering")
    void folding() {
        RenderedOutput output = success(pipeline.run("2 * 3 + x"));

        assertEquals("(BinOp +\n  (Number 6)\n  (Identifier x)\n)\n", output.text());
        assertEquals(5, output.nodeCount());
        assertEquals(3, output.optimizedNodeCount());
    }

    @Test
    @DisplayName("Fully constant input folds to a single number")
    void fullyConstant() {
        assertEquals("(Number 14)\n", success(pipeline.run("2 + 3 * 4")).text());
    }

    @Test
    @DisplayName("Division by zero survives folding")
    void divisionByZero() {
        RenderedOutput output = success(pipeline.run("4 / 0"));

        assertEquals("(BinOp /\n  (Number 4)\n  (Number 0)\n)\n", output.text());
    }

    @Test
    @DisplayName("Empty input fails with UNEXPECTED_END in the parser")
    void emptyInput() {
        PipelineError error = failure(pipeline.run(""));

        assertEquals(PipelineError.ErrorKind.UNEXPECTED_END, error.kind());
        assertEquals(Stage.PARSER.name(), error.stageName());
        assertEquals(1, error.position());
    }

    @Test
    @DisplayName("Syntax errors carry the offending position")
    void unexpectedToken() {
        PipelineError error = failure(pipeline.run("x * + y"));

        assertEquals(PipelineError.ErrorKind.UNEXPECTED_TOKEN, error.kind());
        assertEquals(3, error.position());
        assertTrue(error.hasPosition());
    }

    @Test
    @DisplayName("Missing stage configuration is reported as CONFIG_MISSING")
    void missingConfig() {
        Governance partial = new DefaultGovernance(ConfigLoader.load("classpath:rift-gov-tokenizer-only.yaml"));

        PipelineError error = failure(RiftPipeline.runPipeline("x + y", partial));

        assertEquals(PipelineError.ErrorKind.CONFIG_MISSING, error.kind());
        assertFalse(error.hasPosition());
        assertNull(error.stageName());
    }

    @Test
    @DisplayName("Constructor surfaces missing configuration")
    void constructorThrows() {
        Map<Stage, StageConfig> stages = new EnumMap<>(RiftConfig.defaults().stages());
        stages.remove(Stage.RENDERER);
        Governance noRenderer = new DefaultGovernance(new RiftConfig("no-renderer", "1.0.0", stages));

        assertThrows(ConfigurationException.class, () -> new RiftPipeline(noRenderer));
    }

    @Test
    @DisplayName("Alternate governance changes classification and output format")
    void alternateGovernance() {
        Governance test = new DefaultGovernance(ConfigLoader.load("classpath:rift-gov-test.yaml"));

        RenderedOutput output = success(RiftPipeline.runPipeline("a + 2 * 3", test));

        assertEquals(OutputFormat.C_CODE, output.format());
        assertEquals("(a + 6)", output.text());
        assertEquals(List.of("constant_folding"), output.appliedPasses());
        assertTrue(output.additionalOutputs().isEmpty());
    }

    @Test
    @DisplayName("Same input renders identically across runs")
    void deterministic() {
        String first = success(pipeline.run("a * b - c / d")).text();
        String second = success(new RiftPipeline(governance).run("a * b - c / d")).text();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Very long operator chains fail with ALLOCATION_FAILURE instead of overflowing")
    void longChainIsAllocationFailure() {
        PipelineError error = failure(pipeline.run("a" + " + a".repeat(20_000)));

        assertEquals(PipelineError.ErrorKind.ALLOCATION_FAILURE, error.kind());
        assertEquals(Stage.PARSER.name(), error.stageName());
        assertFalse(error.hasPosition());
    }

    @Test
    @DisplayName("Chains just under the depth limit run through every stage")
    void chainBelowLimitSucceeds() {
        RenderedOutput output = success(pipeline.run("1" + " + 1".repeat(Parser.MAX_DEPTH - 1)));

        assertEquals("(Number " + Parser.MAX_DEPTH + ")\n", output.text());
        assertEquals(2 * Parser.MAX_DEPTH - 1, output.nodeCount());
        assertEquals(1, output.optimizedNodeCount());
    }
}
