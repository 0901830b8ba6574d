package com.rift.render;

import com.rift.parser.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage 3: renders the final AST in the configured formats.
 */
public class Renderer {

    private static final Logger log = LoggerFactory.getLogger(Renderer.class);

    private final OutputSettings settings;
    private final AstRenderer primary;
    private final Map<OutputFormat, AstRenderer> additional = new LinkedHashMap<>();

    public Renderer() {
        this(OutputSettings.canonical());
    }

    public Renderer(OutputSettings settings) {
        this.settings = settings;
        this.primary = RendererFactory.create(settings.primaryFormat());
        for (OutputFormat format : settings.additionalFormats()) {
            additional.put(format, RendererFactory.create(format));
        }
        log.info("Renderer initialized: primary={}, additional={}", primary.getFormat(), additional.keySet());
    }

    /**
     * Render in the primary format.
     */
    public String render(AstNode ast) {
        return primary.render(ast);
    }

    /**
     * Render in every additional format, keyed by format.
     */
    public Map<OutputFormat, String> renderAdditional(AstNode ast) {
        Map<OutputFormat, String> outputs = new LinkedHashMap<>();
        for (Map.Entry<OutputFormat, AstRenderer> entry : additional.entrySet()) {
            outputs.put(entry.getKey(), entry.getValue().render(ast));
            log.debug("Rendered additional format {}", entry.getKey());
        }
        return Collections.unmodifiableMap(outputs);
    }

    public OutputSettings getSettings() {
        return settings;
    }
}
