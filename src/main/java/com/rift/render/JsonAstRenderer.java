package com.rift.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rift.exception.RenderException;
import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;
import com.rift.parser.IdentifierNode;
import com.rift.parser.NumberNode;

/**
 * JSON export of the tree, e.g.
 * {@code {"type":"BINARY_OP","operator":"+","left":{...},"right":{...}}}.
 */
public class JsonAstRenderer implements AstRenderer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public String render(AstNode ast) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(ast));
        } catch (JsonProcessingException e) {
            throw new RenderException("Failed to export AST as JSON: " + e.getMessage(), e);
        }
    }

    ObjectNode toJson(AstNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", node.getType().name());
        if (node instanceof IdentifierNode identifier) {
            json.put("value", identifier.text());
        } else if (node instanceof NumberNode number) {
            json.put("value", number.text());
        } else if (node instanceof BinaryOpNode binary) {
            json.put("operator", binary.operator());
            json.set("left", toJson(binary.left()));
            json.set("right", toJson(binary.right()));
        } else {
            throw new IllegalArgumentException("Unsupported AST node: " + node);
        }
        return json;
    }
}
