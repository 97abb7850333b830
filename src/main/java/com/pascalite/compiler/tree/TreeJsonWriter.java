package com.pascalite.compiler.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pascalite.compiler.parser.Declaration;

/**
 * JSON rendering of a syntax tree:
 * {@code {"node": "...", "value": "...", "children": [...]}}, where
 * {@code value} and {@code children} are left out when absent or empty.
 */
public final class TreeJsonWriter {

    private static final ObjectMapper om = new ObjectMapper();

    private TreeJsonWriter() {}

    public static ObjectNode toJson(Declaration.Program root) {
        return toJson(TreePrinter.describe(root));
    }

    public static String write(Declaration.Program root) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("tree serialization failed", e);
        }
    }

    private static ObjectNode toJson(DisplayNode node) {
        ObjectNode out = om.createObjectNode();
        out.put("node", node.node);
        if (node.value != null) out.put("value", node.value);
        if (!node.children.isEmpty()) {
            ArrayNode children = out.putArray("children");
            for (DisplayNode child : node.children) children.add(toJson(child));
        }
        return out;
    }
}
