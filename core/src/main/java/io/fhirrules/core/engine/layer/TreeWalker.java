package io.fhirrules.core.engine.layer;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Depth-first, document-order walk over a JSON tree with concrete paths.
 */
final class TreeWalker {

    /** Callback receiving each node with its concrete path. */
    @FunctionalInterface
    interface Visitor {
        void visit(String path, JsonNode node);
    }

    private TreeWalker() {}

    static void walk(JsonNode node, String path, Visitor visitor) {
        visitor.visit(path, node);
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                walk(field.getValue(), path + "." + field.getKey(), visitor);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                walk(node.get(i), path + "[" + i + "]", visitor);
            }
        }
    }
}
