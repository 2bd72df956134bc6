package com.shapekit.core.util;

import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

import java.util.Map;
import java.util.Objects;

/**
 * Helpers for Smithy {@link Node} values.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * Merges two object nodes recursively.
     *
     * <p>Members present in only one node are kept. When both nodes have an object under the
     * same key, the two objects are merged the same way; any other collision is won by
     * {@code overlay}. Neither input is modified.
     *
     * @param base node providing defaults
     * @param overlay node whose values win
     * @return merged node
     */
    public static ObjectNode deepMerge(ObjectNode base, ObjectNode overlay) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(overlay, "overlay must not be null");
        ObjectNode result = base;
        for (Map.Entry<StringNode, Node> entry : overlay.getMembers().entrySet()) {
            Node existing = result.getMember(entry.getKey().getValue()).orElse(null);
            Node value = entry.getValue();
            if (existing != null && existing.isObjectNode() && value.isObjectNode()) {
                value = deepMerge(existing.expectObjectNode(), value.expectObjectNode());
            }
            result = result.withMember(entry.getKey(), value);
        }
        return result;
    }
}
