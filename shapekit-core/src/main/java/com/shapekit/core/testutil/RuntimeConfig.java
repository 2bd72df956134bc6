package com.shapekit.core.testutil;

import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.ToNode;

import java.util.Objects;

/**
 * Where generated code finds its runtime library.
 *
 * @param version runtime library version
 * @param relativePath path to a local checkout of the runtime, null to resolve by version
 */
public record RuntimeConfig(String version, String relativePath) implements ToNode {

    public RuntimeConfig {
        Objects.requireNonNull(version, "version must not be null");
    }

    @Override
    public Node toNode() {
        ObjectNode.Builder builder = Node.objectNodeBuilder().withMember("version", version);
        if (relativePath != null) {
            builder.withMember("relativePath", relativePath);
        }
        return builder.build();
    }
}
