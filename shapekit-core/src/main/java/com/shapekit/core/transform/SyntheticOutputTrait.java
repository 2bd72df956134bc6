package com.shapekit.core.transform;

import software.amazon.smithy.model.SourceLocation;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.traits.AbstractTrait;

import java.util.Objects;
import java.util.Optional;

/**
 * Marks a structure created by {@link OperationNormalizer} as the output of an operation.
 */
public final class SyntheticOutputTrait extends AbstractTrait {

    public static final ShapeId ID = ShapeId.from("shapekit.synthetic#syntheticOutput");

    private final ShapeId operation;
    private final ShapeId originalId;

    /**
     * Creates the trait.
     *
     * @param operation operation the structure is the output of
     * @param originalId modeled output, or null when the operation had none
     */
    public SyntheticOutputTrait(ShapeId operation, ShapeId originalId) {
        super(ID, SourceLocation.NONE);
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.originalId = originalId;
    }

    public ShapeId operation() {
        return operation;
    }

    public Optional<ShapeId> originalId() {
        return Optional.ofNullable(originalId);
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    protected Node createNode() {
        ObjectNode.Builder builder = Node.objectNodeBuilder().withMember("operation", operation.toString());
        if (originalId != null) {
            builder.withMember("originalId", originalId.toString());
        }
        return builder.build();
    }
}
