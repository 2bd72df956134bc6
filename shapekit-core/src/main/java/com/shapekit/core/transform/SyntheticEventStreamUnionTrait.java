package com.shapekit.core.transform;

import software.amazon.smithy.model.SourceLocation;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.traits.AbstractTrait;

import java.util.List;
import java.util.Objects;

/**
 * Records the error members {@link EventStreamNormalizer} removed from an event stream union.
 */
public final class SyntheticEventStreamUnionTrait extends AbstractTrait {

    public static final ShapeId ID = ShapeId.from("shapekit.synthetic#syntheticEventStreamUnion");

    private final List<MemberShape> errorMembers;

    public SyntheticEventStreamUnionTrait(List<MemberShape> errorMembers) {
        super(ID, SourceLocation.NONE);
        this.errorMembers = List.copyOf(Objects.requireNonNull(errorMembers, "errorMembers must not be null"));
    }

    /**
     * Returns the removed members, which still refer to the union by id.
     *
     * @return error members in model order
     */
    public List<MemberShape> errorMembers() {
        return errorMembers;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    protected Node createNode() {
        return Node.objectNode().withMember("errorMembers", errorMembers.stream()
            .map(member -> Node.from(member.getId().toString()))
            .collect(ArrayNode.collect()));
    }
}
