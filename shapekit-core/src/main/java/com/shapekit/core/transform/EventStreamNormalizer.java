package com.shapekit.core.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.UnionShape;
import software.amazon.smithy.model.traits.ErrorTrait;
import software.amazon.smithy.model.traits.StreamingTrait;
import software.amazon.smithy.model.transform.ModelTransformer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Separates event stream errors from event stream messages.
 *
 * <p>Every {@code @streaming} union is replaced by a union with the same id that keeps only
 * the members whose target is not an {@code @error} structure. The removed members are
 * recorded in a {@link SyntheticEventStreamUnionTrait} on the new union. Unions already
 * carrying that trait are left alone.
 */
public final class EventStreamNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventStreamNormalizer.class);

    private EventStreamNormalizer() {
        // Utility class
    }

    /**
     * Returns a model whose event stream unions no longer have error members.
     *
     * @param model model to transform
     * @return transformed model
     */
    public static Model transform(Model model) {
        Objects.requireNonNull(model, "model must not be null");
        List<Shape> replacements = new ArrayList<>();
        for (UnionShape union : model.getUnionShapes()) {
            if (!union.hasTrait(StreamingTrait.class)) {
                continue;
            }
            if (union.hasTrait(SyntheticEventStreamUnionTrait.class)) {
                continue;
            }
            List<MemberShape> errorMembers = new ArrayList<>();
            UnionShape.Builder builder = union.toBuilder().clearMembers();
            for (MemberShape member : union.members()) {
                if (isError(model, member)) {
                    errorMembers.add(member);
                } else {
                    builder.addMember(member);
                }
            }
            replacements.add(builder.addTrait(new SyntheticEventStreamUnionTrait(errorMembers)).build());
            log.debug("Normalized event stream {}: {} error member(s) split off", union.getId(), errorMembers.size());
        }
        if (replacements.isEmpty()) {
            return model;
        }
        return ModelTransformer.create().replaceShapes(model, replacements);
    }

    private static boolean isError(Model model, MemberShape member) {
        return model.getShape(member.getTarget())
            .map(target -> target.hasTrait(ErrorTrait.class))
            .orElse(false);
    }
}
