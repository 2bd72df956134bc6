package com.shapekit.core.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.OperationShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;
import software.amazon.smithy.model.traits.Trait;
import software.amazon.smithy.model.transform.ModelTransformer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Gives every operation a dedicated input and output structure.
 *
 * <p>For operation {@code ns#Op} the structures {@code ns.synthetic#OpInput} and
 * {@code ns.synthetic#OpOutput} are created as copies of the modeled input and output (empty
 * when the operation uses {@code smithy.api#Unit}), tagged with {@link SyntheticInputTrait}
 * and {@link SyntheticOutputTrait}, and the operation is repointed at them. The modeled
 * structures stay in the model.
 *
 * <p>Operations already pointing at synthetic structures are left alone.
 */
public final class OperationNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OperationNormalizer.class);

    private static final String SYNTHETIC_NAMESPACE_SUFFIX = ".synthetic";
    private static final ShapeId UNIT = ShapeId.from("smithy.api#Unit");

    private OperationNormalizer() {
        // Utility class
    }

    /**
     * Returns a model in which every operation has synthetic input and output structures.
     *
     * @param model model to transform
     * @return transformed model
     */
    public static Model transform(Model model) {
        Objects.requireNonNull(model, "model must not be null");
        List<Shape> replacements = new ArrayList<>();
        List<OperationShape> operations = model.getOperationShapes().stream()
            .sorted(Comparator.comparing(Shape::getId))
            .toList();
        for (OperationShape operation : operations) {
            if (isNormalized(model, operation)) {
                continue;
            }
            ShapeId inputId = syntheticId(operation.getId(), "Input");
            ShapeId outputId = syntheticId(operation.getId(), "Output");
            replacements.add(synthesize(model, operation.getInputShape(), inputId,
                new SyntheticInputTrait(operation.getId(), originalOrNull(operation.getInputShape()))));
            replacements.add(synthesize(model, operation.getOutputShape(), outputId,
                new SyntheticOutputTrait(operation.getId(), originalOrNull(operation.getOutputShape()))));
            replacements.add(operation.toBuilder().input(inputId).output(outputId).build());
            log.debug("Normalized operation {} -> input {}, output {}", operation.getId(), inputId, outputId);
        }
        if (replacements.isEmpty()) {
            return model;
        }
        return ModelTransformer.create().replaceShapes(model, replacements);
    }

    /**
     * Returns the id of a synthetic structure for an operation.
     *
     * @param operation operation id
     * @param suffix "Input" or "Output"
     * @return synthetic structure id
     */
    public static ShapeId syntheticId(ShapeId operation, String suffix) {
        return ShapeId.fromParts(operation.getNamespace() + SYNTHETIC_NAMESPACE_SUFFIX, operation.getName() + suffix);
    }

    private static boolean isNormalized(Model model, OperationShape operation) {
        return hasTrait(model, operation.getInputShape(), SyntheticInputTrait.class)
            && hasTrait(model, operation.getOutputShape(), SyntheticOutputTrait.class);
    }

    private static boolean hasTrait(Model model, ShapeId id, Class<? extends Trait> trait) {
        return model.getShape(id).map(shape -> shape.hasTrait(trait)).orElse(false);
    }

    private static StructureShape synthesize(Model model, ShapeId original, ShapeId newId, Trait marker) {
        if (original.equals(UNIT)) {
            return StructureShape.builder().id(newId).addTrait(marker).build();
        }
        StructureShape structure = model.expectShape(original, StructureShape.class);
        StructureShape.Builder builder = structure.toBuilder().id(newId).clearMembers();
        for (MemberShape member : structure.members()) {
            builder.addMember(member.toBuilder().id(newId.withMember(member.getMemberName())).build());
        }
        return builder.addTrait(marker).build();
    }

    private static ShapeId originalOrNull(ShapeId id) {
        return id.equals(UNIT) ? null : id;
    }
}
