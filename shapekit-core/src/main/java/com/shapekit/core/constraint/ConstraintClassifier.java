package com.shapekit.core.constraint;

import com.shapekit.core.codegen.JavaSymbols;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.StructureShape;
import software.amazon.smithy.model.traits.DefaultTrait;

import java.util.Objects;

/**
 * Decides whether a shape is directly constrained.
 *
 * <p>A shape is directly constrained when it carries, on itself, a trait that the active
 * {@link ConstraintPolicy} materializes for its type. Structures are the relational case:
 * they are constrained when the symbol resolver reports a member as non-optional and that
 * member has no non-null {@code @default}.
 *
 * <p>Instances are immutable and may be shared across threads.
 *
 * @see ReachabilityAnalyzer
 */
public final class ConstraintClassifier {

    private final SymbolProvider symbolProvider;
    private final ConstraintPolicy policy;

    /**
     * Creates a classifier.
     *
     * @param symbolProvider resolver deciding member optionality
     * @param policy trait kinds materialized per shape type
     */
    public ConstraintClassifier(SymbolProvider symbolProvider, ConstraintPolicy policy) {
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Returns the policy this classifier applies.
     *
     * @return constraint policy
     */
    public ConstraintPolicy policy() {
        return policy;
    }

    /**
     * Checks whether the shape itself is constrained.
     *
     * @param shape shape to classify
     * @return true if the shape is directly constrained
     */
    public boolean isDirectlyConstrained(Shape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        if (shape instanceof MemberShape) {
            return false;
        }
        if (hasNonNullDefault(shape)) {
            return false;
        }
        if (shape instanceof StructureShape structure) {
            return policy.materializes(shape.getType(), ConstraintTraitKind.REQUIRED)
                && structure.members().stream().anyMatch(this::isNonOptionalWithoutDefault);
        }
        for (ConstraintTraitKind kind : policy.supportedKinds(shape.getType())) {
            if (kind.isTypeLevel() && kind.isPresentOn(shape)) {
                return true;
            }
        }
        return false;
    }

    private boolean isNonOptionalWithoutDefault(MemberShape member) {
        return !JavaSymbols.isOptional(symbolProvider.toSymbol(member)) && !hasNonNullDefault(member);
    }

    /**
     * Checks whether a shape carries a {@code @default} trait with a non-null value.
     *
     * @param shape shape to inspect
     * @return true if a non-null default is present
     */
    public static boolean hasNonNullDefault(Shape shape) {
        return shape.getTrait(DefaultTrait.class)
            .map(trait -> !trait.toNode().isNullNode())
            .orElse(false);
    }
}
