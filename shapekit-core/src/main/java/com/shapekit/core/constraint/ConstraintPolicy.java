package com.shapekit.core.constraint;

import com.shapekit.core.codegen.CodegenTarget;
import software.amazon.smithy.model.shapes.ShapeType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table of trait kinds that a code generation mode materializes as validated types.
 *
 * <p>A trait that the model recognises but the table omits for a shape type is informational
 * only: it never makes a shape directly constrained. Member shapes have no entry in any of the
 * built-in tables, so member-level {@code @range} or {@code @pattern} never count.
 *
 * <p>{@link ConstraintTraitKind#REQUIRED} in the structure row enables the relational rule:
 * a structure with a non-optional member that has no default is constrained.
 *
 * @param table trait kinds materialized per shape type
 */
public record ConstraintPolicy(Map<ShapeType, Set<ConstraintTraitKind>> table) {

    /**
     * Compact constructor with validation.
     */
    public ConstraintPolicy {
        Objects.requireNonNull(table, "table must not be null");
        Map<ShapeType, Set<ConstraintTraitKind>> copy = new EnumMap<>(ShapeType.class);
        table.forEach((type, kinds) -> copy.put(type, kinds.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(kinds))));
        table = Map.copyOf(copy);
    }

    /**
     * Policy of the server generator, which emits a validated wrapper type for every
     * constrained shape it supports.
     *
     * @return server policy
     */
    public static ConstraintPolicy server() {
        Map<ShapeType, Set<ConstraintTraitKind>> table = new EnumMap<>(ShapeType.class);
        table.put(ShapeType.STRING, EnumSet.of(ConstraintTraitKind.LENGTH, ConstraintTraitKind.PATTERN, ConstraintTraitKind.ENUM));
        table.put(ShapeType.ENUM, EnumSet.of(ConstraintTraitKind.ENUM, ConstraintTraitKind.LENGTH, ConstraintTraitKind.PATTERN));
        table.put(ShapeType.LIST, EnumSet.of(ConstraintTraitKind.LENGTH, ConstraintTraitKind.UNIQUE_ITEMS));
        table.put(ShapeType.SET, EnumSet.of(ConstraintTraitKind.LENGTH, ConstraintTraitKind.UNIQUE_ITEMS));
        table.put(ShapeType.MAP, EnumSet.of(ConstraintTraitKind.LENGTH));
        table.put(ShapeType.BLOB, EnumSet.of(ConstraintTraitKind.LENGTH));
        table.put(ShapeType.BYTE, EnumSet.of(ConstraintTraitKind.RANGE));
        table.put(ShapeType.SHORT, EnumSet.of(ConstraintTraitKind.RANGE));
        table.put(ShapeType.INTEGER, EnumSet.of(ConstraintTraitKind.RANGE));
        table.put(ShapeType.INT_ENUM, EnumSet.of(ConstraintTraitKind.RANGE));
        table.put(ShapeType.LONG, EnumSet.of(ConstraintTraitKind.RANGE));
        table.put(ShapeType.STRUCTURE, EnumSet.of(ConstraintTraitKind.REQUIRED));
        return new ConstraintPolicy(table);
    }

    /**
     * Policy of the client generator, which never emits validated types.
     *
     * @return client policy
     */
    public static ConstraintPolicy client() {
        return new ConstraintPolicy(Map.of());
    }

    /**
     * Returns the built-in policy for a code generation target.
     *
     * @param target code generation target
     * @return policy for the target
     */
    public static ConstraintPolicy forTarget(CodegenTarget target) {
        return switch (Objects.requireNonNull(target, "target must not be null")) {
            case CLIENT -> client();
            case SERVER -> server();
        };
    }

    /**
     * Returns the kinds materialized for a shape type.
     *
     * @param type shape type
     * @return supported kinds, empty when the type is never constrained
     */
    public Set<ConstraintTraitKind> supportedKinds(ShapeType type) {
        return table.getOrDefault(type, Set.of());
    }

    /**
     * Checks whether a kind is materialized for a shape type.
     *
     * @param type shape type
     * @param kind trait kind
     * @return true if the policy materializes the kind for the type
     */
    public boolean materializes(ShapeType type, ConstraintTraitKind kind) {
        return supportedKinds(type).contains(kind);
    }

    /**
     * Returns a copy of this policy with the row for one shape type replaced.
     *
     * @param type shape type to change
     * @param kinds kinds to materialize for the type, none to disable it
     * @return new policy
     */
    public ConstraintPolicy with(ShapeType type, ConstraintTraitKind... kinds) {
        Map<ShapeType, Set<ConstraintTraitKind>> copy = new EnumMap<>(ShapeType.class);
        copy.putAll(table);
        if (kinds.length == 0) {
            copy.remove(type);
        } else {
            copy.put(type, EnumSet.copyOf(Arrays.asList(kinds)));
        }
        return new ConstraintPolicy(copy);
    }
}
