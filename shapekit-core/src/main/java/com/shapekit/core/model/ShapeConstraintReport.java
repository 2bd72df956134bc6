package com.shapekit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Constraint analysis outcome for one shape.
 *
 * @param shapeId absolute shape id (e.g., "test#MapA")
 * @param shapeType Smithy shape type name (e.g., "map", "structure")
 * @param traitKinds constraint-related trait kinds present on the shape
 * @param directlyConstrained whether the shape itself is constrained
 * @param reachesConstrained whether a constrained shape is reachable from it
 */
public record ShapeConstraintReport(
    String shapeId,
    String shapeType,
    List<String> traitKinds,
    boolean directlyConstrained,
    boolean reachesConstrained
) {
    /**
     * Compact constructor with validation.
     */
    public ShapeConstraintReport {
        Objects.requireNonNull(shapeId, "shapeId must not be null");
        Objects.requireNonNull(shapeType, "shapeType must not be null");
        traitKinds = traitKinds == null ? List.of() : List.copyOf(traitKinds);
    }
}
