package com.shapekit.core.constraint;

import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.Shape;

/**
 * Static entry points for one-off constraint queries under the server policy.
 *
 * <p>Callers issuing many queries against one model should hold on to a
 * {@link ReachabilityAnalyzer} instead.
 */
public final class Constraints {

    private Constraints() {
        // Utility class
    }

    /**
     * Checks whether the shape itself is constrained.
     *
     * @param shape shape to classify
     * @param symbolProvider resolver deciding member optionality
     * @return true if the shape is directly constrained
     */
    public static boolean isDirectlyConstrained(Shape shape, SymbolProvider symbolProvider) {
        return new ConstraintClassifier(symbolProvider, ConstraintPolicy.server()).isDirectlyConstrained(shape);
    }

    /**
     * Checks whether the shape can reach a directly constrained shape.
     *
     * @param shape root shape
     * @param model model containing the shape
     * @param symbolProvider resolver deciding member optionality
     * @return true if a constrained shape is reachable
     */
    public static boolean canReachConstrainedShape(Shape shape, Model model, SymbolProvider symbolProvider) {
        ConstraintClassifier classifier = new ConstraintClassifier(symbolProvider, ConstraintPolicy.server());
        return new ReachabilityAnalyzer(model, classifier).canReachConstrainedShape(shape);
    }
}
