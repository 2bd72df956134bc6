package com.shapekit.core.constraint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.neighbor.NeighborProvider;
import software.amazon.smithy.model.neighbor.Relationship;
import software.amazon.smithy.model.neighbor.RelationshipDirection;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether any path through the model leads from a shape to a directly constrained
 * shape.
 *
 * <p>The traversal follows directed relationships only (container to member, member to target,
 * operation to input, output and errors, service to operations). It is an iterative depth-first
 * search with an explicit stack; each query owns its visited set, so cyclic graphs terminate
 * and no answer leaks between root shapes.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ConstraintClassifier classifier = new ConstraintClassifier(symbolProvider, ConstraintPolicy.server());
 * ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(model, classifier);
 *
 * boolean fallible = analyzer.canReachConstrainedShape(model.expectShape(ShapeId.from("test#MapB")));
 * }</pre>
 */
public final class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    private final Model model;
    private final ConstraintClassifier classifier;
    private final NeighborProvider neighbors;

    /**
     * Creates an analyzer over a model.
     *
     * @param model model to traverse
     * @param classifier classifier deciding which shapes are directly constrained
     */
    public ReachabilityAnalyzer(Model model, ConstraintClassifier classifier) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.neighbors = NeighborProvider.cached(NeighborProvider.of(model));
    }

    /**
     * Returns the classifier used at each visited shape.
     *
     * @return constraint classifier
     */
    public ConstraintClassifier classifier() {
        return classifier;
    }

    /**
     * Checks whether the shape is, or transitively leads to, a directly constrained shape.
     *
     * <p>For a member the answer is that of its target: constraint traits on members are not
     * materialized.
     *
     * @param shape root of the query
     * @return true if a constrained shape is reachable
     */
    public boolean canReachConstrainedShape(Shape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        Shape root = shape instanceof MemberShape member
            ? model.expectShape(member.getTarget())
            : shape;

        Set<ShapeId> visited = new HashSet<>();
        Deque<Shape> stack = new ArrayDeque<>();
        stack.push(root);
        visited.add(root.getId());

        while (!stack.isEmpty()) {
            Shape current = stack.pop();
            if (classifier.isDirectlyConstrained(current)) {
                log.debug("{} reaches constrained shape {}", shape.getId(), current.getId());
                return true;
            }
            for (Relationship relationship : neighbors.getNeighbors(current)) {
                if (relationship.getRelationshipType().getDirection() != RelationshipDirection.DIRECTED) {
                    continue;
                }
                relationship.getNeighborShape()
                    .filter(next -> visited.add(next.getId()))
                    .ifPresent(stack::push);
            }
        }
        log.debug("{} cannot reach a constrained shape ({} shapes visited)", shape.getId(), visited.size());
        return false;
    }
}
