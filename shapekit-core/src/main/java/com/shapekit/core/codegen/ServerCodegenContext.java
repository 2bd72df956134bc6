package com.shapekit.core.codegen;

import com.shapekit.core.constraint.ConstraintClassifier;
import com.shapekit.core.constraint.ConstraintPolicy;
import com.shapekit.core.constraint.ReachabilityAnalyzer;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;

/**
 * Codegen context for server generation.
 *
 * <p>Servers validate their input, so this context also carries the constraint analysis used
 * to decide which builders can fail.
 */
public final class ServerCodegenContext extends JavaCodegenContext {

    private final ReachabilityAnalyzer reachability;

    public ServerCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocol, CodegenSettings settings) {
        super(model, serviceShape, protocol, settings,
            new JavaSymbolProvider(model, settings, CodegenTarget.SERVER));
        ConstraintClassifier classifier = new ConstraintClassifier(symbolProvider(), ConstraintPolicy.server());
        this.reachability = new ReachabilityAnalyzer(model, classifier);
    }

    @Override
    public CodegenTarget target() {
        return CodegenTarget.SERVER;
    }

    public ConstraintClassifier constraintClassifier() {
        return reachability.classifier();
    }

    public ReachabilityAnalyzer reachability() {
        return reachability;
    }
}
