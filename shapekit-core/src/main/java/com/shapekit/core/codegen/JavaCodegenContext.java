package com.shapekit.core.codegen;

import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.Objects;

/**
 * State threaded through code generation: the model, the service being generated, the
 * protocol in use and the symbol provider that names everything.
 *
 * <p>Client and server generation extend this with what only they need.
 *
 * @see ClientCodegenContext
 * @see ServerCodegenContext
 */
public abstract class JavaCodegenContext {

    private final Model model;
    private final ServiceShape serviceShape;
    private final ShapeId protocol;
    private final CodegenSettings settings;
    private final JavaSymbolProvider symbolProvider;

    protected JavaCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocol,
                                 CodegenSettings settings, JavaSymbolProvider symbolProvider) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.serviceShape = Objects.requireNonNull(serviceShape, "serviceShape must not be null");
        this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
    }

    public Model model() {
        return model;
    }

    public ServiceShape serviceShape() {
        return serviceShape;
    }

    public ShapeId protocol() {
        return protocol;
    }

    public CodegenSettings settings() {
        return settings;
    }

    public SymbolProvider symbolProvider() {
        return symbolProvider;
    }

    /**
     * Returns which side of the service is being generated.
     *
     * @return code generation target
     */
    public abstract CodegenTarget target();
}
