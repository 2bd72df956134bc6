package com.shapekit.core.codegen;

import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;

/**
 * Codegen context for client generation.
 */
public final class ClientCodegenContext extends JavaCodegenContext {

    public ClientCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocol, CodegenSettings settings) {
        super(model, serviceShape, protocol, settings,
            new JavaSymbolProvider(model, settings, CodegenTarget.CLIENT));
    }

    @Override
    public CodegenTarget target() {
        return CodegenTarget.CLIENT;
    }
}
