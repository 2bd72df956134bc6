package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.ServerCodegenContext;
import com.shapekit.core.codegen.server.ServerBuilderGenerator;
import com.shapekit.core.config.ConfigLoader;
import com.shapekit.core.config.HarnessConfig;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;

/**
 * Runs the event stream tests against server code generation.
 */
public final class ServerEventStreamTestRequirements
    extends AbstractEventStreamTestRequirements<ServerCodegenContext, ServerBuilderGenerator> {

    /**
     * Creates requirements generating with the root package and version of the harness
     * configuration found by {@link ConfigLoader#loadDefault()}.
     */
    public ServerEventStreamTestRequirements() {
        this(ConfigLoader.loadDefault());
    }

    public ServerEventStreamTestRequirements(HarnessConfig config) {
        this(config.codegen().toSettings(MODULE));
    }

    public ServerEventStreamTestRequirements(CodegenSettings settings) {
        super(settings);
    }

    @Override
    public CodegenTarget target() {
        return CodegenTarget.SERVER;
    }

    @Override
    protected ServerCodegenContext newCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocolShapeId,
                                                     CodegenSettings settings) {
        return new ServerCodegenContext(model, serviceShape, protocolShapeId, settings);
    }

    @Override
    public ServerBuilderGenerator createBuilderGenerator(ServerCodegenContext context, StructureShape structure) {
        return new ServerBuilderGenerator(context, structure);
    }
}
