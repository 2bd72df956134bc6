package com.shapekit.core.testutil;

import com.shapekit.core.codegen.ClientCodegenContext;
import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.client.ClientBuilderGenerator;
import com.shapekit.core.config.ConfigLoader;
import com.shapekit.core.config.HarnessConfig;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;

/**
 * Runs the event stream tests against client code generation.
 */
public final class ClientEventStreamTestRequirements
    extends AbstractEventStreamTestRequirements<ClientCodegenContext, ClientBuilderGenerator> {

    /**
     * Creates requirements generating with the root package and version of the harness
     * configuration found by {@link ConfigLoader#loadDefault()}.
     */
    public ClientEventStreamTestRequirements() {
        this(ConfigLoader.loadDefault());
    }

    public ClientEventStreamTestRequirements(HarnessConfig config) {
        this(config.codegen().toSettings(MODULE));
    }

    public ClientEventStreamTestRequirements(CodegenSettings settings) {
        super(settings);
    }

    @Override
    public CodegenTarget target() {
        return CodegenTarget.CLIENT;
    }

    @Override
    protected ClientCodegenContext newCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocolShapeId,
                                                     CodegenSettings settings) {
        return new ClientCodegenContext(model, serviceShape, protocolShapeId, settings);
    }

    @Override
    public ClientBuilderGenerator createBuilderGenerator(ClientCodegenContext context, StructureShape structure) {
        return new ClientBuilderGenerator(context.symbolProvider(), structure);
    }
}
