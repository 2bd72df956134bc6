package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaCodegenContext;
import com.shapekit.core.codegen.JavaModule;
import com.shapekit.core.codegen.generator.BuilderGenerator;
import com.shapekit.core.codegen.generator.OperationErrorGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;

import java.util.List;
import java.util.Objects;

/**
 * Shared part of the client and server requirements: generator lookup and error rendering.
 *
 * @param <C> codegen context type of the backend
 * @param <B> builder generator type of the backend
 */
public abstract class AbstractEventStreamTestRequirements<C extends JavaCodegenContext, B extends BuilderGenerator>
    implements EventStreamTestRequirements<C, B> {

    /** Module name of generated event stream test projects. */
    public static final String MODULE = "test";

    private static final Logger log = LoggerFactory.getLogger(AbstractEventStreamTestRequirements.class);

    private final CodegenSettings settings;

    protected AbstractEventStreamTestRequirements(CodegenSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Returns the side this backend generates.
     *
     * @return code generation target
     */
    public abstract CodegenTarget target();

    /**
     * Creates the backend's context once the target has been checked.
     *
     * @param model normalized model
     * @param serviceShape service under test
     * @param protocolShapeId protocol trait id
     * @param settings settings with the service filled in
     * @return codegen context
     */
    protected abstract C newCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocolShapeId,
                                           CodegenSettings settings);

    @Override
    public final C createCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocolShapeId,
                                        CodegenTarget target) {
        if (target != target()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " generates " + target()
                + " code, not " + target);
        }
        CodegenSettings withService = new CodegenSettings(serviceShape.getId(), settings.module(),
            settings.moduleVersion(), settings.rootPackage(), settings.debugMode(),
            settings.publicConstrainedTypes(), settings.eventStreamAllowList());
        return newCodegenContext(model, serviceShape, protocolShapeId, withService);
    }

    @Override
    public Symbol renderGenerator(C context, TestEventStreamProject project, EventStreamTestVariety variety) {
        EventStreamProtocolGenerator generator = EventStreamProtocolGenerators.forProtocol(context.protocol(), target());
        log.info("Rendering {} {} with {}", target(), variety, generator.getDisplayName());
        return switch (variety) {
            case MARSHALL -> generator.renderMarshaller(context, project);
            case UNMARSHALL -> generator.renderUnmarshaller(context, project);
        };
    }

    @Override
    public void renderOperationError(GeneratedTestProject project, Model model, SymbolProvider symbolProvider,
                                     Symbol operationSymbol, List<StructureShape> errors) {
        OperationErrorGenerator generator = new OperationErrorGenerator(symbolProvider, operationSymbol, errors, target());
        Symbol errorSymbol = OperationErrorGenerator.errorSymbol(operationSymbol,
            project.settings().packageOf(JavaModule.ERRORS));
        project.useShapeWriter(errorSymbol, generator::render);
    }
}
