package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaCodegenContext;
import com.shapekit.core.codegen.generator.BuilderGenerator;
import com.shapekit.core.codegen.generator.StructureGenerator;
import com.shapekit.core.codegen.generator.UnionGenerator;
import com.shapekit.core.transform.EventStreamNormalizer;
import com.shapekit.core.transform.OperationNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.OperationShape;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;
import software.amazon.smithy.model.shapes.UnionShape;
import software.amazon.smithy.model.traits.ErrorTrait;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one event stream test case against a code generation backend.
 *
 * <p>A run normalizes the case's model, renders the errors, models, output and runtime
 * packages of a fresh project, lets the backend render the marshaller or unmarshaller, writes
 * the matching JUnit class, then compiles and tests the project with the configured build
 * command. A failing build fails the run with the build output attached.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * for (EventStreamTestModels.TestCase testCase : EventStreamTestModels.testCases()) {
 *     EventStreamTestTools.runTestCase(testCase, new ClientEventStreamTestRequirements(),
 *         CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL);
 * }
 * }</pre>
 */
public final class EventStreamTestTools {

    private static final Logger log = LoggerFactory.getLogger(EventStreamTestTools.class);

    private static final String PRELUDE_NAMESPACE = "smithy.api";

    private EventStreamTestTools() {
        // Utility class
    }

    /**
     * Runs a test case in a workspace from the default configuration.
     *
     * @return build output
     * @see #runTestCase(EventStreamTestModels.TestCase, EventStreamTestRequirements, CodegenTarget,
     *      EventStreamTestVariety, TestWorkspace)
     */
    public static <C extends JavaCodegenContext, B extends BuilderGenerator> String runTestCase(
            EventStreamTestModels.TestCase testCase,
            EventStreamTestRequirements<C, B> requirements,
            CodegenTarget target,
            EventStreamTestVariety variety) {
        return runTestCase(testCase, requirements, target, variety, TestWorkspace.fromDefaultConfig());
    }

    /**
     * Runs a test case.
     *
     * @param testCase protocol and expectations
     * @param requirements backend under test
     * @param target client or server
     * @param variety marshall or unmarshall
     * @param workspace where the project is generated
     * @return build output
     * @throws com.shapekit.core.exec.CommandFailedException if the generated project fails to build or test;
     *     an error releasing the workspace afterwards is attached as a suppressed exception
     */
    public static <C extends JavaCodegenContext, B extends BuilderGenerator> String runTestCase(
            EventStreamTestModels.TestCase testCase,
            EventStreamTestRequirements<C, B> requirements,
            CodegenTarget target,
            EventStreamTestVariety variety,
            TestWorkspace workspace) {
        log.info("Running event stream test case {} ({}, {})", testCase, target, variety);
        Model model = EventStreamNormalizer.transform(OperationNormalizer.transform(testCase.model()));
        ServiceShape service = model.expectShape(EventStreamTestModels.SERVICE, ServiceShape.class);
        C context = requirements.createCodegenContext(model, service, testCase.protocolShapeId(), target);

        GeneratedTestProject project = workspace.testProject(context.settings());
        RuntimeException failure = null;
        try {
            TestEventStreamProject test = generateTestProject(requirements, context, project);
            Symbol generator = requirements.renderGenerator(context, test, variety);
            switch (variety) {
                case MARSHALL -> EventStreamMarshallTestCases.write(test, testCase, generator);
                case UNMARSHALL -> EventStreamUnmarshallTestCases.write(test, testCase, target, generator);
            }
            return project.compileAndTest();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            release(workspace, project.root(), failure);
        }
    }

    /**
     * Releases a project directory without hiding the outcome of the run: a release error is
     * attached to the run's failure if there is one, and only logged otherwise.
     */
    private static void release(TestWorkspace workspace, Path directory, RuntimeException failure) {
        try {
            workspace.release(directory);
        } catch (UncheckedIOException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                log.warn("Could not release workspace {}: {}", directory, e.getMessage());
            }
        }
    }

    /**
     * Renders everything except the marshaller, unmarshaller and tests into a project.
     *
     * @param requirements backend under test
     * @param context codegen context of the run
     * @param project empty project
     * @return shapes and project of the run
     */
    public static <C extends JavaCodegenContext, B extends BuilderGenerator> TestEventStreamProject generateTestProject(
            EventStreamTestRequirements<C, B> requirements, C context, GeneratedTestProject project) {
        Model model = context.model();
        SymbolProvider symbolProvider = context.symbolProvider();
        OperationShape operation = model.expectShape(EventStreamTestModels.OPERATION, OperationShape.class);
        UnionShape stream = model.expectShape(EventStreamTestModels.STREAM, UnionShape.class);

        List<StructureShape> errors = model.getStructureShapes().stream()
            .filter(shape -> shape.hasTrait(ErrorTrait.class))
            .sorted(Comparator.comparing(Shape::getId))
            .toList();
        requirements.renderOperationError(project, model, symbolProvider, symbolProvider.toSymbol(operation), errors);
        requirements.renderOperationError(project, model, symbolProvider, symbolProvider.toSymbol(stream), errors);
        for (StructureShape error : errors) {
            renderWithBuilder(requirements, context, project, error);
        }

        StructureShape inputOutput = model.expectShape(EventStreamTestModels.INPUT_OUTPUT, StructureShape.class);
        recursivelyGenerateModels(requirements, context, project, inputOutput, new HashSet<>());

        StructureShape output = model.expectShape(operation.getOutputShape(), StructureShape.class);
        renderWithBuilder(requirements, context, project, output);

        EventStreamRuntime.render(project);
        log.debug("Generated test project files: {}", project.files());
        return new TestEventStreamProject(model, context.serviceShape(), operation, stream, symbolProvider, project);
    }

    private static <C extends JavaCodegenContext, B extends BuilderGenerator> void recursivelyGenerateModels(
            EventStreamTestRequirements<C, B> requirements, C context, GeneratedTestProject project,
            Shape shape, Set<ShapeId> visited) {
        Model model = context.model();
        for (MemberShape member : shape.members()) {
            if (member.getTarget().getNamespace().equals(PRELUDE_NAMESPACE) || !visited.add(member.getTarget())) {
                continue;
            }
            Shape target = model.expectShape(member.getTarget());
            if (target.hasTrait(ErrorTrait.class)) {
                continue;
            }
            if (target instanceof StructureShape structure) {
                renderWithBuilder(requirements, context, project, structure);
            } else if (target instanceof UnionShape union) {
                Symbol symbol = context.symbolProvider().toSymbol(union);
                project.useShapeWriter(symbol, writer -> new UnionGenerator(context.symbolProvider(), writer, union,
                    context.target().renderUnknownVariant()).render());
            } else {
                throw new UnsupportedOperationException("Event stream test projects can't render " + target.getType()
                    + " shape " + target.getId());
            }
            recursivelyGenerateModels(requirements, context, project, target, visited);
        }
    }

    private static <C extends JavaCodegenContext, B extends BuilderGenerator> void renderWithBuilder(
            EventStreamTestRequirements<C, B> requirements, C context, GeneratedTestProject project,
            StructureShape structure) {
        B builder = requirements.createBuilderGenerator(context, structure);
        Symbol symbol = context.symbolProvider().toSymbol(structure);
        project.useShapeWriter(symbol, writer ->
            new StructureGenerator(context.symbolProvider(), writer, structure).render(w -> {
                builder.renderConvenienceMethod(w);
                builder.render(w);
            }));
    }
}
