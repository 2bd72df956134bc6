package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaCodegenContext;
import com.shapekit.core.codegen.generator.BuilderGenerator;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;

import java.util.List;

/**
 * What a code generation backend supplies to run the shared event stream tests.
 *
 * @param <C> codegen context type of the backend
 * @param <B> builder generator type of the backend
 * @see EventStreamTestTools#runTestCase
 */
public interface EventStreamTestRequirements<C extends JavaCodegenContext, B extends BuilderGenerator> {

    /**
     * Creates the codegen context for a test run.
     *
     * @param model normalized model
     * @param serviceShape service under test
     * @param protocolShapeId protocol trait id
     * @param target client or server
     * @return codegen context
     */
    C createCodegenContext(Model model, ServiceShape serviceShape, ShapeId protocolShapeId, CodegenTarget target);

    /**
     * Creates the builder generator for a structure.
     *
     * @param context codegen context of the run
     * @param structure structure to build
     * @return builder generator
     */
    B createBuilderGenerator(C context, StructureShape structure);

    /**
     * Renders the marshaller or unmarshaller under test.
     *
     * @param context codegen context of the run
     * @param project project and shapes under test
     * @param variety direction under test
     * @return symbol of the rendered class
     */
    Symbol renderGenerator(C context, TestEventStreamProject project, EventStreamTestVariety variety);

    /**
     * Renders the error type of an operation or event stream.
     *
     * @param project project receiving the error type
     * @param model normalized model
     * @param symbolProvider names of generated types
     * @param operationSymbol symbol of the operation or stream owning the errors
     * @param errors modeled errors
     */
    void renderOperationError(GeneratedTestProject project, Model model, SymbolProvider symbolProvider,
                              Symbol operationSymbol, List<StructureShape> errors);
}
