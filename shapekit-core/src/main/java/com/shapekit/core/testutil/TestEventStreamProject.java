package com.shapekit.core.testutil;

import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.OperationShape;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.UnionShape;

import java.util.Objects;

/**
 * The shapes and project an event stream test case works on.
 *
 * @param model normalized model
 * @param serviceShape service under test
 * @param operationShape streaming operation
 * @param streamShape event stream union, without its error members
 * @param symbolProvider names of generated types
 * @param project project receiving generated sources
 */
public record TestEventStreamProject(
    Model model,
    ServiceShape serviceShape,
    OperationShape operationShape,
    UnionShape streamShape,
    SymbolProvider symbolProvider,
    GeneratedTestProject project
) {
    public TestEventStreamProject {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(serviceShape, "serviceShape must not be null");
        Objects.requireNonNull(operationShape, "operationShape must not be null");
        Objects.requireNonNull(streamShape, "streamShape must not be null");
        Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        Objects.requireNonNull(project, "project must not be null");
    }
}
