package com.shapekit.core.codegen.client;

import com.shapekit.core.codegen.JavaWriter;
import com.shapekit.core.codegen.generator.AbstractBuilderGenerator;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.StructureShape;

/**
 * Client builders never fail: every member is optional on the client, so {@code build()}
 * assembles whatever was set.
 */
public final class ClientBuilderGenerator extends AbstractBuilderGenerator {

    public ClientBuilderGenerator(SymbolProvider symbolProvider, StructureShape shape) {
        super(symbolProvider, shape);
    }

    @Override
    protected void renderBuildMethod(JavaWriter writer) {
        writer.openBlock("public $L build() {", "}", structureName(), () ->
            writer.write("return new $L($L);", structureName(), constructorArguments()));
    }
}
