package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.ClientCodegenContext;
import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaModule;
import com.shapekit.core.codegen.JavaWriter;
import com.shapekit.core.codegen.ServerCodegenContext;
import com.shapekit.core.codegen.client.ClientBuilderGenerator;
import com.shapekit.core.codegen.server.ServerBuilderGenerator;
import com.shapekit.core.fixture.ModelFixtures;
import com.shapekit.core.fixture.Protocol;
import com.shapekit.core.util.FileUtils;
import com.shapekit.core.verify.GeneratedSourceVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.StructureShape;
import software.amazon.smithy.model.shapes.UnionShape;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the structure, union, builder and error generators. Every rendered file must parse.
 */
class GeneratorsTest {

    private static final String NS = "com.shapekit.constraints#";
    private static final Model MODEL = ModelFixtures.loadConstraintsModel(Protocol.REST_JSON_1);
    private static final ServiceShape SERVICE = MODEL.expectShape(ModelFixtures.CONSTRAINTS_SERVICE, ServiceShape.class);
    private static final CodegenSettings SETTINGS = CodegenSettings.defaults("com.example");

    private final ServerCodegenContext server =
        new ServerCodegenContext(MODEL, SERVICE, Protocol.REST_JSON_1.traitId(), SETTINGS);
    private final ClientCodegenContext client =
        new ClientCodegenContext(MODEL, SERVICE, Protocol.REST_JSON_1.traitId(), SETTINGS);

    @TempDir
    Path tempDir;

    @Test
    void structure_rendersFieldsGettersAndEquality() throws IOException {
        StructureShape conB = structure("ConB");
        JavaWriter writer = writer(JavaModule.MODELS);

        new StructureGenerator(server.symbolProvider(), writer, conB).render();

        String source = writer.toString();
        assertThat(source).contains("public final class ConB {");
        assertThat(source).contains("private final String nice;");
        assertThat(source).contains("public ConB(String nice, Integer int_, String optNice, Integer optInt) {");
        assertThat(source).contains("public Integer getInt() {");
        assertThat(source).contains("public boolean equals(Object o) {");
        assertThat(source).contains("java.util.Arrays.deepHashCode");
        assertParses("model/ConB.java", source);
    }

    @Test
    void structure_errorExtendsRuntimeException() throws IOException {
        JavaWriter writer = writer(JavaModule.ERRORS);

        new StructureGenerator(server.symbolProvider(), writer, structure("ValidationError")).render();

        String source = writer.toString();
        assertThat(source).contains("public final class ValidationError extends RuntimeException {");
        assertThat(source).contains("super(message);");
        assertThat(source).contains("public String getMessage() {");
        assertThat(source).doesNotContain("equals(Object o)");
        assertParses("error/ValidationError.java", source);
    }

    @Test
    void union_clientRendersUnknownVariant() throws IOException {
        UnionShape union = MODEL.expectShape(ShapeId.from(NS + "ConstrainedUnion"), UnionShape.class);
        JavaWriter clientWriter = writer(JavaModule.MODELS);
        JavaWriter serverWriter = writer(JavaModule.MODELS);

        new UnionGenerator(client.symbolProvider(), clientWriter, union, CodegenTarget.CLIENT.renderUnknownVariant()).render();
        new UnionGenerator(server.symbolProvider(), serverWriter, union, CodegenTarget.SERVER.renderUnknownVariant()).render();

        assertThat(clientWriter.toString())
            .contains("public sealed interface ConstrainedUnion {")
            .contains("record ConB(com.example.model.ConB value) implements ConstrainedUnion {}")
            .contains("record Unknown() implements ConstrainedUnion {}");
        assertThat(serverWriter.toString()).doesNotContain("Unknown");
        assertParses("model/ConstrainedUnion.java", clientWriter.toString());
    }

    @Test
    void serverBuilder_fallibleWhenConstrainedShapeReachable() throws IOException {
        StructureShape conA = structure("ConA");
        ServerBuilderGenerator builder = new ServerBuilderGenerator(server, conA);
        JavaWriter writer = writer(JavaModule.MODELS);

        new StructureGenerator(server.symbolProvider(), writer, conA).render(w -> {
            builder.renderConvenienceMethod(w);
            builder.render(w);
        });

        String source = writer.toString();
        assertThat(builder.isFallible()).isTrue();
        assertThat(source).contains("public ConA build() throws ConstraintViolationException {");
        assertThat(source).contains("throw new ConstraintViolationException(\"conB\");");
        assertThat(source).doesNotContain("\"optConB\"");
        assertThat(source).contains("public static final class ConstraintViolationException extends Exception {");
        assertParses("model/ConA.java", source);
    }

    @Test
    void serverBuilder_privateViolationTypeWhenConstrainedTypesAreNotPublic() {
        CodegenSettings settings = new CodegenSettings(null, "test", "1.0.0", "com.example", false, false, List.of());
        ServerCodegenContext context = new ServerCodegenContext(MODEL, SERVICE, Protocol.REST_JSON_1.traitId(), settings);
        JavaWriter writer = writer(JavaModule.MODELS);

        new ServerBuilderGenerator(context, structure("ConB")).render(writer);

        assertThat(writer.toString()).contains("\nstatic final class ConstraintViolationException extends Exception {");
    }

    @Test
    void serverBuilder_infallibleWhenNothingConstrainedReachable() throws IOException {
        StructureShape plain = structure("UnconstrainedShapesOperationInputOutput");
        ServerBuilderGenerator builder = new ServerBuilderGenerator(server, plain);
        JavaWriter writer = writer(JavaModule.MODELS);

        new StructureGenerator(server.symbolProvider(), writer, plain).render(w -> {
            builder.renderConvenienceMethod(w);
            builder.render(w);
        });

        assertThat(builder.isFallible()).isFalse();
        assertThat(writer.toString())
            .contains("public UnconstrainedShapesOperationInputOutput build() {")
            .doesNotContain("ConstraintViolationException");
        assertParses("model/UnconstrainedShapesOperationInputOutput.java", writer.toString());
    }

    @Test
    void clientBuilder_isInfallible() {
        ClientBuilderGenerator builder = new ClientBuilderGenerator(client.symbolProvider(), structure("ConA"));
        JavaWriter writer = writer(JavaModule.MODELS);

        builder.render(writer);

        assertThat(writer.toString())
            .contains("public ConA build() {")
            .contains("public Builder conB(ConB conB) {")
            .doesNotContain("throws");
    }

    @Test
    void operationError_clientAddsUnhandledVariant() throws IOException {
        List<StructureShape> errors = List.of(structure("ValidationError"));
        JavaWriter clientWriter = writer(JavaModule.ERRORS);
        JavaWriter serverWriter = writer(JavaModule.ERRORS);
        Symbol owner = server.symbolProvider().toSymbol(MODEL.expectShape(ShapeId.from(NS + "ConstrainedShapesOperation")));

        new OperationErrorGenerator(client.symbolProvider(), owner, errors, CodegenTarget.CLIENT).render(clientWriter);
        new OperationErrorGenerator(server.symbolProvider(), owner, errors, CodegenTarget.SERVER).render(serverWriter);

        assertThat(clientWriter.toString())
            .contains("public sealed interface ConstrainedShapesOperationError {")
            .contains("record ValidationError(com.example.error.ValidationError error) implements ConstrainedShapesOperationError {}")
            .contains("record Unhandled(Throwable cause) implements ConstrainedShapesOperationError {}");
        assertThat(serverWriter.toString()).doesNotContain("Unhandled");
        assertParses("error/ConstrainedShapesOperationError.java", clientWriter.toString());
    }

    @Test
    void operationError_serverWithoutErrorsIsPlainInterface() {
        JavaWriter writer = writer(JavaModule.ERRORS);
        Symbol owner = server.symbolProvider().toSymbol(MODEL.expectShape(ShapeId.from(NS + "UnconstrainedShapesOperation")));

        new OperationErrorGenerator(server.symbolProvider(), owner, List.of(), CodegenTarget.SERVER).render(writer);

        assertThat(writer.toString()).contains("public interface UnconstrainedShapesOperationError {}");
        assertThat(OperationErrorGenerator.errorSymbol(owner, "com.example.error").getDefinitionFile())
            .isEqualTo("src/main/java/com/example/error/UnconstrainedShapesOperationError.java");
    }

    private static StructureShape structure(String name) {
        return MODEL.expectShape(ShapeId.from(NS + name), StructureShape.class);
    }

    private static JavaWriter writer(JavaModule module) {
        return new JavaWriter(SETTINGS.packageOf(module), false);
    }

    private void assertParses(String relativePath, String source) throws IOException {
        FileUtils.writeString(tempDir.resolve("src/main/java/com/example").resolve(relativePath), source);
        assertThat(GeneratedSourceVerifier.verify(tempDir)).isEmpty();
    }
}
