package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.JavaModule;
import com.shapekit.core.codegen.JavaSymbolProvider;
import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;

/**
 * Support types written into the runtime package of every event stream test project.
 *
 * <p>{@code EventMessage} is the protocol-neutral wire message: string-keyed headers and a
 * byte payload. {@code EventStreamException} is what an unmarshaller throws for an error
 * message that does not correspond to a modeled error.
 */
public final class EventStreamRuntime {

    public static final String EVENT_MESSAGE = "EventMessage";
    public static final String EVENT_STREAM_EXCEPTION = "EventStreamException";

    private EventStreamRuntime() {
        // Utility class
    }

    public static Symbol eventMessage(CodegenSettings settings) {
        return runtimeSymbol(settings, EVENT_MESSAGE);
    }

    public static Symbol eventStreamException(CodegenSettings settings) {
        return runtimeSymbol(settings, EVENT_STREAM_EXCEPTION);
    }

    /**
     * Writes both support types into a project.
     *
     * @param project project to write into
     */
    static void render(GeneratedTestProject project) {
        CodegenSettings settings = project.settings();
        project.useShapeWriter(eventMessage(settings), EventStreamRuntime::renderEventMessage);
        project.useShapeWriter(eventStreamException(settings), EventStreamRuntime::renderEventStreamException);
    }

    private static void renderEventMessage(JavaWriter writer) {
        writer.addImport("java.util.Map");
        writer.openBlock("public record $L(Map<String, Object> headers, byte[] payload) {", "}", EVENT_MESSAGE, () -> {
            writer.openBlock("public $L {", "}", EVENT_MESSAGE, () -> {
                writer.write("headers = Map.copyOf(headers);");
                writer.write("payload = payload.clone();");
            });
            writer.write("");
            writer.openBlock("public Object header(String name) {", "}", () -> writer.write("return headers.get(name);"));
        });
    }

    private static void renderEventStreamException(JavaWriter writer) {
        writer.openBlock("public final class $L extends RuntimeException {", "}", EVENT_STREAM_EXCEPTION, () -> {
            writer.write("private static final long serialVersionUID = 1L;");
            writer.write("");
            writer.write("private final String errorCode;");
            writer.write("");
            writer.openBlock("public $L(String errorCode, String message) {", "}", EVENT_STREAM_EXCEPTION, () -> {
                writer.write("super(message);");
                writer.write("this.errorCode = errorCode;");
            });
            writer.write("");
            writer.openBlock("public String getErrorCode() {", "}", () -> writer.write("return errorCode;"));
        });
    }

    private static Symbol runtimeSymbol(CodegenSettings settings, String name) {
        String packageName = settings.packageOf(JavaModule.RUNTIME);
        return Symbol.builder()
            .name(name)
            .namespace(packageName, ".")
            .definitionFile(JavaSymbolProvider.sourceFile(packageName, name))
            .build();
    }
}
