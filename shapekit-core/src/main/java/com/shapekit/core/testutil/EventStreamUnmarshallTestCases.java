package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.Map;

/**
 * Writes the JUnit class checking an unmarshaller against the canonical events.
 *
 * <p>Every event is rebuilt from its wire form and compared with the expected value. A
 * modeled error message must surface as the generated error class. Clients also get an
 * unmodeled error message, which must surface as {@code EventStreamException}.
 */
final class EventStreamUnmarshallTestCases {

    static final String CLASS_NAME = "EventStreamUnmarshallTestCases";

    private static final ShapeId SOME_ERROR = ShapeId.from("test#SomeError");

    private EventStreamUnmarshallTestCases() {
        // Utility class
    }

    static void write(TestEventStreamProject test, EventStreamTestModels.TestCase testCase, CodegenTarget target,
                      Symbol unmarshaller) {
        test.project().useTestWriter(CLASS_NAME, writer -> {
            CanonicalEvents events = new CanonicalEvents(test, testCase, writer);
            Symbol eventMessage = EventStreamRuntime.eventMessage(test.project().settings());
            Symbol stream = test.symbolProvider().toSymbol(test.streamShape());
            Symbol someError = test.symbolProvider().toSymbol(test.model().expectShape(SOME_ERROR));
            writer.addImport("java.nio.charset.StandardCharsets");
            writer.addImport("java.util.Map");
            writer.addImport("org.junit.jupiter.api.Test");
            writer.addStaticImport("org.junit.jupiter.api.Assertions.assertEquals");
            writer.addStaticImport("org.junit.jupiter.api.Assertions.assertThrows");

            writer.writeProvenance(EventStreamUnmarshallTestCases.class.getSimpleName() + " for " + testCase);
            writer.openBlock("class $L {", "}", CLASS_NAME, () -> {
                writer.write("private final $1T unmarshaller = new $1T();", unmarshaller);
                for (CanonicalEvents.Event event : events.events()) {
                    writer.write("");
                    writer.write("@Test");
                    writer.openBlock("void $L() throws Exception {", "}", event.testMethodName(), () -> {
                        writeMessage(writer, eventMessage, event.headers(), event.payload());
                        writer.write("$T expected = $L;", stream, event.event());
                        writer.write("assertEquals(expected, unmarshaller.unmarshall(message));");
                    });
                }

                writer.write("");
                writer.write("@Test");
                writer.openBlock("void someError() {", "}", () -> {
                    writeMessage(writer, eventMessage, events.someErrorHeaders(),
                        CanonicalEvents.bytes(testCase.validSomeError()));
                    writer.write("$1T error = assertThrows($1T.class, () -> unmarshaller.unmarshall(message));", someError);
                    writer.write("assertEquals($S, error.getMessage());", "some error");
                });

                if (target == CodegenTarget.CLIENT) {
                    Symbol exception = EventStreamRuntime.eventStreamException(test.project().settings());
                    writer.write("");
                    writer.write("@Test");
                    writer.openBlock("void unmodeledError() {", "}", () -> {
                        writeMessage(writer, eventMessage, events.unmodeledErrorHeaders(),
                            CanonicalEvents.bytes(testCase.validUnmodeledError()));
                        writer.write("$1T error = assertThrows($1T.class, () -> unmarshaller.unmarshall(message));",
                            exception);
                        writer.write("assertEquals($S, error.getErrorCode());", "UnmodeledError");
                    });
                }

                writer.write("");
                writer.openBlock("private static byte[] bytes(String value) {", "}", () ->
                    writer.write("return value.getBytes(StandardCharsets.UTF_8);"));
            });
        });
    }

    private static void writeMessage(JavaWriter writer, Symbol eventMessage, Map<String, String> headers,
                                     String payload) {
        writer.write("$1T message = new $1T($2L, $3L);", eventMessage, CanonicalEvents.headerMap(headers), payload);
    }
}
