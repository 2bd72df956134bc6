package com.shapekit.core.testutil;

import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;

import java.util.Map;

/**
 * Writes the JUnit class checking a marshaller against the canonical events.
 *
 * <p>For every event the test marshals the event and compares each expected header and the
 * payload byte for byte.
 */
final class EventStreamMarshallTestCases {

    static final String CLASS_NAME = "EventStreamMarshallTestCases";

    private EventStreamMarshallTestCases() {
        // Utility class
    }

    static void write(TestEventStreamProject test, EventStreamTestModels.TestCase testCase, Symbol marshaller) {
        test.project().useTestWriter(CLASS_NAME, writer -> {
            CanonicalEvents events = new CanonicalEvents(test, testCase, writer);
            Symbol eventMessage = EventStreamRuntime.eventMessage(test.project().settings());
            Symbol stream = test.symbolProvider().toSymbol(test.streamShape());
            writer.addImport("java.nio.charset.StandardCharsets");
            writer.addImport("org.junit.jupiter.api.Test");
            writer.addStaticImport("org.junit.jupiter.api.Assertions.assertArrayEquals");
            writer.addStaticImport("org.junit.jupiter.api.Assertions.assertEquals");

            writer.writeProvenance(EventStreamMarshallTestCases.class.getSimpleName() + " for " + testCase);
            writer.openBlock("class $L {", "}", CLASS_NAME, () -> {
                writer.write("private final $1T marshaller = new $1T();", marshaller);
                for (CanonicalEvents.Event event : events.events()) {
                    writer.write("");
                    writer.write("@Test");
                    writer.openBlock("void $L() throws Exception {", "}", event.testMethodName(), () -> {
                        writer.write("$T event = $L;", stream, event.event());
                        writer.write("$T message = marshaller.marshall(event);", eventMessage);
                        for (Map.Entry<String, String> header : event.headers().entrySet()) {
                            writeHeaderAssertion(writer, header.getKey(), header.getValue());
                        }
                        writer.write("assertArrayEquals($L, message.payload());", event.payload());
                    });
                }
                writer.write("");
                writer.openBlock("private static byte[] bytes(String value) {", "}", () ->
                    writer.write("return value.getBytes(StandardCharsets.UTF_8);"));
            });
        });
    }

    private static void writeHeaderAssertion(JavaWriter writer, String name, String expected) {
        String quotedName = CanonicalEvents.quote(name);
        if (expected.startsWith("bytes(")) {
            writer.write("assertArrayEquals($L, (byte[]) message.header($L));", expected, quotedName);
        } else {
            writer.write("assertEquals($L, message.header($L));", expected, quotedName);
        }
    }
}
