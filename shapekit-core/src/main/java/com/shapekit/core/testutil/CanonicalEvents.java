package com.shapekit.core.testutil;

import com.shapekit.core.codegen.JavaWriter;
import com.shapekit.core.codegen.generator.UnionGenerator;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.utils.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Java expressions for the events of the canonical event stream model, shared by the
 * marshall and unmarshall test writers.
 *
 * <p>Expressions use simple type names; every type they mention is imported into the writer
 * they were created for.
 */
final class CanonicalEvents {

    static final String HELLO_WORLD = "hello, world!";

    private final Model model;
    private final SymbolProvider symbolProvider;
    private final EventStreamTestModels.TestCase testCase;
    private final JavaWriter writer;

    CanonicalEvents(TestEventStreamProject project, EventStreamTestModels.TestCase testCase, JavaWriter writer) {
        this.model = project.model();
        this.symbolProvider = project.symbolProvider();
        this.testCase = testCase;
        this.writer = writer;
    }

    /**
     * An event with its expected wire form.
     *
     * @param name union member name, also the value of the {@code :event-type} header
     * @param headers header name to Java expression, in wire order
     * @param payload Java expression of the payload bytes
     * @param event Java expression constructing the event
     */
    record Event(String name, Map<String, String> headers, String payload, String event) {
        String testMethodName() {
            return StringUtils.uncapitalize(name);
        }
    }

    List<Event> events() {
        return List.of(
            event("MessageWithBlob", "application/octet-stream", bytes(HELLO_WORLD),
                builder("MessageWithBlob").set("data", bytes(HELLO_WORLD)).build()),
            event("MessageWithString", "text/plain", bytes(HELLO_WORLD),
                builder("MessageWithString").set("data", quote(HELLO_WORLD)).build()),
            event("MessageWithStruct", testCase.eventStreamMessageContentType(), bytes(testCase.validTestStruct()),
                builder("MessageWithStruct").set("someStruct", testStruct()).build()),
            event("MessageWithUnion", testCase.eventStreamMessageContentType(), bytes(testCase.validTestUnion()),
                builder("MessageWithUnion").set("someUnion", variant("TestUnion", "Foo", quote("hello"))).build()),
            headersEvent(),
            headerAndPayloadEvent(),
            event("MessageWithNoHeaderPayloadTraits", testCase.eventStreamMessageContentType(),
                bytes(testCase.validMessageWithNoHeaderPayloadTraits()),
                builder("MessageWithNoHeaderPayloadTraits").set("someInt", "5").set("someString", quote("hello")).build())
        );
    }

    /**
     * Returns the headers of an exception message carrying a modeled {@code SomeError}.
     *
     * @return header name to Java expression
     */
    Map<String, String> someErrorHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(":message-type", quote("exception"));
        headers.put(":exception-type", quote("SomeError"));
        headers.put(":content-type", quote(testCase.mediaType()));
        return headers;
    }

    Map<String, String> unmodeledErrorHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(":message-type", quote("error"));
        headers.put(":error-code", quote("UnmodeledError"));
        headers.put(":error-message", quote("unmodeled error"));
        return headers;
    }

    Symbol type(String name) {
        Symbol symbol = symbolProvider.toSymbol(model.expectShape(ShapeId.fromParts("test", name)));
        writer.addImport(symbol);
        return symbol;
    }

    static String quote(String value) {
        StringBuilder quoted = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    static String bytes(String value) {
        return "bytes(" + quote(value) + ")";
    }

    static String headerMap(Map<String, String> headers) {
        StringBuilder map = new StringBuilder("Map.ofEntries(");
        String separator = "";
        for (Map.Entry<String, String> header : headers.entrySet()) {
            map.append(separator).append("\n        Map.entry(").append(quote(header.getKey()))
                .append(", ").append(header.getValue()).append(')');
            separator = ",";
        }
        return map.append(')').toString();
    }

    private Event event(String name, String contentType, String payload, String message) {
        Map<String, String> headers = eventHeaders(name);
        headers.put(":content-type", quote(contentType));
        return new Event(name, headers, payload, variant("TestStream", name, message));
    }

    private Event headersEvent() {
        String name = "MessageWithHeaders";
        writer.addImport("java.time.Instant");
        Map<String, String> headers = eventHeaders(name);
        headers.put("blob", bytes("test"));
        headers.put("boolean", "Boolean.TRUE");
        headers.put("byte", "Byte.valueOf((byte) 55)");
        headers.put("int", "Integer.valueOf(100_000)");
        headers.put("long", "Long.valueOf(9_000_000_000L)");
        headers.put("short", "Short.valueOf((short) 16_000)");
        headers.put("string", quote("test"));
        headers.put("timestamp", "Instant.ofEpochSecond(5)");
        String message = builder(name)
            .set("blob", bytes("test"))
            .set("boolean", "true")
            .set("byte", "(byte) 55")
            .set("int", "100_000")
            .set("long", "9_000_000_000L")
            .set("short", "(short) 16_000")
            .set("string", quote("test"))
            .set("timestamp", "Instant.ofEpochSecond(5)")
            .build();
        return new Event(name, headers, "new byte[0]", variant("TestStream", name, message));
    }

    private Event headerAndPayloadEvent() {
        String name = "MessageWithHeaderAndPayload";
        Map<String, String> headers = eventHeaders(name);
        headers.put("header", quote("header"));
        headers.put(":content-type", quote("application/octet-stream"));
        String message = builder(name)
            .set("header", quote("header"))
            .set("payload", bytes("payload"))
            .build();
        return new Event(name, headers, bytes("payload"), variant("TestStream", name, message));
    }

    private Map<String, String> eventHeaders(String name) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(":message-type", quote("event"));
        headers.put(":event-type", quote(name));
        return headers;
    }

    private String testStruct() {
        return builder("TestStruct").set("someString", quote("hello")).set("someInt", "5").build();
    }

    private String variant(String union, String member, String value) {
        Symbol symbol = type(union);
        MemberShape memberShape = model.expectShape(ShapeId.fromParts("test", union, member), MemberShape.class);
        return "new " + symbol.getName() + "." + UnionGenerator.variantName(memberShape) + "(" + value + ")";
    }

    private BuilderExpression builder(String structure) {
        return new BuilderExpression(structure);
    }

    private final class BuilderExpression {
        private final String structure;
        private final StringBuilder expression;

        private BuilderExpression(String structure) {
            this.structure = structure;
            this.expression = new StringBuilder(type(structure).getName()).append(".builder()");
        }

        BuilderExpression set(String member, String value) {
            MemberShape memberShape = model.expectShape(ShapeId.fromParts("test", structure, member), MemberShape.class);
            expression.append('.').append(symbolProvider.toMemberName(memberShape)).append('(').append(value).append(')');
            return this;
        }

        String build() {
            return expression.append(".build()").toString();
        }
    }
}
