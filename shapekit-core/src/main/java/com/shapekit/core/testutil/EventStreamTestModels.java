package com.shapekit.core.testutil;

import com.shapekit.core.fixture.ModelFixtures;
import com.shapekit.core.fixture.Protocol;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.List;
import java.util.Objects;

/**
 * The canonical event stream model and the per-protocol expectations tests check against.
 *
 * <p>The model always uses the same names ({@link #SERVICE}, {@link #OPERATION},
 * {@link #STREAM}, {@link #INPUT_OUTPUT}); only the service's protocol trait varies.
 */
public final class EventStreamTestModels {

    public static final ShapeId SERVICE = ShapeId.from("test#TestService");
    public static final ShapeId OPERATION = ShapeId.from("test#TestStreamOp");
    public static final ShapeId STREAM = ShapeId.from("test#TestStream");
    public static final ShapeId INPUT_OUTPUT = ShapeId.from("test#TestStreamInputOutput");

    private static final String MODEL_RESOURCE = "/models/event-stream.smithy";

    /**
     * Expectations for one protocol.
     *
     * @param protocol protocol applied to the service
     * @param model canonical model with the protocol applied
     * @param mediaType media type of the protocol's documents
     * @param requestContentType content type of a request carrying an event stream
     * @param responseContentType content type of a response carrying an event stream
     * @param eventStreamMessageContentType content type of a structured event payload
     * @param validTestStruct payload of a {@code TestStruct} with someString "hello" and someInt 5
     * @param validMessageWithNoHeaderPayloadTraits payload of the same values without payload traits
     * @param validTestUnion payload of a {@code TestUnion} with Foo "hello"
     * @param validSomeError payload of a {@code SomeError} with message "some error"
     * @param validUnmodeledError payload of an unmodeled error with message "unmodeled error"
     */
    public record TestCase(
        Protocol protocol,
        Model model,
        String mediaType,
        String requestContentType,
        String responseContentType,
        String eventStreamMessageContentType,
        String validTestStruct,
        String validMessageWithNoHeaderPayloadTraits,
        String validTestUnion,
        String validSomeError,
        String validUnmodeledError
    ) {
        public TestCase {
            Objects.requireNonNull(protocol, "protocol must not be null");
            Objects.requireNonNull(model, "model must not be null");
        }

        public ShapeId protocolShapeId() {
            return protocol.traitId();
        }

        @Override
        public String toString() {
            return protocol.displayName();
        }
    }

    private EventStreamTestModels() {
        // Utility class
    }

    /**
     * Returns the canonical model annotated with a protocol.
     *
     * @param protocol protocol to apply
     * @return assembled model
     */
    public static Model model(Protocol protocol) {
        return ModelFixtures.replaceProtocolTrait(baseModel(), SERVICE, protocol);
    }

    /**
     * Returns the canonical model without a protocol trait.
     *
     * @return assembled model
     */
    public static Model baseModel() {
        return ModelFixtures.loadResourceModel(MODEL_RESOURCE);
    }

    /**
     * Returns the test cases for every protocol with event stream expectations.
     *
     * @return test cases for restJson1, awsJson1_1 and restXml
     */
    public static List<TestCase> testCases() {
        String jsonStruct = "{\"someString\":\"hello\",\"someInt\":5}";
        String jsonUnion = "{\"Foo\":\"hello\"}";
        String jsonSomeError = "{\"Message\":\"some error\"}";
        String jsonUnmodeledError = "{\"Message\":\"unmodeled error\"}";
        return List.of(
            new TestCase(
                Protocol.REST_JSON_1,
                model(Protocol.REST_JSON_1),
                "application/json",
                "application/vnd.amazon.eventstream",
                "application/json",
                "application/json",
                jsonStruct,
                jsonStruct,
                jsonUnion,
                jsonSomeError,
                jsonUnmodeledError),
            new TestCase(
                Protocol.AWS_JSON_1_1,
                model(Protocol.AWS_JSON_1_1),
                "application/x-amz-json-1.1",
                "application/x-amz-json-1.1",
                "application/x-amz-json-1.1",
                "application/json",
                jsonStruct,
                jsonStruct,
                jsonUnion,
                jsonSomeError,
                jsonUnmodeledError),
            new TestCase(
                Protocol.REST_XML,
                model(Protocol.REST_XML),
                "application/xml",
                "application/vnd.amazon.eventstream",
                "application/xml",
                "application/xml",
                "<TestStruct><someString>hello</someString><someInt>5</someInt></TestStruct>",
                "<MessageWithNoHeaderPayloadTraits><someString>hello</someString>"
                    + "<someInt>5</someInt></MessageWithNoHeaderPayloadTraits>",
                "<TestUnion><Foo>hello</Foo></TestUnion>",
                "<ErrorResponse><Error><Type>SomeError</Type><Code>SomeError</Code>"
                    + "<Message>some error</Message></Error></ErrorResponse>",
                "<ErrorResponse><Error><Type>UnmodeledError</Type><Code>UnmodeledError</Code>"
                    + "<Message>unmodeled error</Message></Error></ErrorResponse>")
        );
    }

    /**
     * Returns the test case of one protocol.
     *
     * @param protocol protocol to look up
     * @return test case
     * @throws IllegalArgumentException if the protocol has no test case
     */
    public static TestCase testCase(Protocol protocol) {
        return testCases().stream()
            .filter(testCase -> testCase.protocol() == protocol)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No event stream test case for " + protocol.displayName()));
    }
}
