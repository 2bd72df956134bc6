package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaCodegenContext;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.EnumSet;
import java.util.Set;

/**
 * Renders the event stream marshaller and unmarshaller of one protocol.
 *
 * <p>The rendered class must have a public no-argument constructor and, depending on the
 * direction, one of these methods (types from the project's runtime and model packages):
 * <pre>{@code
 * public EventMessage marshall(TestStream event) throws Exception
 * public TestStream unmarshall(EventMessage message) throws Exception
 * }</pre>
 * An unmarshaller throws the generated error class for a modeled error message and
 * {@code EventStreamException} for any other error message.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.shapekit.core.testutil.EventStreamProtocolGenerator}
 *
 * @see EventStreamProtocolGenerators
 * @see EventStreamRuntime
 */
public interface EventStreamProtocolGenerator {

    /**
     * Returns unique identifier for this generator (e.g., "rest-json-event-stream").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the id of the protocol trait this generator implements.
     *
     * @return protocol trait id, e.g. {@code aws.protocols#restJson1}
     */
    ShapeId getProtocol();

    /**
     * Returns the sides this generator supports.
     *
     * @return supported targets, both by default
     */
    default Set<CodegenTarget> getSupportedTargets() {
        return EnumSet.allOf(CodegenTarget.class);
    }

    /**
     * Renders the marshaller into the project.
     *
     * @param context codegen context of the run
     * @param project project and shapes under test
     * @return symbol of the rendered marshaller class
     */
    Symbol renderMarshaller(JavaCodegenContext context, TestEventStreamProject project);

    /**
     * Renders the unmarshaller into the project.
     *
     * @param context codegen context of the run
     * @param project project and shapes under test
     * @return symbol of the rendered unmarshaller class
     */
    Symbol renderUnmarshaller(JavaCodegenContext context, TestEventStreamProject project);
}
