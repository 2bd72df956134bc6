package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.shapes.ShapeId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Finds {@link EventStreamProtocolGenerator}s registered on the classpath.
 */
public final class EventStreamProtocolGenerators {

    private static final Logger log = LoggerFactory.getLogger(EventStreamProtocolGenerators.class);

    private EventStreamProtocolGenerators() {
        // Utility class
    }

    /**
     * Loads every registered generator.
     *
     * @return generators sorted by id
     */
    public static List<EventStreamProtocolGenerator> all() {
        log.debug("Discovering event stream protocol generators via ServiceLoader");
        ServiceLoader<EventStreamProtocolGenerator> loader = ServiceLoader.load(EventStreamProtocolGenerator.class);
        List<EventStreamProtocolGenerator> generators = new ArrayList<>();
        loader.forEach(generators::add);
        generators.sort(Comparator.comparing(EventStreamProtocolGenerator::getId));
        log.debug("Discovered {} event stream protocol generator(s)", generators.size());
        return generators;
    }

    /**
     * Finds the generator for a protocol and target.
     *
     * @param protocol protocol trait id
     * @param target client or server
     * @return first matching generator by id
     * @throws CodegenException if no registered generator matches
     */
    public static EventStreamProtocolGenerator forProtocol(ShapeId protocol, CodegenTarget target) {
        return all().stream()
            .filter(generator -> generator.getProtocol().equals(protocol))
            .filter(generator -> generator.getSupportedTargets().contains(target))
            .findFirst()
            .orElseThrow(() -> new CodegenException(
                "No event stream generator registered for protocol " + protocol + " (" + target + ")"));
    }
}
