package com.shapekit.cli;

import com.shapekit.core.fixture.Protocol;
import com.shapekit.core.testutil.EventStreamProtocolGenerator;
import com.shapekit.core.testutil.EventStreamProtocolGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list known protocols or registered event stream generators.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List protocols
 * shapekit list protocols
 *
 * # List event stream generators on the classpath
 * shapekit list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List known protocols or registered event stream generators",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: protocols or generators"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "protocols", "protocol" -> listProtocols();
            case "generators", "generator" -> listGenerators();
            default -> {
                log.error("Unknown type: {}. Use: protocols or generators", type);
                yield 1;
            }
        };
    }

    private int listProtocols() {
        System.out.println("Known Protocols:");
        System.out.println();

        for (Protocol protocol : Protocol.values()) {
            System.out.printf("  • %s (%s)%n", protocol.displayName(), protocol.traitId());
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Event Stream Generators:");
        System.out.println();

        List<EventStreamProtocolGenerator> generators = EventStreamProtocolGenerators.all();
        for (EventStreamProtocolGenerator generator : generators) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    Protocol: %s%n", generator.getProtocol());
            System.out.printf("    Targets: %s%n", generator.getSupportedTargets());
            System.out.println();
        }

        if (generators.isEmpty()) {
            System.out.println("  No generators found.");
        }
        return 0;
    }
}
