package com.shapekit;

import ch.qos.logback.classic.Level;
import com.shapekit.cli.ConstraintsCommand;
import com.shapekit.cli.ListCommand;
import com.shapekit.cli.SettingsCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ShapeKit.
 *
 * <p>ShapeKit analyzes Smithy models for the constraints a generated server must enforce and
 * prepares the settings its code generation test harness runs with.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code constraints} - Classify shapes and report constraint reachability</li>
 *   <li>{@code list} - List known protocols or registered event stream generators</li>
 *   <li>{@code settings} - Print a merged codegen settings document</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Report constrained shapes of a model
 * shapekit constraints model/main.smithy --only-constrained
 *
 * # Same analysis as seen by a client
 * shapekit constraints model/main.smithy --target client
 *
 * # List protocols
 * shapekit list protocols
 * }</pre>
 */
@Command(
    name = "shapekit",
    mixinStandardHelpOptions = true,
    version = "ShapeKit 1.0.0-SNAPSHOT",
    description = "Constraint analysis and codegen test tooling for Smithy models",
    subcommands = {
        ConstraintsCommand.class,
        ListCommand.class,
        SettingsCommand.class
    }
)
public class ShapeKitCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ShapeKitCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ShapeKit - Constraint analysis and codegen test tooling for Smithy models");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'shapekit --help' to see available commands");
        System.out.println("Use 'shapekit <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ShapeKitCLI cli = new ShapeKitCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
