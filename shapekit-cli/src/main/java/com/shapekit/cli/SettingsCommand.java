package com.shapekit.cli;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.config.ConfigLoader;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.testutil.AdditionalSettings;
import com.shapekit.core.util.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the codegen settings document the harness would use.
 *
 * <p>Starts from the harness configuration, merges the requested additional settings and
 * checks the result decodes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * shapekit settings --debug-comments --public-constrained-types=false
 * }</pre>
 */
@Command(
    name = "settings",
    description = "Print a merged codegen settings document",
    mixinStandardHelpOptions = true
)
public class SettingsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SettingsCommand.class);

    @Option(names = {"-c", "--config"}, description = "Harness configuration file (default: shapekit.yaml)")
    private Path configFile;

    @Option(names = "--debug-comments", description = "Emit provenance comments in generated code")
    private Boolean debugComments;

    @Option(names = "--public-constrained-types", arity = "0..1", fallbackValue = "true",
        description = "Make constraint violation types public")
    private Boolean publicConstrainedTypes;

    @Override
    public Integer call() {
        HarnessConfig config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.loadDefault();
        ObjectNode base = Node.objectNodeBuilder()
            .withMember("module", "test")
            .withMember("moduleVersion", config.codegen().moduleVersion())
            .withMember("rootPackage", config.codegen().rootPackage())
            .build();

        List<AdditionalSettings> additional = new ArrayList<>();
        if (debugComments != null) {
            additional.add(new AdditionalSettings.GenerateCodegenComments(debugComments));
        }
        if (publicConstrainedTypes != null) {
            additional.add(new AdditionalSettings.PublicConstrainedTypes(publicConstrainedTypes));
        }
        ObjectNode merged = Nodes.deepMerge(base,
            AdditionalSettings.merge(additional.toArray(AdditionalSettings[]::new)).toObjectNode());

        try {
            CodegenSettings settings = CodegenSettings.fromNode(merged);
            log.debug("Decoded settings: {}", settings);
        } catch (CodegenException e) {
            log.error(e.getMessage());
            return 1;
        }
        System.out.println(Node.prettyPrintJson(merged));
        return 0;
    }
}
