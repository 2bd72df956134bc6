package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.exec.CommandRunner;
import com.shapekit.core.util.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.build.FileManifest;
import software.amazon.smithy.build.PluginContext;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs a code generation plugin end to end and verifies what it produced.
 *
 * <p>The plugin receives a {@link PluginContext} whose file manifest points at a fresh
 * directory. After the plugin returns, the directory is verified by the custom command of the
 * parameters or else by a build command. Failures propagate; the directory is left in place
 * for inspection.
 */
public final class CodegenIntegrationTest {

    private static final Logger log = LoggerFactory.getLogger(CodegenIntegrationTest.class);

    private CodegenIntegrationTest() {
        // Utility class
    }

    /**
     * Runs a plugin with the default harness configuration.
     *
     * @return directory the plugin generated into
     * @see #codegenIntegrationTest(Model, IntegrationTestParams, Consumer, TestWorkspace)
     */
    public static Path codegenIntegrationTest(Model model, IntegrationTestParams params, Consumer<PluginContext> plugin) {
        return codegenIntegrationTest(model, params, plugin, TestWorkspace.fromDefaultConfig());
    }

    /**
     * Runs a plugin and verifies its output.
     *
     * @param model model to generate from
     * @param params test options
     * @param plugin plugin under test
     * @param workspace source of the output directory and the default build command
     * @return directory the plugin generated into
     * @throws IllegalArgumentException if no service is given and the model does not have exactly one
     * @throws com.shapekit.core.exec.CommandFailedException if the build command fails
     */
    public static Path codegenIntegrationTest(Model model, IntegrationTestParams params,
                                              Consumer<PluginContext> plugin, TestWorkspace workspace) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(plugin, "plugin must not be null");

        HarnessConfig config = workspace.config();
        Path testDir = params.overrideTestDir() != null ? params.overrideTestDir() : workspace.subproject("smithy-test");
        PluginContext context = PluginContext.builder()
            .model(model)
            .fileManifest(FileManifest.create(testDir))
            .settings(settings(model, params, config, moduleName(testDir)))
            .build();

        if (config.build().strictWarnings()) {
            BuildFiles.writeStrictBuildConfig(testDir);
        }

        plugin.accept(context);
        printGeneratedFiles(context.getFileManifest());

        if (params.command() != null) {
            params.command().accept(testDir);
        } else {
            String command = params.buildCommand() != null ? params.buildCommand() : config.build().command();
            String output = CommandRunner.run(command, testDir);
            log.debug("{}", output);
        }
        return testDir;
    }

    /**
     * Builds the plugin settings document.
     *
     * @param model model to generate from
     * @param params test options
     * @param config harness configuration, supplying the root package and the version when
     *     the params leave it unset
     * @param moduleName name of the generated module
     * @return settings document with the additional settings deep-merged in
     */
    static ObjectNode settings(Model model, IntegrationTestParams params, HarnessConfig config, String moduleName) {
        String moduleVersion = params.moduleVersion() != null ? params.moduleVersion() : config.codegen().moduleVersion();
        ObjectNode.Builder builder = Node.objectNodeBuilder()
            .withMember("service", selectService(model, params.service()).toString())
            .withMember("module", moduleName)
            .withMember("moduleVersion", moduleVersion)
            .withMember("moduleAuthors", ArrayNode.fromStrings("test@shapekit.com"))
            .withMember("rootPackage", config.codegen().rootPackage());
        if (params.runtimeConfig() != null) {
            builder.withMember("runtimeConfig", params.runtimeConfig());
        }
        if (params.addModuleToEventStreamAllowList()) {
            builder.withMember(CodegenSettings.CODEGEN_KEY, Node.objectNode()
                .withMember("eventStreamAllowList", ArrayNode.fromStrings(moduleName)));
        }
        return Nodes.deepMerge(builder.build(), params.additionalSettings());
    }

    /**
     * Picks the service to generate.
     *
     * @param model model to generate from
     * @param service explicit service id, or null
     * @return the explicit service, else the model's only service
     * @throws IllegalArgumentException if no service is given and the model does not have exactly one
     */
    static ShapeId selectService(Model model, String service) {
        if (service != null) {
            return ShapeId.from(service);
        }
        List<ShapeId> services = model.getServiceShapes().stream().map(ServiceShape::getId).sorted().toList();
        if (services.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one service in the model, found " + services.size()
                + (services.isEmpty() ? "" : ": " + services) + ". Pass a service explicitly.");
        }
        return services.get(0);
    }

    private static String moduleName(Path testDir) {
        String name = testDir.getFileName().toString().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return "test_" + name;
    }

    private static void printGeneratedFiles(FileManifest manifest) {
        String files = manifest.getFiles().stream()
            .map(manifest.getBaseDir()::relativize)
            .map(Path::toString)
            .sorted()
            .collect(Collectors.joining("\n  "));
        log.info("Generated {} file(s) in {}:\n  {}", manifest.getFiles().size(), manifest.getBaseDir(), files);
    }
}
