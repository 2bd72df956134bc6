package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.JavaSymbolProvider;
import com.shapekit.core.codegen.JavaWriter;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.exec.CommandRunner;
import com.shapekit.core.util.FileUtils;
import com.shapekit.core.verify.GeneratedSourceVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.codegen.core.Symbol;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A Maven project assembled from generated sources, compiled and tested as a unit.
 *
 * <p>Sources are accumulated in one {@link JavaWriter} per file and only written by
 * {@link #flush()}. Asking twice for the same file is an error: two generators claiming one
 * file means a shape was rendered twice.
 */
public final class GeneratedTestProject {

    private static final Logger log = LoggerFactory.getLogger(GeneratedTestProject.class);

    private final Path root;
    private final CodegenSettings settings;
    private final HarnessConfig config;
    private final Map<String, JavaWriter> writers = new LinkedHashMap<>();

    public GeneratedTestProject(Path root, CodegenSettings settings, HarnessConfig config) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public Path root() {
        return root;
    }

    public CodegenSettings settings() {
        return settings;
    }

    /**
     * Writes the class a symbol is defined in.
     *
     * @param symbol symbol with a definition file
     * @param body writes the file's content
     */
    public void useShapeWriter(Symbol symbol, Consumer<JavaWriter> body) {
        if (symbol.getDefinitionFile().isEmpty()) {
            throw new CodegenException("Symbol " + symbol + " has no definition file");
        }
        body.accept(newWriter(symbol.getDefinitionFile(), symbol.getNamespace()));
    }

    /**
     * Writes a test class in the root package.
     *
     * @param className simple class name
     * @param body writes the file's content
     */
    public void useTestWriter(String className, Consumer<JavaWriter> body) {
        String path = "src/test/java/" + settings.rootPackage().replace('.', '/') + "/" + className + ".java";
        body.accept(newWriter(path, settings.rootPackage()));
    }

    /**
     * Writes a main source class in any package.
     *
     * @param packageName package of the class
     * @param className simple class name
     * @param body writes the file's content
     */
    public void useSourceWriter(String packageName, String className, Consumer<JavaWriter> body) {
        body.accept(newWriter(JavaSymbolProvider.sourceFile(packageName, className), packageName));
    }

    /**
     * Returns the relative paths of the files written so far.
     *
     * @return file paths in creation order
     */
    public List<String> files() {
        return List.copyOf(writers.keySet());
    }

    /**
     * Writes the build files and every source file to disk.
     *
     * @return project root
     */
    public Path flush() {
        BuildFiles.writePom(root, settings.rootPackage(), settings.module(), settings.moduleVersion());
        if (config.build().strictWarnings()) {
            BuildFiles.writeStrictBuildConfig(root);
        }
        try {
            for (Map.Entry<String, JavaWriter> entry : writers.entrySet()) {
                FileUtils.writeString(root.resolve(entry.getKey()), entry.getValue().toString());
                log.debug("Wrote {}", entry.getKey());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write generated project " + root, e);
        }
        log.info("Generated {} file(s) in {}", writers.size(), root);
        return root;
    }

    /**
     * Flushes the project, checks the sources parse, then runs the configured build command.
     *
     * @return build output
     * @throws IllegalStateException if a generated source does not parse
     * @throws com.shapekit.core.exec.CommandFailedException if the build fails
     */
    public String compileAndTest() {
        flush();
        GeneratedSourceVerifier.requireValid(root);
        return CommandRunner.run(config.build().command(), root);
    }

    private JavaWriter newWriter(String path, String packageName) {
        if (writers.containsKey(path)) {
            throw new IllegalStateException("File " + path + " was already generated");
        }
        JavaWriter writer = new JavaWriter(packageName, settings.debugMode());
        writers.put(path, writer);
        return writer;
    }
}
