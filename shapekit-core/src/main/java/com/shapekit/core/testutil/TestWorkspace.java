package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.config.ConfigLoader;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Hands out fresh directories for generated projects.
 *
 * <p>Each call to {@link #subproject(String)} creates a new directory under the configured
 * workspace root, so concurrent harness runs never share files.
 */
public class TestWorkspace {

    private static final Logger log = LoggerFactory.getLogger(TestWorkspace.class);

    private final HarnessConfig config;

    public TestWorkspace(HarnessConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates a workspace from {@link ConfigLoader#loadDefault()}.
     *
     * @return workspace
     */
    public static TestWorkspace fromDefaultConfig() {
        return new TestWorkspace(ConfigLoader.loadDefault());
    }

    public HarnessConfig config() {
        return config;
    }

    /**
     * Creates a new empty directory.
     *
     * @param prefix directory name prefix
     * @return created directory
     */
    public Path subproject(String prefix) {
        try {
            Path root = config.workspace().rootPath();
            Files.createDirectories(root);
            Path directory = Files.createTempDirectory(root, prefix);
            log.debug("Created workspace {}", directory);
            return directory;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace under " + config.workspace().root(), e);
        }
    }

    /**
     * Creates a project in a new directory.
     *
     * @param settings settings of the generated code
     * @return empty project
     */
    public GeneratedTestProject testProject(CodegenSettings settings) {
        return new GeneratedTestProject(subproject("shapekit-test"), settings, config);
    }

    /**
     * Deletes a directory created by this workspace unless the configuration keeps them.
     *
     * @param directory directory to release
     * @throws UncheckedIOException if the directory cannot be deleted
     */
    public void release(Path directory) {
        if (config.workspace().keep()) {
            log.info("Keeping workspace {}", directory);
            return;
        }
        try {
            FileUtils.deleteRecursively(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete workspace " + directory, e);
        }
    }
}
