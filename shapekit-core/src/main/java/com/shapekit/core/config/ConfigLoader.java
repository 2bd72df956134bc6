package com.shapekit.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the settings of the generated-project test harness, chiefly its workspace directory
 * and the command that builds each generated project.
 *
 * <p>Uses Jackson to deserialize {@code shapekit.yaml} into {@link HarnessConfig} records.
 * A missing or unparseable file is not fatal; the harness then generates into the default
 * workspace and builds with the default command, see {@link HarnessConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HarnessConfig config = ConfigLoader.load(Path.of("shapekit.yaml"));
 * String command = config.build().command();
 * }</pre>
 */
public final class ConfigLoader {

    /** System property naming the configuration file. */
    public static final String CONFIG_PROPERTY = "shapekit.config";

    /** Configuration file looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "shapekit.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads harness settings from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link HarnessConfig#defaults()}, so generated projects still build with
     * {@code mvn -B -q test} under the system temp directory.
     *
     * @param configPath path to {@code shapekit.yaml}
     * @return harness settings, or the defaults if the file is unusable
     */
    public static HarnessConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Harness configuration {} not found; generating projects with the default workspace and build command",
                configPath);
            return HarnessConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Harness configuration {} is not a readable file; generating projects with the default settings",
                configPath);
            return HarnessConfig.defaults();
        }

        try {
            log.debug("Reading harness configuration {}", configPath);
            HarnessConfig config = YAML_MAPPER.readValue(configPath.toFile(), HarnessConfig.class);
            if (config == null) {
                log.warn("Harness configuration {} is empty; generating projects with the default settings", configPath);
                return HarnessConfig.defaults();
            }
            log.info("Generated projects go to {} and build with `{}` (from {})",
                config.workspace().root(), config.build().command(), configPath);
            return config;
        } catch (IOException e) {
            log.warn("Harness configuration {} could not be parsed, generating projects with the default settings: {}",
                configPath, e.getMessage());
            return HarnessConfig.defaults();
        }
    }

    /**
     * Loads the harness settings named by the {@code shapekit.config} system property, else
     * {@code ./shapekit.yaml}, else the defaults.
     *
     * @return harness settings
     */
    public static HarnessConfig loadDefault() {
        String configured = System.getProperty(CONFIG_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return load(Path.of(configured));
        }
        Path local = Path.of(DEFAULT_FILE_NAME);
        if (Files.exists(local)) {
            return load(local);
        }
        log.debug("No {} in the working directory, generated projects use the default harness settings", DEFAULT_FILE_NAME);
        return HarnessConfig.defaults();
    }
}
