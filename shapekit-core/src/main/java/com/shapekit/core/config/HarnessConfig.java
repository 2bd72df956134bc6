package com.shapekit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shapekit.core.codegen.CodegenSettings;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration of the code generation test harness.
 *
 * <p>Loaded from {@code shapekit.yaml}. Every section and value is optional; missing ones take
 * the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * workspace:
 *   root: "/tmp/shapekit"
 *   keep: false
 *
 * build:
 *   command: "mvn -B -q test"
 *   strictWarnings: true
 *
 * codegen:
 *   rootPackage: "com.shapekit.generated"
 *   moduleVersion: "1.0.0"
 * }</pre>
 *
 * @param workspace where generated projects are written
 * @param build how generated projects are built
 * @param codegen settings applied to generated code
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HarnessConfig(
    @JsonProperty("workspace") WorkspaceConfig workspace,
    @JsonProperty("build") BuildConfig build,
    @JsonProperty("codegen") CodegenDefaults codegen
) {
    public static final String DEFAULT_BUILD_COMMAND = "mvn -B -q test";

    /**
     * Compact constructor filling in missing sections.
     */
    public HarnessConfig {
        workspace = workspace == null ? new WorkspaceConfig(null, null) : workspace;
        build = build == null ? new BuildConfig(null, null) : build;
        codegen = codegen == null ? new CodegenDefaults(null, null) : codegen;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static HarnessConfig defaults() {
        return new HarnessConfig(null, null, null);
    }

    /**
     * Workspace configuration.
     *
     * @param root directory under which per-run workspaces are created, system temp if unset
     * @param keep whether workspaces survive a harness run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkspaceConfig(
        @JsonProperty("root") String root,
        @JsonProperty("keep") Boolean keep
    ) {
        public WorkspaceConfig {
            root = root == null || root.isBlank() ? System.getProperty("java.io.tmpdir") : root;
            keep = keep != null && keep;
        }

        public Path rootPath() {
            return Path.of(root);
        }
    }

    /**
     * Build configuration.
     *
     * @param command shell command that compiles and tests a generated project
     * @param strictWarnings whether generated projects fail on compiler warnings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BuildConfig(
        @JsonProperty("command") String command,
        @JsonProperty("strictWarnings") Boolean strictWarnings
    ) {
        public BuildConfig {
            command = command == null || command.isBlank() ? DEFAULT_BUILD_COMMAND : command;
            strictWarnings = strictWarnings == null || strictWarnings;
        }
    }

    /**
     * Defaults for generated code.
     *
     * @param rootPackage root Java package
     * @param moduleVersion version of the generated module
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CodegenDefaults(
        @JsonProperty("rootPackage") String rootPackage,
        @JsonProperty("moduleVersion") String moduleVersion
    ) {
        public CodegenDefaults {
            rootPackage = rootPackage == null || rootPackage.isBlank() ? CodegenSettings.DEFAULT_ROOT_PACKAGE : rootPackage;
            moduleVersion = moduleVersion == null || moduleVersion.isBlank() ? "1.0.0" : moduleVersion;
        }

        /**
         * Returns settings for a generated module with these defaults and no service.
         *
         * @param module module name
         * @return codegen settings
         */
        public CodegenSettings toSettings(String module) {
            return new CodegenSettings(null, module, moduleVersion, rootPackage, false, true, List.of());
        }
    }
}
