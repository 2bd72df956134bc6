package com.shapekit.core.testutil;

import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Options of {@link CodegenIntegrationTest#codegenIntegrationTest}.
 *
 * @param addModuleToEventStreamAllowList whether the generated module may use event streams
 * @param service service to generate, null to pick the model's only service
 * @param moduleVersion version of the generated module, null for the harness configuration's version
 * @param runtimeConfig runtime library location, null to leave unset
 * @param additionalSettings settings deep-merged over the generated settings document
 * @param overrideTestDir directory to generate into, null for a fresh workspace directory
 * @param command custom verification of the generated directory, replaces the build command
 * @param buildCommand build command, null for the configured one
 */
public record IntegrationTestParams(
    boolean addModuleToEventStreamAllowList,
    String service,
    String moduleVersion,
    RuntimeConfig runtimeConfig,
    ObjectNode additionalSettings,
    Path overrideTestDir,
    Consumer<Path> command,
    String buildCommand
) {
    public IntegrationTestParams {
        additionalSettings = additionalSettings == null ? Node.objectNode() : additionalSettings;
    }

    /**
     * Returns parameters with every default.
     *
     * @return default parameters
     */
    public static IntegrationTestParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link IntegrationTestParams}.
     */
    public static final class Builder {
        private boolean addModuleToEventStreamAllowList;
        private String service;
        private String moduleVersion;
        private RuntimeConfig runtimeConfig;
        private ObjectNode additionalSettings = Node.objectNode();
        private Path overrideTestDir;
        private Consumer<Path> command;
        private String buildCommand;

        private Builder() {
        }

        public Builder addModuleToEventStreamAllowList(boolean add) {
            this.addModuleToEventStreamAllowList = add;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder moduleVersion(String moduleVersion) {
            this.moduleVersion = moduleVersion;
            return this;
        }

        public Builder runtimeConfig(RuntimeConfig runtimeConfig) {
            this.runtimeConfig = runtimeConfig;
            return this;
        }

        public Builder additionalSettings(ObjectNode additionalSettings) {
            this.additionalSettings = additionalSettings;
            return this;
        }

        public Builder additionalSettings(AdditionalSettings additionalSettings) {
            this.additionalSettings = additionalSettings.toObjectNode();
            return this;
        }

        public Builder overrideTestDir(Path overrideTestDir) {
            this.overrideTestDir = overrideTestDir;
            return this;
        }

        public Builder command(Consumer<Path> command) {
            this.command = command;
            return this;
        }

        public Builder buildCommand(String buildCommand) {
            this.buildCommand = buildCommand;
            return this;
        }

        public IntegrationTestParams build() {
            return new IntegrationTestParams(addModuleToEventStreamAllowList, service, moduleVersion, runtimeConfig,
                additionalSettings, overrideTestDir, command, buildCommand);
        }
    }
}
