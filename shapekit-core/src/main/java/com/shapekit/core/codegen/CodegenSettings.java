package com.shapekit.core.codegen;

import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.ExpectationNotMetException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.ShapeIdSyntaxException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Code generation settings decoded from a plugin settings document.
 *
 * <p><b>Example document:</b>
 * <pre>{@code
 * {
 *   "service": "test#TestService",
 *   "module": "test_module",
 *   "moduleVersion": "1.0.0",
 *   "rootPackage": "com.example.test",
 *   "codegen": {
 *     "debugMode": true,
 *     "publicConstrainedTypes": false,
 *     "eventStreamAllowList": ["test_module"]
 *   }
 * }
 * }</pre>
 *
 * @param service service to generate, null when the caller picks it
 * @param module module name
 * @param moduleVersion module version
 * @param rootPackage root Java package of generated code
 * @param debugMode whether generators emit provenance comments
 * @param publicConstrainedTypes whether constraint violation types are public
 * @param eventStreamAllowList modules allowed to use event streams
 */
public record CodegenSettings(
    ShapeId service,
    String module,
    String moduleVersion,
    String rootPackage,
    boolean debugMode,
    boolean publicConstrainedTypes,
    List<String> eventStreamAllowList
) {
    public static final String DEFAULT_ROOT_PACKAGE = "com.shapekit.generated";
    public static final String CODEGEN_KEY = "codegen";

    /**
     * Compact constructor with validation.
     */
    public CodegenSettings {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(moduleVersion, "moduleVersion must not be null");
        Objects.requireNonNull(rootPackage, "rootPackage must not be null");
        eventStreamAllowList = eventStreamAllowList == null ? List.of() : List.copyOf(eventStreamAllowList);
    }

    /**
     * Creates settings with defaults for everything but the root package.
     *
     * @param rootPackage root Java package of generated code
     * @return default settings
     */
    public static CodegenSettings defaults(String rootPackage) {
        return new CodegenSettings(null, "test", "1.0.0", rootPackage, false, true, List.of());
    }

    /**
     * Decodes settings from a plugin settings document.
     *
     * @param node settings document
     * @return decoded settings
     * @throws CodegenException if a member has the wrong type or an invalid value
     */
    public static CodegenSettings fromNode(ObjectNode node) {
        Objects.requireNonNull(node, "node must not be null");
        try {
            ShapeId service = node.getStringMember("service")
                .map(StringNode::getValue)
                .map(ShapeId::from)
                .orElse(null);
            ObjectNode codegen = node.getObjectMember(CODEGEN_KEY).orElse(Node.objectNode());
            List<String> allowList = codegen.getArrayMember("eventStreamAllowList")
                .map(array -> array.getElements().stream()
                    .map(element -> element.expectStringNode().getValue())
                    .toList())
                .orElse(List.of());
            return new CodegenSettings(
                service,
                node.getStringMemberOrDefault("module", "test"),
                node.getStringMemberOrDefault("moduleVersion", "1.0.0"),
                node.getStringMemberOrDefault("rootPackage", DEFAULT_ROOT_PACKAGE),
                codegen.getBooleanMemberOrDefault("debugMode", false),
                codegen.getBooleanMemberOrDefault("publicConstrainedTypes", true),
                allowList
            );
        } catch (ExpectationNotMetException | ShapeIdSyntaxException e) {
            throw new CodegenException("Invalid codegen settings: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the configured service, if any.
     *
     * @return service id
     */
    public Optional<ShapeId> serviceId() {
        return Optional.ofNullable(service);
    }

    /**
     * Returns the package of a module of the generated project.
     *
     * @param module module
     * @return fully qualified package name
     */
    public String packageOf(JavaModule module) {
        return module.packageName(rootPackage);
    }
}
