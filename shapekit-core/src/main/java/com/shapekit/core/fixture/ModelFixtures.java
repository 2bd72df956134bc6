package com.shapekit.core.fixture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.loader.ModelAssembler;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.transform.ModelTransformer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds and reshapes models for tests.
 *
 * <p>Every method returns a new model; inputs are never modified. Assembly failures surface
 * as Smithy's {@code ValidatedResultException}.
 */
public final class ModelFixtures {

    private static final Logger log = LoggerFactory.getLogger(ModelFixtures.class);

    public static final ShapeId CONSTRAINTS_SERVICE = ShapeId.from("com.shapekit.constraints#ConstraintsService");

    private static final String CONSTRAINTS_MODEL = "/models/constraints.smithy";
    private static final String DEFAULT_SMITHY_VERSION = "2";

    private ModelFixtures() {
        // Utility class
    }

    /**
     * Assembles a model from IDL text, prepending {@code $version: "2"} when the text does not
     * declare a version. Trait definitions on the classpath (AWS protocol traits among them)
     * are discovered.
     *
     * @param idl model in Smithy IDL
     * @return validated model
     */
    public static Model asSmithyModel(String idl) {
        return asSmithyModel(idl, DEFAULT_SMITHY_VERSION);
    }

    /**
     * Assembles a model from IDL text with an explicit IDL version.
     *
     * @param idl model in Smithy IDL
     * @param smithyVersion version used when the text declares none
     * @return validated model
     */
    public static Model asSmithyModel(String idl, String smithyVersion) {
        Objects.requireNonNull(idl, "idl must not be null");
        String source = idl.stripLeading().startsWith("$version")
            ? idl
            : "$version: \"" + smithyVersion + "\"\n" + idl;
        return assembler().addUnparsedModel("test.smithy", source).assemble().unwrap();
    }

    /**
     * Assembles a model from files.
     *
     * @param files model files (IDL or JSON AST)
     * @return validated model
     */
    public static Model assemble(Collection<Path> files) {
        Objects.requireNonNull(files, "files must not be null");
        ModelAssembler assembler = assembler();
        files.forEach(assembler::addImport);
        log.debug("Assembling model from {} file(s)", files.size());
        return assembler.assemble().unwrap();
    }

    /**
     * Loads the bundled constraints model and applies a protocol to its service.
     *
     * @param protocol protocol to apply
     * @return model with {@link #CONSTRAINTS_SERVICE} annotated with the protocol
     */
    public static Model loadConstraintsModel(Protocol protocol) {
        Objects.requireNonNull(protocol, "protocol must not be null");
        return replaceProtocolTrait(loadResourceModel(CONSTRAINTS_MODEL), CONSTRAINTS_SERVICE, protocol);
    }

    /**
     * Assembles a model bundled on the classpath.
     *
     * @param resource absolute resource path of an IDL file
     * @return validated model
     * @throws IllegalStateException if the resource does not exist
     */
    public static Model loadResourceModel(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        try (InputStream in = ModelFixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + resource);
            }
            return asSmithyModel(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Makes {@code protocol} the only protocol trait of a service. Applying the same protocol
     * twice yields an equal model.
     *
     * @param model model containing the service
     * @param serviceId service to annotate
     * @param protocol protocol to apply
     * @return transformed model
     */
    public static Model replaceProtocolTrait(Model model, ShapeId serviceId, Protocol protocol) {
        Objects.requireNonNull(protocol, "protocol must not be null");
        ServiceShape.Builder builder = model.expectShape(serviceId, ServiceShape.class).toBuilder();
        for (Protocol known : Protocol.values()) {
            builder.removeTrait(known.traitId());
        }
        ServiceShape service = builder.addTrait(protocol.trait()).build();
        return ModelTransformer.create().replaceShapes(model, List.of(service));
    }

    /**
     * Removes shapes from a model.
     *
     * @param model model to transform
     * @param ids shapes to remove; each must exist
     * @return transformed model
     */
    public static Model removeShapes(Model model, Collection<ShapeId> ids) {
        Objects.requireNonNull(ids, "ids must not be null");
        List<Shape> shapes = ids.stream().map(model::expectShape).toList();
        return ModelTransformer.create().removeShapes(model, shapes);
    }

    /**
     * Unbinds operations from a service.
     *
     * @param model model to transform
     * @param serviceId service to change
     * @param operations operations to unbind; each must be bound to the service
     * @return transformed model
     * @throws IllegalArgumentException if an operation is not bound to the service
     * @throws IllegalStateException if the service would be left without operations
     */
    public static Model removeOperations(Model model, ShapeId serviceId, Collection<ShapeId> operations) {
        Objects.requireNonNull(operations, "operations must not be null");
        ServiceShape service = model.expectShape(serviceId, ServiceShape.class);
        Set<ShapeId> bound = service.getOperations();
        List<ShapeId> unknown = operations.stream().filter(op -> !bound.contains(op)).toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Operations " + unknown + " are not bound to " + serviceId);
        }

        ServiceShape.Builder builder = service.toBuilder();
        operations.forEach(builder::removeOperation);
        Model changed = ModelTransformer.create().replaceShapes(model, List.of(builder.build()));

        Set<ShapeId> remaining = changed.expectShape(serviceId, ServiceShape.class).getOperations();
        if (remaining.isEmpty()) {
            throw new IllegalStateException("Service " + serviceId + " has no operations left");
        }
        if (operations.stream().anyMatch(remaining::contains)) {
            throw new IllegalStateException("Service " + serviceId + " still binds a removed operation");
        }
        return changed;
    }

    private static ModelAssembler assembler() {
        ClassLoader classLoader = ModelFixtures.class.getClassLoader();
        return Model.assembler(classLoader).discoverModels(classLoader);
    }
}
