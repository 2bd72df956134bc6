package com.shapekit.core.codegen;

import java.util.Objects;

/**
 * A package of the generated compilation unit.
 *
 * <p>The harness fills a fixed set of modules: {@link #ERRORS}, {@link #MODELS} and
 * {@link #OUTPUT}, plus {@link #INPUT} for operation inputs and {@link #RUNTIME} for support
 * types the generated tests rely on.
 *
 * @param name package suffix below the root package
 */
public record JavaModule(String name) {

    public static final JavaModule ERRORS = new JavaModule("error");
    public static final JavaModule MODELS = new JavaModule("model");
    public static final JavaModule INPUT = new JavaModule("input");
    public static final JavaModule OUTPUT = new JavaModule("output");
    public static final JavaModule RUNTIME = new JavaModule("runtime");

    /**
     * Compact constructor with validation.
     */
    public JavaModule {
        Objects.requireNonNull(name, "name must not be null");
        if (!name.matches("[a-z][a-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid module name: " + name);
        }
    }

    /**
     * Resolves the module's package below a root package.
     *
     * @param rootPackage root package of the generated project
     * @return fully qualified package name
     */
    public String packageName(String rootPackage) {
        return rootPackage + "." + name;
    }
}
