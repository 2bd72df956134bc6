package com.shapekit.core.codegen;

import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolReference;
import software.amazon.smithy.utils.AbstractCodeWriter;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes one Java compilation unit.
 *
 * <p>Adds a {@code $T} formatter that takes a {@link Symbol}, imports it (and every symbol it
 * references) and expands to its name. The package declaration and the sorted import block
 * are prepended by {@link #toString()}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * JavaWriter writer = new JavaWriter("com.example.model", false);
 * writer.openBlock("public final class Foo {", "}", () ->
 *     writer.write("private final $T values;", listSymbol));
 * }</pre>
 */
public final class JavaWriter extends AbstractCodeWriter<JavaWriter> {

    private final String packageName;
    private final boolean debugMode;
    private final Set<String> imports = new TreeSet<>();
    private final Set<String> staticImports = new TreeSet<>();

    /**
     * Creates a writer for a file in the given package.
     *
     * @param packageName package of the compilation unit
     * @param debugMode whether {@link #writeProvenance(String)} emits comments
     */
    public JavaWriter(String packageName, boolean debugMode) {
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
        this.debugMode = debugMode;
        trimTrailingSpaces();
        putFormatter('T', (value, indent) -> typeName(value));
    }

    public String packageName() {
        return packageName;
    }

    public boolean debugMode() {
        return debugMode;
    }

    /**
     * Imports a symbol and the symbols it references.
     *
     * @param symbol symbol to import
     * @return this writer
     */
    public JavaWriter addImport(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol must not be null");
        String namespace = symbol.getNamespace();
        if (!namespace.isEmpty() && !namespace.equals("java.lang") && !namespace.equals(packageName)) {
            imports.add(namespace + "." + JavaSymbols.outerClassName(symbol));
        }
        for (SymbolReference reference : symbol.getReferences()) {
            addImport(reference.getSymbol());
        }
        return this;
    }

    /**
     * Imports a class by qualified name.
     *
     * @param qualifiedName fully qualified class name
     * @return this writer
     */
    public JavaWriter addImport(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        int lastDot = qualifiedName.lastIndexOf('.');
        if (lastDot > 0 && !qualifiedName.substring(0, lastDot).equals(packageName)) {
            imports.add(qualifiedName);
        }
        return this;
    }

    /**
     * Statically imports a member, e.g. {@code org.junit.jupiter.api.Assertions.assertEquals}.
     *
     * @param qualifiedMember fully qualified member name
     * @return this writer
     */
    public JavaWriter addStaticImport(String qualifiedMember) {
        staticImports.add(Objects.requireNonNull(qualifiedMember, "qualifiedMember must not be null"));
        return this;
    }

    /**
     * Writes a comment naming the code that produced the following lines, in debug mode only.
     *
     * @param origin producer of the code
     * @return this writer
     */
    public JavaWriter writeProvenance(String origin) {
        if (debugMode) {
            write("// Generated by $L", origin);
        }
        return this;
    }

    private String typeName(Object value) {
        if (!(value instanceof Symbol symbol)) {
            throw new CodegenException("Invalid type provided to $T. Expected a Symbol, but found `" + value + "`");
        }
        addImport(symbol);
        return symbol.getName();
    }

    @Override
    public String toString() {
        StringBuilder header = new StringBuilder();
        header.append("package ").append(packageName).append(";\n\n");
        if (!imports.isEmpty()) {
            for (String imported : imports) {
                header.append("import ").append(imported).append(";\n");
            }
            header.append('\n');
        }
        if (!staticImports.isEmpty()) {
            for (String imported : staticImports) {
                header.append("import static ").append(imported).append(";\n");
            }
            header.append('\n');
        }
        return header + super.toString();
    }
}
