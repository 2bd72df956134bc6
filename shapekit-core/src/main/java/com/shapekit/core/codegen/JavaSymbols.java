package com.shapekit.core.codegen;

import software.amazon.smithy.codegen.core.Symbol;

/**
 * Helpers for the properties {@link JavaSymbolProvider} attaches to symbols.
 */
public final class JavaSymbols {

    /** Boolean property: the member may be absent. */
    public static final String OPTIONAL = "optional";

    /** Shape property: the shape the symbol was created for. */
    public static final String SHAPE = "shape";

    private JavaSymbols() {
        // Utility class
    }

    /**
     * Checks whether a symbol was marked optional.
     *
     * <p>Symbols without the property (anything that is not a member) count as optional.
     *
     * @param symbol symbol to inspect
     * @return true unless the symbol is explicitly non-optional
     */
    public static boolean isOptional(Symbol symbol) {
        return symbol.getProperty(OPTIONAL, Boolean.class).orElse(true);
    }

    /**
     * Returns the fully qualified Java name of a symbol, usable where a simple name would be
     * shadowed by a nested type.
     *
     * @param symbol symbol to qualify
     * @return qualified name
     */
    public static String qualifiedName(Symbol symbol) {
        String namespace = symbol.getNamespace();
        if (namespace.isEmpty() || namespace.equals("java.lang")) {
            return symbol.getName();
        }
        return namespace + "." + symbol.getName();
    }

    /**
     * Returns the name of the outermost class of a symbol, without type arguments.
     *
     * @param symbol symbol to inspect
     * @return outer class name (e.g., "List" for "List&lt;String&gt;", "TestStream" for "TestStream.Foo")
     */
    public static String outerClassName(Symbol symbol) {
        String name = symbol.getName();
        int generic = name.indexOf('<');
        if (generic >= 0) {
            name = name.substring(0, generic);
        }
        int nested = name.indexOf('.');
        return nested >= 0 ? name.substring(0, nested) : name;
    }
}
