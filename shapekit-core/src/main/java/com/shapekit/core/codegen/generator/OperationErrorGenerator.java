package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaSymbolProvider;
import com.shapekit.core.codegen.JavaSymbols;
import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.StructureShape;

import java.util.List;
import java.util.Objects;

/**
 * Renders the error type of an operation or an event stream: a sealed interface with one
 * record per modeled error.
 *
 * <p>Clients add an {@code Unhandled} variant wrapping any other {@link Throwable}. A server
 * type with no modeled errors is a plain interface, since a sealed interface needs at least
 * one permitted subtype.
 */
public final class OperationErrorGenerator {

    public static final String UNHANDLED_VARIANT = "Unhandled";

    private final SymbolProvider symbolProvider;
    private final Symbol ownerSymbol;
    private final List<StructureShape> errors;
    private final CodegenTarget target;

    /**
     * Creates a generator.
     *
     * @param symbolProvider symbol provider of the generated project
     * @param ownerSymbol symbol of the operation or stream the error type belongs to
     * @param errors modeled errors, rendered in the given order
     * @param target client or server
     */
    public OperationErrorGenerator(SymbolProvider symbolProvider, Symbol ownerSymbol,
                                   List<StructureShape> errors, CodegenTarget target) {
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        this.ownerSymbol = Objects.requireNonNull(ownerSymbol, "ownerSymbol must not be null");
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Returns the symbol of the error type rendered for an owner.
     *
     * @param ownerSymbol symbol of the operation or stream
     * @param errorPackage package of the errors module
     * @return error type symbol
     */
    public static Symbol errorSymbol(Symbol ownerSymbol, String errorPackage) {
        String name = ownerSymbol.getName() + "Error";
        return Symbol.builder()
            .name(name)
            .namespace(errorPackage, ".")
            .definitionFile(JavaSymbolProvider.sourceFile(errorPackage, name))
            .build();
    }

    /**
     * Renders the error type into a writer for the errors package.
     *
     * @param writer writer of the error type's file
     */
    public void render(JavaWriter writer) {
        String name = errorSymbol(ownerSymbol, writer.packageName()).getName();
        boolean unhandled = target == CodegenTarget.CLIENT;
        writer.writeProvenance(getClass().getSimpleName() + " for " + ownerSymbol.getName());
        if (errors.isEmpty() && !unhandled) {
            writer.write("public interface $L {}", name);
            return;
        }
        writer.openBlock("public sealed interface $L {", "}", name, () -> {
            for (StructureShape error : errors) {
                Symbol errorSymbol = symbolProvider.toSymbol(error);
                writer.write("record $L($L error) implements $L {}",
                    errorSymbol.getName(), JavaSymbols.qualifiedName(errorSymbol), name);
            }
            if (unhandled) {
                writer.write("record $L(Throwable cause) implements $L {}", UNHANDLED_VARIANT, name);
            }
        });
    }
}
