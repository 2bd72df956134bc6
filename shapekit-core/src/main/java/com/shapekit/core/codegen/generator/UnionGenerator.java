package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.JavaSymbols;
import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.UnionShape;
import software.amazon.smithy.utils.StringUtils;

import java.util.Objects;

/**
 * Renders a union as a sealed interface with one nested record per member.
 *
 * <p>Variant names are the capitalized member names, so a variant frequently shares its
 * simple name with the shape it wraps. Record components therefore use qualified type names.
 * When unknown variants are rendered, an {@code Unknown} record catches members added to the
 * model after the code was generated.
 */
public final class UnionGenerator {

    public static final String UNKNOWN_VARIANT = "Unknown";

    private final SymbolProvider symbolProvider;
    private final JavaWriter writer;
    private final UnionShape shape;
    private final boolean renderUnknownVariant;

    public UnionGenerator(SymbolProvider symbolProvider, JavaWriter writer, UnionShape shape,
                          boolean renderUnknownVariant) {
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        this.renderUnknownVariant = renderUnknownVariant;
    }

    public void render() {
        Symbol symbol = symbolProvider.toSymbol(shape);
        writer.writeProvenance(getClass().getSimpleName() + " for " + shape.getId());
        writer.openBlock("public sealed interface $L {", "}", symbol.getName(), () -> {
            for (MemberShape member : shape.members()) {
                writer.write("record $L($L value) implements $L {}",
                    variantName(member),
                    JavaSymbols.qualifiedName(symbolProvider.toSymbol(member)),
                    symbol.getName());
            }
            if (renderUnknownVariant) {
                writer.write("record $L() implements $L {}", UNKNOWN_VARIANT, symbol.getName());
            }
        });
    }

    /**
     * Returns the nested record name for a union member.
     *
     * @param member union member
     * @return variant name
     */
    public static String variantName(MemberShape member) {
        return StringUtils.capitalize(member.getMemberName());
    }
}
