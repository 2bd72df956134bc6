package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.StructureShape;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Base for builders with one fluent setter per member.
 *
 * <p>Subclasses decide what {@code build()} declares and checks.
 */
public abstract class AbstractBuilderGenerator implements BuilderGenerator {

    protected final SymbolProvider symbolProvider;
    protected final StructureShape shape;

    protected AbstractBuilderGenerator(SymbolProvider symbolProvider, StructureShape shape) {
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
    }

    @Override
    public void render(JavaWriter writer) {
        writer.write("");
        writer.writeProvenance(getClass().getSimpleName() + " for " + shape.getId());
        writer.openBlock("public static final class Builder {", "}", () -> {
            for (MemberShape member : members()) {
                writer.write("private $T $L;", symbolProvider.toSymbol(member), symbolProvider.toMemberName(member));
            }
            writer.write("");
            writer.openBlock("private Builder() {", "}", () -> { });
            for (MemberShape member : members()) {
                String name = symbolProvider.toMemberName(member);
                writer.write("");
                writer.openBlock("public Builder $1L($2T $1L) {", "}", name, symbolProvider.toSymbol(member), () -> {
                    writer.write("this.$1L = $1L;", name);
                    writer.write("return this;");
                });
            }
            writer.write("");
            renderBuildMethod(writer);
        });
        renderSupportingTypes(writer);
    }

    @Override
    public void renderConvenienceMethod(JavaWriter writer) {
        writer.write("");
        writer.openBlock("public static Builder builder() {", "}", () -> writer.write("return new Builder();"));
    }

    /**
     * Renders {@code build()} inside the builder class.
     *
     * @param writer writer positioned inside the builder body
     */
    protected abstract void renderBuildMethod(JavaWriter writer);

    /**
     * Renders types the builder needs next to it in the structure's class body.
     *
     * @param writer writer positioned inside the structure's class body
     */
    protected void renderSupportingTypes(JavaWriter writer) {
    }

    protected List<MemberShape> members() {
        return List.copyOf(shape.members());
    }

    protected String structureName() {
        Symbol symbol = symbolProvider.toSymbol(shape);
        return symbol.getName();
    }

    protected String constructorArguments() {
        return members().stream()
            .map(symbolProvider::toMemberName)
            .collect(Collectors.joining(", "));
    }
}
