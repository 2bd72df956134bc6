package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.JavaWriter;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.StructureShape;
import software.amazon.smithy.model.traits.ErrorTrait;
import software.amazon.smithy.utils.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Renders a structure as an immutable Java class.
 *
 * <p>The class has one final field per member, an all-members constructor, getters, and
 * value-based {@code equals}/{@code hashCode}. Error structures extend
 * {@link RuntimeException} instead; a {@code String} member named {@code message} becomes
 * the exception message.
 */
public final class StructureGenerator {

    private final SymbolProvider symbolProvider;
    private final JavaWriter writer;
    private final StructureShape shape;

    public StructureGenerator(SymbolProvider symbolProvider, JavaWriter writer, StructureShape shape) {
        this.symbolProvider = Objects.requireNonNull(symbolProvider, "symbolProvider must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
    }

    /**
     * Renders the class with no additional content.
     */
    public void render() {
        render(w -> { });
    }

    /**
     * Renders the class, letting the caller add members (typically a builder) before it closes.
     *
     * @param additionalContent writes extra members into the class body
     */
    public void render(Consumer<JavaWriter> additionalContent) {
        Symbol symbol = symbolProvider.toSymbol(shape);
        List<MemberShape> members = List.copyOf(shape.members());
        boolean isError = shape.hasTrait(ErrorTrait.class);

        writer.writeProvenance(getClass().getSimpleName() + " for " + shape.getId());
        String declaration = isError
            ? "public final class " + symbol.getName() + " extends RuntimeException {"
            : "public final class " + symbol.getName() + " {";
        writer.openBlock(declaration, "}", () -> {
            if (isError) {
                writer.write("private static final long serialVersionUID = 1L;");
            }
            for (MemberShape member : members) {
                writer.write("private final $T $L;", symbolProvider.toSymbol(member), symbolProvider.toMemberName(member));
            }
            writer.write("");
            renderConstructor(symbol, members, isError);
            for (MemberShape member : members) {
                writer.write("");
                renderGetter(member, isError);
            }
            if (!isError) {
                writer.write("");
                renderEquals(symbol, members);
                writer.write("");
                renderHashCode(members);
            }
            additionalContent.accept(writer);
        });
    }

    private void renderConstructor(Symbol symbol, List<MemberShape> members, boolean isError) {
        String parameters = members.stream()
            .map(member -> symbolProvider.toSymbol(member).getName() + " " + symbolProvider.toMemberName(member))
            .collect(Collectors.joining(", "));
        members.forEach(member -> writer.addImport(symbolProvider.toSymbol(member)));
        writer.openBlock("public $L($L) {", "}", symbol.getName(), parameters, () -> {
            if (isError) {
                writer.write("super($L);", messageMember(members) == null ? "(String) null" : symbolProvider.toMemberName(messageMember(members)));
            }
            for (MemberShape member : members) {
                String name = symbolProvider.toMemberName(member);
                writer.write("this.$1L = $1L;", name);
            }
        });
    }

    private void renderGetter(MemberShape member, boolean isError) {
        String name = symbolProvider.toMemberName(member);
        Symbol memberSymbol = symbolProvider.toSymbol(member);
        if (isError && member.equals(messageMember(List.copyOf(shape.members())))) {
            writer.write("@Override");
            writer.openBlock("public String getMessage() {", "}", () -> writer.write("return $L;", name));
            return;
        }
        writer.openBlock("public $T $L() {", "}", memberSymbol, getterName(member), () -> writer.write("return $L;", name));
    }

    private void renderEquals(Symbol symbol, List<MemberShape> members) {
        writer.write("@Override");
        writer.openBlock("public boolean equals(Object o) {", "}", () -> {
            writer.openBlock("if (this == o) {", "}", () -> writer.write("return true;"));
            writer.openBlock("if (!(o instanceof $L)) {", "}", symbol.getName(), () -> writer.write("return false;"));
            if (members.isEmpty()) {
                writer.write("return true;");
                return;
            }
            writer.write("$1L other = ($1L) o;", symbol.getName());
            String comparison = members.stream()
                .map(symbolProvider::toMemberName)
                .map(name -> "java.util.Objects.deepEquals(" + name + ", other." + name + ")")
                .collect(Collectors.joining("\n    && "));
            writer.write("return $L;", comparison);
        });
    }

    private void renderHashCode(List<MemberShape> members) {
        String values = members.stream()
            .map(symbolProvider::toMemberName)
            .collect(Collectors.joining(", "));
        writer.write("@Override");
        writer.openBlock("public int hashCode() {", "}", () ->
            writer.write("return java.util.Arrays.deepHashCode(new Object[] {$L});", values));
    }

    /**
     * Returns the getter name of a member: {@code get} followed by the capitalized member name.
     *
     * @param member member shape
     * @return getter method name
     */
    public static String getterName(MemberShape member) {
        return "get" + StringUtils.capitalize(member.getMemberName());
    }

    private MemberShape messageMember(List<MemberShape> members) {
        return members.stream()
            .filter(member -> member.getMemberName().equalsIgnoreCase("message"))
            .filter(member -> symbolProvider.toSymbol(member).getName().equals("String"))
            .findFirst()
            .orElse(null);
    }
}
