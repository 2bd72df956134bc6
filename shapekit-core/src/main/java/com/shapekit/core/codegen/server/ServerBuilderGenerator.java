package com.shapekit.core.codegen.server;

import com.shapekit.core.codegen.JavaSymbols;
import com.shapekit.core.codegen.JavaWriter;
import com.shapekit.core.codegen.ServerCodegenContext;
import com.shapekit.core.codegen.generator.AbstractBuilderGenerator;
import com.shapekit.core.constraint.ConstraintClassifier;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.StructureShape;

import java.util.List;

/**
 * Server builders validate what they build.
 *
 * <p>When the structure can reach a constrained shape, {@code build()} declares the nested
 * checked {@code ConstraintViolationException} and rejects missing non-optional members.
 * The exception class is public only when the settings enable public constrained types.
 * Structures that cannot reach a constrained shape get an infallible builder.
 */
public final class ServerBuilderGenerator extends AbstractBuilderGenerator {

    public static final String VIOLATION_EXCEPTION = "ConstraintViolationException";

    private final boolean fallible;
    private final boolean publicConstrainedTypes;

    public ServerBuilderGenerator(ServerCodegenContext context, StructureShape shape) {
        super(context.symbolProvider(), shape);
        this.fallible = context.reachability().canReachConstrainedShape(shape);
        this.publicConstrainedTypes = context.settings().publicConstrainedTypes();
    }

    /**
     * Returns whether {@code build()} can fail.
     *
     * @return true if the builder validates
     */
    public boolean isFallible() {
        return fallible;
    }

    @Override
    protected void renderBuildMethod(JavaWriter writer) {
        if (!fallible) {
            writer.openBlock("public $L build() {", "}", structureName(), () ->
                writer.write("return new $L($L);", structureName(), constructorArguments()));
            return;
        }
        writer.openBlock("public $L build() throws $L {", "}", structureName(), VIOLATION_EXCEPTION, () -> {
            for (MemberShape member : requiredMembers()) {
                String name = symbolProvider.toMemberName(member);
                writer.openBlock("if ($L == null) {", "}", name, () ->
                    writer.write("throw new $L($S);", VIOLATION_EXCEPTION, member.getMemberName()));
            }
            writer.write("return new $L($L);", structureName(), constructorArguments());
        });
    }

    @Override
    protected void renderSupportingTypes(JavaWriter writer) {
        if (!fallible) {
            return;
        }
        String visibility = publicConstrainedTypes ? "public " : "";
        writer.write("");
        writer.openBlock("$Lstatic final class $L extends Exception {", "}", visibility, VIOLATION_EXCEPTION, () -> {
            writer.write("private static final long serialVersionUID = 1L;");
            writer.write("");
            writer.write("private final String memberName;");
            writer.write("");
            writer.openBlock("$L(String memberName) {", "}", VIOLATION_EXCEPTION, () -> {
                writer.write("super(\"Missing required member: \" + memberName);");
                writer.write("this.memberName = memberName;");
            });
            writer.write("");
            writer.openBlock("public String getMemberName() {", "}", () -> writer.write("return memberName;"));
        });
    }

    private List<MemberShape> requiredMembers() {
        return members().stream()
            .filter(member -> !JavaSymbols.isOptional(symbolProvider.toSymbol(member)))
            .filter(member -> !ConstraintClassifier.hasNonNullDefault(member))
            .toList();
    }
}
