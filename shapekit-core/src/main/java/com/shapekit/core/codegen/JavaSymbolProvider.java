package com.shapekit.core.codegen;

import com.shapekit.core.constraint.ConstraintClassifier;
import com.shapekit.core.transform.SyntheticInputTrait;
import com.shapekit.core.transform.SyntheticOutputTrait;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolProvider;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.CollectionShape;
import software.amazon.smithy.model.shapes.MapShape;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.traits.ErrorTrait;
import software.amazon.smithy.utils.StringUtils;

import java.util.Objects;
import java.util.Set;

/**
 * Maps shapes to Java types of the generated project.
 *
 * <p>Scalars map to boxed JDK types, collections to {@code java.util} interfaces, and
 * aggregates to classes in the module their role dictates: errors in {@link JavaModule#ERRORS},
 * synthetic operation inputs and outputs in {@link JavaModule#INPUT} and
 * {@link JavaModule#OUTPUT}, everything else in {@link JavaModule#MODELS}.
 *
 * <p>Member symbols are the target's symbol plus the {@link JavaSymbols#OPTIONAL} property.
 * Clients treat every member as optional. Servers treat a member as non-optional when it is
 * {@code @required} or has a non-null default.
 */
public final class JavaSymbolProvider implements SymbolProvider {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "record", "sealed", "permits", "yield", "var", "true", "false", "null"
    );

    private final Model model;
    private final CodegenSettings settings;
    private final CodegenTarget target;

    public JavaSymbolProvider(Model model, CodegenSettings settings, CodegenTarget target) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public Symbol toSymbol(Shape shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        return switch (shape.getType()) {
            case MEMBER -> memberSymbol(shape.asMemberShape().orElseThrow());
            case STRING, ENUM -> jdk("java.lang", "String");
            case BOOLEAN -> jdk("java.lang", "Boolean");
            case BYTE -> jdk("java.lang", "Byte");
            case SHORT -> jdk("java.lang", "Short");
            case INTEGER, INT_ENUM -> jdk("java.lang", "Integer");
            case LONG -> jdk("java.lang", "Long");
            case FLOAT -> jdk("java.lang", "Float");
            case DOUBLE -> jdk("java.lang", "Double");
            case BIG_INTEGER -> jdk("java.math", "BigInteger");
            case BIG_DECIMAL -> jdk("java.math", "BigDecimal");
            case TIMESTAMP -> jdk("java.time", "Instant");
            case BLOB -> Symbol.builder().name("byte[]").build();
            case DOCUMENT -> jdk("java.lang", "Object");
            case LIST, SET -> collectionSymbol((CollectionShape) shape);
            case MAP -> mapSymbol((MapShape) shape);
            case STRUCTURE -> generated(shape, moduleOf(shape));
            case UNION -> generated(shape, JavaModule.MODELS);
            case OPERATION, SERVICE, RESOURCE -> rootSymbol(shape);
        };
    }

    @Override
    public String toMemberName(MemberShape shape) {
        String name = StringUtils.uncapitalize(shape.getMemberName());
        return RESERVED_WORDS.contains(name) ? name + "_" : name;
    }

    private Symbol memberSymbol(MemberShape member) {
        Shape targetShape = model.getShape(member.getTarget())
            .orElseThrow(() -> new CodegenException("Member " + member.getId() + " targets missing shape " + member.getTarget()));
        boolean optional = switch (target) {
            case CLIENT -> true;
            case SERVER -> !member.isRequired() && !ConstraintClassifier.hasNonNullDefault(member);
        };
        return toSymbol(targetShape).toBuilder()
            .putProperty(JavaSymbols.OPTIONAL, optional)
            .putProperty(JavaSymbols.SHAPE, member)
            .build();
    }

    private Symbol collectionSymbol(CollectionShape shape) {
        Symbol element = toSymbol(shape.getMember());
        return Symbol.builder()
            .name("List<" + boxed(element) + ">")
            .namespace("java.util", ".")
            .addReference(element)
            .build();
    }

    private Symbol mapSymbol(MapShape shape) {
        Symbol value = toSymbol(shape.getValue());
        return Symbol.builder()
            .name("Map<String, " + boxed(value) + ">")
            .namespace("java.util", ".")
            .addReference(value)
            .build();
    }

    private JavaModule moduleOf(Shape shape) {
        if (shape.hasTrait(ErrorTrait.class)) {
            return JavaModule.ERRORS;
        }
        if (shape.hasTrait(SyntheticOutputTrait.class)) {
            return JavaModule.OUTPUT;
        }
        if (shape.hasTrait(SyntheticInputTrait.class)) {
            return JavaModule.INPUT;
        }
        return JavaModule.MODELS;
    }

    private Symbol generated(Shape shape, JavaModule module) {
        String packageName = settings.packageOf(module);
        String name = StringUtils.capitalize(shape.getId().getName());
        return Symbol.builder()
            .name(name)
            .namespace(packageName, ".")
            .definitionFile(sourceFile(packageName, name))
            .putProperty(JavaSymbols.SHAPE, shape)
            .build();
    }

    private Symbol rootSymbol(Shape shape) {
        return Symbol.builder()
            .name(StringUtils.capitalize(shape.getId().getName()))
            .namespace(settings.rootPackage(), ".")
            .putProperty(JavaSymbols.SHAPE, shape)
            .build();
    }

    private static Symbol jdk(String packageName, String name) {
        return Symbol.builder().name(name).namespace(packageName, ".").build();
    }

    private static String boxed(Symbol symbol) {
        return JavaSymbols.qualifiedName(symbol);
    }

    /**
     * Returns the source path of a top-level class.
     *
     * @param packageName package of the class
     * @param className simple class name
     * @return path relative to the project root
     */
    public static String sourceFile(String packageName, String className) {
        return "src/main/java/" + packageName.replace('.', '/') + "/" + className + ".java";
    }
}
