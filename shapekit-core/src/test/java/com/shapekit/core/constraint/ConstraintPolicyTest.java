package com.shapekit.core.constraint;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaSymbolProvider;
import com.shapekit.core.fixture.ModelFixtures;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.IntEnumShape;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.ShapeType;
import software.amazon.smithy.model.traits.RangeTrait;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConstraintPolicy} and how {@link ConstraintClassifier} applies it.
 */
class ConstraintPolicyTest {

    private static final Model MODEL = ModelFixtures.asSmithyModel("""
        namespace test

        @range(min: 1)
        integer Positive

        @length(min: 1)
        map NonEmptyMap {
            key: String
            value: String
        }

        @length(min: 1)
        string NonEmptyString

        structure Required {
            @required
            name: String
        }
        """);

    @Test
    void server_materializesTypeLevelKinds() {
        ConstraintPolicy policy = ConstraintPolicy.server();

        assertThat(policy.materializes(ShapeType.STRING, ConstraintTraitKind.PATTERN)).isTrue();
        assertThat(policy.materializes(ShapeType.INTEGER, ConstraintTraitKind.RANGE)).isTrue();
        assertThat(policy.materializes(ShapeType.MAP, ConstraintTraitKind.LENGTH)).isTrue();
        assertThat(policy.materializes(ShapeType.STRUCTURE, ConstraintTraitKind.REQUIRED)).isTrue();
    }

    @Test
    void server_omitsUnsupportedCombinations() {
        ConstraintPolicy policy = ConstraintPolicy.server();

        assertThat(policy.materializes(ShapeType.FLOAT, ConstraintTraitKind.RANGE)).isFalse();
        assertThat(policy.materializes(ShapeType.MEMBER, ConstraintTraitKind.RANGE)).isFalse();
        assertThat(policy.supportedKinds(ShapeType.TIMESTAMP)).isEmpty();
    }

    @Test
    void server_constrainsRangedIntEnum() {
        IntEnumShape level = (IntEnumShape) IntEnumShape.builder()
            .id("test#Level")
            .addMember("LOW", 1)
            .addMember("HIGH", 2)
            .addTrait(RangeTrait.builder().min(BigDecimal.ONE).max(BigDecimal.valueOf(2)).build())
            .build();
        JavaSymbolProvider symbolProvider = new JavaSymbolProvider(
            MODEL, CodegenSettings.defaults(CodegenSettings.DEFAULT_ROOT_PACKAGE), CodegenTarget.SERVER);

        assertThat(ConstraintPolicy.server().supportedKinds(ShapeType.INT_ENUM)).containsExactly(ConstraintTraitKind.RANGE);
        assertThat(new ConstraintClassifier(symbolProvider, ConstraintPolicy.server()).isDirectlyConstrained(level))
            .isTrue();
        assertThat(new ConstraintClassifier(symbolProvider, ConstraintPolicy.client()).isDirectlyConstrained(level))
            .isFalse();
    }

    @Test
    void client_materializesNothing() {
        assertThat(ConstraintPolicy.client().table()).isEmpty();
        assertThat(ConstraintPolicy.forTarget(CodegenTarget.CLIENT)).isEqualTo(ConstraintPolicy.client());
        assertThat(ConstraintPolicy.forTarget(CodegenTarget.SERVER)).isEqualTo(ConstraintPolicy.server());
    }

    @Test
    void with_replacesAndRemovesRows() {
        ConstraintPolicy policy = ConstraintPolicy.server()
            .with(ShapeType.INTEGER)
            .with(ShapeType.STRING, ConstraintTraitKind.LENGTH);

        assertThat(policy.supportedKinds(ShapeType.INTEGER)).isEmpty();
        assertThat(policy.supportedKinds(ShapeType.STRING)).containsExactly(ConstraintTraitKind.LENGTH);
        assertThat(ConstraintPolicy.server().supportedKinds(ShapeType.INTEGER)).containsExactly(ConstraintTraitKind.RANGE);
    }

    @Test
    void table_isImmutable() {
        ConstraintPolicy policy = ConstraintPolicy.server();

        assertThatThrownBy(() -> policy.table().put(ShapeType.FLOAT, Set.of(ConstraintTraitKind.RANGE)))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(new ConstraintPolicy(Map.of(ShapeType.LIST, Set.of())).supportedKinds(ShapeType.LIST)).isEmpty();
    }

    @Test
    void classifier_followsPolicyRows() {
        JavaSymbolProvider symbolProvider = new JavaSymbolProvider(
            MODEL, CodegenSettings.defaults(CodegenSettings.DEFAULT_ROOT_PACKAGE), CodegenTarget.SERVER);
        ConstraintClassifier server = new ConstraintClassifier(symbolProvider, ConstraintPolicy.server());
        ConstraintClassifier noRange = new ConstraintClassifier(symbolProvider,
            ConstraintPolicy.server().with(ShapeType.INTEGER).with(ShapeType.STRUCTURE));

        assertThat(server.isDirectlyConstrained(shape("test#Positive"))).isTrue();
        assertThat(server.isDirectlyConstrained(shape("test#Required"))).isTrue();
        assertThat(noRange.isDirectlyConstrained(shape("test#Positive"))).isFalse();
        assertThat(noRange.isDirectlyConstrained(shape("test#Required"))).isFalse();
        assertThat(noRange.isDirectlyConstrained(shape("test#NonEmptyString"))).isTrue();
    }

    @Test
    void classifier_clientSymbolsMakeEveryMemberOptional() {
        JavaSymbolProvider clientSymbols = new JavaSymbolProvider(
            MODEL, CodegenSettings.defaults(CodegenSettings.DEFAULT_ROOT_PACKAGE), CodegenTarget.CLIENT);
        ConstraintClassifier classifier = new ConstraintClassifier(clientSymbols, ConstraintPolicy.server());

        assertThat(classifier.isDirectlyConstrained(shape("test#Required"))).isFalse();
        assertThat(classifier.isDirectlyConstrained(shape("test#NonEmptyMap"))).isTrue();
    }

    @Test
    void kindsOf_listsPresentKinds() {
        assertThat(ConstraintTraitKind.kindsOf(shape("test#Positive"))).containsExactly(ConstraintTraitKind.RANGE);
        assertThat(ConstraintTraitKind.kindsOf(shape("test#Required$name"))).containsExactly(ConstraintTraitKind.REQUIRED);
        assertThat(ConstraintTraitKind.REQUIRED.isTypeLevel()).isFalse();
        assertThat(ConstraintTraitKind.UNIQUE_ITEMS.isTypeLevel()).isTrue();
    }

    private static Shape shape(String id) {
        return MODEL.expectShape(ShapeId.from(id));
    }
}
