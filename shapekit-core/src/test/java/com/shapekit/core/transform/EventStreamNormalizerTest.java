package com.shapekit.core.transform;

import com.shapekit.core.fixture.ModelFixtures;
import com.shapekit.core.testutil.EventStreamTestModels;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.MemberShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.shapes.UnionShape;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EventStreamNormalizer}.
 */
class EventStreamNormalizerTest {

    @Test
    void transform_splitsErrorMembersOff() {
        Model model = EventStreamNormalizer.transform(EventStreamTestModels.baseModel());
        UnionShape stream = model.expectShape(EventStreamTestModels.STREAM, UnionShape.class);

        assertThat(stream.getMemberNames()).doesNotContain("SomeError");
        assertThat(stream.getMemberNames()).contains("MessageWithBlob", "MessageWithStruct");
        assertThat(stream.expectTrait(SyntheticEventStreamUnionTrait.class).errorMembers())
            .extracting(MemberShape::getMemberName)
            .containsExactly("SomeError");
    }

    @Test
    void transform_leavesPlainUnionsAlone() {
        Model source = EventStreamTestModels.baseModel();
        Model model = EventStreamNormalizer.transform(source);

        ShapeId testUnion = ShapeId.from("test#TestUnion");
        assertThat(model.expectShape(testUnion)).isEqualTo(source.expectShape(testUnion));
    }

    @Test
    void transform_isIdempotent() {
        Model once = EventStreamNormalizer.transform(EventStreamTestModels.baseModel());

        assertThat(EventStreamNormalizer.transform(once)).isSameAs(once);
    }

    @Test
    void transform_modelWithoutStreams_isUnchanged() {
        Model model = ModelFixtures.asSmithyModel("namespace test\n\nstring Name\n");

        assertThat(EventStreamNormalizer.transform(model)).isSameAs(model);
    }
}
