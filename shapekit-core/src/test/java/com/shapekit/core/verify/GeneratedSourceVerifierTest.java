package com.shapekit.core.verify;

import com.shapekit.core.util.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneratedSourceVerifier}.
 */
class GeneratedSourceVerifierTest {

    @TempDir
    Path tempDir;

    @Test
    void verify_validSources_reportsNothing() throws IOException {
        FileUtils.writeString(tempDir.resolve("src/main/java/a/Shape.java"), """
            package a;

            public sealed interface Shape {
                record Circle(double radius) implements Shape {}
            }
            """);

        assertThat(GeneratedSourceVerifier.verify(tempDir)).isEmpty();
    }

    @Test
    void verify_brokenSource_reportsFile() throws IOException {
        FileUtils.writeString(tempDir.resolve("src/main/java/a/Broken.java"), "package a;\n\nclass Broken {\n");

        assertThat(GeneratedSourceVerifier.verify(tempDir))
            .isNotEmpty()
            .allMatch(problem -> problem.startsWith(Path.of("src/main/java/a/Broken.java").toString()));
    }

    @Test
    void requireValid_brokenSource_throws() throws IOException {
        FileUtils.writeString(tempDir.resolve("src/main/java/a/Broken.java"), "package a; class Broken { int }");

        assertThatThrownBy(() -> GeneratedSourceVerifier.requireValid(tempDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Broken.java");
    }
}
