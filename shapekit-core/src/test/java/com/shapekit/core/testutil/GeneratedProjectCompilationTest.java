package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.fixture.Protocol;
import com.shapekit.core.util.FileUtils;
import org.apiguardian.api.API;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.opentest4j.AssertionFailedError;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Compiles generated event stream projects with the JDK compiler, including their JUnit
 * classes, so type errors in generated code fail here rather than in an external build.
 */
class GeneratedProjectCompilationTest {

    private static final String GENERATED = "com/shapekit/generated/";

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
        "CLIENT, MARSHALL",
        "CLIENT, UNMARSHALL",
        "SERVER, MARSHALL",
        "SERVER, UNMARSHALL"
    })
    void generatedProject_compiles(CodegenTarget target, EventStreamTestVariety variety) throws Exception {
        Path project = generate(target, variety);
        Path classes = tempDir.resolve("classes");

        List<String> errors = compile(project, classes);

        assertThat(errors).isEmpty();
        assertThat(classes.resolve(GENERATED + "model/TestStream.class")).exists();
        assertThat(classes.resolve(GENERATED + "model/TestStream$MessageWithBlob.class")).exists();
        assertThat(classes.resolve(GENERATED + "error/SomeError.class")).exists();
        assertThat(classes.resolve(GENERATED + "runtime/EventMessage.class")).exists();
        String testClass = variety == EventStreamTestVariety.MARSHALL
            ? EventStreamMarshallTestCases.CLASS_NAME
            : EventStreamUnmarshallTestCases.CLASS_NAME;
        assertThat(classes.resolve(GENERATED + testClass + ".class")).exists();
    }

    @Test
    void serverProject_compilesFallibleBuilder() throws Exception {
        Path project = generate(CodegenTarget.SERVER, EventStreamTestVariety.MARSHALL);
        Path classes = tempDir.resolve("classes");

        assertThat(compile(project, classes)).isEmpty();
        assertThat(classes.resolve(GENERATED + "output/TestStreamOpOutput$ConstraintViolationException.class")).exists();
        assertThat(classes.resolve(GENERATED + "output/TestStreamOpOutput$Builder.class")).exists();
    }

    private Path generate(CodegenTarget target, EventStreamTestVariety variety) throws IOException {
        Path workspaceRoot = Files.createDirectories(tempDir.resolve("workspace"));
        TestWorkspace workspace = new TestWorkspace(new HarnessConfig(
            new HarnessConfig.WorkspaceConfig(workspaceRoot.toString(), true),
            new HarnessConfig.BuildConfig("true", false),
            null));
        EventStreamTestRequirements<?, ?> requirements = target == CodegenTarget.CLIENT
            ? new ClientEventStreamTestRequirements(workspace.config())
            : new ServerEventStreamTestRequirements(workspace.config());

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1), requirements,
            target, variety, workspace);

        try (Stream<Path> projects = Files.list(workspaceRoot)) {
            List<Path> kept = projects.filter(Files::isDirectory).toList();
            assertThat(kept).hasSize(1);
            return kept.get(0);
        }
    }

    private static List<String> compile(Path project, Path classes) throws IOException {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assumeTrue(compiler != null, "Compiling generated code needs a JDK");
        Files.createDirectories(classes);

        List<Path> sources = FileUtils.findFiles(project, "**/*.java");
        List<String> options = List.of(
            "--release", "17",
            "-proc:none",
            "-d", classes.toString(),
            "-classpath", junitClasspath());

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                 compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjectsFromPaths(sources);
            compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
        }
        return diagnostics.getDiagnostics().stream()
            .filter(diagnostic -> diagnostic.getKind() == Diagnostic.Kind.ERROR)
            .map(Object::toString)
            .toList();
    }

    /**
     * Returns the jars generated JUnit classes compile against. Surefire may hide the real
     * classpath behind a manifest jar, so the jars are located through their classes.
     */
    private static String junitClasspath() {
        return Stream.<Class<?>>of(Test.class, AssertionFailedError.class, API.class)
            .map(type -> type.getProtectionDomain().getCodeSource().getLocation())
            .distinct()
            .map(location -> {
                try {
                    return Path.of(location.toURI()).toString();
                } catch (URISyntaxException e) {
                    throw new IllegalStateException("Unexpected class location " + location, e);
                }
            })
            .collect(Collectors.joining(File.pathSeparator));
    }
}
