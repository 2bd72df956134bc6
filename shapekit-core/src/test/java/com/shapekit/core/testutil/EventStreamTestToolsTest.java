package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.config.HarnessConfig;
import com.shapekit.core.exec.CommandFailedException;
import com.shapekit.core.fixture.Protocol;
import com.shapekit.core.util.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.smithy.codegen.core.CodegenException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EventStreamTestTools} with a build command that only succeeds or fails.
 */
class EventStreamTestToolsTest {

    private static final String BASE = "src/main/java/com/shapekit/generated/";

    @TempDir
    Path tempDir;

    @Test
    void runTestCase_clientMarshall_generatesFullProject() throws IOException {
        TestWorkspace workspace = workspace(true, "true");

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace);

        Path project = onlyProject();
        assertThat(relativeSources(project)).contains(
            BASE + "FakeMarshaller.java",
            BASE + "error/SomeError.java",
            BASE + "error/TestStreamOpError.java",
            BASE + "error/TestStreamError.java",
            BASE + "model/TestStream.java",
            BASE + "model/TestStruct.java",
            BASE + "model/TestUnion.java",
            BASE + "model/MessageWithHeaders.java",
            BASE + "output/TestStreamOpOutput.java",
            BASE + "runtime/EventMessage.java",
            BASE + "runtime/EventStreamException.java",
            "src/test/java/com/shapekit/generated/EventStreamMarshallTestCases.java");
        assertThat(project.resolve("pom.xml")).exists();
        assertThat(project.resolve(BuildFiles.MAVEN_CONFIG)).doesNotExist();

        String stream = Files.readString(project.resolve(BASE + "model/TestStream.java"));
        assertThat(stream).contains("record Unknown() implements TestStream {}");
        assertThat(stream).doesNotContain("SomeError");

        String tests = Files.readString(project.resolve("src/test/java/com/shapekit/generated/EventStreamMarshallTestCases.java"));
        assertThat(tests).contains("void messageWithBlob() throws Exception {");
        assertThat(tests).contains("void messageWithNoHeaderPayloadTraits() throws Exception {");
        assertThat(tests).contains("assertEquals(\"application/json\", message.header(\":content-type\"));");
    }

    @Test
    void runTestCase_serverUnmarshall_skipsUnmodeledError() throws IOException {
        TestWorkspace workspace = workspace(true, "true");

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ServerEventStreamTestRequirements(), CodegenTarget.SERVER, EventStreamTestVariety.UNMARSHALL, workspace);

        Path project = onlyProject();
        String tests = Files.readString(project.resolve("src/test/java/com/shapekit/generated/EventStreamUnmarshallTestCases.java"));
        assertThat(tests).contains("void someError() {");
        assertThat(tests).doesNotContain("unmodeledError");

        String stream = Files.readString(project.resolve(BASE + "model/TestStream.java"));
        assertThat(stream).doesNotContain("Unknown");

        String output = Files.readString(project.resolve(BASE + "output/TestStreamOpOutput.java"));
        assertThat(output).contains("build() throws ConstraintViolationException");
    }

    @Test
    void runTestCase_clientUnmarshall_includesUnmodeledError() throws IOException {
        TestWorkspace workspace = workspace(true, "true");

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.UNMARSHALL, workspace);

        String tests = Files.readString(onlyProject().resolve("src/test/java/com/shapekit/generated/EventStreamUnmarshallTestCases.java"));
        assertThat(tests).contains("void unmodeledError() {");
        assertThat(tests).contains("error.getErrorCode()");
    }

    @Test
    void runTestCase_releasesWorkspaceUnlessKept() throws IOException {
        TestWorkspace workspace = workspace(false, "true");

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace);

        assertThat(projects()).isEmpty();
    }

    @Test
    void runTestCase_failingBuild_propagatesOutput() throws IOException {
        TestWorkspace workspace = workspace(false, "echo compilation failed; exit 1");

        assertThatThrownBy(() -> EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace))
            .isInstanceOfSatisfying(CommandFailedException.class, e ->
                assertThat(e.getOutput()).contains("compilation failed"));
        assertThat(projects()).isEmpty();
    }

    @Test
    void runTestCase_failingBuildAndFailingRelease_keepsBuildFailure() {
        TestWorkspace workspace = unreleasableWorkspace("echo compilation failed; exit 1");

        assertThatThrownBy(() -> EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace))
            .isInstanceOfSatisfying(CommandFailedException.class, e -> {
                assertThat(e.getOutput()).contains("compilation failed");
                assertThat(e.getSuppressed()).hasSize(1);
                assertThat(e.getSuppressed()[0])
                    .isInstanceOf(UncheckedIOException.class)
                    .hasMessageContaining("Failed to delete workspace");
            });
    }

    @Test
    void runTestCase_failingRelease_returnsBuildOutput() {
        TestWorkspace workspace = unreleasableWorkspace("echo built");

        String output = EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace);

        assertThat(output).contains("built");
    }

    @Test
    void runTestCase_configuredCodegenDefaults_reachGeneratedPom() throws IOException {
        TestWorkspace workspace = new TestWorkspace(new HarnessConfig(
            new HarnessConfig.WorkspaceConfig(tempDir.toString(), true),
            new HarnessConfig.BuildConfig("true", false),
            new HarnessConfig.CodegenDefaults("com.example.events", "3.1.0")));

        EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ServerEventStreamTestRequirements(workspace.config()), CodegenTarget.SERVER,
            EventStreamTestVariety.MARSHALL, workspace);

        Path project = onlyProject();
        String pom = Files.readString(project.resolve("pom.xml"));
        assertThat(pom).contains("<groupId>com.example.events</groupId>");
        assertThat(pom).contains("<version>3.1.0</version>");
        assertThat(relativeSources(project)).contains("src/main/java/com/example/events/model/TestStream.java");
    }

    @Test
    void runTestCase_noGeneratorForProtocol_throws() {
        TestWorkspace workspace = workspace(false, "true");

        assertThatThrownBy(() -> EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_XML),
            new ClientEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("restXml");
    }

    @Test
    void runTestCase_targetMismatch_throws() {
        TestWorkspace workspace = workspace(false, "true");

        assertThatThrownBy(() -> EventStreamTestTools.runTestCase(EventStreamTestModels.testCase(Protocol.REST_JSON_1),
            new ServerEventStreamTestRequirements(), CodegenTarget.CLIENT, EventStreamTestVariety.MARSHALL, workspace))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCases_coverJsonAndXmlProtocols() {
        assertThat(EventStreamTestModels.testCases())
            .extracting(EventStreamTestModels.TestCase::protocol)
            .containsExactly(Protocol.REST_JSON_1, Protocol.AWS_JSON_1_1, Protocol.REST_XML);
        assertThatThrownBy(() -> EventStreamTestModels.testCase(Protocol.RPC_V2_CBOR))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generators_discoversRegisteredGenerator() {
        assertThat(EventStreamProtocolGenerators.all())
            .extracting(EventStreamProtocolGenerator::getId)
            .contains("fake-rest-json");
        assertThat(EventStreamProtocolGenerators.forProtocol(Protocol.REST_JSON_1.traitId(), CodegenTarget.SERVER))
            .isInstanceOf(FakeEventStreamGenerator.class);
    }

    private TestWorkspace workspace(boolean keep, String command) {
        return new TestWorkspace(new HarnessConfig(
            new HarnessConfig.WorkspaceConfig(tempDir.toString(), keep),
            new HarnessConfig.BuildConfig(command, false),
            null));
    }

    private TestWorkspace unreleasableWorkspace(String command) {
        return new TestWorkspace(workspace(false, command).config()) {
            @Override
            public void release(Path directory) {
                throw new UncheckedIOException("Failed to delete workspace " + directory,
                    new IOException("Directory not empty"));
            }
        };
    }

    private List<Path> projects() throws IOException {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.filter(Files::isDirectory).toList();
        }
    }

    private Path onlyProject() throws IOException {
        List<Path> projects = projects();
        assertThat(projects).hasSize(1);
        return projects.get(0);
    }

    private static List<String> relativeSources(Path project) throws IOException {
        return FileUtils.findFiles(project, "**/*.java").stream()
            .map(project::relativize)
            .map(path -> path.toString().replace('\\', '/'))
            .toList();
    }
}
