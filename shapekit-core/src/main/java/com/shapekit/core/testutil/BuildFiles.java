package com.shapekit.core.testutil;

import com.shapekit.core.util.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Build files written into generated projects.
 */
public final class BuildFiles {

    /** Relative path of the Maven options file. */
    public static final String MAVEN_CONFIG = ".mvn/maven.config";

    static final String JUNIT_VERSION = "5.10.3";
    static final String SUREFIRE_VERSION = "3.2.5";

    private static final String STRICT_FLAGS =
        "-Dmaven.compiler.failOnWarning=true\n"
        + "-Dmaven.compiler.showWarnings=true\n";

    private BuildFiles() {
        // Utility class
    }

    /**
     * Makes compiler warnings fail the build of a project.
     *
     * @param projectRoot project directory
     */
    public static void writeStrictBuildConfig(Path projectRoot) {
        write(projectRoot.resolve(MAVEN_CONFIG), STRICT_FLAGS);
    }

    /**
     * Writes a minimal {@code pom.xml} that compiles for Java 17 and runs JUnit 5 tests.
     *
     * @param projectRoot project directory
     * @param groupId group id of the generated module
     * @param artifactId artifact id of the generated module
     * @param version version of the generated module
     */
    public static void writePom(Path projectRoot, String groupId, String artifactId, String version) {
        write(projectRoot.resolve("pom.xml"), pom(groupId, artifactId, version));
    }

    static String pom(String groupId, String artifactId, String version) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<project xmlns=\"http://maven.apache.org/POM/4.0.0\"\n");
        sb.append("         xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"\n");
        sb.append("         xsi:schemaLocation=\"http://maven.apache.org/POM/4.0.0 ")
            .append("http://maven.apache.org/xsd/maven-4.0.0.xsd\">\n");
        sb.append("    <modelVersion>4.0.0</modelVersion>\n\n");
        element(sb, 1, "groupId", groupId);
        element(sb, 1, "artifactId", artifactId);
        element(sb, 1, "version", version);
        sb.append('\n');

        sb.append("    <properties>\n");
        element(sb, 2, "maven.compiler.release", "17");
        element(sb, 2, "project.build.sourceEncoding", "UTF-8");
        sb.append("    </properties>\n\n");

        sb.append("    <dependencies>\n");
        sb.append("        <dependency>\n");
        element(sb, 3, "groupId", "org.junit.jupiter");
        element(sb, 3, "artifactId", "junit-jupiter");
        element(sb, 3, "version", JUNIT_VERSION);
        element(sb, 3, "scope", "test");
        sb.append("        </dependency>\n");
        sb.append("    </dependencies>\n\n");

        sb.append("    <build>\n");
        sb.append("        <plugins>\n");
        sb.append("            <plugin>\n");
        element(sb, 4, "groupId", "org.apache.maven.plugins");
        element(sb, 4, "artifactId", "maven-surefire-plugin");
        element(sb, 4, "version", SUREFIRE_VERSION);
        sb.append("            </plugin>\n");
        sb.append("        </plugins>\n");
        sb.append("    </build>\n");
        sb.append("</project>\n");
        return sb.toString();
    }

    private static void element(StringBuilder sb, int depth, String name, String value) {
        sb.append("    ".repeat(depth))
            .append('<').append(name).append('>')
            .append(value)
            .append("</").append(name).append(">\n");
    }

    private static void write(Path path, String content) {
        try {
            FileUtils.writeString(path, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }
}
