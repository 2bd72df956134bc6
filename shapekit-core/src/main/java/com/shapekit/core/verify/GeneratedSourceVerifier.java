package com.shapekit.core.verify;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.shapekit.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that generated Java sources parse before an external build is spent on them.
 *
 * <p>Parsing catches malformed output (unbalanced braces, bad identifiers) with a file and
 * position, which is far easier to read than a build log. Type errors are left to the build.
 */
public final class GeneratedSourceVerifier {

    private static final Logger log = LoggerFactory.getLogger(GeneratedSourceVerifier.class);

    private GeneratedSourceVerifier() {
        // Utility class
    }

    /**
     * Parses every {@code .java} file below a directory.
     *
     * @param directory directory to scan
     * @return problems found, one entry per problem, empty when every file parses
     */
    public static List<String> verify(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

        List<String> problems = new ArrayList<>();
        List<Path> sources;
        try {
            sources = FileUtils.findFiles(directory, "**/*.java");
            for (Path source : sources) {
                ParseResult<CompilationUnit> result = parser.parse(source);
                result.getProblems().forEach(problem ->
                    problems.add(directory.relativize(source) + ": " + problem.getVerboseMessage()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sources under " + directory, e);
        }
        log.debug("Verified {} source file(s) under {}, {} problem(s)", sources.size(), directory, problems.size());
        return problems;
    }

    /**
     * Parses every {@code .java} file below a directory and fails on the first bad one.
     *
     * @param directory directory to scan
     * @throws IllegalStateException listing every problem, if any file does not parse
     */
    public static void requireValid(Path directory) {
        List<String> problems = verify(directory);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Generated sources do not parse:\n" + String.join("\n", problems));
        }
    }
}
