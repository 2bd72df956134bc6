package com.shapekit.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Runs shell commands and captures their output.
 *
 * <p>Commands run through {@code sh -c} in the given directory with standard error merged
 * into standard output. Calls block until the process exits; there is no timeout. The
 * process is destroyed on every exit path, including interruption.
 */
public final class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private CommandRunner() {
        // Utility class
    }

    /**
     * Runs a command.
     *
     * @param command shell command line
     * @param workingDirectory directory to run in
     * @return combined output
     * @throws CommandFailedException if the command exits with a non-zero status
     * @throws UncheckedIOException if the process cannot be started or read
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public static String run(String command, Path workingDirectory) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");

        log.info("Running `{}` in {}", command, workingDirectory);
        ProcessBuilder builder = new ProcessBuilder("sh", "-c", command)
            .directory(workingDirectory.toFile())
            .redirectErrorStream(true);

        Process process = null;
        try {
            process = builder.start();
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("{}", line);
                    output.append(line).append('\n');
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.error("Command `{}` exited with {}", command, exitCode);
                throw new CommandFailedException(command, workingDirectory, exitCode, output.toString());
            }
            return output.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run `" + command + "` in " + workingDirectory, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running `" + command + "`", e);
        } finally {
            if (process != null) {
                process.destroy();
            }
        }
    }
}
