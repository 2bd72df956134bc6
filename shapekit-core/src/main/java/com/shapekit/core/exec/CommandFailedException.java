package com.shapekit.core.exec;

import java.nio.file.Path;

/**
 * Thrown when an external command exits with a non-zero status.
 *
 * <p>Carries everything needed to diagnose the failure without re-running it.
 */
public class CommandFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final transient Path workingDirectory;
    private final int exitCode;
    private final String output;

    public CommandFailedException(String command, Path workingDirectory, int exitCode, String output) {
        super("Command `" + command + "` failed in " + workingDirectory + " with exit code " + exitCode
            + (output.isBlank() ? "" : ":\n" + output));
        this.command = command;
        this.workingDirectory = workingDirectory;
        this.exitCode = exitCode;
        this.output = output;
    }

    public String getCommand() {
        return command;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Returns the combined standard output and standard error of the command.
     *
     * @return captured output
     */
    public String getOutput() {
        return output;
    }
}
