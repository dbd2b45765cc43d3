package com.example.jestadapter.service;

import java.nio.file.Path;

/**
 * Runs a shell command line in a working directory.
 * <p>
 * The production implementation is {@link ProcessCommandRunner}; tests substitute a lambda.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command    shell command line, passed to {@code sh -c} as is
     * @param workingDir directory in which to run the command
     * @return exit code and captured output
     * @throws java.io.UncheckedIOException if the process cannot be started
     */
    CommandResult run(String command, Path workingDir);

    /**
     * @param exitCode process exit status
     * @param stdout   captured standard output
     * @param stderr   captured standard error
     */
    record CommandResult(int exitCode, String stdout, String stderr) {

        public CommandResult {
            stdout = stdout != null ? stdout : "";
            stderr = stderr != null ? stderr : "";
        }

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
