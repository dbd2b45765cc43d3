package com.example.jestadapter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs commands through {@code sh -c} and waits for them to finish.
 * No timeout is applied: an unresponsive runner stalls the invocation.
 */
@Service
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(String command, Path workingDir) {
        log.info("Run command: {}", command);

        ProcessBuilder pb = new ProcessBuilder("sh", "-c", command);
        pb.directory(workingDir.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to start command '%s': %s".formatted(command, e.getMessage()), e);
        }
        return await(process, command);
    }

    /**
     * Collects the output of a started process. The process is destroyed if collecting fails.
     */
    CommandResult await(Process process, String command) {
        boolean completed = false;
        try {
            // stderr is drained on its own thread so a chatty runner cannot block on a full pipe
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            CommandResult result = new CommandResult(exitCode, stdout, stderr.join());
            completed = true;

            log.debug("exit code: {}", exitCode);
            log.debug("stdout:\n{}", result.stdout());
            log.debug("stderr:\n{}", result.stderr());
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for '%s'".formatted(command), e);
        } finally {
            if (!completed) {
                log.warn("Destroying '{}' after a failure while collecting its output", command);
                process.destroy();
            }
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
