package com.example.jestadapter.service;

import com.example.jestadapter.config.AdapterProperties;
import com.example.jestadapter.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Runs a Jest command with a bounded number of attempts and parses its JSON output.
 * <p>
 * Each attempt is classified on two axes, the exit status and whether the output file exists:
 * <pre>
 *                    output missing   output present
 *   exit != 0        RETRY            SOFT_SUCCESS
 *   exit == 0        RETRY            SUCCESS
 * </pre>
 * A soft success happens when Jest exits non-zero (failed tests, crashed workers) after flushing
 * a usable report. When the attempts are used up the output is parsed if it exists; a missing
 * output is never papered over.
 * <p>
 * A retry re-runs the whole file. Coverage data written by an earlier attempt is overwritten by
 * the next one, since Jest regenerates the coverage directory on every run.
 */
@Service
public class ResilientJestExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientJestExecutor.class);

    enum AttemptOutcome { SUCCESS, SOFT_SUCCESS, RETRY }

    /** Indexed by [exit ok][output present]. */
    private static final AttemptOutcome[][] DECISION_TABLE = {
            {AttemptOutcome.RETRY, AttemptOutcome.SOFT_SUCCESS},
            {AttemptOutcome.RETRY, AttemptOutcome.SUCCESS},
    };

    private final CommandRunner commandRunner;
    private final JestReportParser reportParser;
    private final AdapterProperties properties;

    public ResilientJestExecutor(CommandRunner commandRunner, JestReportParser reportParser,
                                 AdapterProperties properties) {
        this.commandRunner = commandRunner;
        this.reportParser = reportParser;
        this.properties = properties;
    }

    static AttemptOutcome decide(boolean exitOk, boolean outputPresent) {
        return DECISION_TABLE[exitOk ? 1 : 0][outputPresent ? 1 : 0];
    }

    /**
     * @param projectPath    working directory of the command
     * @param command        command line to run
     * @param outputFileName JSON output file the command writes, relative to the project path
     * @return parsed records, keyed by selector
     * @throws RunnerExecutionException if no output exists after the last attempt
     * @throws ReportParseException     if the output exists but cannot be parsed
     */
    public Map<String, RunRecord> execute(Path projectPath, String command, String outputFileName) {
        int maxAttempts = properties.execution().maxAttempts();
        Path outputFile = projectPath.resolve(outputFileName);
        deleteStaleOutput(outputFile);

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean exitOk;
            try {
                CommandRunner.CommandResult result = commandRunner.run(command, projectPath);
                exitOk = result.succeeded();
                if (!exitOk) {
                    lastError = new AdapterException("Command exited with code " + result.exitCode()
                            + (result.stderr().isBlank() ? "" : ": " + lastLines(result.stderr())));
                }
            } catch (RuntimeException e) {
                exitOk = false;
                lastError = e;
            }

            AttemptOutcome outcome = decide(exitOk, Files.exists(outputFile));
            switch (outcome) {
                case SUCCESS -> {
                    log.debug("Attempt {}/{} succeeded", attempt, maxAttempts);
                    return reportParser.parse(projectPath, outputFileName);
                }
                case SOFT_SUCCESS -> {
                    log.info("Attempt {}/{} failed ({}) but {} was written, parsing it",
                            attempt, maxAttempts, lastError.getMessage(), outputFileName);
                    return reportParser.parse(projectPath, outputFileName);
                }
                case RETRY -> {
                    if (exitOk) {
                        lastError = new AdapterException("Command succeeded but " + outputFileName + " was not written");
                    }
                }
            }
            if (attempt < maxAttempts && !backoff(attempt, maxAttempts, lastError)) {
                break;
            }
        }

        if (Files.exists(outputFile)) {
            log.warn("Retries exhausted for '{}', parsing the output that was written", command);
            return reportParser.parse(projectPath, outputFileName);
        }
        throw new RunnerExecutionException("No output " + outputFileName + " after " + maxAttempts
                + " attempts of '" + command + "'", lastError);
    }

    /** Returns false if interrupted while waiting. */
    private boolean backoff(int attempt, int maxAttempts, Exception lastError) {
        long delay = properties.execution().retryBackoff().toMillis();
        log.warn("Attempt {}/{} failed ({}), retrying in {}ms...",
                attempt, maxAttempts, lastError != null ? lastError.getMessage() : "no output", delay);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void deleteStaleOutput(Path outputFile) {
        try {
            if (Files.deleteIfExists(outputFile)) {
                log.debug("Deleted stale output {}", outputFile);
            }
        } catch (IOException e) {
            log.warn("Unable to delete stale output {}: {}", outputFile, e.getMessage());
        }
    }

    private static String lastLines(String text) {
        String[] lines = text.strip().split("\\r?\\n");
        int start = Math.max(0, lines.length - 5);
        return String.join("\n", Arrays.copyOfRange(lines, start, lines.length));
    }
}
