package com.example.jestadapter.cli;

import com.example.jestadapter.model.LoadResult;
import com.example.jestadapter.model.RunSummary;
import com.example.jestadapter.model.TaskParameters;
import com.example.jestadapter.orchestrator.TestLoadOrchestrator;
import com.example.jestadapter.orchestrator.TestRunOrchestrator;
import com.example.jestadapter.report.FileResultReporter;
import com.example.jestadapter.report.ResultReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry points of the adapter.
 *
 * <p>Usage: {@code load <paramFile>} or {@code run <paramFile>}, where the parameter file is the
 * JSON descriptor written by the test platform.
 * <p>Failures are logged and never propagated, so the host process always exits normally.
 */
@Component
public class AdapterCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdapterCommandLineRunner.class);

    static final String USAGE = "usage: (load|run) <paramFile>";

    private final TestLoadOrchestrator loadOrchestrator;
    private final TestRunOrchestrator runOrchestrator;
    private final ObjectMapper objectMapper;

    public AdapterCommandLineRunner(TestLoadOrchestrator loadOrchestrator,
                                    TestRunOrchestrator runOrchestrator,
                                    ObjectMapper objectMapper) {
        this.loadOrchestrator = loadOrchestrator;
        this.runOrchestrator = runOrchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commandArgs = args.getNonOptionArgs();
        if (commandArgs.size() != 2) {
            log.info(USAGE);
            return;
        }
        String mode = commandArgs.get(0);
        Path paramFile = Path.of(commandArgs.get(1));

        switch (mode) {
            case "load" -> load(paramFile);
            case "run" -> execute(paramFile);
            default -> log.warn("Unknown mode '{}', {}", mode, USAGE);
        }
    }

    void load(Path paramFile) {
        try {
            TaskParameters parameters = readParameters(paramFile);
            LoadResult result = loadOrchestrator.load(parameters, reporterFor(parameters));
            log.info("Load result reported successfully ({} tests, {} errors)",
                    result.tests().size(), result.loadErrors().size());
        } catch (Exception e) {
            log.error("Failed to load test cases from {}", paramFile, e);
        }
    }

    void execute(Path paramFile) {
        try {
            TaskParameters parameters = readParameters(paramFile);
            RunSummary summary = runOrchestrator.run(parameters, reporterFor(parameters));
            log.info("Run result reported successfully ({} results, {} failed files)",
                    summary.reportedResults(), summary.failedGroups());
        } catch (Exception e) {
            log.error("Failed to run test cases from {}", paramFile, e);
        }
    }

    TaskParameters readParameters(Path paramFile) {
        log.info("Pipe file: {}", paramFile);
        try {
            TaskParameters parameters = objectMapper.readValue(paramFile.toFile(), TaskParameters.class);
            log.info("Pipe file content:\n{}", objectMapper.writeValueAsString(parameters));
            if (parameters.projectPath() == null || parameters.fileReportPath() == null) {
                throw new IllegalArgumentException("ProjectPath and FileReportPath are required in " + paramFile);
            }
            return parameters;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read parameter file " + paramFile + ": " + e.getMessage(), e);
        }
    }

    private ResultReporter reporterFor(TaskParameters parameters) {
        return new FileResultReporter(parameters.taskId(), Path.of(parameters.fileReportPath()), objectMapper);
    }
}
