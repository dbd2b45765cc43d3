package com.example.jestadapter.orchestrator;

import com.example.jestadapter.config.AdapterProperties;
import com.example.jestadapter.model.ExecutionGroup;
import com.example.jestadapter.model.JestCommand;
import com.example.jestadapter.model.RunRecord;
import com.example.jestadapter.model.RunSummary;
import com.example.jestadapter.model.TaskParameters;
import com.example.jestadapter.model.TestResult;
import com.example.jestadapter.report.ResultReporter;
import com.example.jestadapter.service.AdapterException;
import com.example.jestadapter.service.CaseGrouper;
import com.example.jestadapter.service.CoverageRelocator;
import com.example.jestadapter.service.JestCommandBuilder;
import com.example.jestadapter.service.ResilientJestExecutor;
import com.example.jestadapter.service.ResultNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Execution pipeline, one group (test file) at a time:
 * 1. Build the jest command
 * 2. Execute with retry and parse the JSON output
 * 3. Normalize and report the results of the group
 * 4. Relocate coverage (when enabled)
 * <p>
 * Groups share the project directory and derive their output file from the file path, so they
 * are never run concurrently. A failing group is logged and the next one proceeds; results of
 * earlier groups are already reported at that point.
 */
@Service
public class TestRunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TestRunOrchestrator.class);

    private final CaseGrouper grouper;
    private final JestCommandBuilder commandBuilder;
    private final ResilientJestExecutor executor;
    private final ResultNormalizer normalizer;
    private final CoverageRelocator coverageRelocator;
    private final AdapterProperties properties;

    public TestRunOrchestrator(CaseGrouper grouper,
                               JestCommandBuilder commandBuilder,
                               ResilientJestExecutor executor,
                               ResultNormalizer normalizer,
                               CoverageRelocator coverageRelocator,
                               AdapterProperties properties) {
        this.grouper = grouper;
        this.commandBuilder = commandBuilder;
        this.executor = executor;
        this.normalizer = normalizer;
        this.coverageRelocator = coverageRelocator;
        this.properties = properties;
    }

    public RunSummary run(TaskParameters parameters, ResultReporter reporter) {
        Path projectPath = Path.of(parameters.projectPath());
        Path reportPath = Path.of(parameters.fileReportPath());
        List<ExecutionGroup> groups = grouper.executionGroups(parameters.testSelectors());

        log.info("═══════════════════════════════════════════════");
        log.info("Running {} test files for task {}", groups.size(), parameters.taskId());
        log.info("═══════════════════════════════════════════════");

        int failedGroups = 0;
        int reported = 0;
        int index = 0;
        for (ExecutionGroup group : groups) {
            index++;
            log.info("── [{}/{}] {} ({} names) ──", index, groups.size(), group.filePath(), group.testNames().size());
            try {
                reported += runGroup(group, projectPath, reportPath, reporter);
            } catch (AdapterException e) {
                failedGroups++;
                log.error("[{}/{}] {} failed, continuing with the next file", index, groups.size(), group.filePath(), e);
            } catch (RuntimeException e) {
                failedGroups++;
                log.error("[{}/{}] Unexpected error for {}, continuing with the next file",
                        index, groups.size(), group.filePath(), e);
            }
        }

        RunSummary summary = new RunSummary(groups.size(), failedGroups, reported);
        log.info("Run completed: {} files, {} failed, {} results reported",
                summary.groups(), summary.failedGroups(), summary.reportedResults());
        return summary;
    }

    private int runGroup(ExecutionGroup group, Path projectPath, Path reportPath, ResultReporter reporter) {
        String outputFileName = group.outputFileName();
        JestCommand command = commandBuilder.build(group.filePath(), group.testNames(), outputFileName);
        log.debug("Requested identifiers: {}", command.testIdentifiers());

        Map<String, RunRecord> records = executor.execute(projectPath, command.command(), outputFileName);
        List<TestResult> results = normalizer.normalize(records);
        for (TestResult result : results) {
            reporter.reportTestResult(result);
        }

        if (properties.coverage().isEnabled()) {
            awaitCoverageFlush();
            coverageRelocator.relocate(projectPath, reportPath);
        }
        return results.size();
    }

    private void awaitCoverageFlush() {
        long delay = properties.coverage().settleDelay().toMillis();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the coverage file to be flushed");
        }
    }
}
