package com.example.jestadapter.orchestrator;

import com.example.jestadapter.model.LoadError;
import com.example.jestadapter.model.LoadResult;
import com.example.jestadapter.model.TaskParameters;
import com.example.jestadapter.model.TestCase;
import com.example.jestadapter.report.ResultReporter;
import com.example.jestadapter.service.AdapterException;
import com.example.jestadapter.service.CaseDiscoveryScanner;
import com.example.jestadapter.service.SelectorFilter;
import com.example.jestadapter.service.TestFileLister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Discovery pipeline:
 * 1. List the project's test files (jest --listTests)
 * 2. Scan them for cases (or keep files only in file mode)
 * 3. Filter against the requested selectors
 */
@Service
public class TestLoadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TestLoadOrchestrator.class);

    static final String LOAD_ERROR_NAME = "jest-load";

    private final TestFileLister fileLister;
    private final CaseDiscoveryScanner scanner;
    private final SelectorFilter selectorFilter;

    public TestLoadOrchestrator(TestFileLister fileLister, CaseDiscoveryScanner scanner,
                                SelectorFilter selectorFilter) {
        this.fileLister = fileLister;
        this.scanner = scanner;
        this.selectorFilter = selectorFilter;
    }

    /**
     * Discovers and filters the project's tests, then hands the load result to the reporter.
     */
    public LoadResult load(TaskParameters parameters, ResultReporter reporter) {
        LoadResult result = collect(Path.of(parameters.projectPath()), parameters.testSelectors());
        reporter.reportLoadResult(result);
        return result;
    }

    /**
     * A discovery failure aborts the whole collection and is returned as a load error,
     * never as a partial list of tests.
     */
    public LoadResult collect(Path projectPath, List<String> testSelectors) {
        log.info("Loading test cases from {} (selectors: {})", projectPath, testSelectors);
        try {
            log.info("[1/3] Listing test files...");
            List<String> files = fileLister.listTestFiles(projectPath);

            log.info("[2/3] Discovering test cases in {} files...", files.size());
            Set<String> discovered = scanner.discover(projectPath, files);

            log.info("[3/3] Filtering {} test cases...", discovered.size());
            List<String> selected = selectorFilter.select(projectPath, testSelectors, discovered);
            log.info("Loaded {} test cases", selected.size());

            return LoadResult.of(selected.stream().map(TestCase::new).toList());

        } catch (AdapterException e) {
            log.error("Test case loading failed", e);
            return LoadResult.failed(new LoadError(LOAD_ERROR_NAME,
                    e.getMessage() != null ? e.getMessage() : "Unknown error"));
        }
    }
}
