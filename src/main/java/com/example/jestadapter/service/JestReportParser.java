package com.example.jestadapter.service;

import com.example.jestadapter.model.JestReport;
import com.example.jestadapter.model.RunRecord;
import com.example.jestadapter.model.RunStatus;
import com.example.jestadapter.model.TestSelector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the {@code jest --json} output file and turns it into one {@link RunRecord} per selector.
 * <ul>
 *   <li>Pending cases are skipped before merging.</li>
 *   <li>Several entries with the same selector are merged: the first creates the record,
 *       later ones append their message.</li>
 *   <li>The suite log section titled like a case is prepended to that case's failure text.</li>
 * </ul>
 */
@Service
public class JestReportParser {

    private static final Logger log = LoggerFactory.getLogger(JestReportParser.class);

    /** Introduces each section of a suite's failure log. */
    static final String SECTION_MARKER = "●";
    /** Separates describe titles from the case title in a section heading. */
    static final String TITLE_SEPARATOR = " › ";

    private final ObjectMapper objectMapper;

    public JestReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param projectPath    project root; suite paths are made relative to it
     * @param outputFileName output file, relative to the project root
     * @throws ReportParseException if the file is missing, not valid Jest JSON, or has a suite without a name
     */
    public Map<String, RunRecord> parse(Path projectPath, String outputFileName) {
        Path outputFile = projectPath.resolve(outputFileName);
        JestReport report;
        try {
            report = objectMapper.readValue(outputFile.toFile(), JestReport.class);
        } catch (IOException e) {
            throw new ReportParseException("Unable to parse jest output " + outputFile + ": " + e.getMessage(), e);
        }
        if (report == null) {
            throw new ReportParseException("Empty jest output " + outputFile, null);
        }
        Map<String, RunRecord> records = toRecords(projectPath, report);
        log.info("Parsed {} results from {}", records.size(), outputFile);
        return records;
    }

    Map<String, RunRecord> toRecords(Path projectPath, JestReport report) {
        Map<String, RunRecord> records = new LinkedHashMap<>();

        for (JestReport.SuiteResult suite : report.testResults()) {
            if (suite.name() == null || suite.name().isBlank()) {
                throw new ReportParseException("Suite without a name in jest output", null);
            }
            String testPath = ProjectPaths.relativize(projectPath, suite.name());
            Map<String, String> suiteLogs = splitSuiteLog(suite.message());

            for (JestReport.AssertionResult assertion : suite.assertionResults()) {
                Optional<RunStatus> status = RunStatus.fromJest(assertion.status());
                if (status.isEmpty()) {
                    continue;
                }
                String selector = new TestSelector(testPath, assertion.fullName()).value();

                String failureText = assertion.joinedFailureMessages();
                String sectionLog = suiteLogs.get(assertion.fullName());
                if (sectionLog != null) {
                    failureText = sectionLog + "\n" + failureText;
                }

                RunRecord record = new RunRecord(selector, status.get(), suite.startTime(), suite.endTime(),
                        failureText, failureText);
                records.merge(selector, record, RunRecord::merge);
            }
        }
        return records;
    }

    /**
     * Splits a suite log on {@value #SECTION_MARKER}, keyed by the section's first line with
     * {@value #TITLE_SEPARATOR} collapsed to a single space.
     */
    static Map<String, String> splitSuiteLog(String message) {
        Map<String, String> sections = new LinkedHashMap<>();
        if (message == null || message.isEmpty()) {
            return sections;
        }
        for (String section : message.split(SECTION_MARKER)) {
            if (section.isBlank()) {
                continue;
            }
            int eol = section.indexOf('\n');
            String heading = eol >= 0 ? section.substring(0, eol) : section;
            String title = heading.replace(TITLE_SEPARATOR, " ").trim();
            sections.put(title, section);
        }
        return sections;
    }
}
